package com.lanka.tourbot.service.impl;

import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.PersonalizationRule;
import com.lanka.tourbot.service.RuntimeConfigService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 執行時配置服務實作 (Runtime Configuration Service Implementation)
 * <p>
 * 功能：
 * 允許在不重啟伺服器的情況下，動態調整語言切換門檻、意圖候選門檻與個人化機率。
 * <p>
 * 機制：
 * 1. 使用 `AtomicReference` 儲存可變的覆蓋值 (Override)。
 * 2. 讀取時，優先回傳 Override 值，若無則回傳 `application.properties` 中的預設值。
 * 3. 預設語言僅由設定檔決定，執行期間不可修改。
 */
@Service
public class RuntimeConfigServiceImpl implements RuntimeConfigService {

    private static final Logger logger = LoggerFactory.getLogger(RuntimeConfigServiceImpl.class);

    private static final String PERSONALIZATION_PREFIX = "tourbot.personalization.";

    @Autowired(required = false)
    private Environment environment;

    @Value("${tourbot.default-language:en}")
    private String defaultLanguageCode = "en";

    @Value("${tourbot.language.switch-threshold:0.7}")
    private double languageSwitchThresholdDefault = 0.7;

    @Value("${tourbot.intent.alternative-min-score:0.3}")
    private double alternativeMinScoreDefault = 0.3;

    @Value("${tourbot.intent.max-alternatives:3}")
    private int maxAlternativesDefault = 3;

    private Language defaultLanguage = Language.EN;

    private final Map<PersonalizationRule, Double> personalizationDefaults = new EnumMap<>(PersonalizationRule.class);

    private final AtomicReference<Double> languageSwitchThresholdOverride = new AtomicReference<>();
    private final AtomicReference<Double> alternativeMinScoreOverride = new AtomicReference<>();
    private final AtomicReference<Integer> maxAlternativesOverride = new AtomicReference<>();
    private final Map<PersonalizationRule, AtomicReference<Double>> personalizationOverrides =
            new EnumMap<>(PersonalizationRule.class);

    public RuntimeConfigServiceImpl() {
        for (PersonalizationRule rule : PersonalizationRule.values()) {
            personalizationDefaults.put(rule, rule.getDefaultProbability());
            personalizationOverrides.put(rule, new AtomicReference<>());
        }
    }

    @PostConstruct
    public void init() {
        defaultLanguage = Language.fromCode(defaultLanguageCode).orElseGet(() -> {
            logger.warn("tourbot.default-language={} 不支援，改用 en", defaultLanguageCode);
            return Language.EN;
        });
        if (environment != null) {
            for (PersonalizationRule rule : PersonalizationRule.values()) {
                Double p = environment.getProperty(PERSONALIZATION_PREFIX + rule.getPropertyName(), Double.class);
                if (p != null) {
                    personalizationDefaults.put(rule, clampProbability(p));
                }
            }
        }
        logger.info("Runtime config initialized: defaultLanguage={}, switchThreshold={}, alternativeMinScore={}",
                defaultLanguage.getCode(), languageSwitchThresholdDefault, alternativeMinScoreDefault);
    }

    @Override
    public Language getDefaultLanguage() {
        return defaultLanguage;
    }

    @Override
    public double getLanguageSwitchThreshold() {
        Double v = languageSwitchThresholdOverride.get();
        return v != null ? v : languageSwitchThresholdDefault;
    }

    @Override
    public double getAlternativeMinScore() {
        Double v = alternativeMinScoreOverride.get();
        return v != null ? v : alternativeMinScoreDefault;
    }

    @Override
    public int getMaxAlternatives() {
        Integer v = maxAlternativesOverride.get();
        return v != null ? v : maxAlternativesDefault;
    }

    @Override
    public double getPersonalizationProbability(PersonalizationRule rule) {
        Double v = personalizationOverrides.get(rule).get();
        return v != null ? v : personalizationDefaults.get(rule);
    }

    /**
     * 更新語言偵測配置 (Update Language Configuration)
     * <p>
     * switchThreshold：偵測信心必須「大於」此值，才會覆寫 Session 目前語言。
     */
    @Override
    public void updateLanguage(Double switchThreshold) {
        if (switchThreshold != null) {
            languageSwitchThresholdOverride.set(clampProbability(switchThreshold));
        }
    }

    /**
     * 更新意圖辨識配置 (Update Intent Configuration)
     * <p>
     * 參數說明：
     * - alternativeMinScore: 候選意圖的最低累積分數。
     * - maxAlternatives: 最多回傳的候選意圖數量。
     */
    @Override
    public void updateIntent(Double alternativeMinScore, Integer maxAlternatives) {
        if (alternativeMinScore != null) {
            alternativeMinScoreOverride.set(Math.max(0.0, alternativeMinScore));
        }
        if (maxAlternatives != null) {
            maxAlternativesOverride.set(Math.max(0, maxAlternatives));
        }
    }

    @Override
    public void updatePersonalization(Map<PersonalizationRule, Double> probabilities) {
        if (probabilities == null) {
            return;
        }
        for (Map.Entry<PersonalizationRule, Double> e : probabilities.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                personalizationOverrides.get(e.getKey()).set(clampProbability(e.getValue()));
            }
        }
    }

    /**
     * 取得設定快照 (Get Configuration Snapshot)
     *
     * @return Map 包含 language、intent、personalization 三大類的當前設定。
     */
    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new HashMap<>();
        Map<String, Object> language = new HashMap<>();
        language.put("defaultLanguage", getDefaultLanguage().getCode());
        language.put("switchThreshold", getLanguageSwitchThreshold());
        out.put("language", language);

        Map<String, Object> intent = new HashMap<>();
        intent.put("alternativeMinScore", getAlternativeMinScore());
        intent.put("maxAlternatives", getMaxAlternatives());
        out.put("intent", intent);

        Map<String, Object> personalization = new LinkedHashMap<>();
        for (PersonalizationRule rule : PersonalizationRule.values()) {
            personalization.put(rule.name(), getPersonalizationProbability(rule));
        }
        out.put("personalization", personalization);

        return out;
    }

    private static double clampProbability(double p) {
        return Math.max(0.0, Math.min(1.0, p));
    }
}
