package com.lanka.tourbot.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lanka.tourbot.model.Guide;
import com.lanka.tourbot.model.Intent;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.PersonalizationRule;
import com.lanka.tourbot.service.PersonalizationService;
import com.lanka.tourbot.service.RuntimeConfigService;
import com.lanka.tourbot.util.JsonLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 個人化包裝服務實作 (Personalization Service Implementation)
 * <p>
 * 每條規則獨立擲骰（random &lt; 機率才觸發），語句池來自 data/personality.json。
 * 某語言沒有對應語句池時，該規則直接略過。語句中的 {guide} 替換為導遊顯示名稱。
 * <p>
 * 組合順序：
 * 1. 問候開場：「開場 + 空白 + 基礎回應」。
 * 2. 熱情 / 協助前綴：「前綴 + 空白 + 目前文字」。
 * 3. 文化小提示、個人分享、鼓勵語依序附加於結尾。
 */
@Service
public class PersonalizationServiceImpl implements PersonalizationService {

    private static final Logger logger = LoggerFactory.getLogger(PersonalizationServiceImpl.class);

    private static final String PERSONALITY_JSON = "data/personality.json";
    private static final String INTRODUCTION_POOL = "introduction";
    private static final String GUIDE_PLACEHOLDER = "{guide}";

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Value("${tourbot.personalization.seed:}")
    private String seed;

    // 語句池：規則鍵 → 語言代碼 → 語句
    private volatile Map<String, Map<String, List<String>>> pools = Map.of();

    private volatile Random random = new Random();

    @PostConstruct
    public void init() {
        Map<String, Map<String, List<String>>> loaded =
                JsonLoader.load(PERSONALITY_JSON, new TypeReference<Map<String, Map<String, List<String>>>>() {});
        if (loaded == null) {
            logger.warn("無法載入 {}，個人化包裝停用", PERSONALITY_JSON);
        } else {
            pools = loaded;
        }
        if (seed != null && !seed.isBlank()) {
            try {
                random = new Random(Long.parseLong(seed.trim()));
                logger.info("Personalization random seeded: {}", seed.trim());
            } catch (NumberFormatException e) {
                logger.warn("tourbot.personalization.seed={} 不是數字，改用隨機種子", seed);
            }
        }
    }

    public void setPools(Map<String, Map<String, List<String>>> pools) {
        this.pools = pools;
    }

    @Override
    public void setRandom(Random random) {
        this.random = random;
    }

    @Override
    public String personalize(String baseText, Intent intent, Language language, boolean hasHistory, Guide guide) {
        if (baseText == null) {
            return null;
        }
        String text = baseText;

        String greeting = pick(PersonalizationRule.GREETING, intent, language, guide);
        if (greeting != null) {
            text = greeting + " " + text;
        }
        String enthusiasm = pick(PersonalizationRule.ENTHUSIASM, intent, language, guide);
        if (enthusiasm != null) {
            text = enthusiasm + " " + text;
        }
        String helpful = pick(PersonalizationRule.HELPFUL, intent, language, guide);
        if (helpful != null) {
            text = helpful + " " + text;
        }
        String insight = pick(PersonalizationRule.CULTURAL_INSIGHT, intent, language, guide);
        if (insight != null) {
            text = text + "\n\n💡 " + insight;
        }
        if (hasHistory) {
            String touch = pick(PersonalizationRule.PERSONAL_TOUCH, intent, language, guide);
            if (touch != null) {
                text = text + "\n\n" + touch;
            }
        }
        String encouragement = pick(PersonalizationRule.ENCOURAGEMENT, intent, language, guide);
        if (encouragement != null) {
            text = text + "\n\n✨ " + encouragement;
        }
        return text;
    }

    @Override
    public String introduction(Guide guide, Language language) {
        Map<String, List<String>> byLanguage = pools.get(INTRODUCTION_POOL);
        if (guide == null || byLanguage == null) {
            return null;
        }
        List<String> phrases = usable(byLanguage.get(language.getCode()), guide);
        if (phrases.isEmpty()) {
            phrases = usable(byLanguage.get(Language.EN.getCode()), guide);
        }
        if (phrases.isEmpty()) {
            return null;
        }
        return phrases.get(random.nextInt(phrases.size()));
    }

    /**
     * 規則適用且擲骰通過時，從該語言的語句池隨機取一句；否則回傳 null
     */
    private String pick(PersonalizationRule rule, Intent intent, Language language, Guide guide) {
        if (!rule.appliesTo(intent)) {
            return null;
        }
        double probability = runtimeConfigService.getPersonalizationProbability(rule);
        if (probability <= 0.0 || random.nextDouble() >= probability) {
            return null;
        }
        Map<String, List<String>> byLanguage = pools.get(rule.getPoolKey());
        List<String> phrases = usable(byLanguage == null ? null : byLanguage.get(language.getCode()), guide);
        if (phrases.isEmpty()) {
            return null;
        }
        return phrases.get(random.nextInt(phrases.size()));
    }

    /**
     * 替換 {guide}；沒有導遊時排除含佔位符的語句
     */
    private static List<String> usable(List<String> phrases, Guide guide) {
        if (phrases == null) {
            return List.of();
        }
        if (guide == null) {
            return phrases.stream().filter(p -> !p.contains(GUIDE_PLACEHOLDER)).toList();
        }
        return phrases.stream().map(p -> p.replace(GUIDE_PLACEHOLDER, guide.displayName())).toList();
    }
}
