package com.lanka.tourbot.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.LanguageProfile;
import com.lanka.tourbot.model.LanguageSignal;
import com.lanka.tourbot.service.LanguageDetectionService;
import com.lanka.tourbot.service.RuntimeConfigService;
import com.lanka.tourbot.util.JsonLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 語言偵測服務實作 (Language Detection Service Implementation)
 * <p>
 * 功能：
 * 以規則方式判斷輸入屬於英文、僧伽羅文或泰米爾文。
 * <p>
 * 評分（每種語言）：
 * 1. 文字比例：落在該語言 Unicode 區段的字元數 / 字母與附加符號總數，上限 0.8（英文無專屬文字，為 0）。
 * 2. 關鍵字比例：命中關鍵字數 / 關鍵字清單大小，上限 0.6。
 * 3. 問候語加分：任一問候樣式命中加 0.4。
 * 4. 單一語言總分上限 1.0。
 * <p>
 * 判定：
 * - 所有非預設語言都低於 0.3 時，預設語言分數至少提升為 0.5。
 * - 取最高分（同分取設定檔順序較前者）；最高分低於 0.3 時回傳（預設語言, 0.5）。
 */
@Service
public class LanguageDetectionServiceImpl implements LanguageDetectionService {

    private static final Logger logger = LoggerFactory.getLogger(LanguageDetectionServiceImpl.class);

    static final double SCRIPT_CAP = 0.8;
    static final double KEYWORD_CAP = 0.6;
    static final double GREETING_BONUS = 0.4;
    static final double MIN_CONFIDENCE = 0.3;
    static final double DEFAULT_CONFIDENCE = 0.5;

    private record CompiledProfile(Language language, LanguageProfile profile, List<String> keywords,
                                   List<Pattern> greetings) {
    }

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Value("${tourbot.nlp.languages-json:nlp/languages.json}")
    private String languagesJson = "nlp/languages.json";

    private volatile List<CompiledProfile> profiles = List.of();

    @PostConstruct
    public void init() {
        List<LanguageProfile> loaded = JsonLoader.loadList(languagesJson, new TypeReference<List<LanguageProfile>>() {});
        if (loaded.isEmpty()) {
            throw new IllegalStateException("No language profiles in " + languagesJson);
        }
        loadProfiles(loaded);
    }

    public void loadProfiles(List<LanguageProfile> source) {
        List<CompiledProfile> compiled = new ArrayList<>();
        for (LanguageProfile profile : source) {
            Optional<Language> language = Language.fromCode(profile.code());
            if (language.isEmpty()) {
                logger.warn("略過不支援的語言設定: {}", profile.code());
                continue;
            }
            List<String> keywords = profile.keywords() == null ? List.of()
                    : profile.keywords().stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
            List<Pattern> greetings = new ArrayList<>();
            if (profile.greetingPatterns() != null) {
                for (String regex : profile.greetingPatterns()) {
                    try {
                        greetings.add(Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS | Pattern.CASE_INSENSITIVE));
                    } catch (PatternSyntaxException e) {
                        logger.warn("語言 {} 的問候樣式格式錯誤，已略過: {}", profile.code(), regex);
                    }
                }
            }
            compiled.add(new CompiledProfile(language.get(), profile, keywords, List.copyOf(greetings)));
        }
        this.profiles = List.copyOf(compiled);
        logger.info("Language profiles loaded: {}", compiled.stream().map(p -> p.language().getCode()).toList());
    }

    @Override
    public LanguageSignal detect(String text) {
        Language defaultLanguage = runtimeConfigService.getDefaultLanguage();
        if (text == null || text.trim().isEmpty()) {
            return new LanguageSignal(defaultLanguage, DEFAULT_CONFIDENCE);
        }

        Map<Language, Double> scores = scores(text);
        Language best = null;
        double bestScore = -1.0;
        for (Map.Entry<Language, Double> e : scores.entrySet()) {
            if (e.getValue() > bestScore) {
                best = e.getKey();
                bestScore = e.getValue();
            }
        }
        if (best == null || bestScore < MIN_CONFIDENCE) {
            return new LanguageSignal(defaultLanguage, DEFAULT_CONFIDENCE);
        }
        return new LanguageSignal(best, bestScore);
    }

    @Override
    public Map<Language, Double> scores(String text) {
        Map<Language, Double> out = new LinkedHashMap<>();
        if (text == null || text.trim().isEmpty()) {
            return out;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        int letters = countLettersAndMarks(text);

        for (CompiledProfile p : profiles) {
            double score = 0.0;
            if (p.profile().hasScript() && letters > 0) {
                long inScript = text.codePoints().filter(p.profile()::inScript).count();
                score += Math.min(SCRIPT_CAP, (double) inScript / letters);
            }
            if (!p.keywords().isEmpty()) {
                long hits = p.keywords().stream().filter(lowered::contains).count();
                score += Math.min(KEYWORD_CAP, (double) hits / p.keywords().size());
            }
            for (Pattern g : p.greetings()) {
                if (g.matcher(lowered).find()) {
                    score += GREETING_BONUS;
                    break;
                }
            }
            out.put(p.language(), Math.min(1.0, score));
        }

        Language defaultLanguage = runtimeConfigService.getDefaultLanguage();
        boolean othersWeak = out.entrySet().stream()
                .filter(e -> e.getKey() != defaultLanguage)
                .allMatch(e -> e.getValue() < MIN_CONFIDENCE);
        if (othersWeak) {
            out.merge(defaultLanguage, DEFAULT_CONFIDENCE, Math::max);
        }
        return out;
    }

    private static int countLettersAndMarks(String text) {
        return (int) text.codePoints().filter(cp -> {
            int type = Character.getType(cp);
            return Character.isLetter(cp)
                    || type == Character.NON_SPACING_MARK
                    || type == Character.COMBINING_SPACING_MARK
                    || type == Character.ENCLOSING_MARK;
        }).count();
    }
}
