package com.lanka.tourbot.nlp;

import com.lanka.tourbot.model.Intent;
import com.lanka.tourbot.model.IntentLexiconDefinition;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.util.JsonLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 意圖詞庫
 * <p>
 * 載入 nlp/intents.json，預先編譯各意圖的正則樣式與關鍵字，
 * 以及上下文規則與「僅關鍵字」後備清單。格式錯誤的樣式會被略過並記錄警告。
 */
@Component
public class IntentLexicon {

    private static final Logger logger = LoggerFactory.getLogger(IntentLexicon.class);

    static final int REGEX_FLAGS = Pattern.UNICODE_CHARACTER_CLASS | Pattern.CASE_INSENSITIVE;

    public record IntentEntry(Intent intent,
                              Map<Language, List<Pattern>> patterns,
                              Map<Language, List<TermMatcher>> keywords) {

        public List<Pattern> patternsFor(Language language) {
            return withEnglishFallback(patterns, language);
        }

        public List<TermMatcher> keywordsFor(Language language) {
            return withEnglishFallback(keywords, language);
        }
    }

    public record ContextRule(String name, Intent intent, double score, List<TermMatcher> phrases) {
    }

    public record FallbackEntry(Intent intent, List<TermMatcher> keywords) {
    }

    @Value("${tourbot.nlp.intents-json:nlp/intents.json}")
    private String intentsJson = "nlp/intents.json";

    private volatile List<IntentEntry> intents = List.of();
    private volatile List<ContextRule> contextRules = List.of();
    private volatile List<FallbackEntry> fallbackEntries = List.of();

    @PostConstruct
    public void init() {
        IntentLexiconDefinition definition = JsonLoader.load(intentsJson, IntentLexiconDefinition.class);
        if (definition == null) {
            throw new IllegalStateException("Intent lexicon could not be loaded from " + intentsJson);
        }
        load(definition);
    }

    public void load(IntentLexiconDefinition definition) {
        List<IntentEntry> compiledIntents = new ArrayList<>();
        if (definition.intents() != null) {
            for (IntentLexiconDefinition.IntentDefinition def : definition.intents()) {
                Optional<Intent> intent = Intent.fromWireName(def.intent());
                if (intent.isEmpty()) {
                    logger.warn("略過未知意圖: {}", def.intent());
                    continue;
                }
                compiledIntents.add(new IntentEntry(intent.get(),
                        compilePatterns(def.intent(), def.patterns()),
                        compileKeywords(def.keywords())));
            }
        }

        List<ContextRule> rules = new ArrayList<>();
        if (definition.contextRules() != null) {
            for (IntentLexiconDefinition.ContextRule def : definition.contextRules()) {
                Optional<Intent> intent = Intent.fromWireName(def.intent());
                if (intent.isEmpty()) {
                    logger.warn("略過未知意圖的上下文規則: {}", def.name());
                    continue;
                }
                rules.add(new ContextRule(def.name(), intent.get(), def.score(), toMatchers(def.phrases())));
            }
        }

        List<FallbackEntry> fallback = new ArrayList<>();
        if (definition.fallbackKeywords() != null) {
            for (IntentLexiconDefinition.FallbackKeywords def : definition.fallbackKeywords()) {
                Intent.fromWireName(def.intent()).ifPresentOrElse(
                        intent -> fallback.add(new FallbackEntry(intent, toMatchers(def.keywords()))),
                        () -> logger.warn("略過未知意圖的後備關鍵字: {}", def.intent()));
            }
        }

        this.intents = List.copyOf(compiledIntents);
        this.contextRules = List.copyOf(rules);
        this.fallbackEntries = List.copyOf(fallback);
        logger.info("Intent lexicon loaded: intents={}, contextRules={}, fallbackEntries={}",
                intents.size(), contextRules.size(), fallbackEntries.size());
    }

    public List<IntentEntry> intents() {
        return intents;
    }

    public List<ContextRule> contextRules() {
        return contextRules;
    }

    public List<FallbackEntry> fallbackEntries() {
        return fallbackEntries;
    }

    private static Map<Language, List<Pattern>> compilePatterns(String intentName, Map<String, List<String>> source) {
        Map<Language, List<Pattern>> out = new EnumMap<>(Language.class);
        if (source == null) {
            return out;
        }
        for (Map.Entry<String, List<String>> e : source.entrySet()) {
            Optional<Language> language = Language.fromCode(e.getKey());
            if (language.isEmpty() || e.getValue() == null) {
                continue;
            }
            List<Pattern> compiled = new ArrayList<>();
            for (String regex : e.getValue()) {
                try {
                    compiled.add(Pattern.compile(regex, REGEX_FLAGS));
                } catch (PatternSyntaxException ex) {
                    logger.warn("意圖 {} 的樣式格式錯誤，已略過: {} ({})", intentName, regex, ex.getDescription());
                }
            }
            out.put(language.get(), List.copyOf(compiled));
        }
        return out;
    }

    private static Map<Language, List<TermMatcher>> compileKeywords(Map<String, List<String>> source) {
        Map<Language, List<TermMatcher>> out = new EnumMap<>(Language.class);
        if (source == null) {
            return out;
        }
        for (Map.Entry<String, List<String>> e : source.entrySet()) {
            Language.fromCode(e.getKey()).ifPresent(language -> out.put(language, toSubstringMatchers(e.getValue())));
        }
        return out;
    }

    private static List<TermMatcher> toMatchers(List<String> terms) {
        if (terms == null) {
            return List.of();
        }
        return terms.stream().filter(t -> t != null && !t.isBlank()).map(TermMatcher::of).toList();
    }

    private static List<TermMatcher> toSubstringMatchers(List<String> terms) {
        if (terms == null) {
            return List.of();
        }
        return terms.stream().filter(t -> t != null && !t.isBlank()).map(TermMatcher::substring).toList();
    }

    private static <T> List<T> withEnglishFallback(Map<Language, List<T>> byLanguage, Language language) {
        List<T> list = byLanguage.get(language);
        if (list == null || list.isEmpty()) {
            list = byLanguage.get(Language.EN);
        }
        return list == null ? Collections.emptyList() : list;
    }
}
