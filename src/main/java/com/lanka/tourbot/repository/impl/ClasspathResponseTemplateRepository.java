package com.lanka.tourbot.repository.impl;

import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.repository.ResponseTemplateRepository;
import com.lanka.tourbot.util.JsonLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class ClasspathResponseTemplateRepository implements ResponseTemplateRepository {

    private static final Logger logger = LoggerFactory.getLogger(ClasspathResponseTemplateRepository.class);

    private static final String RESPONSES_JSON = "data/responses.json";

    /**
     * responses.json 結構：族群 → 語言代碼 → 內容
     */
    public record ResponseCatalog(
            Map<String, Map<String, String>> templates,
            Map<String, Map<String, List<String>>> suggestions,
            Map<String, Map<String, List<String>>> quickReplies) {
    }

    private volatile ResponseCatalog catalog = new ResponseCatalog(Map.of(), Map.of(), Map.of());

    @PostConstruct
    public void init() {
        ResponseCatalog loaded = JsonLoader.load(RESPONSES_JSON, ResponseCatalog.class);
        if (loaded == null || loaded.templates() == null) {
            throw new IllegalStateException("Response templates could not be loaded from " + RESPONSES_JSON);
        }
        this.catalog = new ResponseCatalog(
                loaded.templates(),
                loaded.suggestions() == null ? Map.of() : loaded.suggestions(),
                loaded.quickReplies() == null ? Map.of() : loaded.quickReplies());
        logger.info("載入 {} 個回應模板族群", loaded.templates().size());
    }

    @Override
    public Optional<String> findTemplate(String family, Language language) {
        Map<String, String> byLanguage = catalog.templates().get(family);
        if (byLanguage == null) {
            return Optional.empty();
        }
        String text = byLanguage.get(language.getCode());
        return text == null || text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    @Override
    public List<String> findSuggestions(String key, Language language) {
        return lookupList(catalog.suggestions(), key, language);
    }

    @Override
    public List<String> findQuickReplies(String key, Language language) {
        return lookupList(catalog.quickReplies(), key, language);
    }

    @Override
    public Set<String> families() {
        return catalog.templates().keySet();
    }

    private static List<String> lookupList(Map<String, Map<String, List<String>>> source, String key, Language language) {
        Map<String, List<String>> byLanguage = source.get(key);
        if (byLanguage == null) {
            return List.of();
        }
        List<String> list = byLanguage.get(language.getCode());
        return list == null ? List.of() : list;
    }
}
