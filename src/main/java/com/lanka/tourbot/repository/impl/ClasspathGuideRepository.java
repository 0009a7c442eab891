package com.lanka.tourbot.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lanka.tourbot.model.Guide;
import com.lanka.tourbot.repository.GuideRepository;
import com.lanka.tourbot.util.JsonLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class ClasspathGuideRepository implements GuideRepository {

    private static final Logger logger = LoggerFactory.getLogger(ClasspathGuideRepository.class);

    private static final String GUIDES_JSON = "data/guides.json";

    @Value("${tourbot.session.default-guide:saru}")
    private String defaultGuideId = "saru";

    private volatile Map<String, Guide> guides = Map.of();

    @PostConstruct
    public void init() {
        List<Guide> loaded = JsonLoader.loadList(GUIDES_JSON, new TypeReference<List<Guide>>() {});
        if (loaded.isEmpty()) {
            throw new IllegalStateException("No guides configured in " + GUIDES_JSON);
        }
        Map<String, Guide> byId = new LinkedHashMap<>();
        for (Guide g : loaded) {
            if (g.id() == null || g.id().isBlank()) {
                logger.warn("略過沒有 id 的導遊設定: {}", g.displayName());
                continue;
            }
            byId.put(g.id(), g);
        }
        this.guides = byId;
        if (!byId.containsKey(defaultGuideId)) {
            logger.warn("預設導遊 {} 不存在，改用 {}", defaultGuideId, byId.keySet().iterator().next());
            defaultGuideId = byId.keySet().iterator().next();
        }
        logger.info("載入 {} 位導遊，預設: {}", byId.size(), defaultGuideId);
    }

    @Override
    public List<Guide> list() {
        return List.copyOf(guides.values());
    }

    @Override
    public Optional<Guide> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(guides.get(id));
    }

    @Override
    public Guide defaultGuide() {
        return guides.get(defaultGuideId);
    }
}
