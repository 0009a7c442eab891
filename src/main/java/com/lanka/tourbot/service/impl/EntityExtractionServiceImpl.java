package com.lanka.tourbot.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lanka.tourbot.model.Entity;
import com.lanka.tourbot.model.EntityPatternDefinition;
import com.lanka.tourbot.model.EntityType;
import com.lanka.tourbot.service.EntityExtractionService;
import com.lanka.tourbot.util.JsonLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 實體擷取服務實作 (Entity Extraction Service Implementation)
 * <p>
 * 流程：
 * 1. 以不分大小寫的正則樣式比對原始輸入，每個命中產生信心 0.8 的實體；位置為原始輸入中的位移，值轉為小寫。
 * 2. 依起始位置穩定排序，同位置依實體類型順序。
 * 3. 同類型同值只保留第一個；不同類型之間不去重。
 */
@Service
public class EntityExtractionServiceImpl implements EntityExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(EntityExtractionServiceImpl.class);

    static final double ENTITY_CONFIDENCE = 0.8;

    static final int REGEX_FLAGS = Pattern.UNICODE_CHARACTER_CLASS | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    @Value("${tourbot.nlp.entities-json:nlp/entities.json}")
    private String entitiesJson = "nlp/entities.json";

    private volatile Map<EntityType, List<Pattern>> patterns = new EnumMap<>(EntityType.class);

    @PostConstruct
    public void init() {
        List<EntityPatternDefinition> definitions =
                JsonLoader.loadList(entitiesJson, new TypeReference<List<EntityPatternDefinition>>() {});
        loadDefinitions(definitions);
    }

    public void loadDefinitions(List<EntityPatternDefinition> definitions) {
        Map<EntityType, List<Pattern>> compiled = new EnumMap<>(EntityType.class);
        int total = 0;
        for (EntityPatternDefinition def : definitions) {
            Optional<EntityType> type = EntityType.fromWireName(def.type());
            if (type.isEmpty()) {
                logger.warn("略過未知實體類型: {}", def.type());
                continue;
            }
            List<Pattern> list = compiled.computeIfAbsent(type.get(), k -> new ArrayList<>());
            if (def.patterns() == null) {
                continue;
            }
            for (String regex : def.patterns()) {
                try {
                    list.add(Pattern.compile(regex, REGEX_FLAGS));
                    total++;
                } catch (PatternSyntaxException e) {
                    logger.warn("實體 {} 的樣式格式錯誤，已略過: {} ({})", def.type(), regex, e.getDescription());
                }
            }
        }
        this.patterns = compiled;
        logger.info("Entity patterns loaded: types={}, patterns={}", compiled.size(), total);
    }

    @Override
    public List<Entity> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        // EnumMap 依類型宣告順序走訪，候選清單天然以類型順序排列，穩定排序後同位置保持此順序
        List<Entity> candidates = new ArrayList<>();
        for (Map.Entry<EntityType, List<Pattern>> e : patterns.entrySet()) {
            for (Pattern p : e.getValue()) {
                Matcher m = p.matcher(text);
                while (m.find()) {
                    if (m.end() > m.start()) {
                        String value = m.group().toLowerCase(Locale.ROOT);
                        candidates.add(new Entity(e.getKey(), value, m.start(), m.end(), ENTITY_CONFIDENCE));
                    }
                }
            }
        }
        candidates.sort(Comparator.comparingInt(Entity::start));

        List<Entity> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Entity entity : candidates) {
            if (seen.add(entity.type().name() + "\u0000" + entity.value())) {
                out.add(entity);
            }
        }
        return out;
    }
}
