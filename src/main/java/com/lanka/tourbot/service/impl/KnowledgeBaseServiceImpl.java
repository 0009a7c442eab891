package com.lanka.tourbot.service.impl;

import com.lanka.tourbot.model.KnowledgeEntry;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.repository.KnowledgeRepository;
import com.lanka.tourbot.service.KnowledgeBaseService;
import com.lanka.tourbot.service.RuntimeConfigService;
import com.lanka.tourbot.util.LuceneKnowledgeIndex;
import com.lanka.tourbot.util.TextOverlap;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 知識庫服務實作 (Knowledge Base Service Implementation)
 * <p>
 * 功能：
 * 提供景點、美食、交通等旅遊知識的名稱查詢與全文檢索。
 * <p>
 * 核心機制：
 * 1. **索引 (Indexing)**：依語言分組，每種語言建立一個 Lucene In-Memory Index。
 * 2. **重建 (Reindex)**：先建好新索引再一次替換參照，查詢端不會看到半成品。
 * 3. **相關性確認**：檢索命中後，以查詢與標題／別名的字元 bigram Jaccard 或查詢覆蓋率判斷是否真的相關。
 */
@Service
public class KnowledgeBaseServiceImpl implements KnowledgeBaseService {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseServiceImpl.class);

    static final double ACCEPT_JACCARD_THRESHOLD = 0.18;
    static final double ACCEPT_COVERAGE_THRESHOLD = 0.6;

    static final String CATEGORY_ATTRACTION = "attraction";
    static final String CATEGORY_FOOD = "food";
    static final String CATEGORY_TRANSPORT = "transport";

    private record LanguageIndex(List<KnowledgeEntry> entries, LuceneKnowledgeIndex index) {
    }

    @Autowired
    private KnowledgeRepository knowledgeRepository;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Value("${tourbot.knowledge.search-top-k:3}")
    private int searchTopK = 3;

    private volatile Map<Language, LanguageIndex> indexes = new EnumMap<>(Language.class);

    @PostConstruct
    public void init() {
        reindex();
    }

    @Override
    public int reindex() {
        List<KnowledgeEntry> all = knowledgeRepository.list();

        Map<Language, List<KnowledgeEntry>> grouped = new EnumMap<>(Language.class);
        for (KnowledgeEntry entry : all) {
            Optional<Language> language = Language.fromCode(entry.getLanguage());
            if (language.isEmpty()) {
                logger.warn("略過語言不支援的知識條目: {}", entry.getId());
                continue;
            }
            grouped.computeIfAbsent(language.get(), k -> new ArrayList<>()).add(entry);
        }

        Map<Language, LanguageIndex> rebuilt = new EnumMap<>(Language.class);
        int count = 0;
        for (Map.Entry<Language, List<KnowledgeEntry>> e : grouped.entrySet()) {
            LuceneKnowledgeIndex index = new LuceneKnowledgeIndex();
            index.build(e.getValue());
            rebuilt.put(e.getKey(), new LanguageIndex(List.copyOf(e.getValue()), index));
            count += e.getValue().size();
        }
        this.indexes = rebuilt;

        logger.info("知識庫索引完成: {} 條 ({})", count, knowledgeRepository.getSource());
        return count;
    }

    @Override
    public int size() {
        return indexes.values().stream().mapToInt(i -> i.entries().size()).sum();
    }

    @Override
    public Optional<KnowledgeEntry> findAttraction(String name, Language language) {
        return findByName(CATEGORY_ATTRACTION, name, language);
    }

    @Override
    public Optional<KnowledgeEntry> findFood(String name, Language language) {
        return findByName(CATEGORY_FOOD, name, language);
    }

    @Override
    public Optional<KnowledgeEntry> findTransport(String name, Language language) {
        return findByName(CATEGORY_TRANSPORT, name, language);
    }

    private Optional<KnowledgeEntry> findByName(String category, String name, Language language) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        Optional<KnowledgeEntry> found = findInLanguage(category, name, language);
        Language defaultLanguage = runtimeConfigService.getDefaultLanguage();
        if (found.isEmpty() && language != defaultLanguage) {
            found = findInLanguage(category, name, defaultLanguage);
        }
        return found;
    }

    private Optional<KnowledgeEntry> findInLanguage(String category, String name, Language language) {
        LanguageIndex li = indexes.get(language);
        if (li == null) {
            return Optional.empty();
        }
        return li.entries().stream()
                .filter(e -> category.equals(e.getCategory()) && e.matchesName(name))
                .findFirst()
                .map(KnowledgeEntry::copy);
    }

    @Override
    public List<KnowledgeEntry> search(String query, Language language, int topK) {
        LanguageIndex li = indexes.get(language);
        if (li == null || query == null || query.isBlank()) {
            return List.of();
        }
        List<KnowledgeEntry> out = new ArrayList<>();
        for (LuceneKnowledgeIndex.Hit hit : li.index().search(query, topK)) {
            if (hit.entryIndex() < 0 || hit.entryIndex() >= li.entries().size()) {
                continue;
            }
            KnowledgeEntry copy = li.entries().get(hit.entryIndex()).copy();
            copy.setScore(hit.score());
            out.add(copy);
        }
        return out;
    }

    @Override
    public Optional<KnowledgeEntry> bestMatch(String query, Language language) {
        List<KnowledgeEntry> hits = search(query, language, searchTopK);
        if (hits.isEmpty()) {
            return Optional.empty();
        }
        KnowledgeEntry top = hits.get(0);
        String normQuery = TextOverlap.normalize(query);
        String names = TextOverlap.normalize(top.getTitle() + " "
                + (top.getAliases() == null ? "" : String.join(" ", top.getAliases())));
        double jaccard = TextOverlap.jaccardCharBigrams(normQuery, names);
        double coverage = TextOverlap.queryBigramCoverage(normQuery, names);
        boolean accepted = jaccard >= ACCEPT_JACCARD_THRESHOLD || coverage >= ACCEPT_COVERAGE_THRESHOLD;
        logger.debug("Knowledge best match: id={} jaccard={} coverage={} accepted={}",
                top.getId(), String.format("%.3f", jaccard), String.format("%.3f", coverage), accepted);
        return accepted ? Optional.of(top) : Optional.empty();
    }
}
