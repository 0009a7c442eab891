package com.lanka.tourbot.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lanka.tourbot.model.KnowledgeEntry;
import com.lanka.tourbot.repository.KnowledgeRepository;
import com.lanka.tourbot.util.JsonLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 知識庫資料來源
 * <p>
 * 預設從 classpath 讀取；若設定 tourbot.knowledge.data-file 且檔案存在，則改讀外部檔案
 * （可在不重新部署的情況下更新內容，再透過後台 reindex 生效）。
 */
@Repository
public class ClasspathKnowledgeRepository implements KnowledgeRepository {

    private static final Logger logger = LoggerFactory.getLogger(ClasspathKnowledgeRepository.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ObjectMapper objectMapper;

    private List<KnowledgeEntry> entries = new ArrayList<>();

    @Value("${tourbot.knowledge.source-json:data/knowledge_base.json}")
    private String sourceJson = "data/knowledge_base.json";

    @Value("${tourbot.knowledge.data-file:}")
    private String dataFile;

    public ClasspathKnowledgeRepository() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @PostConstruct
    public void init() {
        reload();
    }

    @Override
    public int reload() {
        List<KnowledgeEntry> loaded = null;
        if (isExternalFileConfigured()) {
            Path p = Paths.get(dataFile);
            if (Files.exists(p)) {
                loaded = readFromFile(p);
            } else {
                logger.warn("tourbot.knowledge.data-file={} 不存在，改用 classpath 來源 {}", dataFile, sourceJson);
            }
        }
        if (loaded == null) {
            loaded = JsonLoader.loadList(sourceJson, new TypeReference<List<KnowledgeEntry>>() {});
        }

        lock.writeLock().lock();
        try {
            entries = new ArrayList<>(loaded);
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("Knowledge repository loaded: count={}, source={}", loaded.size(), getSource());
        return loaded.size();
    }

    @Override
    public List<KnowledgeEntry> list() {
        lock.readLock().lock();
        try {
            return entries.stream().map(KnowledgeEntry::copy).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public KnowledgeEntry get(String id) {
        if (id == null) {
            return null;
        }
        lock.readLock().lock();
        try {
            for (KnowledgeEntry e : entries) {
                if (id.equals(e.getId())) {
                    return e.copy();
                }
            }
            return null;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String getSource() {
        return isExternalFileConfigured() && Files.exists(Paths.get(dataFile)) ? dataFile : "classpath:" + sourceJson;
    }

    private boolean isExternalFileConfigured() {
        return dataFile != null && !dataFile.trim().isEmpty();
    }

    private List<KnowledgeEntry> readFromFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return objectMapper.readValue(is, new TypeReference<List<KnowledgeEntry>>() {});
        } catch (IOException e) {
            logger.warn("讀取知識庫檔案失敗 (dataFile={}): {}", path, e.getMessage());
            return null;
        }
    }
}
