package com.lanka.tourbot.service;

import com.lanka.tourbot.model.KnowledgeEntry;
import com.lanka.tourbot.model.Language;

import java.util.List;
import java.util.Optional;

/**
 * 旅遊知識庫服務介面
 * 名稱查詢在指定語言找不到時回退到預設語言
 */
public interface KnowledgeBaseService {

    Optional<KnowledgeEntry> findAttraction(String name, Language language);

    Optional<KnowledgeEntry> findFood(String name, Language language);

    Optional<KnowledgeEntry> findTransport(String name, Language language);

    /**
     * Lucene 全文檢索（單一語言）
     *
     * @return 依分數遞減的條目副本，score 欄位為檢索分數
     */
    List<KnowledgeEntry> search(String query, Language language, int topK);

    /**
     * 檢索並以標題／別名的字元重疊度確認相關性，僅在足夠相關時回傳
     */
    Optional<KnowledgeEntry> bestMatch(String query, Language language);

    /**
     * 從資料來源重建索引
     *
     * @return 索引後的條目數
     */
    int reindex();

    int size();
}
