package com.lanka.tourbot.repository;

import com.lanka.tourbot.model.KnowledgeEntry;

import java.util.List;

public interface KnowledgeRepository {
    List<KnowledgeEntry> list();

    KnowledgeEntry get(String id);

    /**
     * 重新讀取資料來源
     *
     * @return 讀取後的條目數量
     */
    int reload();

    String getSource();
}
