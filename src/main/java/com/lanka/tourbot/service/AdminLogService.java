package com.lanka.tourbot.service;

import java.util.List;
import java.util.Map;

/**
 * 後台稽核紀錄：設定變更、知識庫重建、Session 清理等操作
 */
public interface AdminLogService {
    record Entry(long timestampMs, String level, String action, String message, Map<String, Object> data) {
    }

    void info(String action, String message, Map<String, Object> data);

    void warn(String action, String message, Map<String, Object> data);

    List<Entry> query(Long sinceMs, Integer limit, String actionContains, String level);

    int size();
}
