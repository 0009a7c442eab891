package com.lanka.tourbot.service.impl;

import com.lanka.tourbot.service.AdminLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Predicate;

/**
 * 後台稽核日誌服務實作 (Admin Audit Log Service Implementation)
 * <p>
 * 記憶體內的滾動緩衝區，記錄會影響對話行為的後台操作，同時轉寫到應用程式日誌。
 * 超過 `admin.log.max` 時丟棄最舊的紀錄。
 */
@Service
public class AdminLogServiceImpl implements AdminLogService {

    private static final Logger logger = LoggerFactory.getLogger(AdminLogServiceImpl.class);

    private static final int DEFAULT_QUERY_LIMIT = 200;

    @Value("${admin.log.max:1000}")
    private int maxEntries = 1000;

    private final Deque<Entry> entries = new ConcurrentLinkedDeque<>();

    @Override
    public void info(String action, String message, Map<String, Object> data) {
        logger.info("ADMIN action={} msg={} data={}", action, message, data);
        append(new Entry(System.currentTimeMillis(), "INFO", action, message, copyOf(data)));
    }

    @Override
    public void warn(String action, String message, Map<String, Object> data) {
        logger.warn("ADMIN action={} msg={} data={}", action, message, data);
        append(new Entry(System.currentTimeMillis(), "WARN", action, message, copyOf(data)));
    }

    private void append(Entry entry) {
        entries.addLast(entry);
        while (entries.size() > Math.max(1, maxEntries)) {
            entries.pollFirst();
        }
    }

    /**
     * 查詢稽核紀錄 (Query Audit Entries)
     * <p>
     * 依時間、動作名稱（部分比對，不分大小寫）與等級篩選，回傳最新的 limit 筆，依時間遞增排列。
     */
    @Override
    public List<Entry> query(Long sinceMs, Integer limit, String actionContains, String level) {
        long since = sinceMs != null ? sinceMs : 0L;
        int lim = limit != null ? Math.max(1, limit) : DEFAULT_QUERY_LIMIT;

        Predicate<Entry> filter = e -> e.timestampMs() >= since;
        if (actionContains != null && !actionContains.isBlank()) {
            String needle = actionContains.toLowerCase(Locale.ROOT);
            filter = filter.and(e -> e.action() != null && e.action().toLowerCase(Locale.ROOT).contains(needle));
        }
        if (level != null && !level.isBlank()) {
            String wanted = level.toUpperCase(Locale.ROOT);
            filter = filter.and(e -> wanted.equals(e.level()));
        }

        List<Entry> matched = entries.stream().filter(filter).toList();
        return matched.subList(Math.max(0, matched.size() - lim), matched.size());
    }

    @Override
    public int size() {
        return entries.size();
    }

    private static Map<String, Object> copyOf(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        // Map.copyOf 不接受 null 值
        return data.containsValue(null) ? new HashMap<>(data) : Map.copyOf(data);
    }
}
