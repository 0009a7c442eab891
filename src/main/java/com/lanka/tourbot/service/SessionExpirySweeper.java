package com.lanka.tourbot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 閒置 Session 清理排程
 * <p>
 * SessionService 本身不做逾時淘汰；此排程定期找出閒置超過 retention-minutes 的 Session 並移除。
 * 預設關閉（tourbot.session.sweeper.enabled=false），後台也可手動觸發 {@link #sweep()}。
 */
@Component
public class SessionExpirySweeper {

    private static final Logger logger = LoggerFactory.getLogger(SessionExpirySweeper.class);

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Autowired
    private SessionService sessionService;

    @Value("${tourbot.session.sweeper.enabled:false}")
    private boolean enabled;

    @Value("${tourbot.session.retention-minutes:30}")
    private long retentionMinutes = 30;

    @Scheduled(fixedDelayString = "${tourbot.session.sweeper.interval-ms:60000}")
    public void scheduledSweep() {
        if (!enabled) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            logger.debug("Session sweep already running; skipping tick.");
            return;
        }
        try {
            sweep();
        } finally {
            running.set(false);
        }
    }

    /**
     * 執行一次清理
     *
     * @return 移除的 Session 數量
     */
    public int sweep() {
        List<String> idle = sessionService.findIdleSessionIds(Duration.ofMinutes(retentionMinutes));
        int removed = 0;
        for (String id : idle) {
            if (sessionService.resetSession(id)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("已清理 {} 個閒置 Session (retentionMinutes={})", removed, retentionMinutes);
        }
        return removed;
    }

    public long getRetentionMinutes() {
        return retentionMinutes;
    }
}
