package com.lanka.tourbot.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 對話 Session 模型
 * 用於記錄多輪對話歷史、目前語言與導遊
 * <p>
 * 所有可變狀態皆由 Session 自身的鎖保護；不同 Session 之間互不阻塞。
 */
public class ChatSession {

    private final String sessionId;
    private final String userId;
    private final long createdAt;
    private final int historyCap;
    private final Deque<ConversationTurn> history = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    private Language language;
    private String guideId;
    private long lastActiveAt;

    public ChatSession(String sessionId, String userId, Language language, String guideId, int historyCap) {
        if (historyCap <= 0) {
            throw new IllegalArgumentException("historyCap must be positive");
        }
        this.sessionId = sessionId;
        this.userId = userId;
        this.language = language;
        this.guideId = guideId;
        this.historyCap = historyCap;
        this.createdAt = System.currentTimeMillis();
        this.lastActiveAt = this.createdAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public int getHistoryCap() {
        return historyCap;
    }

    /**
     * Session 鎖，整輪對話處理期間由呼叫端持有以保證同一 Session 的歷史順序
     */
    public ReentrantLock lock() {
        return lock;
    }

    public Language getLanguage() {
        lock.lock();
        try {
            return language;
        } finally {
            lock.unlock();
        }
    }

    public void setLanguage(Language language) {
        lock.lock();
        try {
            this.language = language;
            lastActiveAt = System.currentTimeMillis();
        } finally {
            lock.unlock();
        }
    }

    public String getGuideId() {
        lock.lock();
        try {
            return guideId;
        } finally {
            lock.unlock();
        }
    }

    public void setGuideId(String guideId) {
        lock.lock();
        try {
            this.guideId = guideId;
            lastActiveAt = System.currentTimeMillis();
        } finally {
            lock.unlock();
        }
    }

    public long getLastActiveAt() {
        lock.lock();
        try {
            return lastActiveAt;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 追加一輪對話，超過上限時以 FIFO 移除最舊紀錄
     */
    public void appendTurn(ConversationTurn turn) {
        lock.lock();
        try {
            history.addLast(turn);
            while (history.size() > historyCap) {
                history.pollFirst();
            }
            lastActiveAt = System.currentTimeMillis();
        } finally {
            lock.unlock();
        }
    }

    public int getHistorySize() {
        lock.lock();
        try {
            return history.size();
        } finally {
            lock.unlock();
        }
    }

    public SessionSnapshot snapshot() {
        lock.lock();
        try {
            List<ConversationTurn> copy = new ArrayList<>(history);
            return new SessionSnapshot(sessionId, userId, language, guideId,
                    List.copyOf(copy), createdAt, lastActiveAt);
        } finally {
            lock.unlock();
        }
    }
}
