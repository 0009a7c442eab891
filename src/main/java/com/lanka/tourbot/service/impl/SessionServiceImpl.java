package com.lanka.tourbot.service.impl;

import com.lanka.tourbot.exception.SessionNotFoundException;
import com.lanka.tourbot.model.ChatSession;
import com.lanka.tourbot.model.ConversationTurn;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.SessionSnapshot;
import com.lanka.tourbot.repository.GuideRepository;
import com.lanka.tourbot.service.RuntimeConfigService;
import com.lanka.tourbot.service.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session 服務實作 (Session Service Implementation)
 * <p>
 * 功能：
 * 負責管理使用者的對話 Session 生命週期，包括建立、查詢、語言／導遊切換與移除。
 * <p>
 * 流程概述：
 * 1. 使用記憶體內的 ConcurrentHashMap 儲存所有活躍 Session (`sessions`)，不使用全域鎖。
 * 2. 每個 `ChatSession` 自帶鎖，同一 Session 的變更互斥，不同 Session 互不阻塞。
 * 3. 本服務不做逾時淘汰；閒置清理由 `SessionExpirySweeper` 透過 `findIdleSessionIds` + `resetSession` 進行。
 */
@Service
public class SessionServiceImpl implements SessionService {

    private static final Logger logger = LoggerFactory.getLogger(SessionServiceImpl.class);

    // 使用 Thread-Safe 的 Map 來儲存 Session，Key 為 sessionId
    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Autowired
    private GuideRepository guideRepository;

    // 每個 Session 保留的最大對話輪數
    @Value("${tourbot.session.history-cap:50}")
    private int historyCap = 50;

    /**
     * 建立 Session
     * <p>
     * 流程：
     * 1. 以 UUID 產生唯一 ID。
     * 2. 語言未指定時使用預設語言；導遊使用預設導遊。
     * 3. 以 `putIfAbsent` 存入 Map，UUID 碰撞時重新產生。
     */
    @Override
    public String createSession(String userId, Language language) {
        Language initial = language != null ? language : runtimeConfigService.getDefaultLanguage();
        String guideId = guideRepository.defaultGuide().id();
        while (true) {
            String id = UUID.randomUUID().toString();
            ChatSession session = new ChatSession(id, userId, initial, guideId, historyCap);
            if (sessions.putIfAbsent(id, session) == null) {
                logger.info("已建立 Session: {} (userId={}, language={}, guide={})",
                        id, userId, initial.getCode(), guideId);
                return id;
            }
        }
    }

    @Override
    public ChatSession getSession(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        return sessions.get(sessionId);
    }

    @Override
    public ChatSession requireSession(String sessionId) {
        ChatSession session = getSession(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    @Override
    public void appendTurn(String sessionId, ConversationTurn turn) {
        requireSession(sessionId).appendTurn(turn);
    }

    @Override
    public boolean setLanguage(String sessionId, String languageCode) {
        ChatSession session = getSession(sessionId);
        Optional<Language> language = Language.fromCode(languageCode);
        if (session == null || language.isEmpty()) {
            logger.debug("setLanguage 拒絕: sessionId={}, language={}", sessionId, languageCode);
            return false;
        }
        session.setLanguage(language.get());
        return true;
    }

    @Override
    public boolean setGuide(String sessionId, String guideId) {
        ChatSession session = getSession(sessionId);
        if (session == null || guideRepository.find(guideId).isEmpty()) {
            logger.debug("setGuide 拒絕: sessionId={}, guideId={}", sessionId, guideId);
            return false;
        }
        session.setGuideId(guideId);
        return true;
    }

    @Override
    public boolean resetSession(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            logger.info("已清除 Session: {}", sessionId);
        }
        return removed;
    }

    @Override
    public Optional<SessionSnapshot> snapshot(String sessionId) {
        ChatSession session = getSession(sessionId);
        return session == null ? Optional.empty() : Optional.of(session.snapshot());
    }

    @Override
    public List<String> findIdleSessionIds(Duration idleFor) {
        long cutoff = System.currentTimeMillis() - idleFor.toMillis();
        List<String> out = new ArrayList<>();
        for (ChatSession session : sessions.values()) {
            if (session.getLastActiveAt() < cutoff) {
                out.add(session.getSessionId());
            }
        }
        return out;
    }

    @Override
    public int getActiveSessionCount() {
        return sessions.size();
    }
}
