package com.lanka.tourbot.service;

import com.lanka.tourbot.model.ChatSession;
import com.lanka.tourbot.model.ConversationTurn;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.SessionSnapshot;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Session 服務介面
 * 負責管理對話 Session 的生命週期；查詢不會隱式建立 Session
 */
public interface SessionService {

    /**
     * 建立新 Session
     *
     * @param userId   使用者 ID
     * @param language 初始語言，null 表示使用預設語言
     * @return 新的 Session ID
     */
    String createSession(String userId, Language language);

    /**
     * 取得指定 Session
     *
     * @param sessionId Session ID
     * @return ChatSession 或 null
     */
    ChatSession getSession(String sessionId);

    /**
     * 取得指定 Session，不存在時拋出 SessionNotFoundException
     */
    ChatSession requireSession(String sessionId);

    void appendTurn(String sessionId, ConversationTurn turn);

    /**
     * 變更 Session 語言
     *
     * @return Session 存在且語言代碼受支援時為 true；否則不做任何變更
     */
    boolean setLanguage(String sessionId, String languageCode);

    /**
     * 變更 Session 導遊
     *
     * @return Session 存在且導遊 ID 已註冊時為 true；否則不做任何變更
     */
    boolean setGuide(String sessionId, String guideId);

    /**
     * 移除 Session
     *
     * @return Session 原本存在時為 true
     */
    boolean resetSession(String sessionId);

    Optional<SessionSnapshot> snapshot(String sessionId);

    /**
     * 列出閒置超過指定時間的 Session，供外部清理排程使用
     */
    List<String> findIdleSessionIds(Duration idleFor);

    /**
     * 取得目前活躍的 Session 數量
     *
     * @return 活躍 Session 數量
     */
    int getActiveSessionCount();
}
