package com.lanka.tourbot.service;

import com.lanka.tourbot.model.ConversationSummary;
import com.lanka.tourbot.model.Entity;
import com.lanka.tourbot.model.Intent;
import com.lanka.tourbot.model.IntentScore;
import com.lanka.tourbot.model.Language;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Optional;

/**
 * 對話服務介面
 * 串接語言偵測、意圖辨識、實體擷取、回應分派與個人化，處理單輪對話
 */
public interface ChatService {

    /**
     * 處理一輪對話（同步）
     *
     * @param request 輸入
     * @return 處理結果；輸入無效或 Session 不存在時以 status 表示，不拋出例外
     */
    TurnResult processTurn(TurnRequest request);

    /**
     * 處理 Streaming 對話請求，依序發送 language、intent、entities、reply、done 事件
     *
     * @param request 輸入
     * @param emitter SSE 發送器
     */
    void processStreamingTurn(TurnRequest request, SseEmitter emitter);

    /**
     * 對話摘要：輪數、使用過的語言、討論過的主題與持續時間
     */
    Optional<ConversationSummary> summarize(String sessionId);

    /**
     * @param languageOverride 明確指定的語言代碼，null 表示自動偵測
     */
    record TurnRequest(String sessionId, String message, String languageOverride) {
    }

    enum TurnStatus {
        OK,
        INVALID_INPUT,
        SESSION_NOT_FOUND
    }

    /**
     * 單輪處理結果
     */
    record TurnResult(
            TurnStatus status,
            String sessionId,
            String replyText,
            Language resolvedLanguage,
            Language detectedLanguage,
            double languageConfidence,
            Intent intent,
            double intentConfidence,
            List<IntentScore> alternatives,
            List<Entity> entities,
            String guideId,
            List<String> suggestions,
            List<String> quickReplies,
            String message) {

        public static TurnResult invalidInput(String sessionId, String message) {
            return new TurnResult(TurnStatus.INVALID_INPUT, sessionId, null, null, null, 0.0, null, 0.0,
                    List.of(), List.of(), null, List.of(), List.of(), message);
        }

        public static TurnResult sessionNotFound(String sessionId) {
            return new TurnResult(TurnStatus.SESSION_NOT_FOUND, sessionId, null, null, null, 0.0, null, 0.0,
                    List.of(), List.of(), null, List.of(), List.of(), "Session not found: " + sessionId);
        }

        public boolean isOk() {
            return status == TurnStatus.OK;
        }
    }
}
