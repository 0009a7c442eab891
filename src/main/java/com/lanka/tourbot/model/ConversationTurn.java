package com.lanka.tourbot.model;

import java.util.List;

/**
 * 對話歷史中的單輪紀錄
 */
public record ConversationTurn(
        long timestamp,
        String userMessage,
        Language detectedLanguage,
        Intent intent,
        double intentConfidence,
        List<Entity> entities,
        String botReply) {
}
