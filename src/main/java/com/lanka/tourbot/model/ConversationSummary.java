package com.lanka.tourbot.model;

import java.util.List;

/**
 * 對話摘要
 *
 * @param sessionId       Session ID
 * @param totalTurns      歷史中的對話輪數
 * @param languagesUsed   使用過的語言（依首次出現順序）
 * @param topicsDiscussed 討論過的主題（實質意圖，依首次出現順序）
 * @param sessionStart    Session 建立時間
 * @param lastInteraction 最後互動時間
 * @param durationSeconds 對話持續秒數
 */
public record ConversationSummary(
        String sessionId,
        int totalTurns,
        List<Language> languagesUsed,
        List<Intent> topicsDiscussed,
        long sessionStart,
        long lastInteraction,
        long durationSeconds) {
}
