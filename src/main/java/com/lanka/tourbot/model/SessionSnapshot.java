package com.lanka.tourbot.model;

import java.util.List;

/**
 * Session 快照（唯讀複本）
 * 用於查詢與序列化，避免持有 Session 鎖時輸出給呼叫端
 */
public record SessionSnapshot(
        String sessionId,
        String userId,
        Language language,
        String guideId,
        List<ConversationTurn> history,
        long createdAt,
        long lastActiveAt) {

    /**
     * 取得最近一個實質意圖（由新到舊搜尋）
     *
     * @return 實質意圖，若無則為 null
     */
    public Intent lastSubstantiveIntent() {
        for (int i = history.size() - 1; i >= 0; i--) {
            Intent intent = history.get(i).intent();
            if (intent != null && intent.isSubstantive()) {
                return intent;
            }
        }
        return null;
    }
}
