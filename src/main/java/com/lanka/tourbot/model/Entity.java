package com.lanka.tourbot.model;

/**
 * 抽取出的實體
 *
 * @param type       實體類型
 * @param value      命中文字（小寫）
 * @param start      原始輸入中的起始位置（含）
 * @param end        結束位置（不含）
 * @param confidence 信心分數
 */
public record Entity(
        EntityType type,
        String value,
        int start,
        int end,
        double confidence) {
}
