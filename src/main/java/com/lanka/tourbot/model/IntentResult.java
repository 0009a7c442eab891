package com.lanka.tourbot.model;

import java.util.List;

/**
 * 意圖分類結果
 *
 * @param intent       最佳意圖
 * @param confidence   融合後信心分數 [0,1]
 * @param alternatives 其餘候選意圖（分數遞減）
 */
public record IntentResult(
        Intent intent,
        double confidence,
        List<IntentScore> alternatives) {

    public static IntentResult unknown() {
        return new IntentResult(Intent.UNKNOWN, 0.0, List.of());
    }

    public boolean isUnknown() {
        return intent == Intent.UNKNOWN;
    }
}
