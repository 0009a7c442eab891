package com.lanka.tourbot.model;

import java.util.List;

/**
 * 回應派發結果
 *
 * @param text              基礎回應文字（尚未個人化）
 * @param resolvedIntent    實際用於派發的意圖（follow_up 會解析為先前的實質意圖）
 * @param templateFamily    使用的模板族群
 * @param suggestions       建議問題
 * @param quickReplies      快速回覆按鈕
 * @param localizedFallback 是否因缺少翻譯而回退至預設語言
 */
public record DispatchResult(
        String text,
        Intent resolvedIntent,
        String templateFamily,
        List<String> suggestions,
        List<String> quickReplies,
        boolean localizedFallback) {
}
