package com.lanka.tourbot.model;

import java.util.List;
import java.util.Map;

/**
 * 虛擬導遊（人設）
 * 靜態設定，從 data/guides.json 載入，執行期間不可變
 */
public record Guide(
        String id,
        String displayName,
        String personality,
        Map<String, String> greetings,
        List<String> specialties) {

    /**
     * 取得指定語言的問候語，若未提供則回退至 fallback 語言
     */
    public String greetingFor(Language language, Language fallback) {
        if (greetings == null) {
            return null;
        }
        String text = greetings.get(language.getCode());
        return text != null ? text : greetings.get(fallback.getCode());
    }
}
