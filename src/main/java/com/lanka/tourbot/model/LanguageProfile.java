package com.lanka.tourbot.model;

import java.util.List;

/**
 * 語言偵測設定（對應 nlp/languages.json）
 *
 * @param code             語言代碼
 * @param scriptRangeStart 文字區段起點（Unicode code point），無專屬文字時為 null
 * @param scriptRangeEnd   文字區段終點（含）
 * @param keywords         常見關鍵字
 * @param greetingPatterns 問候語正規表示式
 */
public record LanguageProfile(
        String code,
        Integer scriptRangeStart,
        Integer scriptRangeEnd,
        List<String> keywords,
        List<String> greetingPatterns) {

    public boolean hasScript() {
        return scriptRangeStart != null && scriptRangeEnd != null;
    }

    public boolean inScript(int codePoint) {
        return hasScript() && codePoint >= scriptRangeStart && codePoint <= scriptRangeEnd;
    }
}
