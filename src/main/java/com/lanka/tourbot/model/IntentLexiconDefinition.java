package com.lanka.tourbot.model;

import java.util.List;
import java.util.Map;

/**
 * 意圖詞庫設定（對應 nlp/intents.json）
 *
 * @param intents          各意圖的樣式與關鍵字（以語言代碼分組）
 * @param contextRules     上下文規則（依序判斷，第一個觸發者生效）
 * @param fallbackKeywords 後備關鍵字（依序判斷）
 */
public record IntentLexiconDefinition(
        List<IntentDefinition> intents,
        List<ContextRule> contextRules,
        List<FallbackKeywords> fallbackKeywords) {

    public record IntentDefinition(
            String intent,
            Map<String, List<String>> patterns,
            Map<String, List<String>> keywords) {
    }

    public record ContextRule(String name, String intent, double score, List<String> phrases) {
    }

    public record FallbackKeywords(String intent, List<String> keywords) {
    }
}
