package com.lanka.tourbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * 支援語言
 * 對話引擎可處理的語言集合（封閉集合）
 */
public enum Language {

    EN("en", "English"),
    SI("si", "Sinhala"),
    TA("ta", "Tamil");

    private final String code;
    private final String displayName;

    Language(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 依語言代碼查詢
     *
     * @param code 語言代碼（如 en / si / ta，不分大小寫）
     * @return 對應語言，若不支援則為 empty
     */
    public static Optional<Language> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.code.equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    public static boolean isSupported(String code) {
        return fromCode(code).isPresent();
    }
}
