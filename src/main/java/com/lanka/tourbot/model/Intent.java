package com.lanka.tourbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * 意圖（封閉集合）
 * <p>
 * wireName 為 JSON 詞彙檔與 API 輸出使用的名稱。
 */
public enum Intent {

    GREETING("greeting"),
    FAREWELL("farewell"),
    ATTRACTION_INQUIRY("attraction_inquiry"),
    FOOD_INQUIRY("food_inquiry"),
    TRANSPORT_INQUIRY("transport_inquiry"),
    ACCOMMODATION_INQUIRY("accommodation_inquiry"),
    WEATHER_INQUIRY("weather_inquiry"),
    HELP_INQUIRY("help_inquiry"),
    CULTURE_INQUIRY("culture_inquiry"),
    FOLLOW_UP("follow_up"),
    CLARIFICATION("clarification"),
    CONFIRMATION("confirmation"),
    UNKNOWN("unknown");

    private final String wireName;

    Intent(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * 是否為「實質」意圖，即可作為追問 (follow_up) 的承接對象
     */
    public boolean isSubstantive() {
        return switch (this) {
            case ATTRACTION_INQUIRY, FOOD_INQUIRY, TRANSPORT_INQUIRY, ACCOMMODATION_INQUIRY,
                    WEATHER_INQUIRY, CULTURE_INQUIRY -> true;
            default -> false;
        };
    }

    public static Optional<Intent> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Intent intent : values()) {
            if (intent.wireName.equals(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
