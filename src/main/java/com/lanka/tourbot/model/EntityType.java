package com.lanka.tourbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * 實體類型
 */
public enum EntityType {

    LOCATION("location"),
    ATTRACTION("attraction"),
    TIME("time"),
    BUDGET("budget"),
    DURATION("duration"),
    FOOD("food"),
    TRANSPORT_TYPE("transport_type"),
    ACCOMMODATION_TYPE("accommodation_type");

    private final String wireName;

    EntityType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<EntityType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
