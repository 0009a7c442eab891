package com.lanka.tourbot.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 個人化包裝規則
 * <p>
 * 每條規則對應 personality.json 中的一個語句池，以及預設觸發機率與適用意圖。
 */
public enum PersonalizationRule {
    GREETING("greeting", "greeting-probability", 1.0,
            EnumSet.of(Intent.GREETING)),
    ENTHUSIASM("enthusiasm", "enthusiasm-probability", 0.7,
            EnumSet.of(Intent.ATTRACTION_INQUIRY, Intent.FOOD_INQUIRY, Intent.CULTURE_INQUIRY)),
    HELPFUL("helpful", "helpful-probability", 0.6,
            EnumSet.of(Intent.TRANSPORT_INQUIRY, Intent.ACCOMMODATION_INQUIRY)),
    CULTURAL_INSIGHT("culturalInsight", "cultural-insight-probability", 0.5,
            EnumSet.of(Intent.ATTRACTION_INQUIRY, Intent.FOOD_INQUIRY, Intent.CULTURE_INQUIRY)),
    // 適用所有意圖，但僅在 Session 已有歷史時觸發
    PERSONAL_TOUCH("personalTouch", "personal-touch-probability", 0.3,
            EnumSet.allOf(Intent.class)),
    ENCOURAGEMENT("encouragement", "encouragement-probability", 0.4,
            EnumSet.complementOf(EnumSet.of(Intent.FAREWELL, Intent.UNKNOWN, Intent.CLARIFICATION)));

    private final String poolKey;
    private final String propertyName;
    private final double defaultProbability;
    private final Set<Intent> eligibleIntents;

    PersonalizationRule(String poolKey, String propertyName, double defaultProbability, Set<Intent> eligibleIntents) {
        this.poolKey = poolKey;
        this.propertyName = propertyName;
        this.defaultProbability = defaultProbability;
        this.eligibleIntents = eligibleIntents;
    }

    public String getPoolKey() {
        return poolKey;
    }

    /**
     * application.properties 中 tourbot.personalization.* 的鍵名
     */
    public String getPropertyName() {
        return propertyName;
    }

    public double getDefaultProbability() {
        return defaultProbability;
    }

    public boolean appliesTo(Intent intent) {
        return intent != null && eligibleIntents.contains(intent);
    }
}
