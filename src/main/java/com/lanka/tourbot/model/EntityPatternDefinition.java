package com.lanka.tourbot.model;

import java.util.List;

/**
 * 實體擷取規則（對應 nlp/entities.json）
 */
public record EntityPatternDefinition(String type, List<String> patterns) {
}
