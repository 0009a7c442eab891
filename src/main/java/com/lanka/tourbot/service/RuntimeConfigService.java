package com.lanka.tourbot.service;

import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.PersonalizationRule;

import java.util.Map;

public interface RuntimeConfigService {
    Language getDefaultLanguage();

    double getLanguageSwitchThreshold();

    double getAlternativeMinScore();

    int getMaxAlternatives();

    double getPersonalizationProbability(PersonalizationRule rule);

    void updateLanguage(Double switchThreshold);

    void updateIntent(Double alternativeMinScore, Integer maxAlternatives);

    void updatePersonalization(Map<PersonalizationRule, Double> probabilities);

    Map<String, Object> snapshot();
}
