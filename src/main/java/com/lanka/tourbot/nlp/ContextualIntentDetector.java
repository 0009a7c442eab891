package com.lanka.tourbot.nlp;

import com.lanka.tourbot.model.IntentScore;
import com.lanka.tourbot.model.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 上下文線索偵測（追問、澄清、確認），依規則順序第一個命中者勝出，使用規則的固定分數
 */
@Component
@Order(3)
public class ContextualIntentDetector implements IntentSignalDetector {

    @Autowired
    private IntentLexicon lexicon;

    public ContextualIntentDetector() {
    }

    public ContextualIntentDetector(IntentLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public String name() {
        return "contextual";
    }

    @Override
    public Optional<IntentScore> detect(String loweredText, Language language) {
        for (IntentLexicon.ContextRule rule : lexicon.contextRules()) {
            for (TermMatcher phrase : rule.phrases()) {
                if (phrase.matches(loweredText)) {
                    return Optional.of(new IntentScore(rule.intent(), rule.score()));
                }
            }
        }
        return Optional.empty();
    }
}
