package com.lanka.tourbot.nlp;

import com.lanka.tourbot.model.IntentScore;
import com.lanka.tourbot.model.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 正則樣式偵測：分數 = 所有樣式的總命中次數 / 樣式數量，上限 1.0
 */
@Component
@Order(1)
public class PatternIntentDetector implements IntentSignalDetector {

    @Autowired
    private IntentLexicon lexicon;

    public PatternIntentDetector() {
    }

    public PatternIntentDetector(IntentLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public String name() {
        return "pattern";
    }

    @Override
    public Optional<IntentScore> detect(String loweredText, Language language) {
        IntentScore best = null;
        for (IntentLexicon.IntentEntry entry : lexicon.intents()) {
            List<Pattern> patterns = entry.patternsFor(language);
            if (patterns.isEmpty()) {
                continue;
            }
            int matches = 0;
            for (Pattern p : patterns) {
                Matcher m = p.matcher(loweredText);
                while (m.find()) {
                    matches++;
                }
            }
            if (matches == 0) {
                continue;
            }
            double score = Math.min(1.0, (double) matches / patterns.size());
            if (best == null || score > best.score()) {
                best = new IntentScore(entry.intent(), score);
            }
        }
        return Optional.ofNullable(best);
    }
}
