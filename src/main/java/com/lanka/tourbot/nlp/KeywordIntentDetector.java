package com.lanka.tourbot.nlp;

import com.lanka.tourbot.model.IntentScore;
import com.lanka.tourbot.model.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 關鍵字偵測：分數 = 命中的關鍵字數 / 該語言關鍵字清單大小
 */
@Component
@Order(2)
public class KeywordIntentDetector implements IntentSignalDetector {

    @Autowired
    private IntentLexicon lexicon;

    public KeywordIntentDetector() {
    }

    public KeywordIntentDetector(IntentLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public String name() {
        return "keyword";
    }

    @Override
    public Optional<IntentScore> detect(String loweredText, Language language) {
        IntentScore best = null;
        for (IntentLexicon.IntentEntry entry : lexicon.intents()) {
            List<TermMatcher> keywords = entry.keywordsFor(language);
            if (keywords.isEmpty()) {
                continue;
            }
            long hits = keywords.stream().filter(k -> k.matches(loweredText)).count();
            if (hits == 0) {
                continue;
            }
            double score = (double) hits / keywords.size();
            if (best == null || score > best.score()) {
                best = new IntentScore(entry.intent(), score);
            }
        }
        return Optional.ofNullable(best);
    }
}
