package com.lanka.tourbot.service.impl;

import com.lanka.tourbot.model.Intent;
import com.lanka.tourbot.model.IntentResult;
import com.lanka.tourbot.model.IntentScore;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.nlp.IntentLexicon;
import com.lanka.tourbot.nlp.IntentSignalDetector;
import com.lanka.tourbot.nlp.TermMatcher;
import com.lanka.tourbot.service.IntentRecognitionService;
import com.lanka.tourbot.service.RuntimeConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 意圖辨識服務實作 (Intent Recognition Service Implementation)
 * <p>
 * 功能：
 * 融合多個獨立偵測器（樣式、關鍵字、上下文）的訊號，產生最終意圖與候選清單。
 * <p>
 * 融合流程：
 * 1. 依偵測器順序執行，同一意圖的分數累加。
 * 2. 最高累積分者勝出；同分時以先貢獻的偵測器順序為準。
 * 3. 信心 = 勝出分數 / 所有貢獻總和。
 * 4. 候選 = 其他累積分數 ≥ alternativeMinScore 的意圖，遞減排序，取前 maxAlternatives 個。
 * 5. 偵測器拋出例外時記錄警告，視為零貢獻。
 */
@Service
public class IntentRecognitionServiceImpl implements IntentRecognitionService {

    private static final Logger logger = LoggerFactory.getLogger(IntentRecognitionServiceImpl.class);

    static final double FALLBACK_CONFIDENCE = 0.5;

    @Autowired
    private List<IntentSignalDetector> detectors;

    @Autowired
    private IntentLexicon lexicon;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Override
    public IntentResult recognize(String text, Language language) {
        if (text == null || text.isBlank()) {
            return IntentResult.unknown();
        }
        String lowered = text.toLowerCase(Locale.ROOT);

        Map<Intent, Double> cumulative = new LinkedHashMap<>();
        for (IntentSignalDetector detector : detectors) {
            Optional<IntentScore> signal;
            try {
                signal = detector.detect(lowered, language);
            } catch (RuntimeException e) {
                logger.warn("Intent detector {} failed, contributing nothing: {}", detector.name(), e.toString());
                continue;
            }
            signal.filter(s -> s.score() > 0.0)
                    .ifPresent(s -> cumulative.merge(s.intent(), s.score(), Double::sum));
        }
        if (cumulative.isEmpty()) {
            return IntentResult.unknown();
        }

        Intent best = null;
        double bestScore = 0.0;
        double total = 0.0;
        for (Map.Entry<Intent, Double> e : cumulative.entrySet()) {
            total += e.getValue();
            if (best == null || e.getValue() > bestScore) {
                best = e.getKey();
                bestScore = e.getValue();
            }
        }
        double confidence = total > 0.0 ? Math.max(0.0, Math.min(1.0, bestScore / total)) : 0.0;

        double minScore = runtimeConfigService.getAlternativeMinScore();
        Intent winner = best;
        List<IntentScore> alternatives = cumulative.entrySet().stream()
                .filter(e -> e.getKey() != winner && e.getValue() >= minScore)
                .sorted(Map.Entry.<Intent, Double>comparingByValue(Comparator.reverseOrder()))
                .limit(runtimeConfigService.getMaxAlternatives())
                .map(e -> new IntentScore(e.getKey(), e.getValue()))
                .toList();

        logger.debug("Intent fused: winner={} confidence={} scores={}", winner, confidence, cumulative);
        return new IntentResult(winner, confidence, alternatives);
    }

    @Override
    public IntentResult recognizeByFallbackKeywords(String text) {
        if (text == null || text.isBlank()) {
            return IntentResult.unknown();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (IntentLexicon.FallbackEntry entry : lexicon.fallbackEntries()) {
            for (TermMatcher keyword : entry.keywords()) {
                if (keyword.matches(lowered)) {
                    return new IntentResult(entry.intent(), FALLBACK_CONFIDENCE, List.of());
                }
            }
        }
        return IntentResult.unknown();
    }
}
