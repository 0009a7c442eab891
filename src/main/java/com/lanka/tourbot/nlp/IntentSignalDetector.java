package com.lanka.tourbot.nlp;

import com.lanka.tourbot.model.IntentScore;
import com.lanka.tourbot.model.Language;

import java.util.Optional;

/**
 * 意圖訊號偵測器
 * <p>
 * 每個偵測器獨立對（已轉小寫的）輸入給出最多一個意圖分數，由 IntentRecognitionService 融合。
 * 偵測順序由 {@link org.springframework.core.annotation.Order} 決定，分數相同時先貢獻者勝出。
 */
public interface IntentSignalDetector {

    String name();

    Optional<IntentScore> detect(String loweredText, Language language);
}
