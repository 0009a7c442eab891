package com.lanka.tourbot.service;

import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.LanguageSignal;

import java.util.Map;

/**
 * 語言偵測服務介面
 */
public interface LanguageDetectionService {

    /**
     * 偵測輸入語言
     *
     * @param text 使用者輸入
     * @return 語言與信心分數；空白輸入回傳（預設語言, 0.5）
     */
    LanguageSignal detect(String text);

    /**
     * 各語言的評分明細，依語言設定檔順序
     */
    Map<Language, Double> scores(String text);
}
