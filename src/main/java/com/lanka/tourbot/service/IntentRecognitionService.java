package com.lanka.tourbot.service;

import com.lanka.tourbot.model.IntentResult;
import com.lanka.tourbot.model.Language;

public interface IntentRecognitionService {

    /**
     * 融合所有偵測器訊號辨識意圖
     *
     * @param text     使用者輸入
     * @param language Session 目前語言，決定使用哪一組樣式與關鍵字
     * @return 意圖、信心分數與候選意圖；無任何訊號時為 unknown
     */
    IntentResult recognize(String text, Language language);

    /**
     * 僅關鍵字的後備辨識：依清單順序第一個命中的意圖，信心固定 0.5
     */
    IntentResult recognizeByFallbackKeywords(String text);
}
