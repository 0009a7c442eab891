package com.lanka.tourbot.service;

import com.lanka.tourbot.model.Guide;
import com.lanka.tourbot.model.Intent;
import com.lanka.tourbot.model.Language;

import java.util.Random;

/**
 * 個人化包裝服務介面
 * 依機率為基礎回應加上導遊風格的開場、前綴或結尾；語句中的 {guide} 以導遊名稱替換
 */
public interface PersonalizationService {

    /**
     * @param baseText   分派產生的基礎回應
     * @param intent     實際用於回應的意圖
     * @param language   回應語言
     * @param hasHistory Session 在本輪之前是否已有對話紀錄
     * @param guide      Session 目前的導遊；為 null 時略過含 {guide} 的語句
     * @return 包裝後的回應；所有規則都未觸發時原樣回傳
     */
    String personalize(String baseText, Intent intent, Language language, boolean hasHistory, Guide guide);

    /**
     * 導遊自我介紹（切換導遊時使用），該語言沒有語句時回退英文
     */
    String introduction(Guide guide, Language language);

    /**
     * 替換亂數來源（測試用以固定結果）
     */
    void setRandom(Random random);
}
