package com.lanka.tourbot.service;

import com.lanka.tourbot.model.DispatchResult;
import com.lanka.tourbot.model.Entity;
import com.lanka.tourbot.model.IntentResult;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.SessionSnapshot;
import com.lanka.tourbot.model.Utterance;

import java.util.List;

/**
 * 回應分派服務介面
 * 依意圖選擇回應模板並以實體參數化；結果不含個人化包裝
 */
public interface ResponseDispatchService {

    /**
     * @param session      處理本輪前的 Session 快照（尚未加入本輪）
     * @param intentResult 意圖辨識結果
     * @param entities     擷取到的實體
     * @param utterance    原始輸入，unknown 意圖時用於知識庫檢索
     */
    DispatchResult dispatch(SessionSnapshot session, IntentResult intentResult, List<Entity> entities,
                            Utterance utterance);

    /**
     * 內部錯誤時的在地化回應
     */
    DispatchResult errorReply(Language language);
}
