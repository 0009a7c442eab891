package com.lanka.tourbot.service;

import com.lanka.tourbot.model.Entity;

import java.util.List;

public interface EntityExtractionService {

    /**
     * 擷取實體，依出現位置排序；同類型同值僅保留第一個。任何輸入皆不拋出例外
     */
    List<Entity> extract(String text);
}
