package com.lanka.tourbot.repository;

import com.lanka.tourbot.model.Language;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 回應模板目錄
 * 只回傳指定語言的內容，語言回退由呼叫端決定
 */
public interface ResponseTemplateRepository {
    Optional<String> findTemplate(String family, Language language);

    List<String> findSuggestions(String key, Language language);

    List<String> findQuickReplies(String key, Language language);

    Set<String> families();
}
