package com.lanka.tourbot.repository;

import com.lanka.tourbot.model.Guide;

import java.util.List;
import java.util.Optional;

/**
 * 導遊（人設）目錄，執行期間唯讀
 */
public interface GuideRepository {
    List<Guide> list();

    Optional<Guide> find(String id);

    Guide defaultGuide();
}
