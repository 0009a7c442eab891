package com.lanka.tourbot.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

/**
 * JSON 檔案載入工具
 * 從 classpath（resources 目錄）讀取詞庫與資料檔
 */
public final class JsonLoader {

    private static final Logger logger = LoggerFactory.getLogger(JsonLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonLoader() {
    }

    /**
     * 載入 JSON 陣列
     *
     * @param resource 檔案路徑（相對於 resources 目錄）
     * @param type     元素型別
     * @return 物件列表，若讀取失敗則回傳空列表
     */
    public static <T> List<T> loadList(String resource, TypeReference<List<T>> type) {
        List<T> list = load(resource, type);
        if (list == null) {
            return Collections.emptyList();
        }
        logger.info("成功載入 {}：{} 筆", resource, list.size());
        return list;
    }

    /**
     * 載入任意 JSON 結構
     *
     * @return 解析結果，若檔案不存在或格式錯誤則回傳 null
     */
    public static <T> T load(String resource, TypeReference<T> type) {
        try (InputStream is = JsonLoader.class.getResourceAsStream("/" + resource)) {
            if (is == null) {
                logger.error("找不到檔案: {}", resource);
                return null;
            }
            return MAPPER.readValue(is, type);
        } catch (IOException e) {
            logger.error("載入 JSON 檔案 {} 時發生錯誤: {}", resource, e.getMessage(), e);
            return null;
        }
    }

    public static <T> T load(String resource, Class<T> type) {
        try (InputStream is = JsonLoader.class.getResourceAsStream("/" + resource)) {
            if (is == null) {
                logger.error("找不到檔案: {}", resource);
                return null;
            }
            return MAPPER.readValue(is, type);
        } catch (IOException e) {
            logger.error("載入 JSON 檔案 {} 時發生錯誤: {}", resource, e.getMessage(), e);
            return null;
        }
    }
}
