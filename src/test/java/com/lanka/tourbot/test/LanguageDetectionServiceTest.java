package com.lanka.tourbot.test;

import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.LanguageProfile;
import com.lanka.tourbot.model.LanguageSignal;
import com.lanka.tourbot.service.impl.LanguageDetectionServiceImpl;
import com.lanka.tourbot.service.impl.RuntimeConfigServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 語言偵測測試
 */
public class LanguageDetectionServiceTest {

    private LanguageDetectionServiceImpl detector;

    @BeforeEach
    public void setUp() {
        detector = TourbotFixtures.languageDetector(TourbotFixtures.runtimeConfig());
    }

    @Test
    @DisplayName("英文問候 - 判定為英文")
    public void testEnglishGreeting() {
        LanguageSignal signal = detector.detect("Hello");

        assertEquals(Language.EN, signal.language(), "應判定為英文");
        assertTrue(signal.confidence() >= 0.5, "英文為預設語言，分數至少 0.5");
    }

    @Test
    @DisplayName("僧伽羅文問候 - 文字比例 + 關鍵字 + 問候加分，上限 1.0")
    public void testSinhalaGreeting() {
        LanguageSignal signal = detector.detect("ආයුබෝවන්");

        assertEquals(Language.SI, signal.language(), "應判定為僧伽羅文");
        assertEquals(1.0, signal.confidence(), 1e-9, "總分上限為 1.0");
    }

    @Test
    @DisplayName("泰米爾文問句 - 僅文字比例，上限 0.8")
    public void testTamilScriptOnly() {
        LanguageSignal signal = detector.detect("சிகிரியா பற்றி சொல்லுங்கள்");

        assertEquals(Language.TA, signal.language(), "應判定為泰米爾文");
        assertEquals(0.8, signal.confidence(), 1e-9, "文字比例上限 0.8");
    }

    @Test
    @DisplayName("空白輸入 - 回傳預設語言與 0.5")
    public void testBlankInput() {
        assertEquals(new LanguageSignal(Language.EN, 0.5), detector.detect("   "));
        assertEquals(new LanguageSignal(Language.EN, 0.5), detector.detect(null));
    }

    @Test
    @DisplayName("無任何訊號 - 預設語言提升至 0.5")
    public void testNoSignalFallsBackToDefault() {
        LanguageSignal signal = detector.detect("12345 !!!");

        assertEquals(Language.EN, signal.language());
        assertEquals(0.5, signal.confidence(), 1e-9);
    }

    @Test
    @DisplayName("預設語言改為僧伽羅文 - 空白輸入回傳僧伽羅文")
    public void testConfiguredDefaultLanguage() {
        RuntimeConfigServiceImpl config = new RuntimeConfigServiceImpl();
        ReflectionTestUtils.setField(config, "defaultLanguageCode", "si");
        config.init();
        LanguageDetectionServiceImpl siDetector = TourbotFixtures.languageDetector(config);

        assertEquals(Language.SI, siDetector.detect("").language(), "空白輸入應回傳設定的預設語言");
        assertEquals(Language.SI, siDetector.detect("12345").language(), "無訊號時應回傳設定的預設語言");
    }

    @Test
    @DisplayName("評分明細 - 依設定檔順序列出所有語言")
    public void testScoresBreakdown() {
        Map<Language, Double> scores = detector.scores("வணக்கம்");

        assertEquals(List.of(Language.EN, Language.SI, Language.TA), List.copyOf(scores.keySet()));
        assertEquals(1.0, scores.get(Language.TA), 1e-9);
        assertEquals(0.0, scores.get(Language.SI), 1e-9);
        assertEquals(0.0, scores.get(Language.EN), 1e-9, "泰米爾文分數高時英文不提升");
    }

    @Test
    @DisplayName("同分 - 取設定檔順序較前者")
    public void testTieGoesToProfileOrder() {
        RuntimeConfigServiceImpl config = TourbotFixtures.runtimeConfig();
        LanguageDetectionServiceImpl custom = TourbotFixtures.languageDetector(config);
        custom.loadProfiles(List.of(
                new LanguageProfile("ta", null, null, List.of("zz"), List.of()),
                new LanguageProfile("si", null, null, List.of("zz"), List.of()),
                new LanguageProfile("en", null, null, List.of(), List.of())));

        LanguageSignal signal = custom.detect("zz");

        assertEquals(Language.TA, signal.language(), "同分時應取第一個設定檔");
        assertEquals(0.6, signal.confidence(), 1e-9, "關鍵字比例上限 0.6");
    }

    @Test
    @DisplayName("格式錯誤的問候樣式 - 略過不拋出例外")
    public void testMalformedGreetingPatternSkipped() {
        LanguageDetectionServiceImpl custom = TourbotFixtures.languageDetector(TourbotFixtures.runtimeConfig());
        assertDoesNotThrow(() -> custom.loadProfiles(List.of(
                new LanguageProfile("en", null, null, List.of("hello"), List.of("(unclosed")))));

        assertEquals(Language.EN, custom.detect("hello").language());
    }
}
