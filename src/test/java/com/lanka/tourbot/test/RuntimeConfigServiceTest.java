package com.lanka.tourbot.test;

import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.PersonalizationRule;
import com.lanka.tourbot.service.impl.RuntimeConfigServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 執行時配置測試
 */
public class RuntimeConfigServiceTest {

    private RuntimeConfigServiceImpl config;

    @BeforeEach
    public void setUp() {
        config = TourbotFixtures.runtimeConfig();
    }

    @Test
    @DisplayName("預設值 - 未覆蓋時回傳設定檔預設")
    public void testDefaults() {
        assertEquals(Language.EN, config.getDefaultLanguage());
        assertEquals(0.7, config.getLanguageSwitchThreshold(), 1e-9);
        assertEquals(0.3, config.getAlternativeMinScore(), 1e-9);
        assertEquals(3, config.getMaxAlternatives());
        assertEquals(1.0, config.getPersonalizationProbability(PersonalizationRule.GREETING), 1e-9);
        assertEquals(0.3, config.getPersonalizationProbability(PersonalizationRule.PERSONAL_TOUCH), 1e-9);
    }

    @Test
    @DisplayName("覆蓋值 - 部分更新，null 參數保留原值")
    public void testPartialOverrides() {
        config.updateIntent(0.5, null);
        assertEquals(0.5, config.getAlternativeMinScore(), 1e-9);
        assertEquals(3, config.getMaxAlternatives(), "未提供的欄位應保持原值");

        config.updateIntent(null, 1);
        assertEquals(0.5, config.getAlternativeMinScore(), 1e-9);
        assertEquals(1, config.getMaxAlternatives());

        config.updateLanguage(null);
        assertEquals(0.7, config.getLanguageSwitchThreshold(), 1e-9);
        config.updateLanguage(0.9);
        assertEquals(0.9, config.getLanguageSwitchThreshold(), 1e-9);
    }

    @Test
    @DisplayName("機率值 - 超出範圍時夾在 [0,1]")
    public void testProbabilitiesClamped() {
        config.updatePersonalization(Map.of(
                PersonalizationRule.ENTHUSIASM, 1.7,
                PersonalizationRule.HELPFUL, -0.2));
        config.updateLanguage(3.0);

        assertEquals(1.0, config.getPersonalizationProbability(PersonalizationRule.ENTHUSIASM), 1e-9);
        assertEquals(0.0, config.getPersonalizationProbability(PersonalizationRule.HELPFUL), 1e-9);
        assertEquals(1.0, config.getLanguageSwitchThreshold(), 1e-9);
    }

    @Test
    @DisplayName("設定檔 - tourbot.personalization.* 覆寫規則預設機率")
    public void testPersonalizationDefaultsFromEnvironment() {
        RuntimeConfigServiceImpl fromEnv = new RuntimeConfigServiceImpl();
        MockEnvironment env = new MockEnvironment()
                .withProperty("tourbot.personalization.greeting-probability", "0.25")
                .withProperty("tourbot.personalization.encouragement-probability", "0");
        ReflectionTestUtils.setField(fromEnv, "environment", env);
        fromEnv.init();

        assertEquals(0.25, fromEnv.getPersonalizationProbability(PersonalizationRule.GREETING), 1e-9);
        assertEquals(0.0, fromEnv.getPersonalizationProbability(PersonalizationRule.ENCOURAGEMENT), 1e-9);
        assertEquals(0.7, fromEnv.getPersonalizationProbability(PersonalizationRule.ENTHUSIASM), 1e-9);
    }

    @Test
    @DisplayName("不支援的預設語言 - 改用 en")
    public void testUnsupportedDefaultLanguage() {
        RuntimeConfigServiceImpl other = new RuntimeConfigServiceImpl();
        ReflectionTestUtils.setField(other, "defaultLanguageCode", "fr");
        other.init();

        assertEquals(Language.EN, other.getDefaultLanguage());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("快照 - 反映目前生效的值")
    public void testSnapshot() {
        config.updateIntent(0.4, 2);

        Map<String, Object> snapshot = config.snapshot();
        Map<String, Object> language = (Map<String, Object>) snapshot.get("language");
        Map<String, Object> intent = (Map<String, Object>) snapshot.get("intent");
        Map<String, Object> personalization = (Map<String, Object>) snapshot.get("personalization");

        assertEquals("en", language.get("defaultLanguage"));
        assertEquals(0.4, (Double) intent.get("alternativeMinScore"), 1e-9);
        assertEquals(2, intent.get("maxAlternatives"));
        assertEquals(PersonalizationRule.values().length, personalization.size());
        assertTrue(personalization.containsKey("CULTURAL_INSIGHT"));
    }
}
