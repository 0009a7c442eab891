package com.lanka.tourbot.test;

import com.lanka.tourbot.model.ConversationSummary;
import com.lanka.tourbot.model.EntityType;
import com.lanka.tourbot.model.Intent;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.PersonalizationRule;
import com.lanka.tourbot.service.ChatService;
import com.lanka.tourbot.service.ChatService.TurnRequest;
import com.lanka.tourbot.service.ChatService.TurnResult;
import com.lanka.tourbot.service.ChatService.TurnStatus;
import com.lanka.tourbot.service.RuntimeConfigService;
import com.lanka.tourbot.service.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 對話流程整合測試
 * <p>
 * 個人化機率全部設為 0，使回應文字可預期。
 */
@SpringBootTest
public class ChatServiceTest {

    @Autowired
    private ChatService chatService;

    @Autowired
    private SessionService sessionService;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @BeforeEach
    public void disablePersonalization() {
        Map<PersonalizationRule, Double> zero = new EnumMap<>(PersonalizationRule.class);
        for (PersonalizationRule rule : PersonalizationRule.values()) {
            zero.put(rule, 0.0);
        }
        runtimeConfigService.updatePersonalization(zero);
    }

    private TurnResult send(String sessionId, String message) {
        return chatService.processTurn(new TurnRequest(sessionId, message, null));
    }

    // ==================== 單輪 ====================

    @Test
    @DisplayName("英文問候 - greeting，回應包含導遊問候語")
    public void testEnglishGreeting() {
        String sid = sessionService.createSession("u", null);

        TurnResult result = send(sid, "Hello");

        assertEquals(TurnStatus.OK, result.status());
        assertEquals(Intent.GREETING, result.intent());
        assertEquals(1.0, result.intentConfidence(), 1e-9);
        assertEquals(Language.EN, result.resolvedLanguage());
        assertTrue(result.replyText().contains("Saru"));
        assertEquals("saru", result.guideId());
        assertFalse(result.quickReplies().isEmpty());
        assertEquals(1, sessionService.getSession(sid).getHistorySize(), "應寫入一筆歷史");
    }

    @Test
    @DisplayName("英文景點 - 回應包含知識庫內容")
    public void testAttractionReply() {
        String sid = sessionService.createSession("u", null);

        TurnResult result = send(sid, "tell me about Sigiriya");

        assertEquals(Intent.ATTRACTION_INQUIRY, result.intent());
        assertTrue(result.replyText().contains("Sigiriya Rock Fortress"));
        assertTrue(result.entities().stream().anyMatch(e -> e.type() == EntityType.LOCATION));
    }

    @Test
    @DisplayName("泰米爾文輸入 - 高信心偵測切換 Session 語言")
    public void testTamilSwitchesSessionLanguage() {
        String sid = sessionService.createSession("u", Language.EN);

        TurnResult result = send(sid, "சிகிரியா பற்றி சொல்லுங்கள்");

        assertEquals(Language.TA, result.detectedLanguage());
        assertEquals(0.8, result.languageConfidence(), 1e-9);
        assertEquals(Language.TA, result.resolvedLanguage());
        assertEquals(Language.TA, sessionService.getSession(sid).getLanguage(), "Session 語言應已切換");
        assertEquals(Intent.ATTRACTION_INQUIRY, result.intent());
        assertTrue(result.replyText().contains("சீகிரியா பாறை கோட்டை"));
    }

    @Test
    @DisplayName("混合文字 - 泰米爾文為主時偵測為泰米爾文，不受拉丁字 Sigiriya 影響")
    public void testMixedScriptFavorsTamil() {
        String sid = sessionService.createSession("u", Language.EN);

        TurnResult result = send(sid, "வணக்கம் Sigiriya பற்றி சொல்லுங்கள்");

        assertEquals(Language.TA, result.detectedLanguage());
        assertEquals(1.0, result.languageConfidence(), 1e-9);
        assertEquals(Language.TA, result.resolvedLanguage());
    }

    @Test
    @DisplayName("連續兩輪 - 第二輪擷取 kandy，語言與導遊沿用 Session 狀態")
    public void testTwoTurnsCarrySessionState() {
        String sid = sessionService.createSession("u", Language.EN);
        assertTrue(sessionService.setGuide(sid, "anjali"));

        TurnResult first = send(sid, "tell me about Sigiriya");
        TurnResult second = send(sid, "what about Kandy");

        assertEquals(TurnStatus.OK, first.status());
        assertEquals(TurnStatus.OK, second.status());
        assertTrue(second.entities().stream()
                        .anyMatch(e -> e.type() == EntityType.LOCATION && e.value().equals("kandy")),
                "第二輪應擷取到 location=kandy");
        assertEquals(2, sessionService.getSession(sid).getHistorySize());
        assertEquals(Language.EN, second.resolvedLanguage());
        assertEquals("anjali", second.guideId());
        assertEquals("anjali", sessionService.getSession(sid).getGuideId());
    }

    @Test
    @DisplayName("低信心偵測 - 不切換 Session 語言")
    public void testLowConfidenceKeepsLanguage() {
        String sid = sessionService.createSession("u", Language.TA);

        TurnResult result = send(sid, "what about Kandy");

        assertEquals(Language.EN, result.detectedLanguage());
        assertTrue(result.languageConfidence() <= 0.7);
        assertEquals(Language.TA, result.resolvedLanguage(), "信心未超過門檻不應切換");
    }

    @Test
    @DisplayName("指定語言 - 直接切換，後備關鍵字辨識出問候")
    public void testLanguageOverrideWithFallbackKeywords() {
        String sid = sessionService.createSession("u", Language.EN);

        TurnResult result = chatService.processTurn(new TurnRequest(sid, "hello", "si"));

        assertEquals(Language.SI, result.resolvedLanguage());
        assertEquals(Language.SI, result.detectedLanguage());
        assertEquals(1.0, result.languageConfidence(), 1e-9);
        assertEquals(Intent.GREETING, result.intent());
        assertEquals(0.5, result.intentConfidence(), 1e-9, "後備關鍵字信心固定 0.5");
        assertTrue(result.replyText().startsWith("ආයුබෝවන්"));
    }

    @Test
    @DisplayName("追問 - 以候選中的食物意圖回應")
    public void testFollowUpResolvedToFood() {
        String sid = sessionService.createSession("u", null);

        TurnResult result = send(sid, "can you also tell me about food");

        assertEquals(Intent.FOLLOW_UP, result.intent());
        assertTrue(result.replyText().contains("Sri Lankan cuisine is amazing"));
    }

    // ==================== 驗證 ====================

    @Test
    @DisplayName("空白訊息 - INVALID_INPUT，不寫入歷史")
    public void testBlankMessageRejected() {
        String sid = sessionService.createSession("u", null);

        TurnResult result = send(sid, "   ");

        assertEquals(TurnStatus.INVALID_INPUT, result.status());
        assertEquals("Message must not be empty", result.message());
        assertEquals(0, sessionService.getSession(sid).getHistorySize());
    }

    @Test
    @DisplayName("不支援的指定語言 - INVALID_INPUT")
    public void testUnsupportedOverrideRejected() {
        String sid = sessionService.createSession("u", null);

        TurnResult result = chatService.processTurn(new TurnRequest(sid, "hello", "fr"));

        assertEquals(TurnStatus.INVALID_INPUT, result.status());
        assertEquals("Unsupported language: fr", result.message());
    }

    @Test
    @DisplayName("不存在的 Session - SESSION_NOT_FOUND，且不會建立 Session")
    public void testUnknownSession() {
        int before = sessionService.getActiveSessionCount();

        TurnResult result = send("no-such-session", "hello");

        assertEquals(TurnStatus.SESSION_NOT_FOUND, result.status());
        assertEquals(before, sessionService.getActiveSessionCount());
    }

    // ==================== 歷史與摘要 ====================

    @Test
    @DisplayName("摘要 - 輪數、使用語言與主題依首次出現順序")
    public void testSummary() {
        String sid = sessionService.createSession("u", null);
        send(sid, "Hello");
        send(sid, "tell me about Sigiriya");
        send(sid, "சிகிரியா பற்றி சொல்லுங்கள்");

        ConversationSummary summary = chatService.summarize(sid).orElseThrow();

        assertEquals(3, summary.totalTurns());
        assertEquals(List.of(Language.EN, Language.TA), summary.languagesUsed());
        assertEquals(List.of(Intent.ATTRACTION_INQUIRY), summary.topicsDiscussed());
        assertTrue(summary.durationSeconds() >= 0);
    }

    @Test
    @DisplayName("摘要 - Session 不存在時為 empty")
    public void testSummaryForMissingSession() {
        assertTrue(chatService.summarize("missing").isEmpty());
    }

    // ==================== 串流 ====================

    @Test
    @DisplayName("串流 - 依序發送 language、intent、entities、reply、done")
    public void testStreamingEventOrder() throws InterruptedException {
        String sid = sessionService.createSession("u", null);
        CapturingSseEmitter emitter = new CapturingSseEmitter();

        chatService.processStreamingTurn(new TurnRequest(sid, "tell me about Sigiriya", null), emitter);

        assertTrue(emitter.awaitCompletion(), "串流應在時限內完成");
        assertEquals(List.of("language", "intent", "entities", "reply", "done"), emitter.eventNames());
        assertEquals(1, sessionService.getSession(sid).getHistorySize());
    }

    @Test
    @DisplayName("串流 - Session 不存在時只發送 error 事件")
    public void testStreamingUnknownSession() throws InterruptedException {
        CapturingSseEmitter emitter = new CapturingSseEmitter();

        chatService.processStreamingTurn(new TurnRequest("missing", "hello", null), emitter);

        assertTrue(emitter.awaitCompletion());
        assertEquals(List.of("error"), emitter.eventNames());
        assertTrue(emitter.payloads().get(0).contains("SESSION_NOT_FOUND"));
    }

    /**
     * 記錄事件名稱與內容的 SseEmitter（不需要實際的 HTTP 連線）
     */
    static class CapturingSseEmitter extends SseEmitter {

        private final List<String> names = Collections.synchronizedList(new ArrayList<>());
        private final List<String> payloads = Collections.synchronizedList(new ArrayList<>());
        private final CountDownLatch completed = new CountDownLatch(1);

        CapturingSseEmitter() {
            super(10_000L);
        }

        @Override
        public void send(SseEventBuilder builder) {
            StringBuilder raw = new StringBuilder();
            builder.build().forEach(part -> raw.append(part.getData()));
            String text = raw.toString();
            int start = text.indexOf("event:");
            if (start >= 0) {
                names.add(text.substring(start + 6, text.indexOf('\n', start)));
            }
            payloads.add(text);
        }

        @Override
        public void complete() {
            completed.countDown();
        }

        @Override
        public void completeWithError(Throwable ex) {
            completed.countDown();
        }

        boolean awaitCompletion() throws InterruptedException {
            return completed.await(5, TimeUnit.SECONDS);
        }

        List<String> eventNames() {
            return new ArrayList<>(names);
        }

        List<String> payloads() {
            return new ArrayList<>(payloads);
        }
    }
}
