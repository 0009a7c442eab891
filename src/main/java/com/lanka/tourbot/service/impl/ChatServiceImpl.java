package com.lanka.tourbot.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lanka.tourbot.model.ChatSession;
import com.lanka.tourbot.model.ConversationSummary;
import com.lanka.tourbot.model.ConversationTurn;
import com.lanka.tourbot.model.DispatchResult;
import com.lanka.tourbot.model.Entity;
import com.lanka.tourbot.model.Guide;
import com.lanka.tourbot.model.Intent;
import com.lanka.tourbot.model.IntentResult;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.LanguageSignal;
import com.lanka.tourbot.model.SessionSnapshot;
import com.lanka.tourbot.model.Utterance;
import com.lanka.tourbot.repository.GuideRepository;
import com.lanka.tourbot.service.ChatService;
import com.lanka.tourbot.service.EntityExtractionService;
import com.lanka.tourbot.service.IntentRecognitionService;
import com.lanka.tourbot.service.LanguageDetectionService;
import com.lanka.tourbot.service.PersonalizationService;
import com.lanka.tourbot.service.ResponseDispatchService;
import com.lanka.tourbot.service.RuntimeConfigService;
import com.lanka.tourbot.service.SessionService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 對話服務實作 (Chat Service Implementation)
 * <p>
 * 功能：
 * 單輪對話的協調者，依固定順序串接各 NLP 元件並維護 Session 歷史。
 * <p>
 * 處理流程（整輪持有 Session 鎖，同一 Session 的歷史順序即處理順序）：
 * 1. **驗證**：空白輸入或不支援的語言指定回傳 INVALID_INPUT；Session 不存在（或取得鎖前已被重置）回傳 SESSION_NOT_FOUND。
 * 2. **語言**：有指定語言時直接切換；否則偵測，信心高於門檻且與目前語言不同才切換。
 * 3. **意圖**：以 Session 語言辨識；結果為 unknown 時改用僅關鍵字的後備辨識。
 * 4. **實體**：擷取實體。
 * 5. **分派**：以加入本輪前的 Session 快照產生基礎回應。
 * 6. **個人化**：以 Session 目前的導遊包裝回應後寫入歷史。
 * 7. 任何非預期例外皆在此邊界攔截，回傳在地化的錯誤訊息（不寫入歷史）。
 */
@Service
public class ChatServiceImpl implements ChatService {

    private static final Logger logger = LoggerFactory.getLogger(ChatServiceImpl.class);

    @Autowired
    private SessionService sessionService;

    @Autowired
    private LanguageDetectionService languageDetectionService;

    @Autowired
    private IntentRecognitionService intentRecognitionService;

    @Autowired
    private EntityExtractionService entityExtractionService;

    @Autowired
    private ResponseDispatchService responseDispatchService;

    @Autowired
    private PersonalizationService personalizationService;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Autowired
    private GuideRepository guideRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ThreadPoolExecutor executor = new ThreadPoolExecutor(
            8,
            32,
            60L,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(200),
            new ThreadPoolExecutor.AbortPolicy());

    @PreDestroy
    public void shutdownExecutor() {
        executor.shutdown();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public TurnResult processTurn(TurnRequest request) {
        final long t0 = System.nanoTime();
        String sessionId = request.sessionId();

        Utterance utterance = Utterance.of(request.message());
        if (utterance.isBlank()) {
            return TurnResult.invalidInput(sessionId, "Message must not be empty");
        }
        Optional<Language> override = Optional.empty();
        if (request.languageOverride() != null && !request.languageOverride().isBlank()) {
            override = Language.fromCode(request.languageOverride());
            if (override.isEmpty()) {
                return TurnResult.invalidInput(sessionId, "Unsupported language: " + request.languageOverride());
            }
        }

        ChatSession session = sessionService.getSession(sessionId);
        if (session == null) {
            return TurnResult.sessionNotFound(sessionId);
        }

        session.lock().lock();
        try {
            // 等待鎖期間 Session 可能已被重置移除
            if (sessionService.getSession(sessionId) != session) {
                logger.info("Session {} was reset before the turn started", sessionId);
                return TurnResult.sessionNotFound(sessionId);
            }
            return runTurn(session, utterance, override, t0);
        } catch (RuntimeException e) {
            logger.error("Turn failed for session {}: {}", sessionId, e.toString(), e);
            Language language = session.getLanguage();
            DispatchResult error = responseDispatchService.errorReply(language);
            return new TurnResult(TurnStatus.OK, sessionId, error.text(), language, language, 0.0,
                    Intent.UNKNOWN, 0.0, List.of(), List.of(), session.getGuideId(), List.of(), List.of(),
                    "internal error");
        } finally {
            session.lock().unlock();
        }
    }

    private TurnResult runTurn(ChatSession session, Utterance utterance, Optional<Language> override, long t0) {
        String text = utterance.text();

        LanguageSignal signal;
        if (override.isPresent()) {
            signal = new LanguageSignal(override.get(), 1.0);
            session.setLanguage(override.get());
        } else {
            signal = languageDetectionService.detect(text);
            if (signal.confidence() > runtimeConfigService.getLanguageSwitchThreshold()
                    && signal.language() != session.getLanguage()) {
                logger.info("Session {} language switched {} -> {} (confidence={})", session.getSessionId(),
                        session.getLanguage().getCode(), signal.language().getCode(), signal.confidence());
                session.setLanguage(signal.language());
            }
        }
        long tLang = System.nanoTime();

        Language language = session.getLanguage();
        IntentResult intentResult = intentRecognitionService.recognize(text, language);
        if (intentResult.isUnknown()) {
            intentResult = intentRecognitionService.recognizeByFallbackKeywords(text);
        }
        long tIntent = System.nanoTime();

        List<Entity> entities = entityExtractionService.extract(text);
        long tEntity = System.nanoTime();

        SessionSnapshot before = session.snapshot();
        DispatchResult dispatch = responseDispatchService.dispatch(before, intentResult, entities, utterance);
        Guide guide = guideRepository.find(session.getGuideId()).orElseGet(guideRepository::defaultGuide);
        String reply = personalizationService.personalize(dispatch.text(), dispatch.resolvedIntent(), language,
                !before.history().isEmpty(), guide);
        long tDispatch = System.nanoTime();

        session.appendTurn(new ConversationTurn(utterance.receivedAt(), text, signal.language(),
                intentResult.intent(), intentResult.confidence(), entities, reply));

        long tEnd = System.nanoTime();
        logger.info("PERF(turn) sid={} langMs={} intentMs={} entityMs={} dispatchMs={} totalMs={} lang={} intent={} family={}",
                session.getSessionId(),
                (tLang - t0) / 1_000_000,
                (tIntent - tLang) / 1_000_000,
                (tEntity - tIntent) / 1_000_000,
                (tDispatch - tEntity) / 1_000_000,
                (tEnd - t0) / 1_000_000,
                language.getCode(), intentResult.intent().getWireName(), dispatch.templateFamily());

        return new TurnResult(TurnStatus.OK, session.getSessionId(), reply, language, signal.language(),
                signal.confidence(), intentResult.intent(), intentResult.confidence(), intentResult.alternatives(),
                entities, session.getGuideId(), dispatch.suggestions(), dispatch.quickReplies(), null);
    }

    /**
     * 處理串流對話 (Process Streaming Turn)
     * <p>
     * 在 ThreadPool 中執行完整一輪，再依序以 SSE 事件回傳各階段結果。
     * 執行緒池已滿時發送 error 事件並結束連線。
     */
    @Override
    public void processStreamingTurn(TurnRequest request, SseEmitter emitter) {
        AtomicBoolean isCompleted = new AtomicBoolean(false);

        // 監聽客戶端斷線
        emitter.onCompletion(() -> {
            isCompleted.set(true);
            logger.debug("SSE 連線完成");
        });
        emitter.onTimeout(() -> {
            isCompleted.set(true);
            logger.debug("SSE 連線超時或客戶端中止");
            emitter.complete();
        });
        emitter.onError(e -> {
            isCompleted.set(true);
            logger.debug("SSE 連線錯誤: {}: {}", e.getClass().getSimpleName(), e.getMessage());
        });

        try {
            executor.execute(() -> {
                try {
                    TurnResult result = processTurn(request);
                    if (isCompleted.get()) {
                        logger.debug("Client gone before reply for session {}", request.sessionId());
                        return;
                    }
                    if (!result.isOk()) {
                        sendSseEvent(emitter, "error", Map.of(
                                "type", "error",
                                "status", result.status().name(),
                                "message", result.message()));
                        emitter.complete();
                        return;
                    }

                    sendSseEvent(emitter, "language", Map.of(
                            "detected", result.detectedLanguage().getCode(),
                            "confidence", result.languageConfidence(),
                            "resolved", result.resolvedLanguage().getCode()));
                    sendSseEvent(emitter, "intent", Map.of(
                            "intent", result.intent().getWireName(),
                            "confidence", result.intentConfidence(),
                            "alternatives", result.alternatives()));
                    sendSseEvent(emitter, "entities", Map.of("entities", result.entities()));

                    Map<String, Object> reply = new HashMap<>();
                    reply.put("text", result.replyText());
                    reply.put("guideId", result.guideId());
                    reply.put("suggestions", result.suggestions());
                    reply.put("quickReplies", result.quickReplies());
                    sendSseEvent(emitter, "reply", reply);

                    sendSseEvent(emitter, "done", Map.of("sessionId", result.sessionId()));
                    emitter.complete();
                } catch (Exception e) {
                    handleStreamingError(emitter, e, isCompleted);
                }
            });
        } catch (RejectedExecutionException e) {
            isCompleted.set(true);
            logger.warn("Streaming 請求被拒絕（執行緒池已滿）");
            try {
                sendSseEvent(emitter, "error", Map.of("type", "error", "message", "Server busy, please retry"));
            } catch (Exception ex) {
                logger.debug("發送 error 事件失敗: {}", ex.getMessage());
            }
            emitter.completeWithError(e);
        }
    }

    @Override
    public Optional<ConversationSummary> summarize(String sessionId) {
        return sessionService.snapshot(sessionId).map(snapshot -> {
            Set<Language> languages = new LinkedHashSet<>();
            Set<Intent> topics = new LinkedHashSet<>();
            for (ConversationTurn turn : snapshot.history()) {
                if (turn.detectedLanguage() != null) {
                    languages.add(turn.detectedLanguage());
                }
                if (turn.intent() != null && turn.intent().isSubstantive()) {
                    topics.add(turn.intent());
                }
            }
            long durationSeconds = Math.max(0L, (snapshot.lastActiveAt() - snapshot.createdAt()) / 1000L);
            return new ConversationSummary(snapshot.sessionId(), snapshot.history().size(),
                    new ArrayList<>(languages), new ArrayList<>(topics),
                    snapshot.createdAt(), snapshot.lastActiveAt(), durationSeconds);
        });
    }

    private void handleStreamingError(SseEmitter emitter, Exception e, AtomicBoolean isCompleted) {
        if (!isCompleted.get()) {
            logger.error("Streaming 對話錯誤: {}", e.getMessage());
            try {
                sendSseEvent(emitter, "error", Map.of("type", "error", "message", String.valueOf(e.getMessage())));
            } catch (Exception ex) {
                logger.debug("發送 error 事件失敗: {}", ex.getMessage());
            }
            emitter.completeWithError(e);
        }
    }

    private void sendSseEvent(SseEmitter emitter, String eventName, Map<String, Object> data) throws Exception {
        emitter.send(SseEmitter.event()
                .name(eventName)
                .data(objectMapper.writeValueAsString(data)));
    }
}
