package com.lanka.tourbot.controller;

import com.lanka.tourbot.model.ChatSession;
import com.lanka.tourbot.model.ConversationSummary;
import com.lanka.tourbot.model.Guide;
import com.lanka.tourbot.model.Intent;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.LanguageSignal;
import com.lanka.tourbot.model.SessionSnapshot;
import com.lanka.tourbot.repository.GuideRepository;
import com.lanka.tourbot.service.ChatService;
import com.lanka.tourbot.service.KnowledgeBaseService;
import com.lanka.tourbot.service.LanguageDetectionService;
import com.lanka.tourbot.service.PersonalizationService;
import com.lanka.tourbot.service.RuntimeConfigService;
import com.lanka.tourbot.service.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 對話控制器
 * 提供 Session 管理與對話 REST API 端點
 * <p>
 * 注意：業務邏輯位於 ChatService / SessionService
 */
@RestController
@RequestMapping("/api/chat")
@CrossOrigin(origins = "*")
public class ChatController {

    private static final Logger logger = LoggerFactory.getLogger(ChatController.class);

    @Autowired
    private ChatService chatService;

    @Autowired
    private SessionService sessionService;

    @Autowired
    private LanguageDetectionService languageDetectionService;

    @Autowired
    private GuideRepository guideRepository;

    @Autowired
    private KnowledgeBaseService knowledgeBaseService;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Autowired
    private PersonalizationService personalizationService;

    @Value("${tourbot.stream.timeout-ms:30000}")
    private long streamTimeoutMs;

    /**
     * 建立 Session
     */
    @PostMapping("/sessions")
    public ResponseEntity<Map<String, Object>> createSession(@RequestBody(required = false) Map<String, Object> body) {
        String userId = body == null ? null : asString(body.get("userId"));
        String languageCode = body == null ? null : asString(body.get("language"));

        Language language = null;
        if (languageCode != null && !languageCode.isBlank()) {
            Optional<Language> parsed = Language.fromCode(languageCode);
            if (parsed.isEmpty()) {
                return failure(HttpStatus.BAD_REQUEST, "Unsupported language: " + languageCode);
            }
            language = parsed.get();
        }

        String sessionId = sessionService.createSession(userId == null ? "anonymous" : userId, language);
        SessionSnapshot snapshot = sessionService.snapshot(sessionId).orElseThrow();
        logger.info("建立 Session 請求: userId={}, sessionId={}", userId, sessionId);

        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("sessionId", sessionId);
        out.put("language", snapshot.language());
        out.put("guide", snapshot.guideId());
        return ResponseEntity.status(HttpStatus.CREATED).body(out);
    }

    /**
     * 處理一輪對話 - 非 Streaming 版本
     */
    @PostMapping("/messages")
    public ResponseEntity<Map<String, Object>> sendMessage(@RequestBody Map<String, Object> body) {
        ChatService.TurnRequest request = new ChatService.TurnRequest(
                asString(body.get("sessionId")),
                asString(body.get("message")),
                asString(body.get("language")));
        logger.debug("收到對話請求: sessionId={}", request.sessionId());

        ChatService.TurnResult result = chatService.processTurn(request);
        HttpStatus status = switch (result.status()) {
            case OK -> HttpStatus.OK;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
        return ResponseEntity.status(status).body(toResponse(result));
    }

    /**
     * 處理一輪對話 - Streaming 版本
     */
    @GetMapping(value = "/messages/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamMessage(
            @RequestParam String sessionId,
            @RequestParam String message,
            @RequestParam(required = false) String language) {

        logger.info("收到 Streaming 對話請求: sessionId={}", sessionId);
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        chatService.processStreamingTurn(new ChatService.TurnRequest(sessionId, message, language), emitter);
        return emitter;
    }

    @GetMapping("/sessions/{id}")
    public ResponseEntity<Map<String, Object>> getSession(@PathVariable String id) {
        Optional<SessionSnapshot> snapshot = sessionService.snapshot(id);
        if (snapshot.isEmpty()) {
            return failure(HttpStatus.NOT_FOUND, "Session not found: " + id);
        }
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", snapshot.get());
        return ResponseEntity.ok(out);
    }

    @GetMapping("/sessions/{id}/summary")
    public ResponseEntity<Map<String, Object>> getSummary(@PathVariable String id) {
        Optional<ConversationSummary> summary = chatService.summarize(id);
        if (summary.isEmpty()) {
            return failure(HttpStatus.NOT_FOUND, "Session not found: " + id);
        }
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", summary.get());
        return ResponseEntity.ok(out);
    }

    @PutMapping("/sessions/{id}/language")
    public ResponseEntity<Map<String, Object>> setLanguage(@PathVariable String id,
                                                           @RequestBody Map<String, Object> body) {
        String code = asString(body.get("language"));
        if (sessionService.getSession(id) == null) {
            return failure(HttpStatus.NOT_FOUND, "Session not found: " + id);
        }
        if (!sessionService.setLanguage(id, code)) {
            return failure(HttpStatus.BAD_REQUEST, "Unsupported language: " + code);
        }
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("language", Language.fromCode(code).orElseThrow());
        return ResponseEntity.ok(out);
    }

    /**
     * 切換導遊，回應附上新導遊以 Session 語言的自我介紹
     */
    @PutMapping("/sessions/{id}/guide")
    public ResponseEntity<Map<String, Object>> setGuide(@PathVariable String id,
                                                        @RequestBody Map<String, Object> body) {
        String guideId = asString(body.get("guideId"));
        ChatSession session = sessionService.getSession(id);
        if (session == null) {
            return failure(HttpStatus.NOT_FOUND, "Session not found: " + id);
        }
        if (!sessionService.setGuide(id, guideId)) {
            return failure(HttpStatus.BAD_REQUEST, "Unknown guide: " + guideId);
        }
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("guide", guideId);
        out.put("introduction", guideRepository.find(guideId)
                .map(guide -> personalizationService.introduction(guide, session.getLanguage()))
                .orElse(null));
        return ResponseEntity.ok(out);
    }

    /**
     * 清除 Session
     */
    @DeleteMapping("/sessions/{id}")
    public ResponseEntity<Map<String, Object>> deleteSession(@PathVariable String id) {
        logger.info("清除 Session 請求: {}", id);
        if (!sessionService.resetSession(id)) {
            return failure(HttpStatus.NOT_FOUND, "Session not found: " + id);
        }
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("message", "Session cleared");
        return ResponseEntity.ok(out);
    }

    /**
     * 語言偵測（含各語言評分明細）
     */
    @PostMapping("/detect-language")
    public Map<String, Object> detectLanguage(@RequestBody Map<String, Object> body) {
        String text = asString(body.get("text"));
        LanguageSignal signal = languageDetectionService.detect(text);

        Map<String, Object> scores = new LinkedHashMap<>();
        languageDetectionService.scores(text).forEach((k, v) -> scores.put(k.getCode(), v));

        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("language", signal.language());
        out.put("confidence", signal.confidence());
        out.put("scores", scores);
        return out;
    }

    @GetMapping("/languages")
    public Map<String, Object> listLanguages() {
        List<Map<String, Object>> data = new ArrayList<>();
        for (Language language : Language.values()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("code", language.getCode());
            item.put("name", language.getDisplayName());
            item.put("default", language == runtimeConfigService.getDefaultLanguage());
            data.add(item);
        }
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", data);
        return out;
    }

    @GetMapping("/intents")
    public Map<String, Object> listIntents() {
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", List.of(Intent.values()));
        return out;
    }

    @GetMapping("/guides")
    public Map<String, Object> listGuides() {
        List<Guide> guides = guideRepository.list();
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", guides);
        out.put("default", guideRepository.defaultGuide().id());
        out.put("count", guides.size());
        return out;
    }

    /**
     * 取得系統狀態
     */
    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("status", "UP");
        status.put("activeSessions", sessionService.getActiveSessionCount());
        status.put("knowledgeEntries", knowledgeBaseService.size());
        status.put("guides", guideRepository.list().size());
        status.put("defaultLanguage", runtimeConfigService.getDefaultLanguage());
        return status;
    }

    private static Map<String, Object> toResponse(ChatService.TurnResult result) {
        Map<String, Object> out = new HashMap<>();
        out.put("success", result.isOk());
        out.put("status", result.status());
        out.put("sessionId", result.sessionId());
        out.put("reply", result.replyText());
        out.put("language", result.resolvedLanguage());
        out.put("detectedLanguage", result.detectedLanguage());
        out.put("languageConfidence", result.languageConfidence());
        out.put("intent", result.intent());
        out.put("intentConfidence", result.intentConfidence());
        out.put("alternatives", result.alternatives());
        out.put("entities", result.entities());
        out.put("guide", result.guideId());
        out.put("suggestions", result.suggestions());
        out.put("quickReplies", result.quickReplies());
        if (result.message() != null) {
            out.put("message", result.message());
        }
        return out;
    }

    private static ResponseEntity<Map<String, Object>> failure(HttpStatus status, String message) {
        Map<String, Object> out = new HashMap<>();
        out.put("success", false);
        out.put("message", message);
        return ResponseEntity.status(status).body(out);
    }

    private static String asString(Object o) {
        return o == null ? null : String.valueOf(o);
    }
}
