package com.lanka.tourbot.service.impl;

import com.lanka.tourbot.model.DispatchResult;
import com.lanka.tourbot.model.Entity;
import com.lanka.tourbot.model.EntityType;
import com.lanka.tourbot.model.Guide;
import com.lanka.tourbot.model.Intent;
import com.lanka.tourbot.model.IntentResult;
import com.lanka.tourbot.model.IntentScore;
import com.lanka.tourbot.model.KnowledgeEntry;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.SessionSnapshot;
import com.lanka.tourbot.model.Utterance;
import com.lanka.tourbot.repository.GuideRepository;
import com.lanka.tourbot.repository.ResponseTemplateRepository;
import com.lanka.tourbot.service.KnowledgeBaseService;
import com.lanka.tourbot.service.ResponseDispatchService;
import com.lanka.tourbot.service.RuntimeConfigService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 回應分派服務實作 (Response Dispatch Service Implementation)
 * <p>
 * 功能：
 * 以固定的 switch 將意圖對應到回應建構流程，產生確定性的基礎回應文字。
 * <p>
 * 模板解析順序：
 * 1. Session 語言的模板。
 * 2. 預設語言的同族模板（記錄 WARN，標記 localizedFallback）。
 * 3. unknown 模板族。
 * <p>
 * 追問 (follow_up)：優先使用候選意圖中最強的實質意圖，其次為歷史中最近的實質意圖，皆無則回應說明。
 */
@Service
public class ResponseDispatchServiceImpl implements ResponseDispatchService {

    private static final Logger logger = LoggerFactory.getLogger(ResponseDispatchServiceImpl.class);

    static final String FAMILY_UNKNOWN = "unknown";
    static final String FAMILY_ERROR = "error";
    static final String FAMILY_GREETING = "greeting";

    private static final String MISSING_VALUE = "-";

    private record Rendered(String text, String family, boolean localizedFallback) {
    }

    @Autowired
    private ResponseTemplateRepository templateRepository;

    @Autowired
    private GuideRepository guideRepository;

    @Autowired
    private KnowledgeBaseService knowledgeBaseService;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    /**
     * 啟動時確認最終回退模板存在，否則任何回應都可能無法產生
     */
    @PostConstruct
    public void init() {
        Language defaultLanguage = runtimeConfigService.getDefaultLanguage();
        for (String family : List.of(FAMILY_UNKNOWN, FAMILY_ERROR)) {
            if (templateRepository.findTemplate(family, defaultLanguage).isEmpty()) {
                throw new IllegalStateException("Missing required template '" + family + "' for default language "
                        + defaultLanguage.getCode());
            }
        }
    }

    @Override
    public DispatchResult dispatch(SessionSnapshot session, IntentResult intentResult, List<Entity> entities,
                                   Utterance utterance) {
        Language language = session.language();
        Intent intent = intentResult.intent();
        if (intent == Intent.FOLLOW_UP) {
            intent = resolveFollowUp(session, intentResult);
        }

        Rendered rendered = switch (intent) {
            case GREETING -> buildGreeting(session, language);
            case FAREWELL -> buildFarewell(session, language);
            case ATTRACTION_INQUIRY -> buildAttraction(entities, language);
            case FOOD_INQUIRY -> buildFood(entities, language);
            case TRANSPORT_INQUIRY -> buildTransport(entities, language);
            case ACCOMMODATION_INQUIRY -> buildAccommodation(entities, language);
            case WEATHER_INQUIRY -> render("weather_general", language, Map.of());
            case CULTURE_INQUIRY -> render("culture_general", language, Map.of());
            case HELP_INQUIRY, FOLLOW_UP -> render("help", language, Map.of());
            case CLARIFICATION -> render("clarification", language, Map.of());
            case CONFIRMATION -> render("confirmation", language, Map.of());
            case UNKNOWN -> buildUnknown(utterance, language);
        };

        String key = suggestionKeyFor(intent == Intent.FOLLOW_UP ? Intent.HELP_INQUIRY : intent);
        return new DispatchResult(rendered.text(), intent, rendered.family(),
                localizedList(key, language, true), localizedList(key, language, false),
                rendered.localizedFallback());
    }

    @Override
    public DispatchResult errorReply(Language language) {
        Rendered rendered = render(FAMILY_ERROR, language, Map.of());
        return new DispatchResult(rendered.text(), Intent.UNKNOWN, rendered.family(), List.of(), List.of(),
                rendered.localizedFallback());
    }

    private Intent resolveFollowUp(SessionSnapshot session, IntentResult intentResult) {
        for (IntentScore alt : intentResult.alternatives()) {
            if (alt.intent().isSubstantive()) {
                return alt.intent();
            }
        }
        Intent previous = session.lastSubstantiveIntent();
        return previous != null ? previous : Intent.HELP_INQUIRY;
    }

    private Rendered buildGreeting(SessionSnapshot session, Language language) {
        Guide guide = guideFor(session);
        Language defaultLanguage = runtimeConfigService.getDefaultLanguage();
        String text = guide.greetingFor(language, defaultLanguage);
        if (text == null) {
            return render("help", language, Map.of());
        }
        boolean fallback = guide.greetings() == null || !guide.greetings().containsKey(language.getCode());
        if (fallback) {
            logger.warn("Guide {} has no greeting for {}, using {}", guide.id(), language.getCode(),
                    defaultLanguage.getCode());
        }
        return new Rendered(text, FAMILY_GREETING, fallback);
    }

    private Rendered buildFarewell(SessionSnapshot session, Language language) {
        return render("farewell", language, Map.of("guide", guideFor(session).displayName()));
    }

    /**
     * 景點：先找 attraction 實體，再找 location 實體，依序查知識庫；
     * 多個不同景點各自產生一段詳細說明。
     */
    private Rendered buildAttraction(List<Entity> entities, Language language) {
        List<String> names = new ArrayList<>(valuesOf(entities, EntityType.ATTRACTION));
        names.addAll(valuesOf(entities, EntityType.LOCATION));

        Map<String, KnowledgeEntry> found = new LinkedHashMap<>();
        for (String name : names) {
            knowledgeBaseService.findAttraction(name, language)
                    .ifPresent(entry -> found.putIfAbsent(entry.getKey(), entry));
        }

        if (!found.isEmpty()) {
            List<String> parts = new ArrayList<>();
            boolean fallback = false;
            for (KnowledgeEntry entry : found.values()) {
                Map<String, String> values = new LinkedHashMap<>();
                values.put("name", entry.getTitle());
                values.put("description", entry.getSummary());
                values.put("location", entry.getLocation());
                values.put("best_time", entry.getBestTime());
                values.put("duration", entry.getDuration());
                values.put("entry_fee", entry.getEntryFee());
                values.put("tips", entry.getTips());
                Rendered r = render("attraction_detail", language, values);
                parts.add(r.text());
                fallback |= r.localizedFallback();
            }
            return new Rendered(String.join("\n\n", parts), "attraction_detail", fallback);
        }

        List<String> locations = valuesOf(entities, EntityType.LOCATION);
        if (!locations.isEmpty()) {
            return render("attraction_location", language, Map.of("location", capitalizeWords(locations.get(0))));
        }
        return render("attraction_general", language, Map.of());
    }

    private Rendered buildFood(List<Entity> entities, Language language) {
        for (String name : valuesOf(entities, EntityType.FOOD)) {
            Optional<KnowledgeEntry> entry = knowledgeBaseService.findFood(name, language);
            if (entry.isPresent()) {
                Map<String, String> values = new LinkedHashMap<>();
                values.put("name", entry.get().getTitle());
                values.put("description", entry.get().getSummary());
                values.put("where_to_try", entry.get().getTips());
                return render("food_detail", language, values);
            }
        }
        return render("food_general", language, Map.of());
    }

    private Rendered buildTransport(List<Entity> entities, Language language) {
        for (String name : valuesOf(entities, EntityType.TRANSPORT_TYPE)) {
            Optional<KnowledgeEntry> entry = knowledgeBaseService.findTransport(name, language);
            if (entry.isPresent()) {
                Map<String, String> values = new LinkedHashMap<>();
                values.put("name", entry.get().getTitle());
                values.put("description", entry.get().getSummary());
                values.put("tips", entry.get().getTips());
                return render("transport_detail", language, values);
            }
        }
        return render("transport_general", language, Map.of());
    }

    private Rendered buildAccommodation(List<Entity> entities, Language language) {
        List<String> locations = valuesOf(entities, EntityType.LOCATION);
        if (!locations.isEmpty()) {
            return render("accommodation_location", language,
                    Map.of("location", capitalizeWords(locations.get(0))));
        }
        return render("accommodation_general", language, Map.of());
    }

    private Rendered buildUnknown(Utterance utterance, Language language) {
        if (utterance != null && !utterance.isBlank()) {
            Optional<KnowledgeEntry> hit = knowledgeBaseService.bestMatch(utterance.text(), language);
            if (hit.isPresent()) {
                logger.debug("Unknown intent answered from knowledge base: {}", hit.get().getId());
                return render("knowledge_hit", language,
                        Map.of("title", nullToDash(hit.get().getTitle()), "summary", nullToDash(hit.get().getSummary())));
            }
        }
        return render(FAMILY_UNKNOWN, language, Map.of());
    }

    /**
     * 依模板解析順序取得模板並代入參數
     */
    private Rendered render(String family, Language language, Map<String, String> values) {
        Optional<String> template = templateRepository.findTemplate(family, language);
        boolean fallback = false;
        String usedFamily = family;
        Language defaultLanguage = runtimeConfigService.getDefaultLanguage();

        if (template.isEmpty() && language != defaultLanguage) {
            template = templateRepository.findTemplate(family, defaultLanguage);
            if (template.isPresent()) {
                logger.warn("Template '{}' missing for {}, falling back to {}", family, language.getCode(),
                        defaultLanguage.getCode());
                fallback = true;
            }
        }
        if (template.isEmpty()) {
            logger.warn("Template '{}' missing entirely, using '{}'", family, FAMILY_UNKNOWN);
            usedFamily = FAMILY_UNKNOWN;
            template = templateRepository.findTemplate(FAMILY_UNKNOWN, language);
            if (template.isEmpty()) {
                template = templateRepository.findTemplate(FAMILY_UNKNOWN, defaultLanguage);
                fallback = true;
            }
        }
        return new Rendered(fill(template.orElse(""), values), usedFamily, fallback);
    }

    private List<String> localizedList(String key, Language language, boolean suggestions) {
        if (key == null) {
            return List.of();
        }
        List<String> list = suggestions
                ? templateRepository.findSuggestions(key, language)
                : templateRepository.findQuickReplies(key, language);
        Language defaultLanguage = runtimeConfigService.getDefaultLanguage();
        if (list.isEmpty() && language != defaultLanguage) {
            logger.debug("No {} for '{}' in {}, using {}", suggestions ? "suggestions" : "quick replies",
                    key, language.getCode(), defaultLanguage.getCode());
            list = suggestions
                    ? templateRepository.findSuggestions(key, defaultLanguage)
                    : templateRepository.findQuickReplies(key, defaultLanguage);
        }
        return List.copyOf(list);
    }

    private Guide guideFor(SessionSnapshot session) {
        return guideRepository.find(session.guideId()).orElseGet(guideRepository::defaultGuide);
    }

    static String suggestionKeyFor(Intent intent) {
        return switch (intent) {
            case GREETING -> "greeting";
            case ATTRACTION_INQUIRY -> "attractions";
            case FOOD_INQUIRY -> "food";
            case TRANSPORT_INQUIRY -> "transport";
            case ACCOMMODATION_INQUIRY -> "accommodation";
            case WEATHER_INQUIRY -> "weather";
            case CULTURE_INQUIRY -> "culture";
            case HELP_INQUIRY, UNKNOWN, CLARIFICATION -> "help";
            default -> null;
        };
    }

    static String fill(String template, Map<String, String> values) {
        String out = template;
        for (Map.Entry<String, String> e : values.entrySet()) {
            out = out.replace("{" + e.getKey() + "}", nullToDash(e.getValue()));
        }
        return out;
    }

    static String capitalizeWords(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (char c : value.toCharArray()) {
            sb.append(startOfWord ? Character.toUpperCase(c) : c);
            startOfWord = Character.isWhitespace(c);
        }
        return sb.toString();
    }

    private static List<String> valuesOf(List<Entity> entities, EntityType type) {
        Set<String> out = new LinkedHashSet<>();
        if (entities != null) {
            for (Entity e : entities) {
                if (e.type() == type) {
                    out.add(e.value().toLowerCase(Locale.ROOT));
                }
            }
        }
        return new ArrayList<>(out);
    }

    private static String nullToDash(String s) {
        return s == null || s.isBlank() ? MISSING_VALUE : s;
    }
}
