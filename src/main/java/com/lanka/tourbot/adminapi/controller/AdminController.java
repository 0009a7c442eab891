package com.lanka.tourbot.adminapi.controller;

import com.lanka.tourbot.model.PersonalizationRule;
import com.lanka.tourbot.repository.KnowledgeRepository;
import com.lanka.tourbot.service.AdminLogService;
import com.lanka.tourbot.service.KnowledgeBaseService;
import com.lanka.tourbot.service.RuntimeConfigService;
import com.lanka.tourbot.service.SessionExpirySweeper;
import com.lanka.tourbot.service.SessionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 後台 API：執行時設定、稽核紀錄、知識庫重建與 Session 清理
 */
@RestController
@RequestMapping("/api/admin")
@CrossOrigin(origins = "*")
public class AdminController {

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Autowired
    private AdminLogService adminLogService;

    @Autowired
    private KnowledgeRepository knowledgeRepository;

    @Autowired
    private KnowledgeBaseService knowledgeBaseService;

    @Autowired
    private SessionExpirySweeper sessionExpirySweeper;

    @Autowired
    private SessionService sessionService;

    @GetMapping("/config")
    public Map<String, Object> getConfig() {
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", runtimeConfigService.snapshot());
        return out;
    }

    /**
     * 部分更新；未出現的欄位維持原值。
     * 格式：{"language":{"switchThreshold":0.8},"intent":{"alternativeMinScore":0.2,"maxAlternatives":2},
     * "personalization":{"ENTHUSIASM":0.0}}
     */
    @SuppressWarnings("unchecked")
    @PutMapping("/config")
    public Map<String, Object> updateConfig(@RequestBody Map<String, Object> body) {
        Map<String, Object> language = body.get("language") instanceof Map ? (Map<String, Object>) body.get("language") : null;
        Map<String, Object> intent = body.get("intent") instanceof Map ? (Map<String, Object>) body.get("intent") : null;
        Map<String, Object> personalization = body.get("personalization") instanceof Map
                ? (Map<String, Object>) body.get("personalization") : null;

        if (language != null) {
            runtimeConfigService.updateLanguage(asDouble(language.get("switchThreshold")));
        }

        if (intent != null) {
            runtimeConfigService.updateIntent(
                    asDouble(intent.get("alternativeMinScore")),
                    asInt(intent.get("maxAlternatives")));
        }

        if (personalization != null) {
            Map<PersonalizationRule, Double> probabilities = new EnumMap<>(PersonalizationRule.class);
            for (Map.Entry<String, Object> e : personalization.entrySet()) {
                PersonalizationRule rule = asRule(e.getKey());
                Double p = asDouble(e.getValue());
                if (rule != null && p != null) {
                    probabilities.put(rule, p);
                }
            }
            runtimeConfigService.updatePersonalization(probabilities);
        }

        Map<String, Object> snapshot = runtimeConfigService.snapshot();
        adminLogService.info("config.update", "Runtime config updated", snapshot);

        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", snapshot);
        return out;
    }

    @GetMapping("/logs")
    public Map<String, Object> queryLogs(
            @RequestParam(required = false) Long sinceMs,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String actionContains,
            @RequestParam(required = false) String level) {

        List<AdminLogService.Entry> entries = adminLogService.query(sinceMs, limit, actionContains, level);
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", entries);
        out.put("count", entries.size());
        return out;
    }

    @PostMapping("/knowledge/reindex")
    public Map<String, Object> reindexKnowledge() {
        int loaded = knowledgeRepository.reload();
        int indexed = knowledgeBaseService.reindex();
        adminLogService.info("knowledge.reindex", "Knowledge base reindexed",
                Map.of("loaded", loaded, "indexed", indexed, "source", knowledgeRepository.getSource()));

        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("count", indexed);
        out.put("source", knowledgeRepository.getSource());
        return out;
    }

    @PostMapping("/sessions/sweep")
    public Map<String, Object> sweepSessions() {
        int removed = sessionExpirySweeper.sweep();
        adminLogService.info("sessions.sweep", "Idle sessions swept",
                Map.of("removed", removed, "retentionMinutes", sessionExpirySweeper.getRetentionMinutes()));

        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("removed", removed);
        out.put("activeSessions", sessionService.getActiveSessionCount());
        return out;
    }

    private static PersonalizationRule asRule(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (PersonalizationRule rule : PersonalizationRule.values()) {
            if (rule.name().equals(normalized) || rule.getPoolKey().equalsIgnoreCase(name.trim())) {
                return rule;
            }
        }
        return null;
    }

    private static Integer asInt(Object o) {
        if (o == null) {
            return null;
        }
        if (o instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(o).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double asDouble(Object o) {
        if (o == null) {
            return null;
        }
        if (o instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(o).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
