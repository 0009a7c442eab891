package com.lanka.tourbot.test;

import com.lanka.tourbot.nlp.ContextualIntentDetector;
import com.lanka.tourbot.nlp.IntentLexicon;
import com.lanka.tourbot.nlp.IntentSignalDetector;
import com.lanka.tourbot.nlp.KeywordIntentDetector;
import com.lanka.tourbot.nlp.PatternIntentDetector;
import com.lanka.tourbot.repository.impl.ClasspathGuideRepository;
import com.lanka.tourbot.repository.impl.ClasspathKnowledgeRepository;
import com.lanka.tourbot.repository.impl.ClasspathResponseTemplateRepository;
import com.lanka.tourbot.service.RuntimeConfigService;
import com.lanka.tourbot.service.impl.EntityExtractionServiceImpl;
import com.lanka.tourbot.service.impl.IntentRecognitionServiceImpl;
import com.lanka.tourbot.service.impl.KnowledgeBaseServiceImpl;
import com.lanka.tourbot.service.impl.LanguageDetectionServiceImpl;
import com.lanka.tourbot.service.impl.ResponseDispatchServiceImpl;
import com.lanka.tourbot.service.impl.RuntimeConfigServiceImpl;
import com.lanka.tourbot.service.impl.SessionServiceImpl;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

/**
 * 不啟動 Spring 的元件組裝，資料皆來自 classpath 上的正式設定檔
 */
final class TourbotFixtures {

    private TourbotFixtures() {
    }

    static RuntimeConfigServiceImpl runtimeConfig() {
        RuntimeConfigServiceImpl config = new RuntimeConfigServiceImpl();
        config.init();
        return config;
    }

    static LanguageDetectionServiceImpl languageDetector(RuntimeConfigService config) {
        LanguageDetectionServiceImpl detector = new LanguageDetectionServiceImpl();
        ReflectionTestUtils.setField(detector, "runtimeConfigService", config);
        detector.init();
        return detector;
    }

    static IntentLexicon lexicon() {
        IntentLexicon lexicon = new IntentLexicon();
        lexicon.init();
        return lexicon;
    }

    static IntentRecognitionServiceImpl intentRecognizer(RuntimeConfigService config, IntentLexicon lexicon) {
        return intentRecognizer(config, lexicon, List.of(
                new PatternIntentDetector(lexicon),
                new KeywordIntentDetector(lexicon),
                new ContextualIntentDetector(lexicon)));
    }

    static IntentRecognitionServiceImpl intentRecognizer(RuntimeConfigService config, IntentLexicon lexicon,
                                                         List<IntentSignalDetector> detectors) {
        IntentRecognitionServiceImpl recognizer = new IntentRecognitionServiceImpl();
        ReflectionTestUtils.setField(recognizer, "detectors", detectors);
        ReflectionTestUtils.setField(recognizer, "lexicon", lexicon);
        ReflectionTestUtils.setField(recognizer, "runtimeConfigService", config);
        return recognizer;
    }

    static EntityExtractionServiceImpl entityExtractor() {
        EntityExtractionServiceImpl extractor = new EntityExtractionServiceImpl();
        extractor.init();
        return extractor;
    }

    static ClasspathGuideRepository guides() {
        ClasspathGuideRepository guides = new ClasspathGuideRepository();
        guides.init();
        return guides;
    }

    static ClasspathResponseTemplateRepository templates() {
        ClasspathResponseTemplateRepository templates = new ClasspathResponseTemplateRepository();
        templates.init();
        return templates;
    }

    static KnowledgeBaseServiceImpl knowledgeBase(RuntimeConfigService config) {
        ClasspathKnowledgeRepository repository = new ClasspathKnowledgeRepository();
        repository.init();
        KnowledgeBaseServiceImpl knowledgeBase = new KnowledgeBaseServiceImpl();
        ReflectionTestUtils.setField(knowledgeBase, "knowledgeRepository", repository);
        ReflectionTestUtils.setField(knowledgeBase, "runtimeConfigService", config);
        knowledgeBase.init();
        return knowledgeBase;
    }

    static SessionServiceImpl sessions(RuntimeConfigService config, ClasspathGuideRepository guides) {
        SessionServiceImpl sessions = new SessionServiceImpl();
        ReflectionTestUtils.setField(sessions, "runtimeConfigService", config);
        ReflectionTestUtils.setField(sessions, "guideRepository", guides);
        return sessions;
    }

    static ResponseDispatchServiceImpl dispatcher(RuntimeConfigService config) {
        ResponseDispatchServiceImpl dispatcher = new ResponseDispatchServiceImpl();
        ReflectionTestUtils.setField(dispatcher, "templateRepository", templates());
        ReflectionTestUtils.setField(dispatcher, "guideRepository", guides());
        ReflectionTestUtils.setField(dispatcher, "knowledgeBaseService", knowledgeBase(config));
        ReflectionTestUtils.setField(dispatcher, "runtimeConfigService", config);
        dispatcher.init();
        return dispatcher;
    }
}
