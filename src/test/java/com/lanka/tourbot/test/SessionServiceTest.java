package com.lanka.tourbot.test;

import com.lanka.tourbot.exception.SessionNotFoundException;
import com.lanka.tourbot.model.ChatSession;
import com.lanka.tourbot.model.ConversationTurn;
import com.lanka.tourbot.model.Intent;
import com.lanka.tourbot.model.Language;
import com.lanka.tourbot.model.SessionSnapshot;
import com.lanka.tourbot.service.SessionExpirySweeper;
import com.lanka.tourbot.service.impl.SessionServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Session 生命週期測試
 */
public class SessionServiceTest {

    private SessionServiceImpl sessionService;

    @BeforeEach
    public void setUp() {
        sessionService = TourbotFixtures.sessions(TourbotFixtures.runtimeConfig(), TourbotFixtures.guides());
    }

    private static ConversationTurn turn(int i, Intent intent) {
        return new ConversationTurn(System.currentTimeMillis(), "message " + i, Language.EN, intent, 1.0,
                List.of(), "reply " + i);
    }

    private void makeIdle(String sessionId, Duration idleFor) {
        ChatSession session = sessionService.getSession(sessionId);
        ReflectionTestUtils.setField(session, "lastActiveAt", System.currentTimeMillis() - idleFor.toMillis());
    }

    @Test
    @DisplayName("建立 Session - 未指定語言時使用預設語言與預設導遊")
    public void testCreateWithDefaults() {
        String id = sessionService.createSession("user-1", null);

        SessionSnapshot snapshot = sessionService.snapshot(id).orElseThrow();
        assertEquals(Language.EN, snapshot.language());
        assertEquals("saru", snapshot.guideId());
        assertEquals("user-1", snapshot.userId());
        assertTrue(snapshot.history().isEmpty());
        assertEquals(1, sessionService.getActiveSessionCount());
    }

    @Test
    @DisplayName("建立 Session - 每次產生不同 ID")
    public void testCreateGeneratesUniqueIds() {
        String a = sessionService.createSession("u", Language.SI);
        String b = sessionService.createSession("u", Language.SI);

        assertNotEquals(a, b);
        assertEquals(Language.SI, sessionService.getSession(a).getLanguage());
    }

    @Test
    @DisplayName("歷史上限 - 超過 50 輪時以 FIFO 移除最舊紀錄")
    public void testHistoryTrimmedFifo() {
        String id = sessionService.createSession("u", Language.EN);
        for (int i = 0; i < 51; i++) {
            sessionService.appendTurn(id, turn(i, Intent.GREETING));
        }

        List<ConversationTurn> history = sessionService.snapshot(id).orElseThrow().history();
        assertEquals(50, history.size(), "應只保留 50 輪");
        assertEquals("message 1", history.get(0).userMessage(), "最舊的一輪應被移除");
        assertEquals("message 50", history.get(49).userMessage());
    }

    @Test
    @DisplayName("快照 - 為唯讀複本，之後的變更不影響已取得的快照")
    public void testSnapshotIsDetached() {
        String id = sessionService.createSession("u", Language.EN);
        sessionService.appendTurn(id, turn(0, Intent.FOOD_INQUIRY));
        SessionSnapshot before = sessionService.snapshot(id).orElseThrow();

        sessionService.appendTurn(id, turn(1, Intent.GREETING));

        assertEquals(1, before.history().size());
        assertThrows(UnsupportedOperationException.class, () -> before.history().add(turn(2, Intent.GREETING)));
        assertEquals(Intent.FOOD_INQUIRY, sessionService.snapshot(id).orElseThrow().lastSubstantiveIntent());
    }

    @Test
    @DisplayName("不存在的 Session - 查詢回傳 null，set 操作回傳 false 且不會建立 Session")
    public void testMissingSessionIsNeverCreated() {
        assertNull(sessionService.getSession("missing"));
        assertNull(sessionService.getSession(null));
        assertFalse(sessionService.setLanguage("missing", "si"));
        assertFalse(sessionService.setGuide("missing", "anjali"));
        assertFalse(sessionService.resetSession("missing"));
        assertTrue(sessionService.snapshot("missing").isEmpty());
        assertEquals(0, sessionService.getActiveSessionCount(), "不應隱式建立 Session");
    }

    @Test
    @DisplayName("requireSession / appendTurn - 不存在時拋出 SessionNotFoundException")
    public void testRequireSessionThrows() {
        SessionNotFoundException ex = assertThrows(SessionNotFoundException.class,
                () -> sessionService.requireSession("ghost"));
        assertEquals("ghost", ex.getSessionId());

        assertThrows(SessionNotFoundException.class,
                () -> sessionService.appendTurn("ghost", turn(0, Intent.GREETING)));
    }

    @Test
    @DisplayName("切換語言與導遊 - 驗證輸入值")
    public void testSetLanguageAndGuide() {
        String id = sessionService.createSession("u", Language.EN);

        assertTrue(sessionService.setLanguage(id, "TA"));
        assertEquals(Language.TA, sessionService.getSession(id).getLanguage());
        assertFalse(sessionService.setLanguage(id, "fr"), "不支援的語言應被拒絕");
        assertEquals(Language.TA, sessionService.getSession(id).getLanguage());

        assertTrue(sessionService.setGuide(id, "anjali"));
        assertEquals("anjali", sessionService.getSession(id).getGuideId());
        assertFalse(sessionService.setGuide(id, "nobody"), "不存在的導遊應被拒絕");
        assertEquals("anjali", sessionService.getSession(id).getGuideId());
    }

    @Test
    @DisplayName("清除 Session - 之後查詢不到")
    public void testResetSession() {
        String id = sessionService.createSession("u", Language.EN);

        assertTrue(sessionService.resetSession(id));
        assertNull(sessionService.getSession(id));
        assertFalse(sessionService.resetSession(id));
    }

    @Test
    @DisplayName("閒置偵測 - 只回傳閒置超過時限的 Session")
    public void testFindIdleSessions() {
        String idle = sessionService.createSession("u", Language.EN);
        String active = sessionService.createSession("u", Language.EN);
        makeIdle(idle, Duration.ofHours(2));

        List<String> found = sessionService.findIdleSessionIds(Duration.ofMinutes(30));
        assertEquals(List.of(idle), found);
        assertNotNull(sessionService.getSession(active));
    }

    @Test
    @DisplayName("清理排程 - sweep 移除閒置 Session")
    public void testSweeperRemovesIdleSessions() {
        SessionExpirySweeper sweeper = new SessionExpirySweeper();
        ReflectionTestUtils.setField(sweeper, "sessionService", sessionService);

        String idle = sessionService.createSession("u", Language.EN);
        String active = sessionService.createSession("u", Language.EN);
        makeIdle(idle, Duration.ofMinutes(45));

        assertEquals(1, sweeper.sweep());
        assertNull(sessionService.getSession(idle));
        assertNotNull(sessionService.getSession(active));
    }

    @Test
    @DisplayName("清理排程 - 未啟用時排程觸發不做任何事")
    public void testDisabledSweeperDoesNothing() {
        SessionExpirySweeper sweeper = new SessionExpirySweeper();
        ReflectionTestUtils.setField(sweeper, "sessionService", sessionService);
        String idle = sessionService.createSession("u", Language.EN);
        makeIdle(idle, Duration.ofHours(5));

        sweeper.scheduledSweep();

        assertNotNull(sessionService.getSession(idle));
    }

    @Test
    @DisplayName("並行追加 - 不同執行緒寫入同一 Session 不遺失")
    public void testConcurrentAppends() throws InterruptedException {
        String id = sessionService.createSession("u", Language.EN);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(40);
        for (int i = 0; i < 40; i++) {
            int n = i;
            pool.submit(() -> {
                try {
                    sessionService.appendTurn(id, turn(n, Intent.HELP_INQUIRY));
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(40, sessionService.getSession(id).getHistorySize());
    }
}
