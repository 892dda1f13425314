package com.autonomous.orchestrator.storage;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.StorageException;
import com.autonomous.orchestrator.model.ChatContext;
import com.autonomous.orchestrator.model.LogStream;
import com.autonomous.orchestrator.model.Project;
import com.autonomous.orchestrator.model.ProjectRegistry;
import com.autonomous.orchestrator.model.QueueState;
import com.autonomous.orchestrator.model.Session;
import com.autonomous.orchestrator.model.SessionState;
import com.autonomous.orchestrator.service.SessionStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StorageServiceTest {

    private InMemoryObjectStore store;
    private StorageService storage;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        storage = new StorageService(store, properties());
    }

    @Test
    void sessionShouldRoundTripWithConsistentNextTransitions() {
        Session session = Session.builder()
            .id("s-1")
            .project("demo")
            .unit("3")
            .branch("sprint/demo/unit-3-s-1")
            .chatContext(ChatContext.builder().platform("slack").channelId("C1").build())
            .queuedAt(Instant.parse("2026-01-01T10:00:00Z"))
            .build();
        session.getHistory().add(SessionState.QUEUED);
        SessionStateMachine.transition(session, SessionState.STARTING);
        SessionStateMachine.transition(session, SessionState.CLONING);
        SessionStateMachine.transition(session, SessionState.RUNNING);
        session.getPauseContext().put("repeatedIssue", "TypeError");

        storage.saveSession(session);
        Session loaded = storage.getSession("s-1").orElseThrow();

        assertEquals(session, loaded);
        assertEquals(SessionState.RUNNING, loaded.getState());
        assertFalse(SessionStateMachine.validTransitions(loaded.getState()).isEmpty());
        assertEquals(SessionStateMachine.validTransitions(session.getState()),
            SessionStateMachine.validTransitions(loaded.getState()));
    }

    @Test
    void shouldListSessionsNewestFirstWithFilter() {
        storage.saveSession(session("a", "demo", "2026-01-01T10:00:00Z"));
        storage.saveSession(session("b", "other", "2026-01-02T10:00:00Z"));
        storage.saveSession(session("c", "demo", "2026-01-03T10:00:00Z"));

        List<Session> demo = storage.listSessions(s -> "demo".equals(s.getProject()));

        assertEquals(List.of("c", "a"), demo.stream().map(Session::getId).toList());
        assertEquals(3, storage.listSessions().size());
    }

    @Test
    void deleteSessionShouldRemoveRecordAndLogs() {
        storage.saveSession(session("a", "demo", "2026-01-01T10:00:00Z"));
        storage.appendLog("a", LogStream.STDOUT, "hello\n");

        storage.deleteSession("a");

        assertTrue(storage.getSession("a").isEmpty());
        assertEquals("", storage.readLog("a", LogStream.STDOUT));
    }

    @Test
    void logsShouldAppendAndTail() {
        storage.appendLog("a", LogStream.STDOUT, "one\ntwo\n");
        storage.appendLog("a", LogStream.STDOUT, "three\n");
        storage.appendLog("a", LogStream.STDERR, "oops\n");

        assertEquals(List.of("two", "three"), storage.tailLog("a", LogStream.STDOUT, 2));
        assertEquals(List.of("one", "two", "three"), storage.tailLog("a", LogStream.STDOUT, 100));
        assertEquals(3, storage.countLogLines("a", LogStream.STDOUT));
        assertEquals(List.of("oops"), storage.tailLog("a", LogStream.STDERR, 10));
        assertTrue(storage.tailLog("a", LogStream.ORCHESTRATOR, 10).isEmpty());
    }

    @Test
    void missingQueueShouldBeEmptyAndSavedQueueListed() {
        QueueState queue = storage.getQueue("demo");
        assertFalse(queue.hasActive());
        assertTrue(queue.getPending().isEmpty());

        queue.setActiveSessionId("s-1");
        queue.getPending().add("s-2");
        storage.saveQueue(queue);

        QueueState loaded = storage.getQueue("demo");
        assertEquals("s-1", loaded.getActiveSessionId());
        assertEquals(List.of("s-2"), loaded.getPending());
        assertNotNull(loaded.getUpdatedAt());
        assertEquals(List.of("demo"), storage.listQueueTargets());
    }

    @Test
    void registryShouldRoundTrip() {
        ProjectRegistry registry = storage.getRegistry();
        assertEquals(ProjectRegistry.CURRENT_VERSION, registry.getVersion());

        registry.getProjects().add(Project.builder().id("demo").name("Demo").repoUrl("https://x/demo.git").build());
        storage.saveRegistry(registry);

        Project loaded = storage.getRegistry().find("demo").orElseThrow();
        assertEquals("main", loaded.getDefaultBranch());
        assertTrue(loaded.isEnabled());
    }

    @Test
    void transientFailuresShouldBeRetried() {
        AtomicInteger failures = new AtomicInteger(2);
        StorageService flaky = new StorageService(new InMemoryObjectStore() {
            @Override
            public Optional<byte[]> get(String key) {
                if (failures.getAndDecrement() > 0) {
                    throw new StorageException("disk hiccup");
                }
                return super.get(key);
            }
        }, properties());

        assertTrue(flaky.getSession("missing").isEmpty());
    }

    @Test
    void persistentFailuresShouldPropagate() {
        StorageService broken = new StorageService(new InMemoryObjectStore() {
            @Override
            public void put(String key, byte[] value) {
                throw new StorageException("disk full");
            }
        }, properties());

        assertThrows(StorageException.class,
            () -> broken.saveSession(session("a", "demo", "2026-01-01T10:00:00Z")));
    }

    private static Session session(String id, String project, String queuedAt) {
        return Session.builder().id(id).project(project).unit("1").queuedAt(Instant.parse(queuedAt)).build();
    }

    private static OrchestratorProperties properties() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getStorage().setRetryAttempts(3);
        properties.getStorage().setRetryBackoff(Duration.ZERO);
        return properties;
    }
}
