package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.LogStream;
import com.autonomous.orchestrator.model.Session;
import com.autonomous.orchestrator.model.SessionState;
import com.autonomous.orchestrator.storage.InMemoryObjectStore;
import com.autonomous.orchestrator.storage.StorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SessionJanitorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private StorageService storage;
    private SessionJanitor janitor;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getRetention().setMaxAge(Duration.ofDays(30));
        properties.getStorage().setRetryBackoff(Duration.ZERO);
        storage = new StorageService(new InMemoryObjectStore(), properties);
        janitor = new SessionJanitor(storage, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldPurgeOnlyExpiredTerminalSessions() {
        save("old-done", SessionState.COMPLETED, NOW.minus(Duration.ofDays(31)));
        save("old-failed", SessionState.FAILED, NOW.minus(Duration.ofDays(45)));
        save("recent", SessionState.COMPLETED, NOW.minus(Duration.ofDays(2)));
        save("paused", SessionState.PAUSED, null);
        storage.appendLog("old-done", LogStream.STDOUT, "line\n");

        assertEquals(2, janitor.purgeExpired());

        assertTrue(storage.getSession("old-done").isEmpty());
        assertTrue(storage.getSession("old-failed").isEmpty());
        assertTrue(storage.readLog("old-done", LogStream.STDOUT).isEmpty());
        assertTrue(storage.getSession("recent").isPresent());
        assertTrue(storage.getSession("paused").isPresent());
    }

    @Test
    void sweepOnEmptyStoreShouldDoNothing() {
        assertDoesNotThrow(janitor::sweep);
        assertEquals(0, janitor.purgeExpired());
    }

    private void save(String id, SessionState state, Instant completedAt) {
        storage.saveSession(Session.builder()
            .id(id)
            .project("demo")
            .unit("1")
            .state(state)
            .completedAt(completedAt)
            .build());
    }
}
