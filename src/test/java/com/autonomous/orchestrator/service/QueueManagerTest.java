package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.AdmissionResult;
import com.autonomous.orchestrator.model.QueueState;
import com.autonomous.orchestrator.storage.InMemoryObjectStore;
import com.autonomous.orchestrator.storage.StorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QueueManagerTest {

    private static final int MAX_DEPTH = 3;

    private StorageService storage;
    private QueueManager queue;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getQueue().setMaxDepth(MAX_DEPTH);
        properties.getStorage().setRetryBackoff(Duration.ZERO);
        storage = new StorageService(new InMemoryObjectStore(), properties);
        queue = new QueueManager(storage, properties);
    }

    @Test
    void firstSessionShouldBeAdmittedImmediately() {
        AdmissionResult result = queue.enqueue("demo", "s1");

        assertTrue(result.isAdmitted());
        assertEquals(0, result.getPosition());
        assertEquals(Optional.of("s1"), queue.activeSession("demo"));
    }

    @Test
    void shouldQueueInFifoOrderAndRejectExactlyOneOverDepth() {
        queue.enqueue("demo", "active");

        List<AdmissionResult> results = new ArrayList<>();
        for (int i = 1; i <= MAX_DEPTH + 1; i++) {
            results.add(queue.enqueue("demo", "s" + i));
        }

        long rejected = results.stream().filter(AdmissionResult::isRejected).count();
        assertEquals(1, rejected);
        assertTrue(results.get(MAX_DEPTH).isRejected());
        for (int i = 0; i < MAX_DEPTH; i++) {
            assertEquals(AdmissionResult.Outcome.QUEUED, results.get(i).getOutcome());
            assertEquals(i + 1, results.get(i).getPosition());
        }
        assertEquals(List.of("s1", "s2", "s3"), storage.getQueue("demo").getPending());
    }

    @Test
    void terminalSessionShouldPromoteNextInOrder() {
        queue.enqueue("demo", "s1");
        queue.enqueue("demo", "s2");
        queue.enqueue("demo", "s3");

        assertEquals(Optional.of("s2"), queue.onSessionTerminal("demo", "s1"));
        assertEquals(Optional.of("s3"), queue.onSessionTerminal("demo", "s2"));
        assertEquals(Optional.empty(), queue.onSessionTerminal("demo", "s3"));
        assertFalse(storage.getQueue("demo").hasActive());
    }

    @Test
    void terminalCallFromNonActiveSessionShouldNotTouchSlot() {
        queue.enqueue("demo", "s1");
        queue.enqueue("demo", "s2");

        assertEquals(Optional.empty(), queue.onSessionTerminal("demo", "s2"));
        assertEquals(Optional.empty(), queue.onSessionTerminal("demo", "unknown"));

        QueueState state = storage.getQueue("demo");
        assertEquals("s1", state.getActiveSessionId());
        assertTrue(state.getPending().isEmpty());
    }

    @Test
    void releasingTwiceShouldPromoteOnlyOnce() {
        queue.enqueue("demo", "s1");
        queue.enqueue("demo", "s2");
        queue.enqueue("demo", "s3");

        assertEquals(Optional.of("s2"), queue.onSessionTerminal("demo", "s1"));
        assertEquals(Optional.empty(), queue.onSessionTerminal("demo", "s1"));
        assertEquals("s2", storage.getQueue("demo").getActiveSessionId());
    }

    @Test
    void targetsShouldBeIndependent() {
        assertTrue(queue.enqueue("demo", "s1").isAdmitted());
        assertTrue(queue.enqueue("other", "s2").isAdmitted());
        assertEquals(1, queue.enqueue("demo", "s3").getPosition());
    }

    @Test
    void shouldReportPositionsAndWaitEstimate() {
        queue.enqueue("demo", "s1");
        queue.enqueue("demo", "s2");
        queue.enqueue("demo", "s3");

        assertEquals(0, queue.position("demo", "s1"));
        assertEquals(2, queue.position("demo", "s3"));
        assertEquals(-1, queue.position("demo", "nope"));
        assertEquals(60, queue.estimatedWaitMinutes(2));
        assertEquals(2, queue.pendingCount("demo"));
    }

    @Test
    void removePendingShouldDropOnlyWaitingSessions() {
        queue.enqueue("demo", "s1");
        queue.enqueue("demo", "s2");

        assertTrue(queue.removePending("demo", "s2"));
        assertFalse(queue.removePending("demo", "s1"));
        assertEquals("s1", storage.getQueue("demo").getActiveSessionId());
    }

    @Test
    void repairShouldReleaseDeadSlotAndSkipDeadPending() {
        queue.enqueue("demo", "dead-active");
        queue.enqueue("demo", "dead-pending");
        queue.enqueue("demo", "alive");

        Set<String> live = Set.of("alive");
        Optional<String> promoted = queue.repair("demo", live::contains);

        assertEquals(Optional.of("alive"), promoted);
        QueueState state = storage.getQueue("demo");
        assertEquals("alive", state.getActiveSessionId());
        assertTrue(state.getPending().isEmpty());
    }

    @Test
    void repairShouldLeaveHealthyQueueAlone() {
        queue.enqueue("demo", "s1");
        queue.enqueue("demo", "s2");

        assertEquals(Optional.empty(), queue.repair("demo", id -> true));
        assertEquals("s1", storage.getQueue("demo").getActiveSessionId());
        assertEquals(List.of("s2"), storage.getQueue("demo").getPending());
    }

    @Test
    void concurrentEnqueuesShouldNotLoseAnySession() throws Exception {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getQueue().setMaxDepth(100);
        QueueManager wide = new QueueManager(storage, properties);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AdmissionResult>> futures = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            String id = "s" + i;
            futures.add(pool.submit(() -> {
                start.await();
                return wide.enqueue("busy", id);
            }));
        }
        start.countDown();

        int admitted = 0;
        for (Future<AdmissionResult> future : futures) {
            if (future.get(10, TimeUnit.SECONDS).isAdmitted()) {
                admitted++;
            }
        }
        pool.shutdown();

        QueueState state = storage.getQueue("busy");
        assertEquals(1, admitted);
        assertTrue(state.hasActive());
        assertEquals(39, state.getPending().size());
    }
}
