package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.AdmissionResult;
import com.autonomous.orchestrator.model.QueueState;
import com.autonomous.orchestrator.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Per-target admission: one active slot and a FIFO list of waiting sessions.
 *
 * Every read-modify-write of a target's queue happens under that target's
 * lock, so two concurrent enqueues cannot overwrite each other. Different
 * targets never contend.
 */
@Slf4j
@Service
public class QueueManager {

    static final int MINUTES_PER_POSITION = 30;

    private final StorageService storage;
    private final int maxDepth;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public QueueManager(StorageService storage, OrchestratorProperties properties) {
        this.storage = storage;
        this.maxDepth = properties.getQueue().getMaxDepth();
    }

    /**
     * Takes the active slot when it is free, otherwise appends to the pending
     * list. The pending list holds at most {@code maxDepth} ids; the active
     * slot does not count towards it.
     */
    public AdmissionResult enqueue(String target, String sessionId) {
        return withLock(target, () -> {
            QueueState queue = storage.getQueue(target);

            if (!queue.hasActive()) {
                queue.setActiveSessionId(sessionId);
                storage.saveQueue(queue);
                log.info("Session {} admitted on {}", sessionId, target);
                return AdmissionResult.admitted();
            }

            if (queue.getPending().size() >= maxDepth) {
                log.info("Queue for {} is full ({} pending), rejecting {}", target, maxDepth, sessionId);
                return AdmissionResult.rejected();
            }

            queue.getPending().add(sessionId);
            storage.saveQueue(queue);
            int position = queue.getPending().size();
            log.info("Session {} queued on {} at position {}", sessionId, target, position);
            return AdmissionResult.queued(position);
        });
    }

    /**
     * Releases the active slot held by {@code sessionId} and promotes the
     * next pending session in the same write. A session that was still
     * pending is simply dropped from the list.
     *
     * @return the promoted session id, if any
     */
    public Optional<String> onSessionTerminal(String target, String sessionId) {
        return withLock(target, () -> {
            QueueState queue = storage.getQueue(target);

            if (sessionId.equals(queue.getActiveSessionId())) {
                String next = queue.getPending().isEmpty() ? null : queue.getPending().remove(0);
                queue.setActiveSessionId(next);
                storage.saveQueue(queue);
                if (next != null) {
                    log.info("Session {} released {}, promoted {}", sessionId, target, next);
                } else {
                    log.info("Session {} released {}, queue is empty", sessionId, target);
                }
                return Optional.ofNullable(next);
            }

            if (queue.getPending().remove(sessionId)) {
                storage.saveQueue(queue);
                log.info("Session {} removed from {} queue", sessionId, target);
            }
            return Optional.empty();
        });
    }

    /**
     * Drops a waiting session from the pending list.
     *
     * @return true if the session was pending
     */
    public boolean removePending(String target, String sessionId) {
        return withLock(target, () -> {
            QueueState queue = storage.getQueue(target);
            boolean removed = queue.getPending().remove(sessionId);
            if (removed) {
                storage.saveQueue(queue);
            }
            return removed;
        });
    }

    /**
     * Clears an active slot and pending entries whose sessions can no longer
     * run (missing or terminal), promoting the first live pending session if
     * the slot ends up free. Used after a restart.
     *
     * @return the session id newly placed in the active slot, if any
     */
    public Optional<String> repair(String target, Predicate<String> live) {
        return withLock(target, () -> {
            QueueState queue = storage.getQueue(target);
            boolean changed = false;

            Iterator<String> pending = queue.getPending().iterator();
            while (pending.hasNext()) {
                String id = pending.next();
                if (!live.test(id)) {
                    log.warn("Dropping stale pending session {} from {}", id, target);
                    pending.remove();
                    changed = true;
                }
            }

            String promoted = null;
            if (queue.hasActive() && !live.test(queue.getActiveSessionId())) {
                log.warn("Active slot on {} held by finished session {}, releasing", target, queue.getActiveSessionId());
                queue.setActiveSessionId(null);
                changed = true;
            }
            if (!queue.hasActive() && !queue.getPending().isEmpty()) {
                promoted = queue.getPending().remove(0);
                queue.setActiveSessionId(promoted);
                changed = true;
            }

            if (changed) {
                storage.saveQueue(queue);
            }
            return Optional.ofNullable(promoted);
        });
    }

    /**
     * 0 for the active session, 1-based position for a pending one, -1 otherwise.
     */
    public int position(String target, String sessionId) {
        QueueState queue = storage.getQueue(target);
        if (sessionId.equals(queue.getActiveSessionId())) {
            return 0;
        }
        int index = queue.getPending().indexOf(sessionId);
        return index < 0 ? -1 : index + 1;
    }

    public Optional<String> activeSession(String target) {
        return Optional.ofNullable(storage.getQueue(target).getActiveSessionId());
    }

    public int pendingCount(String target) {
        return storage.getQueue(target).getPending().size();
    }

    public int estimatedWaitMinutes(int position) {
        return Math.max(0, position) * MINUTES_PER_POSITION;
    }

    private <T> T withLock(String target, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(target, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
