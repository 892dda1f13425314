package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.Session;
import com.autonomous.orchestrator.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Deletes finished sessions, with their logs, once they are older than the
 * retention window. Sessions that are still live are never touched.
 */
@Slf4j
@Service
public class SessionJanitor {

    private final StorageService storage;
    private final Duration maxAge;
    private final Clock clock;

    @Autowired
    public SessionJanitor(StorageService storage, OrchestratorProperties properties) {
        this(storage, properties, Clock.systemUTC());
    }

    SessionJanitor(StorageService storage, OrchestratorProperties properties, Clock clock) {
        this.storage = storage;
        this.maxAge = properties.getRetention().getMaxAge();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${orchestrator.retention.sweep-interval-ms:3600000}",
               initialDelayString = "${orchestrator.retention.sweep-interval-ms:3600000}")
    public void sweep() {
        try {
            int removed = purgeExpired();
            if (removed > 0) {
                log.info("Retention sweep removed {} sessions older than {}", removed, maxAge);
            }
        } catch (RuntimeException e) {
            log.error("Retention sweep failed: {}", e.getMessage(), e);
        }
    }

    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(maxAge);
        List<Session> expired = storage.listSessions(s -> s.isTerminal()
            && s.getCompletedAt() != null
            && s.getCompletedAt().isBefore(cutoff));

        for (Session session : expired) {
            storage.deleteSession(session.getId());
            log.debug("Deleted session {} ({} on {}, finished {})",
                session.getId(), session.getState(), session.getProject(), session.getCompletedAt());
        }
        return expired.size();
    }
}
