package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.CircuitBreakerResult;
import com.autonomous.orchestrator.model.Session;
import com.autonomous.orchestrator.model.SessionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Formats lifecycle messages and hands them to the {@link Notifier}.
 *
 * Delivery is retried a few times; if it still fails the message is dropped
 * and logged. A session never waits on chat.
 */
@Slf4j
@Service
public class NotificationService {

    private final Notifier notifier;
    private final CircuitBreakerDetector detector;
    private final int attempts;
    private final Duration backoff;

    public NotificationService(Notifier notifier, CircuitBreakerDetector detector, OrchestratorProperties properties) {
        this.notifier = notifier;
        this.detector = detector;
        this.attempts = properties.getNotifications().getRetryAttempts();
        this.backoff = properties.getNotifications().getRetryBackoff();
    }

    public void queued(Session session, int position, int waitMinutes) {
        StringBuilder message = header("Session Queued", session);
        message.append("Queue position: *").append(position).append("*");
        message.append(" (estimated wait ~").append(waitMinutes).append(" min)\n\n");
        message.append("Another session is running on this project. Yours starts automatically when it finishes.\n\n");
        message.append("Check status: `/sprint-status ").append(session.getId()).append("`");
        deliver(session, "queued", message.toString());
    }

    public void started(Session session) {
        StringBuilder message = header("Session Started", session);
        message.append("Branch: `").append(session.getBranch()).append("`\n");
        message.append("Session ID: `").append(session.getId()).append("`\n\n");
        message.append("Check status: `/sprint-status ").append(session.getId()).append("`");
        deliver(session, "started", message.toString());
    }

    public void paused(Session session, CircuitBreakerResult result) {
        StringBuilder message = header("Session Paused", session);
        message.append(detector.formatMessage(result, session.getId()));
        deliver(session, "paused", message.toString());
    }

    public void resumed(Session session) {
        StringBuilder message = header("Session Resumed", session);
        message.append("Continuing on `").append(session.getBranch()).append("`");
        deliver(session, "resumed", message.toString());
    }

    public void completed(Session session) {
        SessionMetrics metrics = session.getMetrics();
        StringBuilder message = header("Sprint Completed", session);
        message.append("*Draft PR:* ").append(session.getPrUrl()).append("\n\n");
        message.append("*Files changed:* ").append(metrics.getFilesChanged()).append("\n");
        message.append("*Lines:* +").append(metrics.getLinesAdded())
            .append(" / -").append(metrics.getLinesRemoved()).append("\n");
        if (metrics.getTestsRun() > 0) {
            message.append("*Tests:* ").append(metrics.getTestsPassed())
                .append("/").append(metrics.getTestsRun()).append(" passed\n");
        }
        message.append("*Duration:* ").append(formatDuration(metrics.getRuntimeMillis())).append("\n\n");
        message.append("Session ID: `").append(session.getId()).append("`");
        deliver(session, "completed", message.toString());
    }

    public void failed(Session session) {
        StringBuilder message = header("Session Failed", session);
        message.append("*Error:* ").append(session.getError()).append("\n\n");
        message.append("View logs: `/sprint-logs ").append(session.getId()).append("`");
        deliver(session, "failed", message.toString());
    }

    public void aborted(Session session) {
        StringBuilder message = header("Session Aborted", session);
        message.append("Session ID: `").append(session.getId()).append("`");
        deliver(session, "aborted", message.toString());
    }

    static String formatDuration(long millis) {
        long seconds = millis / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes % 60);
        }
        if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds % 60);
        }
        return seconds + "s";
    }

    private StringBuilder header(String title, Session session) {
        StringBuilder message = new StringBuilder();
        message.append("*").append(title).append("*\n");
        message.append("Sprint *").append(session.getUnit()).append("* on `")
            .append(session.getProject()).append("`\n\n");
        return message;
    }

    private void deliver(Session session, String event, String message) {
        if (session.getChatContext() == null || session.getChatContext().getChannelId() == null) {
            log.debug("Session {} has no chat context, skipping {} notification", session.getId(), event);
            return;
        }
        try {
            Retries.runWithBackoff("notify " + event + " for " + session.getId(), attempts, backoff,
                () -> notifier.send(session.getChatContext(), message));
        } catch (RuntimeException e) {
            log.warn("Dropped {} notification for session {}: {}", event, session.getId(), e.getMessage());
        }
    }
}
