package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.ErrorCode;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.model.ChatContext;
import com.autonomous.orchestrator.model.LogStream;
import com.autonomous.orchestrator.model.Project;
import com.autonomous.orchestrator.model.RunRequest;
import com.autonomous.orchestrator.model.Session;
import com.autonomous.orchestrator.model.SessionMetrics;
import com.autonomous.orchestrator.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Turns structured commands into chat responses. Every command answers with
 * text, including on failure: typed errors show their message and hint,
 * anything unexpected becomes a storage error carrying the session id.
 */
@Slf4j
@Service
public class CommandService {

    private final SessionManager sessionManager;

    public CommandService(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    public String run(String target, String unit, String branch, String userId, ChatContext chatContext) {
        return respond(null, () -> {
            Session session = sessionManager.run(RunRequest.builder()
                .target(target)
                .unit(unit)
                .branch(branch)
                .triggeredBy(userId)
                .chatContext(chatContext)
                .build());
            return String.format("Sprint *%s* on `%s` accepted.\n\nSession ID: `%s`\nBranch: `%s`\n\n"
                    + "Updates will be posted here. Check status: `/sprint-status %s`",
                session.getUnit(), session.getProject(), session.getId(), session.getBranch(), session.getId());
        });
    }

    public String status(String sessionId) {
        return respond(sessionId, () -> {
            if (sessionId != null) {
                return formatSession(sessionManager.status(sessionId));
            }
            List<Session> active = sessionManager.activeSessions();
            if (!active.isEmpty()) {
                StringBuilder response = new StringBuilder("*Active Sessions*\n");
                active.forEach(s -> response.append("\n").append(formatSession(s)).append("\n"));
                return response.toString().trim();
            }
            List<Session> recent = sessionManager.history(null);
            if (!recent.isEmpty()) {
                return "*No active session*\n\nMost recent session:\n\n" + formatSession(recent.get(0));
            }
            return "*No active session*\n\nNo sessions have been run yet. Start one with `/sprint-run <project> <sprint>`";
        });
    }

    public String resume(String sessionId) {
        return respond(sessionId, () -> {
            Session session = sessionManager.resume(sessionId);
            return String.format("Resuming session `%s` (sprint *%s* on `%s`).",
                session.getId(), session.getUnit(), session.getProject());
        });
    }

    public String abort(String sessionId) {
        return respond(sessionId, () -> {
            Session session = sessionManager.abort(sessionId);
            return String.format("Session `%s` aborted (sprint *%s* on `%s`).",
                session.getId(), session.getUnit(), session.getProject());
        });
    }

    public String projects() {
        return respond(null, () -> {
            List<Project> projects = sessionManager.projects();
            if (projects.isEmpty()) {
                return "*Registered Projects*\n\nNo projects registered yet.";
            }
            StringBuilder response = new StringBuilder("*Registered Projects*\n");
            for (Project project : projects) {
                response.append("\n").append(project.isEnabled() ? "[enabled] " : "[disabled] ")
                    .append("*").append(project.getName()).append("* (`").append(project.getId()).append("`)\n")
                    .append("   ").append(project.getRepoUrl()).append("\n");
            }
            return response.toString().trim();
        });
    }

    public String history(String target) {
        return respond(null, () -> {
            String title = target != null ? "*Session History for " + target + "*" : "*Session History*";
            List<Session> sessions = sessionManager.history(target);
            if (sessions.isEmpty()) {
                return title + "\n\nNo sessions found.";
            }
            StringBuilder response = new StringBuilder(title).append("\n");
            for (Session session : sessions) {
                response.append("\n`").append(session.shortId()).append("` ")
                    .append(session.getProject()).append(" sprint ").append(session.getUnit())
                    .append(" - ").append(session.getState());
                if (session.getPrUrl() != null) {
                    response.append(" - ").append(session.getPrUrl());
                }
            }
            return response.toString();
        });
    }

    public String logs(String sessionId, Integer lines) {
        return respond(sessionId, () -> {
            List<String> tail = sessionManager.logs(sessionId, lines, LogStream.STDOUT);
            if (tail.isEmpty()) {
                return "*Logs for session `" + sessionId + "`*\n\nNo output recorded yet.";
            }
            return "*Logs for session `" + sessionId + "`* (last " + tail.size() + " lines)\n\n```\n"
                + String.join("\n", tail) + "\n```";
        });
    }

    public String help() {
        return "*Sprint Orchestrator* - autonomous sprint execution\n\n"
            + "*Commands:*\n"
            + "• `/sprint-run <project> <sprint> [branch]` - start a sprint\n"
            + "• `/sprint-status [session-id]` - show a session, or the active ones\n"
            + "• `/sprint-resume <session-id>` - continue a paused session\n"
            + "• `/sprint-abort <session-id>` - cancel a session\n"
            + "• `/sprint-projects` - list registered projects\n"
            + "• `/sprint-history [project]` - recent sessions\n"
            + "• `/sprint-logs <session-id> [lines]` - tail the agent output\n\n"
            + "*Example:* `/sprint-run demo 3`";
    }

    String formatSession(Session session) {
        StringBuilder lines = new StringBuilder();
        lines.append("*Session*: `").append(session.getId()).append("`\n");
        lines.append("*Project*: `").append(session.getProject()).append("`\n");
        lines.append("*Sprint*: ").append(session.getUnit()).append("\n");
        lines.append("*Branch*: `").append(session.getBranch()).append("`\n");
        lines.append("*State*: ").append(session.getState()).append("\n");
        lines.append("*Triggered by*: ").append(session.getTriggeredBy());

        if (session.getStartedAt() != null) {
            Instant end = session.getCompletedAt() != null ? session.getCompletedAt() : Instant.now();
            lines.append("\n*Duration*: ").append(NotificationService.formatDuration(
                Duration.between(session.getStartedAt(), end).toMillis()));
        }

        if (session.getState() == SessionState.PAUSED && session.getPauseReason() != null) {
            lines.append("\n\n*Pause Reason*: ").append(session.getPauseReason());
            lines.append("\n\n*Options*:");
            lines.append("\n• Resume: `/sprint-resume ").append(session.getId()).append("`");
            lines.append("\n• Abort: `/sprint-abort ").append(session.getId()).append("`");
            lines.append("\n• View logs: `/sprint-logs ").append(session.getId()).append("`");
        }
        if (session.getPrUrl() != null) {
            lines.append("\n\n*Draft PR*: ").append(session.getPrUrl());
        }
        if (session.getState() == SessionState.FAILED && session.getError() != null) {
            lines.append("\n\n*Error*: ").append(session.getError());
            lines.append("\nView logs: `/sprint-logs ").append(session.getId()).append("`");
        }
        if (session.getState() == SessionState.COMPLETED) {
            SessionMetrics metrics = session.getMetrics();
            lines.append("\n\n*Metrics*:");
            lines.append("\n• Files changed: ").append(metrics.getFilesChanged());
            lines.append("\n• Lines added: ").append(metrics.getLinesAdded());
            lines.append("\n• Lines removed: ").append(metrics.getLinesRemoved());
        }
        return lines.toString();
    }

    private String respond(String sessionId, Supplier<String> command) {
        try {
            return command.get();
        } catch (OrchestratorException e) {
            return e.toUserMessage();
        } catch (RuntimeException e) {
            log.error("Command failed{}", sessionId != null ? " for session " + sessionId : "", e);
            OrchestratorException wrapped = new OrchestratorException(ErrorCode.E011,
                sessionId != null ? "Session `" + sessionId + "`: " + e.getMessage() : e.getMessage(), e);
            return wrapped.toUserMessage();
        }
    }
}
