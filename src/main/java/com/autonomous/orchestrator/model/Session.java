package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One attempt to execute a unit of work against a target project.
 *
 * Owned by SessionManager; state only changes through SessionStateMachine
 * and the record is never modified once the state is terminal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {
    private String id;
    private String project;
    private String unit;
    private String branch;
    private String baseBranch;

    @Builder.Default
    private SessionState state = SessionState.QUEUED;

    private ChatContext chatContext;
    private String triggeredBy;

    private Instant queuedAt;
    private Instant startedAt;
    private Instant pausedAt;
    private Instant completedAt;

    private String pauseReason;
    @Builder.Default
    private Map<String, Object> pauseContext = new LinkedHashMap<>();

    private String prUrl;
    private String error;

    @Builder.Default
    private SessionMetrics metrics = new SessionMetrics();

    @Builder.Default
    private List<SessionState> history = new ArrayList<>();

    private int attempts;

    @JsonIgnore
    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }

    public String shortId() {
        return id == null ? "" : id.substring(0, Math.min(8, id.length()));
    }
}
