package com.autonomous.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-target admission record: at most one active session id plus the FIFO
 * list of session ids waiting for the target. Stored under a single key so a
 * promotion is one write.
 */
@Data
@NoArgsConstructor
public class QueueState {
    private String target;
    private String activeSessionId;
    private List<String> pending = new ArrayList<>();
    private Instant updatedAt;

    public QueueState(String target) {
        this.target = target;
    }

    public boolean hasActive() {
        return activeSessionId != null;
    }
}
