package com.autonomous.orchestrator.model;

import lombok.Data;

@Data
public class SessionMetrics {
    private int filesChanged;
    private int linesAdded;
    private int linesRemoved;
    private int testsRun;
    private int testsPassed;

    // Time spent in RUNNING across all attempts; paused time is excluded.
    private long runtimeMillis;
}
