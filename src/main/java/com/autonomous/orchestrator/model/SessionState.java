package com.autonomous.orchestrator.model;

public enum SessionState {
    QUEUED,
    STARTING,
    CLONING,
    RUNNING,
    PAUSED,
    COMPLETING,
    COMPLETED,
    FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABORTED;
    }
}
