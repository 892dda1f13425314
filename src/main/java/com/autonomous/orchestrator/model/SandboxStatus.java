package com.autonomous.orchestrator.model;

import lombok.Value;

@Value
public class SandboxStatus {
    boolean running;
    Integer exitCode;   // null while running

    public static SandboxStatus running() {
        return new SandboxStatus(true, null);
    }

    public static SandboxStatus exited(int exitCode) {
        return new SandboxStatus(false, exitCode);
    }
}
