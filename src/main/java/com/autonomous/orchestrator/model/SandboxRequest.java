package com.autonomous.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class SandboxRequest {
    String sessionId;
    String project;
    String unit;
    String branch;
    Path worktree;
    boolean resumed;
}
