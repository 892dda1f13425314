package com.autonomous.orchestrator.model;

import lombok.Value;

import java.time.Instant;

@Value
public class SandboxHandle {
    String id;
    String sessionId;
    Instant startedAt;
}
