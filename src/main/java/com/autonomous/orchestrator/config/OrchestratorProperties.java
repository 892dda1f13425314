package com.autonomous.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    private String workspaceRoot = "workspaces";
    private String branchPrefix = "sprint";

    // Targets this instance recovers on startup. Empty means every target.
    private List<String> claimedTargets = new ArrayList<>();

    private Storage storage = new Storage();
    private Queue queue = new Queue();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Sandbox sandbox = new Sandbox();
    private Notifications notifications = new Notifications();
    private Registry registry = new Registry();
    private Retention retention = new Retention();

    @Data
    public static class Storage {
        private String type = "filesystem";     // filesystem | memory
        private String root = "data/store";
        private int retryAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(200);
    }

    @Data
    public static class Queue {
        private int maxDepth = 10;
    }

    @Data
    public static class CircuitBreaker {
        private int sameIssueThreshold = 3;
        private int noProgressCycles = 5;
        private Duration timeout = Duration.ofHours(8);
        private int maxCycles = 20;
    }

    @Data
    public static class Sandbox {
        private int startAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(2);
        private Duration stopTimeout = Duration.ofSeconds(10);
        private int vcsAttempts = 3;
    }

    @Data
    public static class Notifications {
        private int retryAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Registry {
        private String seedPath = "config/projects";
    }

    @Data
    public static class Retention {
        private Duration maxAge = Duration.ofDays(30);
    }
}
