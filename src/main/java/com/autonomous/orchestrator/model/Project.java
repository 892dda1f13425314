package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registry entry for a target repository. Only administrative operations
 * modify these; the orchestrator reads them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Project {
    private String id;
    private String name;
    private String repoUrl;

    @Builder.Default
    private String defaultBranch = "main";

    // GitHub App installation id or any other auth reference the VCS client understands.
    private String installationId;

    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;
    private Instant updatedAt;
}
