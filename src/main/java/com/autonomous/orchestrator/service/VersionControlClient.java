package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Project;

import java.nio.file.Path;

/**
 * Publishes a session's work as a draft change request.
 */
public interface VersionControlClient {

    /**
     * Commits and pushes the worktree branch, then opens a draft change
     * request against {@code baseBranch}. Calling it again for a branch that
     * already has an open request returns the existing URL.
     *
     * @return the change request URL
     * @throws com.autonomous.orchestrator.exception.OrchestratorException E012 on failure
     */
    String openDraftChangeRequest(Project project, Path worktree, String branch, String baseBranch,
                                  String title, String description);
}
