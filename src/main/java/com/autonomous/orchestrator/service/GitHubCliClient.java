package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.ErrorCode;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.model.Project;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opens draft pull requests with git and the GitHub CLI.
 */
@Slf4j
@Service
public class GitHubCliClient implements VersionControlClient {

    private static final Pattern URL_PATTERN = Pattern.compile("https://\\S+");
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final CommandRunner runner;

    public GitHubCliClient(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public String openDraftChangeRequest(Project project, Path worktree, String branch, String baseBranch,
                                         String title, String description) {
        commitAll(worktree, title);
        push(worktree, branch);

        CommandRunner.Result created = runner.run(worktree, TIMEOUT,
            "gh", "pr", "create",
            "--draft",
            "--title", title,
            "--body", description,
            "--base", baseBranch,
            "--head", branch);

        if (created.isSuccess()) {
            return extractUrl(created.getOutput());
        }

        // A retry after a crash finds the request already open.
        if (created.getOutput().contains("already exists")) {
            CommandRunner.Result existing = runner.run(worktree, TIMEOUT,
                "gh", "pr", "view", branch, "--json", "url", "-q", ".url");
            if (existing.isSuccess()) {
                return extractUrl(existing.getOutput());
            }
        }
        throw new OrchestratorException(ErrorCode.E012, "gh pr create failed: " + created.getOutput().trim());
    }

    private void commitAll(Path worktree, String message) {
        runner.run(worktree, TIMEOUT, "git", "add", "-A");
        CommandRunner.Result status = runner.run(worktree, TIMEOUT, "git", "status", "--porcelain");
        if (status.isSuccess() && status.getOutput().isBlank()) {
            log.debug("Nothing to commit in {}", worktree);
            return;
        }
        CommandRunner.Result commit = runner.run(worktree, TIMEOUT, "git", "commit", "-m", message);
        if (!commit.isSuccess()) {
            throw new OrchestratorException(ErrorCode.E012, "git commit failed: " + commit.getOutput().trim());
        }
    }

    private void push(Path worktree, String branch) {
        CommandRunner.Result push = runner.run(worktree, TIMEOUT, "git", "push", "-u", "origin", branch);
        if (!push.isSuccess()) {
            throw new OrchestratorException(ErrorCode.E012, "git push failed: " + push.getOutput().trim());
        }
    }

    private static String extractUrl(String output) {
        Matcher matcher = URL_PATTERN.matcher(output);
        String url = null;
        while (matcher.find()) {
            url = matcher.group();
        }
        if (url == null) {
            throw new OrchestratorException(ErrorCode.E012, "No pull request URL in gh output: " + output.trim());
        }
        return url;
    }
}
