package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.ErrorCode;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.model.Project;
import com.autonomous.orchestrator.model.Session;
import com.autonomous.orchestrator.model.SessionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Working copies of target repositories. One worktree per target: the queue
 * guarantees a single active session per target, so nothing else touches it.
 * A session that did not finish leaves its edits behind, so the worktree is
 * reset whenever it moves to another session's branch.
 */
@Slf4j
@Service
public class WorkspaceService {

    private static final Pattern DIFF_STATS_PATTERN =
        Pattern.compile("(\\d+) files? changed(?:, (\\d+) insertions?\\(\\+\\))?(?:, (\\d+) deletions?\\(-\\))?");

    private static final Duration CLONE_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration GIT_TIMEOUT = Duration.ofSeconds(60);

    private final CommandRunner runner;
    private final Path workspaceRoot;
    private final String branchPrefix;

    public WorkspaceService(CommandRunner runner, OrchestratorProperties properties) {
        this.runner = runner;
        this.workspaceRoot = Paths.get(properties.getWorkspaceRoot());
        this.branchPrefix = properties.getBranchPrefix();
    }

    /**
     * Default branch for a session: {@code {prefix}/{target}/unit-{unit}-{shortId}}.
     */
    public String generateBranchName(String target, String unit, String shortId) {
        return String.format("%s/%s/unit-%s-%s", branchPrefix, target, unit, shortId);
    }

    public Path worktreePath(String target) {
        return workspaceRoot.resolve(target);
    }

    /**
     * Makes sure the target is cloned and the session branch is checked out.
     * Safe to call again for the same session: an existing clone is fetched
     * and an existing branch is checked out as it is, keeping earlier work.
     * Moving to a different branch first discards whatever the previous
     * session left uncommitted.
     *
     * @throws OrchestratorException E006 when the clone or checkout fails
     */
    public Path prepare(Project project, Session session) {
        Path worktree = worktreePath(project.getId());

        if (Files.isDirectory(worktree.resolve(".git"))) {
            if (!runGitCommand(worktree, "git", "fetch", "origin")) {
                log.warn("Fetch failed for {}, continuing with local state", project.getId());
            }
        } else {
            clone(project, worktree);
        }

        if (!session.getBranch().equals(currentBranch(worktree))) {
            discardLocalChanges(project, worktree);
        }

        String base = session.getBaseBranch() != null ? session.getBaseBranch() : project.getDefaultBranch();
        boolean checkedOut = branchExists(worktree, session.getBranch())
            ? runGitCommand(worktree, "git", "checkout", session.getBranch())
            : runGitCommand(worktree, "git", "checkout", "-b", session.getBranch(), "origin/" + base);

        if (!checkedOut) {
            throw new OrchestratorException(ErrorCode.E006,
                "Could not check out " + session.getBranch() + " in " + project.getId());
        }
        log.info("Workspace for session {} ready at {} on {}", session.getId(), worktree, session.getBranch());
        return worktree;
    }

    /**
     * Stages everything in the worktree and measures it against the base branch.
     */
    public SessionMetrics diffMetrics(Path worktree, String baseBranch, SessionMetrics metrics) {
        runGitCommand(worktree, "git", "add", "-A");
        CommandRunner.Result diff = runner.run(worktree, GIT_TIMEOUT,
            "git", "diff", "--cached", "--shortstat", "origin/" + baseBranch);
        if (!diff.isSuccess()) {
            log.warn("Could not compute diff stats in {}: {}", worktree, diff.getOutput().trim());
            return metrics;
        }
        return parseDiffStats(diff.getOutput(), metrics);
    }

    public SessionMetrics parseDiffStats(String diffOutput, SessionMetrics metrics) {
        Matcher matcher = DIFF_STATS_PATTERN.matcher(diffOutput);
        if (matcher.find()) {
            metrics.setFilesChanged(Integer.parseInt(matcher.group(1)));
            metrics.setLinesAdded(matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0);
            metrics.setLinesRemoved(matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : 0);
        } else {
            metrics.setFilesChanged(0);
            metrics.setLinesAdded(0);
            metrics.setLinesRemoved(0);
        }
        return metrics;
    }

    private void clone(Project project, Path worktree) {
        try {
            Files.createDirectories(worktree.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new OrchestratorException(ErrorCode.E006, "Cannot create " + worktree.getParent(), e);
        }

        CommandRunner.Result result = runner.run(null, CLONE_TIMEOUT,
            "git", "clone", project.getRepoUrl(), worktree.toString());
        if (!result.isSuccess()) {
            throw new OrchestratorException(ErrorCode.E006, tail(result.getOutput()));
        }
        log.info("Cloned {} into {}", project.getRepoUrl(), worktree);
    }

    private String currentBranch(Path worktree) {
        CommandRunner.Result head = runner.run(worktree, GIT_TIMEOUT, "git", "rev-parse", "--abbrev-ref", "HEAD");
        return head.isSuccess() ? head.getOutput().trim() : "";
    }

    private void discardLocalChanges(Project project, Path worktree) {
        if (!runGitCommand(worktree, "git", "reset", "--hard")
                || !runGitCommand(worktree, "git", "clean", "-fdx")) {
            throw new OrchestratorException(ErrorCode.E006,
                "Could not clean the worktree of " + project.getId());
        }
        log.info("Discarded leftover changes in {}", worktree);
    }

    private boolean branchExists(Path worktree, String branch) {
        return runGitCommand(worktree, "git", "rev-parse", "--verify", "--quiet", "refs/heads/" + branch);
    }

    private boolean runGitCommand(Path worktree, String... command) {
        CommandRunner.Result result = runner.run(worktree, GIT_TIMEOUT, command);
        if (!result.isSuccess()) {
            log.debug("{} exited {}: {}", String.join(" ", command), result.getExitCode(), result.getOutput().trim());
        }
        return result.isSuccess();
    }

    private static String tail(String output) {
        String trimmed = output.trim();
        return trimmed.length() <= 500 ? trimmed : trimmed.substring(trimmed.length() - 500);
    }
}
