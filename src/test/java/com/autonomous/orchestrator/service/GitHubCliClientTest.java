package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.ErrorCode;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.model.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GitHubCliClientTest {

    private static final Path WORKTREE = Paths.get("workspaces", "demo");
    private static final Project PROJECT = Project.builder().id("demo").name("Demo").build();
    private static final String BRANCH = "sprint/demo/unit-3-abcd1234";

    @Mock
    private CommandRunner runner;

    @InjectMocks
    private GitHubCliClient client;

    // Keyed by "git <verb>" or "gh pr <verb>"; anything else succeeds silently.
    private final Map<String, CommandRunner.Result> answers = new HashMap<>();

    @BeforeEach
    void setUp() {
        when(runner.run(any(), any(), any(String[].class))).thenAnswer(invocation -> {
            Object[] args = invocation.getArguments();
            String tool = (String) args[2];
            String key = "gh".equals(tool) ? "gh pr " + args[4] : "git " + args[3];
            return answers.getOrDefault(key, new CommandRunner.Result(0, ""));
        });
    }

    @Test
    void shouldCommitPushAndReturnPullRequestUrl() {
        stubCommand("git status", 0, " M src/App.java\n");
        stubCommand("git commit", 0, "");
        stubCommand("git push", 0, "");
        stubCommand("gh pr create", 0, "Creating draft pull request\nhttps://github.com/example/demo/pull/42\n");

        String url = open();

        assertEquals("https://github.com/example/demo/pull/42", url);
        verify(runner).run(eq(WORKTREE), any(), eq("git"), eq("commit"), eq("-m"), eq("[Sprint] Sprint 3 - Demo"));
        verify(runner).run(eq(WORKTREE), any(), eq("gh"), eq("pr"), eq("create"), eq("--draft"),
            eq("--title"), anyString(), eq("--body"), anyString(),
            eq("--base"), eq("main"), eq("--head"), eq(BRANCH));
    }

    @Test
    void shouldSkipCommitWhenTreeIsClean() {
        stubCommand("git status", 0, "");
        stubCommand("git push", 0, "");
        stubCommand("gh pr create", 0, "https://github.com/example/demo/pull/43");

        assertEquals("https://github.com/example/demo/pull/43", open());
        verify(runner, never()).run(any(), any(), eq("git"), eq("commit"), anyString(), anyString());
    }

    @Test
    void shouldReuseExistingPullRequest() {
        stubCommand("git status", 0, "");
        stubCommand("git push", 0, "");
        stubCommand("gh pr create", 1, "a pull request for branch \"" + BRANCH + "\" already exists:\nhttps://github.com/example/demo/pull/9");
        stubCommand("gh pr view", 0, "https://github.com/example/demo/pull/9\n");

        assertEquals("https://github.com/example/demo/pull/9", open());
    }

    @Test
    void pushFailureShouldRaiseRetryableVcsError() {
        stubCommand("git status", 0, "");
        stubCommand("git push", 128, "remote: Permission denied");

        OrchestratorException e = assertThrows(OrchestratorException.class, this::open);

        assertEquals(ErrorCode.E012, e.getCode());
        assertTrue(e.isRetryable());
        // add, status and push; gh is never reached
        verify(runner, times(3)).run(any(), any(), any(String[].class));
    }

    @Test
    void outputWithoutUrlShouldFail() {
        stubCommand("git status", 0, "");
        stubCommand("git push", 0, "");
        stubCommand("gh pr create", 0, "done");

        OrchestratorException e = assertThrows(OrchestratorException.class, this::open);

        assertEquals(ErrorCode.E012, e.getCode());
    }

    private String open() {
        return client.openDraftChangeRequest(PROJECT, WORKTREE, BRANCH, "main", "[Sprint] Sprint 3 - Demo", "body");
    }

    private void stubCommand(String command, int exitCode, String output) {
        answers.put(command, new CommandRunner.Result(exitCode, output));
    }
}
