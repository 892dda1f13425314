package com.autonomous.orchestrator.exception;

/**
 * User-facing error codes. The message is shown verbatim, the hint tells the
 * requester what to do next.
 */
public enum ErrorCode {
    E001("Project not found", "Check the project name with `/sprint-projects`", false),
    E002("Project disabled", "The project is currently disabled for autonomous execution", false),
    E003("Session already active", "Use `/sprint-status` to check the current session, or `/sprint-abort` to cancel it", false),
    E004("Queue full", "The queue for this project has reached maximum capacity. Try again later.", false),
    E005("VCS installation missing", "Install the GitHub App on the target repository", false),
    E006("Clone failed", "Check repository access and network connectivity", true),
    E007("Circuit breaker tripped", "Review the issue with `/sprint-logs {session-id}` and `/sprint-resume` when ready", false),
    E008("Session timeout", "The session exceeded the maximum execution time", false),
    E009("Session not found", "Check the session ID is correct", false),
    E010("Invalid session state", "The operation cannot be performed in the current session state", false),
    E011("Storage error", "An error occurred accessing storage. Try again.", true),
    E012("GitHub API error", "An error occurred communicating with GitHub. Try again.", true);

    private final String message;
    private final String hint;
    private final boolean retryable;

    ErrorCode(String message, String hint, boolean retryable) {
        this.message = message;
        this.hint = hint;
        this.retryable = retryable;
    }

    public String getMessage() {
        return message;
    }

    public String getHint() {
        return hint;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
