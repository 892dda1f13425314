package com.autonomous.orchestrator.exception;

/**
 * The sandbox could not be started at all. Distinct from the agent process
 * failing after it started, which is run content for the circuit breaker.
 */
public class SandboxStartException extends RuntimeException {

    public SandboxStartException(String message) {
        super(message);
    }

    public SandboxStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
