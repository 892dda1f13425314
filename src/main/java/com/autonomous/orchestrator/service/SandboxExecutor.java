package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.OutputChunk;
import com.autonomous.orchestrator.model.SandboxHandle;
import com.autonomous.orchestrator.model.SandboxRequest;
import com.autonomous.orchestrator.model.SandboxStatus;

import java.util.stream.Stream;

/**
 * Runs the coding agent for a session and carries its output back. The
 * executor never interprets the output.
 */
public interface SandboxExecutor {

    /**
     * @throws com.autonomous.orchestrator.exception.SandboxStartException if the sandbox could not be started
     */
    SandboxHandle start(SandboxRequest request);

    /**
     * Output in emission order. Blocks while the agent is quiet and ends once
     * the process has exited and all of its output was delivered.
     */
    Stream<OutputChunk> streamOutput(SandboxHandle handle);

    SandboxStatus status(SandboxHandle handle);

    /**
     * Terminates the sandbox. Stopping one that already ended is a no-op.
     */
    void stop(SandboxHandle handle);
}
