package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.SandboxStartException;
import com.autonomous.orchestrator.model.LogStream;
import com.autonomous.orchestrator.model.OutputChunk;
import com.autonomous.orchestrator.model.SandboxHandle;
import com.autonomous.orchestrator.model.SandboxRequest;
import com.autonomous.orchestrator.model.SandboxStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Runs Claude Code as a local subprocess inside the session worktree.
 *
 * stdout and stderr are read on their own threads into a single queue, so
 * the consumer sees both streams line by line in arrival order.
 */
@Slf4j
@Service
public class ProcessSandboxExecutor implements SandboxExecutor {

    private static final OutputChunk END = new OutputChunk(LogStream.ORCHESTRATOR, "");

    @Value("${claude.code.path:claude}")
    private String claudeCodePath;

    private final Duration stopTimeout;
    private final Map<String, RunningSandbox> sandboxes = new ConcurrentHashMap<>();
    private final ExecutorService readers = Executors.newCachedThreadPool();

    public ProcessSandboxExecutor(OrchestratorProperties properties) {
        this.stopTimeout = properties.getSandbox().getStopTimeout();
    }

    @Override
    public SandboxHandle start(SandboxRequest request) {
        if (request.getWorktree() == null || !Files.isDirectory(request.getWorktree())) {
            throw new SandboxStartException("Worktree missing for session " + request.getSessionId());
        }

        ProcessBuilder pb = new ProcessBuilder(buildCommand(request));
        pb.directory(request.getWorktree().toFile());
        Map<String, String> env = pb.environment();
        env.put("SESSION_ID", request.getSessionId());
        env.put("PROJECT_NAME", request.getProject());
        env.put("SPRINT_NUMBER", request.getUnit());
        env.put("CI", "true");
        env.put("TERM", "dumb");

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SandboxStartException("Could not launch " + claudeCodePath + ": " + e.getMessage(), e);
        }

        SandboxHandle handle = new SandboxHandle(UUID.randomUUID().toString(), request.getSessionId(), Instant.now());
        RunningSandbox sandbox = new RunningSandbox(process);
        sandboxes.put(handle.getId(), sandbox);

        readers.submit(() -> pump(process.getInputStream(), LogStream.STDOUT, sandbox));
        readers.submit(() -> pump(process.getErrorStream(), LogStream.STDERR, sandbox));

        log.info("Started agent for session {} (pid {}, resumed={})",
            request.getSessionId(), process.pid(), request.isResumed());
        return handle;
    }

    @Override
    public Stream<OutputChunk> streamOutput(SandboxHandle handle) {
        RunningSandbox sandbox = sandboxes.get(handle.getId());
        if (sandbox == null) {
            return Stream.empty();
        }
        Spliterator<OutputChunk> spliterator =
            new Spliterators.AbstractSpliterator<OutputChunk>(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
                @Override
                public boolean tryAdvance(Consumer<? super OutputChunk> action) {
                    try {
                        OutputChunk chunk = sandbox.chunks.take();
                        if (chunk == END) {
                            sandbox.chunks.offer(END);
                            return false;
                        }
                        action.accept(chunk);
                        return true;
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                }
            };
        return StreamSupport.stream(spliterator, false);
    }

    @Override
    public SandboxStatus status(SandboxHandle handle) {
        RunningSandbox sandbox = sandboxes.get(handle.getId());
        if (sandbox == null) {
            return SandboxStatus.exited(-1);
        }
        Process process = sandbox.process;
        if (process.isAlive()) {
            return SandboxStatus.running();
        }
        return SandboxStatus.exited(process.exitValue());
    }

    @Override
    public void stop(SandboxHandle handle) {
        RunningSandbox sandbox = sandboxes.remove(handle.getId());
        if (sandbox == null) {
            return;
        }
        Process process = sandbox.process;
        if (!process.isAlive()) {
            return;
        }
        process.destroy();
        try {
            if (!process.waitFor(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Agent for session {} ignored SIGTERM, killing", handle.getSessionId());
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        log.info("Stopped agent for session {}", handle.getSessionId());
    }

    @PreDestroy
    public void shutdown() {
        sandboxes.values().forEach(s -> s.process.destroyForcibly());
        readers.shutdownNow();
    }

    List<String> buildCommand(SandboxRequest request) {
        List<String> command = new ArrayList<>();
        command.add(claudeCodePath);
        command.add("--append-system-prompt");
        command.add(buildSystemPrompt(request));
        command.add("-p");
        command.add("/run sprint-" + request.getUnit());
        command.add("--permission-mode");
        command.add("acceptEdits");
        return command;
    }

    String buildSystemPrompt(SandboxRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are running in autonomous sprint mode.\n\n");
        prompt.append("Session ID: ").append(request.getSessionId()).append("\n");
        prompt.append("Project: ").append(request.getProject()).append("\n");
        prompt.append("Sprint: ").append(request.getUnit()).append("\n");
        prompt.append("Branch: ").append(request.getBranch()).append("\n\n");
        prompt.append("Rules:\n");
        prompt.append("1. Do not commit or push; the orchestrator collects the diff and opens a draft PR\n");
        prompt.append("2. Repeated failures pause the session for human review\n");
        prompt.append("3. Complete the sprint tasks as defined in sprint.md\n");
        prompt.append("4. Record progress and decisions in NOTES.md\n");
        prompt.append("5. Do not use interactive commands, this is a headless environment\n");
        if (request.isResumed()) {
            prompt.append("\nThis session was paused and resumed. Read NOTES.md and continue where it stopped.\n");
        }
        return prompt.toString();
    }

    private void pump(InputStream input, LogStream stream, RunningSandbox sandbox) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                sandbox.chunks.add(new OutputChunk(stream, line));
            }
        } catch (IOException e) {
            log.debug("{} reader closed: {}", stream.getFileName(), e.getMessage());
        } finally {
            if (sandbox.openStreams.decrementAndGet() == 0) {
                waitForExit(sandbox.process);
                sandbox.chunks.add(END);
            }
        }
    }

    private static void waitForExit(Process process) {
        try {
            process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class RunningSandbox {
        final Process process;
        final BlockingQueue<OutputChunk> chunks = new LinkedBlockingQueue<>();
        final AtomicInteger openStreams = new AtomicInteger(2);

        RunningSandbox(Process process) {
            this.process = process;
        }
    }
}
