package com.autonomous.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs short-lived external commands (git, gh) and captures their output.
 */
@Slf4j
@Component
public class CommandRunner {

    private static final Duration READER_GRACE = Duration.ofSeconds(5);

    public Result run(Path workingDir, Duration timeout, String... command) {
        return run(workingDir, timeout, Arrays.asList(command));
    }

    /**
     * Output is drained on its own thread so a command that hangs without
     * closing its output is still killed once {@code timeout} passes.
     */
    public Result run(Path workingDir, Duration timeout, List<String> command) {
        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            if (workingDir != null) {
                pb.directory(workingDir.toFile());
            }
            pb.redirectErrorStream(true);
            process = pb.start();
        } catch (IOException e) {
            log.warn("Could not run {}: {}", String.join(" ", command), e.getMessage());
            return new Result(-1, e.getMessage());
        }

        StringBuffer output = new StringBuffer();
        Thread reader = new Thread(() -> drain(process, output, command.get(0)), command.get(0) + "-output");
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                reader.join(READER_GRACE.toMillis());
                log.warn("{} timed out after {}s", command.get(0), timeout.toSeconds());
                return new Result(-1, output + "timed out after " + timeout.toSeconds() + "s\n");
            }
            reader.join(READER_GRACE.toMillis());
            return new Result(process.exitValue(), output.toString());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new Result(-1, "interrupted");
        }
    }

    private void drain(Process process, StringBuffer output, String name) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        } catch (IOException e) {
            // The stream closes under us when a timed-out process is killed.
            log.debug("Stopped reading output of {}: {}", name, e.getMessage());
        }
    }

    public static final class Result {
        private final int exitCode;
        private final String output;

        public Result(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output == null ? "" : output;
        }

        public int getExitCode() {
            return exitCode;
        }

        public String getOutput() {
            return output;
        }

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
