package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.InvalidTransitionException;
import com.autonomous.orchestrator.exception.OrchestratorException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with linear backoff for transient failures.
 * Non-retryable orchestrator errors and invalid transitions are rethrown at once.
 */
@Slf4j
public final class Retries {

    private Retries() {
    }

    public static <T> T withBackoff(String operation, int maxAttempts, Duration backoff, Supplier<T> action) {
        int attempts = Math.max(1, maxAttempts);
        RuntimeException last = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return action.get();
            } catch (InvalidTransitionException e) {
                throw e;
            } catch (OrchestratorException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
            } catch (RuntimeException e) {
                last = e;
            }

            if (attempt < attempts) {
                log.warn("{} failed (attempt {}/{}), retrying: {}", operation, attempt, attempts, last.getMessage());
                sleep(backoff.multipliedBy(attempt));
            }
        }

        log.error("{} failed after {} attempts", operation, attempts);
        throw last;
    }

    public static void runWithBackoff(String operation, int maxAttempts, Duration backoff, Runnable action) {
        withBackoff(operation, maxAttempts, backoff, () -> {
            action.run();
            return null;
        });
    }

    private static void sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry", e);
        }
    }
}
