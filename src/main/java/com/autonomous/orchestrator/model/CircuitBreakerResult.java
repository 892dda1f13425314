package com.autonomous.orchestrator.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classification of an execution log. Computed on demand, never stored as
 * its own record.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CircuitBreakerResult {

    private static final CircuitBreakerResult NOT_TRIPPED =
        new CircuitBreakerResult(false, null, null, Collections.emptyMap());

    boolean tripped;
    TripType type;
    String reason;
    Map<String, Object> context;

    public static CircuitBreakerResult notTripped() {
        return NOT_TRIPPED;
    }

    public static CircuitBreakerResult tripped(TripType type, String reason, Map<String, Object> context) {
        return new CircuitBreakerResult(true, type, reason,
            Collections.unmodifiableMap(new LinkedHashMap<>(context)));
    }

    public String repeatedIssue() {
        Object issue = context.get("repeatedIssue");
        return issue != null ? issue.toString() : null;
    }
}
