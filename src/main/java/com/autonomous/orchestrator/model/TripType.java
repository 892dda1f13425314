package com.autonomous.orchestrator.model;

/**
 * Why the circuit breaker tripped. Declared in detection priority order.
 */
public enum TripType {
    SAME_ISSUE,
    NO_PROGRESS,
    TIMEOUT,
    MAX_CYCLES,
    GENERIC
}
