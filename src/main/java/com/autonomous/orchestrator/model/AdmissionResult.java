package com.autonomous.orchestrator.model;

import lombok.Value;

/**
 * Outcome of asking the queue for a slot on a target. A full queue is an
 * ordinary outcome, not an exception.
 */
@Value
public class AdmissionResult {

    public enum Outcome { ADMITTED, QUEUED, REJECTED_QUEUE_FULL }

    Outcome outcome;
    int position;

    public static AdmissionResult admitted() {
        return new AdmissionResult(Outcome.ADMITTED, 0);
    }

    public static AdmissionResult queued(int position) {
        return new AdmissionResult(Outcome.QUEUED, position);
    }

    public static AdmissionResult rejected() {
        return new AdmissionResult(Outcome.REJECTED_QUEUE_FULL, -1);
    }

    public boolean isAdmitted() {
        return outcome == Outcome.ADMITTED;
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECTED_QUEUE_FULL;
    }
}
