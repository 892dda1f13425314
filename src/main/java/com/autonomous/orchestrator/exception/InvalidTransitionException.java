package com.autonomous.orchestrator.exception;

import com.autonomous.orchestrator.model.SessionState;
import lombok.Getter;

/**
 * Raised when code asks for a transition the state machine does not allow.
 * This is a bug in the caller, never a user error.
 */
@Getter
public class InvalidTransitionException extends IllegalStateException {

    private final SessionState from;
    private final SessionState to;

    public InvalidTransitionException(SessionState from, SessionState to) {
        super("Invalid transition from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }
}
