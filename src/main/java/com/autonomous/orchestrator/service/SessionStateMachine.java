package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.InvalidTransitionException;
import com.autonomous.orchestrator.model.Session;
import com.autonomous.orchestrator.model.SessionState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.autonomous.orchestrator.model.SessionState.*;

/**
 * Legal session lifecycle transitions.
 *
 * <pre>
 *   QUEUED -> STARTING -> CLONING -> RUNNING -> COMPLETING -> COMPLETED
 *                                      |  ^          |
 *                                      v  |          v
 *                                     PAUSED       FAILED
 * </pre>
 *
 * ABORTED is reachable from every non-terminal state. COMPLETED, FAILED and
 * ABORTED have no outgoing transitions.
 */
public final class SessionStateMachine {

    private static final Map<SessionState, Set<SessionState>> TRANSITIONS = new EnumMap<>(SessionState.class);

    static {
        TRANSITIONS.put(QUEUED, EnumSet.of(STARTING, ABORTED));
        TRANSITIONS.put(STARTING, EnumSet.of(CLONING, FAILED, ABORTED));
        TRANSITIONS.put(CLONING, EnumSet.of(RUNNING, FAILED, ABORTED));
        TRANSITIONS.put(RUNNING, EnumSet.of(PAUSED, COMPLETING, FAILED, ABORTED));
        TRANSITIONS.put(PAUSED, EnumSet.of(RUNNING, ABORTED));
        TRANSITIONS.put(COMPLETING, EnumSet.of(COMPLETED, FAILED, ABORTED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(SessionState.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(SessionState.class));
        TRANSITIONS.put(ABORTED, EnumSet.noneOf(SessionState.class));
    }

    private SessionStateMachine() {
    }

    public static boolean canTransition(SessionState from, SessionState to) {
        return from != null && to != null && TRANSITIONS.get(from).contains(to);
    }

    public static Set<SessionState> validTransitions(SessionState from) {
        return Collections.unmodifiableSet(EnumSet.copyOf(TRANSITIONS.get(from)));
    }

    /**
     * Moves the session to {@code to} and records it in the session history.
     * The caller persists the session before doing anything else.
     *
     * @throws InvalidTransitionException if the transition is not allowed
     */
    public static Session transition(Session session, SessionState to) {
        SessionState from = session.getState();
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(from, to);
        }
        session.setState(to);
        session.getHistory().add(to);
        return session;
    }

    public static boolean isTerminal(SessionState state) {
        return state.isTerminal();
    }

    public static boolean canResume(SessionState state) {
        return state == PAUSED;
    }

    public static boolean canAbort(SessionState state) {
        return canTransition(state, ABORTED);
    }

    /**
     * True when {@code states}, read in order, is a walk the machine allows.
     */
    public static boolean isValidWalk(List<SessionState> states) {
        for (int i = 1; i < states.size(); i++) {
            if (!canTransition(states.get(i - 1), states.get(i))) {
                return false;
            }
        }
        return true;
    }

    public static List<SessionState> happyPath() {
        return List.of(QUEUED, STARTING, CLONING, RUNNING, COMPLETING, COMPLETED);
    }
}
