package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.ErrorCode;
import com.autonomous.orchestrator.exception.InvalidTransitionException;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.exception.SandboxStartException;
import com.autonomous.orchestrator.model.AdmissionResult;
import com.autonomous.orchestrator.model.CircuitBreakerResult;
import com.autonomous.orchestrator.model.LogStream;
import com.autonomous.orchestrator.model.OutputChunk;
import com.autonomous.orchestrator.model.Project;
import com.autonomous.orchestrator.model.RunRequest;
import com.autonomous.orchestrator.model.SandboxHandle;
import com.autonomous.orchestrator.model.SandboxRequest;
import com.autonomous.orchestrator.model.SandboxStatus;
import com.autonomous.orchestrator.model.Session;
import com.autonomous.orchestrator.model.SessionState;
import com.autonomous.orchestrator.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Drives sessions through their lifecycle.
 *
 * <p>Every state change goes through {@link SessionStateMachine} and is
 * persisted before the side effect that follows it, so after a crash the
 * stored state never lags behind what actually happened. Each state's entry
 * work is safe to repeat, which is what {@link #recover()} relies on.
 *
 * <p>All writes to a session happen under that session's lock. Executions run
 * on the session executor, one at a time per session; the per-target queue
 * guarantees one at a time per target.
 */
@Slf4j
@Service
public class SessionManager {

    static final int HISTORY_LIMIT = 10;
    static final int DEFAULT_LOG_LINES = 100;
    static final int MAX_LOG_LINES = 1000;

    private static final int DETECT_EVERY_CHUNK_BELOW = 64 * 1024;
    private static final Duration DETECT_INTERVAL = Duration.ofSeconds(1);

    private final StorageService storage;
    private final RegistryService registry;
    private final QueueManager queue;
    private final CircuitBreakerDetector detector;
    private final SandboxExecutor sandbox;
    private final WorkspaceService workspace;
    private final VersionControlClient vcs;
    private final NotificationService notifications;
    private final ChangeRequestComposer composer;
    private final ExecutorService executor;
    private final OrchestratorProperties properties;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, Execution> executions = new ConcurrentHashMap<>();
    private final Map<String, SandboxHandle> handles = new ConcurrentHashMap<>();
    // Sessions aborted while an execution may still be streaming; no more log appends.
    private final Set<String> closed = ConcurrentHashMap.newKeySet();

    public SessionManager(StorageService storage, RegistryService registry, QueueManager queue,
                          CircuitBreakerDetector detector, SandboxExecutor sandbox, WorkspaceService workspace,
                          VersionControlClient vcs, NotificationService notifications,
                          ChangeRequestComposer composer, ExecutorService sessionExecutor,
                          OrchestratorProperties properties) {
        this.storage = storage;
        this.registry = registry;
        this.queue = queue;
        this.detector = detector;
        this.sandbox = sandbox;
        this.workspace = workspace;
        this.vcs = vcs;
        this.notifications = notifications;
        this.composer = composer;
        this.executor = sessionExecutor;
        this.properties = properties;
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    /**
     * Creates a session and either starts it or queues it behind the
     * target's active session. Repeated requests for the same unit are
     * queued like any other, in arrival order.
     *
     * @throws OrchestratorException E001/E002/E005 for an unusable target,
     *                               E004 if the target's queue is full
     */
    public Session run(RunRequest request) {
        Project project = registry.validateForExecution(request.getTarget());

        String id = UUID.randomUUID().toString();
        String branch = request.getBranch() != null && !request.getBranch().isBlank()
            ? request.getBranch()
            : workspace.generateBranchName(project.getId(), request.getUnit(), id.substring(0, 8));

        Session session = Session.builder()
            .id(id)
            .project(project.getId())
            .unit(request.getUnit())
            .branch(branch)
            .baseBranch(project.getDefaultBranch())
            .chatContext(request.getChatContext())
            .triggeredBy(request.getTriggeredBy())
            .queuedAt(Instant.now())
            .build();
        session.getHistory().add(SessionState.QUEUED);

        // The record exists before the id enters the queue, so a promotion never finds a missing session.
        storage.saveSession(session);
        AdmissionResult admission;
        try {
            admission = queue.enqueue(project.getId(), id);
        } catch (RuntimeException e) {
            storage.deleteSession(id);
            throw e;
        }

        if (admission.isRejected()) {
            storage.deleteSession(id);
            throw new OrchestratorException(ErrorCode.E004,
                queue.pendingCount(project.getId()) + " sessions already waiting for `" + project.getId() + "`");
        }

        trace(id, "queued sprint " + request.getUnit() + " on " + branch);
        if (admission.isAdmitted()) {
            log.info("Session {} admitted on {}, starting", id, project.getId());
            launch(id);
        } else {
            log.info("Session {} queued on {} at position {}", id, project.getId(), admission.getPosition());
            notifications.queued(session, admission.getPosition(),
                queue.estimatedWaitMinutes(admission.getPosition()));
        }
        return session;
    }

    public Session status(String sessionId) {
        return require(sessionId);
    }

    /**
     * Sessions that have not reached a terminal state, most recent first.
     */
    public List<Session> activeSessions() {
        return storage.listSessions(s -> !s.isTerminal());
    }

    /**
     * Continues a paused session on the same branch and worktree. The state
     * flips to RUNNING before this returns, so a second call is rejected.
     */
    public Session resume(String sessionId) {
        Session session = withLock(sessionId, () -> {
            Session current = require(sessionId);
            if (!SessionStateMachine.canResume(current.getState())) {
                throw new OrchestratorException(ErrorCode.E010,
                    "Session is " + current.getState() + ", only PAUSED sessions can be resumed");
            }
            if (executions.containsKey(sessionId)) {
                throw new OrchestratorException(ErrorCode.E010, "Session is still shutting down, try again shortly");
            }
            SessionStateMachine.transition(current, SessionState.RUNNING);
            current.setPausedAt(null);
            current.setPauseReason(null);
            current.setPauseContext(new LinkedHashMap<>());
            persist(current, "resumed by request");
            launchLocked(sessionId);
            return current;
        });
        log.info("Session {} resumed", sessionId);
        notifications.resumed(session);
        return session;
    }

    /**
     * Ends a session from any non-terminal state. ABORTED is recorded even if
     * the sandbox refuses to stop.
     */
    public Session abort(String sessionId) {
        boolean[] inFlight = new boolean[1];
        Session session = withLock(sessionId, () -> {
            Session current = require(sessionId);
            if (!SessionStateMachine.canAbort(current.getState())) {
                throw new OrchestratorException(ErrorCode.E010,
                    "Session is already " + current.getState());
            }
            closed.add(sessionId);
            SessionStateMachine.transition(current, SessionState.ABORTED);
            current.setCompletedAt(Instant.now());
            persist(current, "aborted by request");
            inFlight[0] = executions.containsKey(sessionId);
            return current;
        });
        log.info("Session {} aborted", sessionId);

        stopSandbox(sessionId);
        notifications.aborted(session);

        // A running execution releases the slot itself once it unwinds.
        if (!inFlight[0]) {
            release(session);
        }
        return session;
    }

    public List<Project> projects() {
        return registry.listProjects();
    }

    /**
     * Most recent sessions, optionally for one target.
     */
    public List<Session> history(String target) {
        return storage.listSessions(s -> target == null || target.equals(s.getProject())).stream()
            .limit(HISTORY_LIMIT)
            .collect(Collectors.toList());
    }

    public List<String> logs(String sessionId, Integer lines, LogStream stream) {
        require(sessionId);
        int limit = lines == null || lines <= 0 ? DEFAULT_LOG_LINES : Math.min(lines, MAX_LOG_LINES);
        return storage.tailLog(sessionId, stream != null ? stream : LogStream.STDOUT, limit);
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover();
    }

    /**
     * Picks up every non-terminal session of the claimed targets from its
     * stored state. Paused sessions stay paused and queued sessions wait for
     * the slot; everything else continues where it was.
     *
     * @return number of sessions relaunched
     */
    public int recover() {
        List<Session> live = storage.listSessions(s -> !s.isTerminal() && isClaimed(s.getProject()));
        live.sort(Comparator.comparing(Session::getQueuedAt, Comparator.nullsFirst(Comparator.naturalOrder())));

        Set<String> targets = new LinkedHashSet<>();
        storage.listQueueTargets().stream().filter(this::isClaimed).forEach(targets::add);
        live.forEach(s -> targets.add(s.getProject()));

        for (String target : targets) {
            queue.repair(target, id -> storage.getSession(id).map(s -> !s.isTerminal()).orElse(false));
        }

        int relaunched = 0;
        for (Session session : live) {
            switch (session.getState()) {
                case PAUSED:
                    log.info("Recovery: session {} stays paused", session.getId());
                    break;
                case QUEUED:
                    relaunched += recoverQueued(session) ? 1 : 0;
                    break;
                default:
                    log.info("Recovery: resuming session {} from {}", session.getId(), session.getState());
                    trace(session.getId(), "recovered in state " + session.getState());
                    launch(session.getId());
                    relaunched++;
            }
        }
        log.info("Recovery finished: {} live sessions, {} relaunched", live.size(), relaunched);
        return relaunched;
    }

    private boolean recoverQueued(Session session) {
        String target = session.getProject();
        int position = queue.position(target, session.getId());
        if (position == 0) {
            log.info("Recovery: session {} holds the slot on {}, starting", session.getId(), target);
            launch(session.getId());
            return true;
        }
        if (position > 0) {
            return false;
        }

        // Saved but never made it into the queue before the crash.
        AdmissionResult admission = queue.enqueue(target, session.getId());
        if (admission.isAdmitted()) {
            launch(session.getId());
            return true;
        }
        if (admission.isRejected()) {
            failSession(session.getId(), ErrorCode.E004.getMessage() + ": lost its queue place during restart");
            release(require(session.getId()));
        }
        return false;
    }

    private boolean isClaimed(String target) {
        List<String> claimed = properties.getClaimedTargets();
        return claimed == null || claimed.isEmpty() || claimed.contains(target);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    private void launch(String sessionId) {
        withLock(sessionId, () -> {
            launchLocked(sessionId);
            return null;
        });
    }

    private void launchLocked(String sessionId) {
        if (executions.containsKey(sessionId)) {
            log.debug("Session {} already executing", sessionId);
            return;
        }
        closed.remove(sessionId);
        Execution execution = new Execution(sessionId);
        executions.put(sessionId, execution);
        executor.submit(() -> execute(execution));
    }

    private void execute(Execution execution) {
        String id = execution.sessionId;
        try {
            Session session = storage.getSession(id).orElse(null);
            if (session == null) {
                log.warn("Session {} disappeared before it could run", id);
                return;
            }
            if (session.isTerminal()) {
                return;
            }

            if (session.getState() == SessionState.QUEUED) {
                session = advance(id, SessionState.STARTING, s -> s.setStartedAt(Instant.now()));
                notifications.started(session);
            }
            if (session.getState() == SessionState.STARTING) {
                session = advance(id, SessionState.CLONING, null);
            }
            if (session.getState() == SessionState.CLONING) {
                Path worktree = prepareWorkspace(session);
                if (worktree == null) {
                    return;
                }
                session = advance(id, SessionState.RUNNING, null);
                runAgent(execution, worktree, false);
            } else if (session.getState() == SessionState.RUNNING) {
                // Resumed by request or after a restart: the previous sandbox is gone.
                Path worktree = prepareWorkspace(session);
                if (worktree != null) {
                    runAgent(execution, worktree, true);
                }
            } else if (session.getState() == SessionState.COMPLETING) {
                complete(id, storage.readLog(id, LogStream.STDOUT));
            }
        } catch (InvalidTransitionException e) {
            if (closed.contains(id)) {
                log.info("Session {} was aborted while in {}", id, e.getFrom());
            } else {
                log.error("Session {} attempted invalid transition", id, e);
            }
        } catch (OrchestratorException e) {
            log.warn("Session {} stopped: {}", id, e.getMessage());
            stopSandbox(id);
            failQuietly(id, e.getCode() + " " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Session {} execution failed", id, e);
            stopSandbox(id);
            failQuietly(id, ErrorCode.E011.getMessage() + ": " + e.getMessage());
        } finally {
            finish(execution);
        }
    }

    /**
     * Clones or refreshes the worktree, retrying setup faults. Marks the
     * session FAILED and returns null when the retries run out.
     */
    private Path prepareWorkspace(Session session) {
        OrchestratorProperties.Sandbox settings = properties.getSandbox();
        try {
            Project project = registry.requireProject(session.getProject());
            return Retries.withBackoff("prepare workspace for " + session.getId(),
                settings.getStartAttempts(), settings.getRetryDelay(),
                () -> workspace.prepare(project, session));
        } catch (OrchestratorException e) {
            failSession(session.getId(), e.getCode() + " " + e.getMessage());
            return null;
        }
    }

    private void runAgent(Execution execution, Path worktree, boolean resumed) {
        String id = execution.sessionId;
        Session session = update(id, s -> s.setAttempts(s.getAttempts() + 1));

        SandboxRequest request = SandboxRequest.builder()
            .sessionId(id)
            .project(session.getProject())
            .unit(session.getUnit())
            .branch(session.getBranch())
            .worktree(worktree)
            .resumed(resumed)
            .build();

        OrchestratorProperties.Sandbox settings = properties.getSandbox();
        SandboxHandle handle;
        try {
            handle = Retries.withBackoff("start sandbox for " + id,
                settings.getStartAttempts(), settings.getRetryDelay(), () -> sandbox.start(request));
        } catch (SandboxStartException e) {
            failSession(id, "Sandbox failed to start: " + e.getMessage());
            return;
        }
        handles.put(id, handle);
        if (closed.contains(id)) {
            handles.remove(id);
            stopQuietly(handle);
            return;
        }
        trace(id, "sandbox " + handle.getId() + " started (attempt " + session.getAttempts() + ")");

        long priorRuntime = session.getMetrics().getRuntimeMillis();
        Instant attemptStart = Instant.now();
        Instant lastCheck = Instant.EPOCH;
        // Only this attempt's output is classified, so a resumed session does not re-trip on what paused it.
        StringBuilder transcript = new StringBuilder();

        try (Stream<OutputChunk> output = sandbox.streamOutput(handle)) {
            Iterator<OutputChunk> chunks = output.iterator();
            while (chunks.hasNext()) {
                OutputChunk chunk = chunks.next();
                if (!appendChunk(id, chunk)) {
                    return;
                }
                transcript.append(chunk.getText()).append('\n');

                Instant now = Instant.now();
                if (transcript.length() < DETECT_EVERY_CHUNK_BELOW
                        || Duration.between(lastCheck, now).compareTo(DETECT_INTERVAL) >= 0) {
                    lastCheck = now;
                    CircuitBreakerResult result = detector.detect(transcript.toString(),
                        elapsed(priorRuntime, attemptStart));
                    if (result.isTripped()) {
                        pause(execution, handle, result, runtime(priorRuntime, attemptStart));
                        return;
                    }
                }
            }
        }

        if (closed.contains(id)) {
            return;
        }

        CircuitBreakerResult result = detector.detect(transcript.toString(), elapsed(priorRuntime, attemptStart));
        if (result.isTripped()) {
            pause(execution, handle, result, runtime(priorRuntime, attemptStart));
            return;
        }

        SandboxStatus status = sandbox.status(handle);
        handles.remove(id);
        stopQuietly(handle);
        long runtime = runtime(priorRuntime, attemptStart);
        int exitCode = status.getExitCode() != null ? status.getExitCode() : -1;
        String output = transcript.toString();

        if (exitCode == 0 || detector.isSuccessfulCompletion(output)) {
            advance(id, SessionState.COMPLETING, s -> {
                s.getMetrics().setRuntimeMillis(runtime);
                composer.applyTestResults(s.getMetrics(), output);
            });
            complete(id, output);
        } else {
            failSession(id, "Agent exited with code " + exitCode, runtime);
        }
    }

    private void pause(Execution execution, SandboxHandle handle, CircuitBreakerResult result, long runtime) {
        String id = execution.sessionId;
        log.info("Circuit breaker tripped for session {}: {} ({})", id, result.getType(), result.getReason());
        handles.remove(id);
        stopQuietly(handle);

        Session session = withLock(id, () -> {
            Session current = require(id);
            SessionStateMachine.transition(current, SessionState.PAUSED);
            current.setPausedAt(Instant.now());
            current.setPauseReason(result.getReason());
            Map<String, Object> context = new LinkedHashMap<>(result.getContext());
            context.put("type", result.getType().name());
            current.setPauseContext(context);
            current.getMetrics().setRuntimeMillis(runtime);
            persist(current, "circuit breaker: " + result.getReason());
            // Paused sessions have no execution; resume starts a new one.
            executions.remove(id, execution);
            return current;
        });
        notifications.paused(session, result);
    }

    private void complete(String id, String output) {
        Session session = require(id);
        Project project = registry.requireProject(session.getProject());
        String base = session.getBaseBranch() != null ? session.getBaseBranch() : project.getDefaultBranch();

        String prUrl = session.getPrUrl();
        if (prUrl == null) {
            Path worktree = workspace.worktreePath(project.getId());
            session = update(id, s -> workspace.diffMetrics(worktree, base, s.getMetrics()));
            Session snapshot = session;
            OrchestratorProperties.Sandbox settings = properties.getSandbox();
            try {
                prUrl = Retries.withBackoff("open change request for " + id,
                    settings.getVcsAttempts(), settings.getRetryDelay(),
                    () -> vcs.openDraftChangeRequest(project, worktree, snapshot.getBranch(), base,
                        composer.title(snapshot, project), composer.description(snapshot, project, output)));
            } catch (OrchestratorException e) {
                failSession(id, e.getCode() + " " + e.getMessage());
                return;
            }
        }

        String url = prUrl;
        session = advance(id, SessionState.COMPLETED, s -> {
            s.setPrUrl(url);
            s.setCompletedAt(Instant.now());
        });
        log.info("Session {} completed: {}", id, url);
        notifications.completed(session);
    }

    /**
     * Unwinds an execution. Whoever finishes last after a terminal state
     * releases the target slot: the execution here, or {@link #abort} when
     * no execution was running.
     */
    private void finish(Execution execution) {
        String id = execution.sessionId;
        boolean[] terminal = new boolean[1];
        Session[] last = new Session[1];
        withLock(id, () -> {
            executions.remove(id, execution);
            last[0] = storage.getSession(id).orElse(null);
            terminal[0] = last[0] != null && last[0].isTerminal();
            return null;
        });
        if (terminal[0]) {
            release(last[0]);
        }
    }

    private void release(Session session) {
        closed.remove(session.getId());
        handles.remove(session.getId());
        locks.remove(session.getId());
        queue.onSessionTerminal(session.getProject(), session.getId()).ifPresent(next -> {
            log.info("Promoting session {} on {}", next, session.getProject());
            launch(next);
        });
    }

    // ------------------------------------------------------------------
    // State and persistence helpers
    // ------------------------------------------------------------------

    private void failSession(String id, String error) {
        failSession(id, error, -1);
    }

    private void failSession(String id, String error, long runtime) {
        Session session = advance(id, SessionState.FAILED, s -> {
            s.setError(error);
            s.setCompletedAt(Instant.now());
            if (runtime >= 0) {
                s.getMetrics().setRuntimeMillis(runtime);
            }
        });
        log.warn("Session {} failed: {}", id, error);
        notifications.failed(session);
    }

    private void failQuietly(String id, String error) {
        try {
            Session current = require(id);
            if (!current.isTerminal()) {
                failSession(id, error);
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure of session {}: {}", id, e.getMessage());
        }
    }

    /**
     * Reloads the session, applies the transition and any field changes, and
     * persists it, all under the session lock.
     */
    private Session advance(String id, SessionState to, Consumer<Session> changes) {
        return withLock(id, () -> {
            Session session = require(id);
            SessionState from = session.getState();
            SessionStateMachine.transition(session, to);
            if (changes != null) {
                changes.accept(session);
            }
            persist(session, from + " -> " + to);
            log.info("Session {} on {}: {} -> {}", id, session.getProject(), from, to);
            return session;
        });
    }

    /**
     * Field changes without a state change. Never applied to a finished session.
     */
    private Session update(String id, Consumer<Session> changes) {
        return withLock(id, () -> {
            Session session = require(id);
            if (session.isTerminal()) {
                throw new InvalidTransitionException(session.getState(), session.getState());
            }
            changes.accept(session);
            storage.saveSession(session);
            return session;
        });
    }

    private void persist(Session session, String note) {
        trace(session.getId(), note);
        storage.saveSession(session);
    }

    private boolean appendChunk(String id, OutputChunk chunk) {
        return withLock(id, () -> {
            if (closed.contains(id)) {
                return false;
            }
            storage.appendLog(id, chunk.getStream(), chunk.getText() + "\n");
            return true;
        });
    }

    private void trace(String id, String message) {
        storage.appendLog(id, LogStream.ORCHESTRATOR, Instant.now() + " " + message + "\n");
    }

    private Session require(String id) {
        return storage.getSession(id)
            .orElseThrow(() -> new OrchestratorException(ErrorCode.E009, "No session `" + id + "`"));
    }

    private void stopSandbox(String sessionId) {
        SandboxHandle handle = handles.remove(sessionId);
        if (handle != null) {
            stopQuietly(handle);
        }
    }

    private void stopQuietly(SandboxHandle handle) {
        try {
            sandbox.stop(handle);
        } catch (RuntimeException e) {
            log.warn("Could not stop sandbox {} for session {}: {}",
                handle.getId(), handle.getSessionId(), e.getMessage());
        }
    }

    private static Duration elapsed(long priorRuntime, Instant attemptStart) {
        return Duration.ofMillis(priorRuntime).plus(Duration.between(attemptStart, Instant.now()));
    }

    private static long runtime(long priorRuntime, Instant attemptStart) {
        return elapsed(priorRuntime, attemptStart).toMillis();
    }

    private <T> T withLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(sessionId, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * One run of the execution loop for a session. Identity matters: a
     * finished execution must not unregister the one that replaced it.
     */
    private static final class Execution {
        final String sessionId;

        Execution(String sessionId) {
            this.sessionId = sessionId;
        }
    }
}
