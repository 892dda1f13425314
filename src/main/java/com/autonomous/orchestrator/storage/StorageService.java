package com.autonomous.orchestrator.storage;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.StorageException;
import com.autonomous.orchestrator.model.LogStream;
import com.autonomous.orchestrator.model.ProjectRegistry;
import com.autonomous.orchestrator.model.QueueState;
import com.autonomous.orchestrator.model.Session;
import com.autonomous.orchestrator.service.Retries;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Typed access to sessions, logs, queues and the registry on top of an
 * {@link ObjectStore}. Every store call is retried with backoff; when the
 * retries run out the failure propagates so callers cannot advance state
 * they failed to record.
 *
 * Layout:
 * <pre>
 *   registry.json
 *   queues/{target}.json
 *   sessions/{id}/session.json
 *   sessions/{id}/logs/{stream}.log
 * </pre>
 */
@Slf4j
@Service
public class StorageService {

    static final String REGISTRY_KEY = "registry.json";
    static final String QUEUE_PREFIX = "queues/";
    static final String SESSION_PREFIX = "sessions/";
    private static final String SESSION_FILE = "/session.json";

    private final ObjectStore store;
    private final ObjectMapper mapper;
    private final int attempts;
    private final Duration backoff;

    public StorageService(ObjectStore store, OrchestratorProperties properties) {
        this.store = store;
        this.attempts = properties.getStorage().getRetryAttempts();
        this.backoff = properties.getStorage().getRetryBackoff();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    public void saveSession(Session session) {
        writeJson(sessionKey(session.getId()), session);
    }

    public Optional<Session> getSession(String id) {
        return readJson(sessionKey(id), Session.class);
    }

    /**
     * All sessions matching the filter, most recently queued first.
     */
    public List<Session> listSessions(Predicate<Session> filter) {
        List<String> keys = retry("list sessions", () -> store.list(SESSION_PREFIX));
        List<Session> sessions = new ArrayList<>();
        for (String key : keys) {
            if (!key.endsWith(SESSION_FILE)) {
                continue;
            }
            readJson(key, Session.class)
                .filter(filter)
                .ifPresent(sessions::add);
        }
        sessions.sort(Comparator.comparing(
            (Session s) -> s.getQueuedAt() != null ? s.getQueuedAt() : Instant.EPOCH).reversed());
        return sessions;
    }

    public List<Session> listSessions() {
        return listSessions(s -> true);
    }

    /**
     * Removes a session record and all of its logs. Only used by retention cleanup.
     */
    public void deleteSession(String id) {
        String prefix = SESSION_PREFIX + id + "/";
        List<String> keys = retry("list " + prefix, () -> store.list(prefix));
        for (String key : keys) {
            retry("delete " + key, () -> {
                store.delete(key);
                return null;
            });
        }
    }

    // ------------------------------------------------------------------
    // Logs
    // ------------------------------------------------------------------

    public void appendLog(String sessionId, LogStream stream, String content) {
        if (content == null || content.isEmpty()) {
            return;
        }
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        String key = logKey(sessionId, stream);
        retry("append " + key, () -> {
            store.append(key, bytes);
            return null;
        });
    }

    public String readLog(String sessionId, LogStream stream) {
        String key = logKey(sessionId, stream);
        return retry("read " + key, () -> store.getString(key)).orElse("");
    }

    /**
     * Last {@code lines} lines of a log. A trailing newline does not count as an extra line.
     */
    public List<String> tailLog(String sessionId, LogStream stream, int lines) {
        String content = readLog(sessionId, stream);
        if (content.isEmpty()) {
            return List.of();
        }
        List<String> all = Arrays.asList(content.split("\n", -1));
        if (content.endsWith("\n")) {
            all = all.subList(0, all.size() - 1);
        }
        int from = Math.max(0, all.size() - lines);
        return new ArrayList<>(all.subList(from, all.size()));
    }

    public int countLogLines(String sessionId, LogStream stream) {
        String content = readLog(sessionId, stream);
        if (content.isEmpty()) {
            return 0;
        }
        int count = (int) content.chars().filter(c -> c == '\n').count();
        return content.endsWith("\n") ? count : count + 1;
    }

    // ------------------------------------------------------------------
    // Registry
    // ------------------------------------------------------------------

    public ProjectRegistry getRegistry() {
        return readJson(REGISTRY_KEY, ProjectRegistry.class).orElseGet(ProjectRegistry::new);
    }

    public void saveRegistry(ProjectRegistry registry) {
        writeJson(REGISTRY_KEY, registry);
    }

    // ------------------------------------------------------------------
    // Queues
    // ------------------------------------------------------------------

    public QueueState getQueue(String target) {
        return readJson(queueKey(target), QueueState.class).orElseGet(() -> new QueueState(target));
    }

    public void saveQueue(QueueState queue) {
        queue.setUpdatedAt(Instant.now());
        writeJson(queueKey(queue.getTarget()), queue);
    }

    public List<String> listQueueTargets() {
        return retry("list queues", () -> store.list(QUEUE_PREFIX)).stream()
            .filter(key -> key.endsWith(".json"))
            .map(key -> key.substring(QUEUE_PREFIX.length(), key.length() - ".json".length()))
            .collect(Collectors.toList());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> Optional<T> readJson(String key, Class<T> type) {
        Optional<byte[]> bytes = retry("read " + key, () -> store.get(key));
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(bytes.get(), type));
        } catch (IOException e) {
            throw new StorageException("Corrupt object at " + key, e);
        }
    }

    private void writeJson(String key, Object value) {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new StorageException("Cannot serialize " + key, e);
        }
        retry("write " + key, () -> {
            store.put(key, bytes);
            return null;
        });
    }

    private <T> T retry(String operation, Supplier<T> action) {
        return Retries.withBackoff(operation, attempts, backoff, action);
    }

    private static String sessionKey(String id) {
        return SESSION_PREFIX + id + SESSION_FILE;
    }

    private static String logKey(String id, LogStream stream) {
        return SESSION_PREFIX + id + "/logs/" + stream.getFileName() + ".log";
    }

    private static String queueKey(String target) {
        return QUEUE_PREFIX + target + ".json";
    }
}
