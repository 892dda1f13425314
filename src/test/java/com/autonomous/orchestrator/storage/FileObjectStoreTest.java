package com.autonomous.orchestrator.storage;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.StorageException;
import com.autonomous.orchestrator.model.LogStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileObjectStoreTest {

    @TempDir
    Path tempDir;

    private FileObjectStore store;

    @BeforeEach
    void setUp() {
        store = new FileObjectStore(tempDir);
    }

    @Test
    void shouldWriteAndReadBack() {
        store.put("sessions/a/session.json", bytes("{\"id\":\"a\"}"));

        assertEquals("{\"id\":\"a\"}", store.getString("sessions/a/session.json").orElseThrow());
        assertTrue(Files.exists(tempDir.resolve("sessions/a/session.json")));
    }

    @Test
    void missingKeyShouldBeAbsent() {
        assertTrue(store.get("nope.json").isEmpty());
    }

    @Test
    void overwriteShouldReplaceContentAndLeaveNoTempFiles() throws Exception {
        store.put("registry.json", bytes("one"));
        store.put("registry.json", bytes("two"));

        assertEquals("two", store.getString("registry.json").orElseThrow());
        try (var files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void shouldListByPrefixInKeyOrder() {
        store.put("queues/b.json", bytes("{}"));
        store.put("queues/a.json", bytes("{}"));
        store.put("sessions/x/session.json", bytes("{}"));

        assertEquals(List.of("queues/a.json", "queues/b.json"), store.list("queues/"));
        assertEquals(3, store.list("").size());
    }

    @Test
    void appendShouldAccumulate() {
        store.append("sessions/a/logs/stdout.log", bytes("line 1\n"));
        store.append("sessions/a/logs/stdout.log", bytes("line 2\n"));

        assertEquals("line 1\nline 2\n", store.getString("sessions/a/logs/stdout.log").orElseThrow());
    }

    @Test
    void failedAppendShouldLeavePreviousContentIntact() {
        FlakyFileObjectStore flaky = new FlakyFileObjectStore(tempDir, 0);
        flaky.append("sessions/a/logs/stdout.log", bytes("line 1\n"));
        flaky.failures = 1;

        assertThrows(StorageException.class, () -> flaky.append("sessions/a/logs/stdout.log", bytes("line 2\n")));

        assertEquals("line 1\n", flaky.getString("sessions/a/logs/stdout.log").orElseThrow());
    }

    @Test
    void retriedLogAppendShouldNotDuplicateContent() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getStorage().setRetryAttempts(3);
        properties.getStorage().setRetryBackoff(Duration.ZERO);
        FlakyFileObjectStore flaky = new FlakyFileObjectStore(tempDir, 0);
        StorageService storage = new StorageService(flaky, properties);
        storage.appendLog("a", LogStream.STDOUT, "line 1\n");
        flaky.failures = 2;

        storage.appendLog("a", LogStream.STDOUT, "line 2\n");

        assertEquals("line 1\nline 2\n", storage.readLog("a", LogStream.STDOUT));
        assertEquals(0, flaky.failures);
    }

    @Test
    void deleteShouldRemoveKeyAndTolerateMissing() {
        store.put("registry.json", bytes("x"));

        store.delete("registry.json");
        store.delete("registry.json");

        assertTrue(store.get("registry.json").isEmpty());
    }

    @Test
    void shouldRejectKeysEscapingTheRoot() {
        assertThrows(RuntimeException.class, () -> store.put("../outside.json", bytes("x")));
        assertThrows(RuntimeException.class, () -> store.get("/etc/passwd"));
    }

    @Test
    void dataShouldSurviveANewInstance() {
        store.put("registry.json", bytes("persisted"));

        FileObjectStore reopened = new FileObjectStore(tempDir);

        assertEquals("persisted", reopened.getString("registry.json").orElseThrow());
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    // Writes half of each chunk and then fails, while failures remain.
    private static class FlakyFileObjectStore extends FileObjectStore {
        int failures;

        FlakyFileObjectStore(Path root, int failures) {
            super(root);
            this.failures = failures;
        }

        @Override
        protected void write(FileChannel channel, ByteBuffer buffer) throws IOException {
            if (failures > 0) {
                failures--;
                ByteBuffer half = buffer.duplicate();
                half.limit(buffer.position() + buffer.remaining() / 2);
                channel.write(half);
                throw new IOException("device not ready");
            }
            super.write(channel, buffer);
        }
    }
}
