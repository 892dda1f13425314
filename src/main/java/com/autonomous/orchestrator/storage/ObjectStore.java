package com.autonomous.orchestrator.storage;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Durable key-value store over opaque blobs. There are no transactions;
 * callers that need atomicity keep composite state under a single key.
 *
 * Every method may throw {@link com.autonomous.orchestrator.exception.StorageException}
 * on a transient failure. Implementations never return stale data instead of failing.
 */
public interface ObjectStore {

    Optional<byte[]> get(String key);

    void put(String key, byte[] value);

    void delete(String key);

    List<String> list(String prefix);

    /**
     * Appends to the blob at {@code key}, creating it when absent. A failed
     * append leaves the blob unchanged, so callers may retry it. The default
     * is a read-modify-write, which is only safe for a single writer per key.
     */
    default void append(String key, byte[] value) {
        byte[] existing = get(key).orElse(new byte[0]);
        byte[] combined = new byte[existing.length + value.length];
        System.arraycopy(existing, 0, combined, 0, existing.length);
        System.arraycopy(value, 0, combined, existing.length, value.length);
        put(key, combined);
    }

    default Optional<String> getString(String key) {
        return get(key).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }
}
