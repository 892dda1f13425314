package com.autonomous.orchestrator.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

public class InMemoryObjectStore implements ObjectStore {

    private final Map<String, byte[]> objects = new ConcurrentSkipListMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        byte[] value = objects.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void put(String key, byte[] value) {
        objects.put(key, value.clone());
    }

    @Override
    public void delete(String key) {
        objects.remove(key);
    }

    @Override
    public List<String> list(String prefix) {
        return objects.keySet().stream()
            .filter(key -> key.startsWith(prefix))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void append(String key, byte[] value) {
        ObjectStore.super.append(key, value);
    }
}
