package com.autonomous.orchestrator.storage;

import com.autonomous.orchestrator.exception.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.*;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory-backed object store. Each key maps to a file below the root;
 * writes go to a temp file first and are moved into place.
 */
@Slf4j
public class FileObjectStore implements ObjectStore {

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;

    public FileObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage root " + this.root, e);
        }
        log.info("File object store at {}", this.root);
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path file = resolve(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read " + key, e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        Path file = resolve(key);
        Path temp = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            Files.createDirectories(file.getParent());
            Files.write(temp, value);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new StorageException("Failed to write " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + key, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(Files::isRegularFile)
                .map(path -> root.relativize(path).toString().replace('\\', '/'))
                .filter(key -> !key.endsWith(TEMP_SUFFIX))
                .filter(key -> key.startsWith(prefix))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new StorageException("Failed to list " + prefix, e);
        }
    }

    /**
     * All or nothing: a write that fails part way is truncated back to the
     * previous length, so retrying the append never duplicates bytes.
     */
    @Override
    public void append(String key, byte[] value) {
        Path file = resolve(key);
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
                long length = channel.size();
                channel.position(length);
                try {
                    write(channel, ByteBuffer.wrap(value));
                } catch (IOException e) {
                    rollback(channel, length, e);
                    throw e;
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to append to " + key, e);
        }
    }

    protected void write(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private static void rollback(FileChannel channel, long length, IOException cause) {
        try {
            channel.truncate(length);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank() || key.startsWith("/") || key.contains("..")) {
            throw new IllegalArgumentException("Invalid storage key: " + key);
        }
        return root.resolve(key).normalize();
    }
}
