package com.streamfirst.mosaic.adapters;

import com.streamfirst.mosaic.domain.StoragePath;
import com.streamfirst.mosaic.ports.FileStoragePort;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of FileStoragePort for testing and development.
 * Simulates file storage using in-memory byte arrays keyed by path.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryStorageAdapter implements FileStoragePort {

    private final Map<StoragePath, byte[]> contents = new ConcurrentHashMap<>();

    @Override
    public long write(StoragePath path, byte[] data) {
        contents.put(path, Arrays.copyOf(data, data.length));
        log.debug("Wrote file {} ({} bytes)", path, data.length);
        return data.length;
    }

    @Override
    public long write(StoragePath path, InputStream data) {
        try {
            return write(path, data.readAllBytes());
        } catch (IOException e) {
            log.error("Failed to write file {}", path, e);
            throw new UncheckedIOException("Failed to write file: " + path, e);
        }
    }

    @Override
    public byte[] read(StoragePath path) {
        byte[] content = contents.get(path);
        if (content == null) {
            throw new UncheckedIOException(new NoSuchFileException(path.toString()));
        }
        return Arrays.copyOf(content, content.length);
    }

    @Override
    public InputStream openStream(StoragePath path) {
        return new ByteArrayInputStream(read(path));
    }

    @Override
    public boolean exists(StoragePath path) {
        return contents.containsKey(path);
    }

    @Override
    public long size(StoragePath path) {
        byte[] content = contents.get(path);
        if (content == null) {
            throw new UncheckedIOException(new NoSuchFileException(path.toString()));
        }
        return content.length;
    }

    @Override
    public boolean delete(StoragePath path) {
        boolean removed = contents.remove(path) != null;
        log.debug("Deleted file {}: {}", path, removed);
        return removed;
    }

    @Override
    public int deleteRecursively(StoragePath path) {
        List<StoragePath> doomed = list(path);
        doomed.forEach(contents::remove);
        log.debug("Deleted {} files under {}", doomed.size(), path);
        return doomed.size();
    }

    @Override
    public List<StoragePath> list(StoragePath prefix) {
        return contents.keySet().stream()
                .filter(candidate -> candidate.startsWith(prefix))
                .sorted(Comparator.comparing(StoragePath::toString))
                .toList();
    }

    /**
     * Gets the total number of stored files.
     */
    public int getTotalFileCount() {
        return contents.size();
    }

    /**
     * Gets the total size of all stored files.
     */
    public long getTotalStorageSize() {
        return contents.values().stream()
                .mapToLong(content -> content.length)
                .sum();
    }

    /**
     * Clears all storage data. Useful for testing.
     */
    public void clear() {
        log.info("Clearing all storage data");
        contents.clear();
    }
}
