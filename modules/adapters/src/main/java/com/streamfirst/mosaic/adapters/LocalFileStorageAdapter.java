package com.streamfirst.mosaic.adapters;

import com.streamfirst.mosaic.domain.StoragePath;
import com.streamfirst.mosaic.ports.FileStoragePort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * FileStoragePort backed by a directory on the local filesystem.
 * Writes go to a temporary sibling first and are moved into place, so readers never see a
 * half-written file.
 */
@Slf4j
public class LocalFileStorageAdapter implements FileStoragePort {

    private final Path root;

    public LocalFileStorageAdapter(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create storage root " + this.root, e);
        }
        log.info("Using local file storage at {}", this.root);
    }

    @Override
    public long write(StoragePath path, byte[] data) {
        Path file = resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Path temp = Files.createTempFile(file.getParent(), ".tmp-", file.getFileName().toString());
            Files.write(temp, data);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote file {} ({} bytes)", path, data.length);
            return data.length;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write file: " + path, e);
        }
    }

    @Override
    public long write(StoragePath path, InputStream data) {
        Path file = resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Path temp = Files.createTempFile(file.getParent(), ".tmp-", file.getFileName().toString());
            long written = Files.copy(data, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Streamed file {} ({} bytes)", path, written);
            return written;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write file: " + path, e);
        }
    }

    @Override
    public byte[] read(StoragePath path) {
        try {
            return Files.readAllBytes(resolve(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read file: " + path, e);
        }
    }

    @Override
    public InputStream openStream(StoragePath path) {
        try {
            return Files.newInputStream(resolve(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open file: " + path, e);
        }
    }

    @Override
    public boolean exists(StoragePath path) {
        return Files.isRegularFile(resolve(path));
    }

    @Override
    public long size(StoragePath path) {
        try {
            return Files.size(resolve(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat file: " + path, e);
        }
    }

    @Override
    public boolean delete(StoragePath path) {
        try {
            return Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete file: " + path, e);
        }
    }

    @Override
    public int deleteRecursively(StoragePath path) {
        Path start = resolve(path);
        if (!Files.exists(start)) {
            return 0;
        }
        int[] removed = {0};
        try (Stream<Path> walk = Files.walk(start)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    boolean regular = Files.isRegularFile(p);
                    if (Files.deleteIfExists(p) && regular) {
                        removed[0]++;
                    }
                } catch (NoSuchFileException e) {
                    log.debug("File {} vanished during delete", p);
                } catch (IOException e) {
                    log.warn("Could not delete {}", p, e);
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete tree: " + path, e);
        }
        log.debug("Deleted {} files under {}", removed[0], path);
        return removed[0];
    }

    @Override
    public List<StoragePath> list(StoragePath prefix) {
        Path start = resolve(prefix);
        if (!Files.exists(start)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(start)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> StoragePath.of(root.relativize(p).toString()))
                    .sorted(Comparator.comparing(StoragePath::toString))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + prefix, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(StoragePath path) {
        Path resolved = root.resolve(path.path()).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes storage root: " + path);
        }
        return resolved;
    }
}
