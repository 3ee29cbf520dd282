package com.streamfirst.mosaic.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * An uploaded target image. Read-only once registered.
 */
public record Target(TargetId id, SessionId sessionId, String name, StoragePath storagePath,
                     int width, int height, Instant createdAt) {
    public Target {
        Objects.requireNonNull(id, "Target id cannot be null");
        Objects.requireNonNull(sessionId, "Session id cannot be null");
        Objects.requireNonNull(name, "Target name cannot be null");
        Objects.requireNonNull(storagePath, "Target storage path cannot be null");
        Objects.requireNonNull(createdAt, "Creation time cannot be null");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target dimensions must be positive: " + width + "x" + height);
        }
    }
}
