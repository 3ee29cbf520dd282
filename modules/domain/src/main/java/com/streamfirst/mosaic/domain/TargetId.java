package com.streamfirst.mosaic.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Unique identifier for a target. Rendered as a 32-character lowercase hex string.
 *
 * @param value the identifier string
 */
public record TargetId(String value) {
    public TargetId {
        Objects.requireNonNull(value, "Target id cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Target id cannot be blank");
        }
    }

    /**
     * Generates a fresh random identifier.
     */
    public static TargetId random() {
        return new TargetId(UUID.randomUUID().toString().replace("-", ""));
    }

    @Override
    public String toString() {
        return value;
    }
}
