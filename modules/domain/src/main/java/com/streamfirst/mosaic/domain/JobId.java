package com.streamfirst.mosaic.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Unique identifier for a mosaic job. Rendered as a 32-character lowercase hex string.
 *
 * @param value the identifier string
 */
public record JobId(String value) {
    public JobId {
        Objects.requireNonNull(value, "Job id cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Job id cannot be blank");
        }
    }

    /**
     * Generates a fresh random identifier.
     */
    public static JobId random() {
        return new JobId(UUID.randomUUID().toString().replace("-", ""));
    }

    @Override
    public String toString() {
        return value;
    }
}
