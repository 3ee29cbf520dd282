package com.streamfirst.mosaic.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Unique identifier for a library. Rendered as a 32-character lowercase hex string.
 *
 * @param value the identifier string
 */
public record LibraryId(String value) {
    public LibraryId {
        Objects.requireNonNull(value, "Library id cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Library id cannot be blank");
        }
    }

    /**
     * Generates a fresh random identifier.
     */
    public static LibraryId random() {
        return new LibraryId(UUID.randomUUID().toString().replace("-", ""));
    }

    @Override
    public String toString() {
        return value;
    }
}
