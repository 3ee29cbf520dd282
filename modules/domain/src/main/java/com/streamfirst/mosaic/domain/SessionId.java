package com.streamfirst.mosaic.domain;

import java.util.Objects;

/**
 * Identifies the caller session that owns targets, libraries and jobs.
 * Callers that do not present a session share the {@link #LEGACY} session.
 *
 * @param value the session identifier as supplied by the caller
 */
public record SessionId(String value) {
    public static final SessionId LEGACY = new SessionId("legacy");

    public SessionId {
        Objects.requireNonNull(value, "Session id cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Session id cannot be blank");
        }
    }

    /**
     * Resolves a possibly absent caller-supplied id, falling back to the legacy session.
     */
    public static SessionId ofNullable(String value) {
        return value == null || value.isBlank() ? LEGACY : new SessionId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
