package com.streamfirst.mosaic.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A caller session. Everything a session owns is deleted once it has been idle past the TTL.
 */
public record Session(SessionId id, Instant createdAt, Instant lastSeen) {
    public Session {
        Objects.requireNonNull(id, "Session id cannot be null");
        Objects.requireNonNull(createdAt, "Creation time cannot be null");
        Objects.requireNonNull(lastSeen, "Last seen time cannot be null");
    }

    public Session touch(Instant now) {
        return new Session(id, createdAt, now.isAfter(lastSeen) ? now : lastSeen);
    }

    public boolean isIdleSince(Instant now, Duration ttl) {
        return lastSeen.isBefore(now.minus(ttl));
    }
}
