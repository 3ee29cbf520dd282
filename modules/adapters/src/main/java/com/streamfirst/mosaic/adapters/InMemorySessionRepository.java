package com.streamfirst.mosaic.adapters;

import com.streamfirst.mosaic.domain.Session;
import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.ports.SessionRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of SessionRepository for testing and development.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemorySessionRepository implements SessionRepository {

    private final Map<SessionId, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public Session touch(SessionId id, Instant now) {
        return sessions.compute(id, (key, existing) -> {
            if (existing == null) {
                log.info("Opened session {}", key);
                return new Session(key, now, now);
            }
            return existing.touch(now);
        });
    }

    @Override
    public Optional<Session> findById(SessionId id) {
        return Optional.ofNullable(sessions.get(id));
    }

    @Override
    public List<SessionId> findInactiveSince(Instant deadline) {
        return sessions.values().stream()
                .filter(session -> session.lastSeen().isBefore(deadline))
                .map(Session::id)
                .toList();
    }

    @Override
    public boolean delete(SessionId id) {
        return sessions.remove(id) != null;
    }

    public int size() {
        return sessions.size();
    }
}
