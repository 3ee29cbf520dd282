package com.streamfirst.mosaic.ports;

import com.streamfirst.mosaic.domain.Session;
import com.streamfirst.mosaic.domain.SessionId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record store for caller sessions and their last activity.
 */
public interface SessionRepository {

    /**
     * Records activity on a session, creating it when it does not exist yet.
     *
     * @param id the session id
     * @param now the activity time
     * @return the stored session
     */
    Session touch(SessionId id, Instant now);

    Optional<Session> findById(SessionId id);

    default boolean exists(SessionId id) {
        return findById(id).isPresent();
    }

    /**
     * Lists sessions whose last activity is strictly before the deadline.
     *
     * @param deadline sessions last seen before this instant are returned
     * @return the inactive session ids
     */
    List<SessionId> findInactiveSince(Instant deadline);

    boolean delete(SessionId id);
}
