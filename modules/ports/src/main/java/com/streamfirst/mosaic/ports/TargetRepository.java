package com.streamfirst.mosaic.ports;

import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.domain.Target;
import com.streamfirst.mosaic.domain.TargetId;

import java.util.List;
import java.util.Optional;

/**
 * Durable record store for uploaded target images.
 */
public interface TargetRepository {

    void save(Target target);

    Optional<Target> findById(TargetId id);

    /**
     * Lists the targets owned by a session, oldest first.
     */
    List<Target> findBySession(SessionId sessionId);

    boolean delete(TargetId id);
}
