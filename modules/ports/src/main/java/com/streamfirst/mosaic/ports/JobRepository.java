package com.streamfirst.mosaic.ports;

import com.streamfirst.mosaic.domain.Job;
import com.streamfirst.mosaic.domain.JobId;
import com.streamfirst.mosaic.domain.SessionId;

import java.util.List;
import java.util.Optional;

/**
 * Durable record store for mosaic jobs.
 */
public interface JobRepository {

    void save(Job job);

    Optional<Job> findById(JobId id);

    /**
     * Lists the jobs owned by a session, oldest first.
     */
    List<Job> findBySession(SessionId sessionId);

    boolean delete(JobId id);
}
