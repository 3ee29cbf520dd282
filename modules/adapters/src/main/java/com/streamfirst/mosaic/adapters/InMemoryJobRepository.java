package com.streamfirst.mosaic.adapters;

import com.streamfirst.mosaic.domain.Job;
import com.streamfirst.mosaic.domain.JobId;
import com.streamfirst.mosaic.domain.JobStatus;
import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.ports.JobRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of JobRepository for testing and development.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryJobRepository implements JobRepository {

    private final Map<JobId, Job> records = new ConcurrentHashMap<>();

    @Override
    public void save(Job job) {
        records.put(job.getId(), job);
        log.debug("Saved job record {} ({}, {}%)", job.getId(), job.getStatus(), job.getProgress());
    }

    @Override
    public Optional<Job> findById(JobId id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<Job> findBySession(SessionId sessionId) {
        return records.values().stream()
                .filter(job -> job.getSessionId().equals(sessionId))
                .sorted(Comparator.comparing(Job::getCreatedAt))
                .toList();
    }

    @Override
    public boolean delete(JobId id) {
        return records.remove(id) != null;
    }

    /**
     * Gets job count by status for monitoring.
     */
    public Map<JobStatus, Long> getJobCountByStatus() {
        return records.values().stream()
                .collect(Collectors.groupingBy(Job::getStatus, Collectors.counting()));
    }

    public int size() {
        return records.size();
    }
}
