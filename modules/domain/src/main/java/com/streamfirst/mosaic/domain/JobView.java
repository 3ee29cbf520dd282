package com.streamfirst.mosaic.domain;

/**
 * What callers may see of a job while polling.
 */
public record JobView(JobId id, JobStatus status, int progress, String message) {
}
