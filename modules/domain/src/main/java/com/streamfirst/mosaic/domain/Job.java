package com.streamfirst.mosaic.domain;

import java.time.Instant;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * One request to render a mosaic of a target with a tile library.
 * Moves {@code QUEUED -> RUNNING -> DONE | ERROR}; terminal jobs never change again.
 */
@Value
@EqualsAndHashCode(of = {"id", "status", "progress", "message"})
public class Job {

    @NonNull JobId id;

    @NonNull SessionId sessionId;

    @NonNull TargetId targetId;

    @NonNull LibraryId libraryId;

    @NonNull JobParameters parameters;

    @NonNull JobStatus status;

    int progress;

    @NonNull String message;

    /** Rendered image, present only when {@link JobStatus#DONE} */
    StoragePath resultRef;

    @NonNull Instant createdAt;

    public static Job queued(JobId id, SessionId sessionId, TargetId targetId, LibraryId libraryId,
                             JobParameters parameters, Instant createdAt) {
        return new Job(id, sessionId, targetId, libraryId, parameters,
                JobStatus.QUEUED, 0, "Queued", null, createdAt);
    }

    public Job start(String startMessage) {
        requireStatus(JobStatus.QUEUED, "start");
        return copy(JobStatus.RUNNING, 0, startMessage, null);
    }

    /**
     * Records progress of a running job. Progress never moves backwards.
     */
    public Job advance(int newProgress, String newMessage) {
        requireStatus(JobStatus.RUNNING, "advance");
        int clamped = Math.max(progress, Math.min(100, newProgress));
        return copy(JobStatus.RUNNING, clamped, newMessage == null ? message : newMessage, null);
    }

    public Job complete(StoragePath result) {
        requireStatus(JobStatus.RUNNING, "complete");
        return copy(JobStatus.DONE, 100, "Done!", result);
    }

    public Job fail(String reason) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status);
        }
        return copy(JobStatus.ERROR, progress, reason, null);
    }

    public Optional<StoragePath> getResultRef() {
        return Optional.ofNullable(resultRef);
    }

    public JobView view() {
        return new JobView(id, status, progress, message);
    }

    private void requireStatus(JobStatus expected, String transition) {
        if (status != expected) {
            throw new IllegalStateException("Cannot " + transition + " job " + id + " in status " + status);
        }
    }

    private Job copy(JobStatus newStatus, int newProgress, String newMessage, StoragePath result) {
        return new Job(id, sessionId, targetId, libraryId, parameters,
                newStatus, newProgress, newMessage, result, createdAt);
    }

    @Override
    public String toString() {
        return "Job{"
                + "id=" + id
                + ", targetId=" + targetId
                + ", libraryId=" + libraryId
                + ", status=" + status
                + ", progress=" + progress
                + '}';
    }
}
