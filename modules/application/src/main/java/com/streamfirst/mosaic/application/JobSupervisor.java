package com.streamfirst.mosaic.application;

import com.streamfirst.mosaic.domain.EntityNotFoundException;
import com.streamfirst.mosaic.domain.Job;
import com.streamfirst.mosaic.domain.JobId;
import com.streamfirst.mosaic.domain.JobParameters;
import com.streamfirst.mosaic.domain.JobView;
import com.streamfirst.mosaic.domain.LibraryId;
import com.streamfirst.mosaic.domain.LibraryView;
import com.streamfirst.mosaic.domain.ResourceExceededException;
import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.domain.StoragePath;
import com.streamfirst.mosaic.domain.Target;
import com.streamfirst.mosaic.domain.TargetId;
import com.streamfirst.mosaic.domain.TileLibrary;
import com.streamfirst.mosaic.domain.ValidationException;
import com.streamfirst.mosaic.ports.FileStoragePort;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts library uploads and mosaic jobs and runs them as independent tasks on a bounded
 * executor.
 *
 * <p>Submissions are validated synchronously: a rejected submission throws and leaves nothing
 * behind. Once accepted, a task reports its outcome only through the state store; a failing task
 * moves its own entity to ERROR and never affects other tasks. When the executor refuses a task the
 * new entity is marked ERROR and the caller gets a {@link ResourceExceededException}.
 */
@Slf4j
@RequiredArgsConstructor
public class JobSupervisor {

  static final String BUSY_MESSAGE = "Server busy, try again later";

  private final MosaicStateStore store;
  private final LibraryIndexer indexer;
  private final MosaicCompositor compositor;
  private final FileStoragePort storage;
  private final Executor executor;
  private final Clock clock;
  private final MosaicSettings settings;

  private final Map<LibraryId, CancellationToken> indexing = new ConcurrentHashMap<>();

  /**
   * Stores an uploaded archive and queues it for indexing.
   *
   * @return id of the new library, initially QUEUED
   * @throws ResourceExceededException if no worker can take the indexing task
   */
  public LibraryId submitLibrary(SessionId sessionId, String name, InputStream archive) {
    store.touchSession(sessionId, clock.instant());
    LibraryId id = LibraryId.random();
    StoragePath archivePath = StorageLayout.archivePath(id);
    storage.write(archivePath, archive);

    store.saveLibrary(
        TileLibrary.queued(id, sessionId, name, settings.getQuantization(), clock.instant()));
    CancellationToken token =
        CancellationToken.when(() -> !store.libraryExists(id) || !store.sessionExists(sessionId));
    indexing.put(id, token);
    log.info("Library {} queued for session {}", id, sessionId);

    dispatch(
        () -> {
          try {
            indexer.index(id, archivePath, token);
          } finally {
            indexing.remove(id);
          }
        },
        failure -> indexer.recordFailure(id, failure),
        () -> {
          indexing.remove(id);
          store.updateLibrary(id, library -> library.failed(BUSY_MESSAGE));
          deleteQuietly(archivePath);
        });
    return id;
  }

  public LibraryView libraryView(SessionId sessionId, LibraryId id) {
    store.touchSession(sessionId, clock.instant());
    return ownedLibrary(sessionId, id).view();
  }

  public List<LibraryView> listLibraries(SessionId sessionId) {
    store.touchSession(sessionId, clock.instant());
    return store.listLibraries(sessionId).stream().map(TileLibrary::view).toList();
  }

  /** Deletes a library, cancelling its indexing if still running. */
  public void deleteLibrary(SessionId sessionId, LibraryId id) {
    store.touchSession(sessionId, clock.instant());
    ownedLibrary(sessionId, id);
    CancellationToken token = indexing.remove(id);
    if (token != null) {
      token.cancel();
    }
    store.deleteLibrary(id);
    log.info("Library {} deleted", id);
  }

  /**
   * Queues a mosaic job after checking its parameters and references.
   *
   * @throws ValidationException if a parameter is out of range, the target or library is unknown to
   *     the session, or the library is not ready
   * @throws ResourceExceededException if no worker can take the job
   */
  public JobId submitJob(
      SessionId sessionId, TargetId targetId, LibraryId libraryId, JobParameters parameters) {
    store.touchSession(sessionId, clock.instant());
    store
        .findTarget(targetId)
        .filter(target -> target.sessionId().equals(sessionId))
        .orElseThrow(() -> new ValidationException("Unknown target: " + targetId));
    TileLibrary library =
        store
            .findLibrary(libraryId)
            .filter(found -> found.getSessionId().equals(sessionId))
            .orElseThrow(() -> new ValidationException("Unknown library: " + libraryId));
    if (!library.isReady()) {
      throw new ValidationException(
          "Library " + libraryId + " is not ready (" + library.getStatus() + ")");
    }
    if (!library.hasContent()) {
      throw new ValidationException("Library " + libraryId + " content is unavailable");
    }

    JobId id = JobId.random();
    store.saveJob(Job.queued(id, sessionId, targetId, libraryId, parameters, clock.instant()));
    log.info("Job {} queued: target {}, library {}, {}", id, targetId, libraryId, parameters);
    dispatch(
        () -> runJob(id),
        failure -> recordJobFailure(id, failure),
        () -> store.updateJob(id, job -> job.fail(BUSY_MESSAGE)));
    return id;
  }

  /**
   * Same as {@link #submitJob(SessionId, TargetId, LibraryId, JobParameters)} with the parameters
   * given individually.
   */
  public JobId submitJob(
      SessionId sessionId,
      TargetId targetId,
      LibraryId libraryId,
      int cellSize,
      int repeatWindowK,
      double colorStrength,
      double overlayStrength) {
    JobParameters parameters =
        new JobParameters(cellSize, repeatWindowK, colorStrength, overlayStrength);
    return submitJob(sessionId, targetId, libraryId, parameters);
  }

  public JobView jobView(SessionId sessionId, JobId id) {
    store.touchSession(sessionId, clock.instant());
    return ownedJob(sessionId, id).view();
  }

  public List<JobView> listJobs(SessionId sessionId) {
    store.touchSession(sessionId, clock.instant());
    return store.listJobs(sessionId).stream().map(Job::view).toList();
  }

  /**
   * The rendered JPEG of a finished job.
   *
   * @throws EntityNotFoundException if the job is unknown or not DONE
   */
  public byte[] result(SessionId sessionId, JobId id) {
    store.touchSession(sessionId, clock.instant());
    Job job = ownedJob(sessionId, id);
    StoragePath path =
        job.getResultRef()
            .orElseThrow(() -> new EntityNotFoundException("Result of job " + id + " is not ready"));
    return storage.read(path);
  }

  public void deleteJob(SessionId sessionId, JobId id) {
    store.touchSession(sessionId, clock.instant());
    ownedJob(sessionId, id);
    store.deleteJob(id);
    log.info("Job {} deleted", id);
  }

  /**
   * Executes a queued job to completion. Never throws; the outcome is recorded on the job.
   */
  void runJob(JobId id) {
    try {
      Job job = store.updateJob(id, queued -> queued.start("Loading")).orElse(null);
      if (job == null) {
        log.info("Job {} was deleted before it started", id);
        return;
      }
      Target target =
          store
              .findTarget(job.getTargetId())
              .orElseThrow(
                  () -> new EntityNotFoundException("Target " + job.getTargetId() + " no longer exists"));
      TileLibrary library =
          store
              .findLibrary(job.getLibraryId())
              .orElseThrow(
                  () ->
                      new EntityNotFoundException("Library " + job.getLibraryId() + " no longer exists"));

      CompositeResult composite =
          compositor.compose(
              target,
              library,
              job.getParameters(),
              (progress, message) -> store.updateJob(id, running -> running.advance(progress, message)));

      store.updateJob(id, running -> running.advance(99, "Saving"));
      byte[] jpeg = TileImages.encodeJpeg(composite.getImage(), settings.getResultQuality());
      StoragePath resultPath = StorageLayout.resultPath(id);
      storage.write(resultPath, jpeg);
      if (store.updateJob(id, running -> running.complete(resultPath)).isEmpty()) {
        log.info("Job {} was deleted while running, dropping its result", id);
        deleteQuietly(resultPath);
        return;
      }
      log.info("Job {} done: {} cells, {} bytes", id, composite.cellCount(), jpeg.length);
    } catch (Exception e) {
      log.error("Job {} failed", id, e);
      recordJobFailure(id, e);
    } catch (Error e) {
      log.error("Job {} aborted", id, e);
      recordJobFailure(id, e);
      throw e;
    }
  }

  private void recordJobFailure(JobId id, Throwable cause) {
    String reason = Failures.describe(cause);
    try {
      store.updateJob(id, job -> job.getStatus().isTerminal() ? job : job.fail(reason));
    } catch (RuntimeException e) {
      log.error("Cannot record failure of job {}", id, e);
    }
  }

  /**
   * Runs a task on the worker pool. A throwable escaping the task is logged and handed to {@code
   * onFailure}; a task the pool refuses triggers {@code onRejected}.
   */
  private void dispatch(Runnable task, Consumer<Throwable> onFailure, Runnable onRejected) {
    try {
      CompletableFuture.runAsync(task, executor)
          .whenComplete(
              (ignored, failure) -> {
                if (failure != null) {
                  Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                      ? failure.getCause()
                      : failure;
                  log.error("Worker task ended abnormally", cause);
                  onFailure.accept(cause);
                }
              });
    } catch (RejectedExecutionException e) {
      log.warn("Worker pool saturated, rejecting task");
      onRejected.run();
      throw new ResourceExceededException(BUSY_MESSAGE, e);
    }
  }

  private TileLibrary ownedLibrary(SessionId sessionId, LibraryId id) {
    return store
        .findLibrary(id)
        .filter(library -> library.getSessionId().equals(sessionId))
        .orElseThrow(() -> new EntityNotFoundException("Library not found: " + id));
  }

  private Job ownedJob(SessionId sessionId, JobId id) {
    return store
        .findJob(id)
        .filter(job -> job.getSessionId().equals(sessionId))
        .orElseThrow(() -> new EntityNotFoundException("Job not found: " + id));
  }

  private void deleteQuietly(StoragePath path) {
    try {
      storage.delete(path);
    } catch (UncheckedIOException e) {
      log.warn("Failed to delete {}", path, e);
    }
  }
}
