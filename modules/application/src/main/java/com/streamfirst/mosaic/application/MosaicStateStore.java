package com.streamfirst.mosaic.application;

import com.streamfirst.mosaic.domain.Job;
import com.streamfirst.mosaic.domain.JobId;
import com.streamfirst.mosaic.domain.LibraryId;
import com.streamfirst.mosaic.domain.LibrarySnapshot;
import com.streamfirst.mosaic.domain.Session;
import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.domain.StoragePath;
import com.streamfirst.mosaic.domain.Target;
import com.streamfirst.mosaic.domain.TargetId;
import com.streamfirst.mosaic.domain.TileLibrary;
import com.streamfirst.mosaic.ports.FileStoragePort;
import com.streamfirst.mosaic.ports.JobRepository;
import com.streamfirst.mosaic.ports.LibrarySnapshotPort;
import com.streamfirst.mosaic.ports.SessionRepository;
import com.streamfirst.mosaic.ports.TargetRepository;
import com.streamfirst.mosaic.ports.TileLibraryRepository;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared state of libraries, jobs and targets: an in-memory cache per entity class in front of the
 * durable repositories.
 *
 * <p>Each entity class has its own lock, held only for one read-modify-write of the cache and the
 * durable record. Snapshot loading and file deletion happen outside the locks. Updates apply to
 * existing entities only, so a task finishing after its entity was deleted cannot bring it back.
 */
@Slf4j
public class MosaicStateStore {

  private final TileLibraryRepository libraryRepository;
  private final JobRepository jobRepository;
  private final TargetRepository targetRepository;
  private final SessionRepository sessionRepository;
  private final LibrarySnapshotPort snapshots;
  private final FileStoragePort storage;

  private final ReentrantLock libraryLock = new ReentrantLock();
  private final Map<LibraryId, TileLibrary> libraries = new HashMap<>();

  private final ReentrantLock jobLock = new ReentrantLock();
  private final Map<JobId, Job> jobs = new HashMap<>();

  private final ReentrantLock targetLock = new ReentrantLock();
  private final Map<TargetId, Target> targets = new HashMap<>();

  public MosaicStateStore(
      TileLibraryRepository libraryRepository,
      JobRepository jobRepository,
      TargetRepository targetRepository,
      SessionRepository sessionRepository,
      LibrarySnapshotPort snapshots,
      FileStoragePort storage) {
    this.libraryRepository = libraryRepository;
    this.jobRepository = jobRepository;
    this.targetRepository = targetRepository;
    this.sessionRepository = sessionRepository;
    this.snapshots = snapshots;
    this.storage = storage;
  }

  public void saveLibrary(TileLibrary library) {
    libraryLock.lock();
    try {
      libraryRepository.save(library.withoutContent());
      libraries.put(library.getId(), library);
    } finally {
      libraryLock.unlock();
    }
  }

  /**
   * Looks up a library. A ready library whose content is not cached is rebuilt from its snapshot;
   * if the snapshot is missing or inconsistent the record is returned without content.
   */
  public Optional<TileLibrary> findLibrary(LibraryId id) {
    TileLibrary record;
    libraryLock.lock();
    try {
      TileLibrary cached = libraries.get(id);
      if (cached != null && (cached.hasContent() || !cached.isReady())) {
        return Optional.of(cached);
      }
      record = cached != null ? cached : libraryRepository.findById(id).orElse(null);
      if (record == null) {
        return Optional.empty();
      }
      if (!record.isReady()) {
        libraries.put(id, record);
        return Optional.of(record);
      }
    } finally {
      libraryLock.unlock();
    }

    TileLibrary rehydrated = rehydrate(record);

    libraryLock.lock();
    try {
      Optional<TileLibrary> current = libraryRepository.findById(id);
      if (current.isEmpty()) {
        libraries.remove(id);
        return Optional.empty();
      }
      TileLibrary cached = libraries.get(id);
      if (cached != null && cached.hasContent()) {
        return Optional.of(cached);
      }
      if (rehydrated.hasContent() && current.get().equals(record)) {
        libraries.put(id, rehydrated);
        return Optional.of(rehydrated);
      }
      return current;
    } finally {
      libraryLock.unlock();
    }
  }

  private TileLibrary rehydrate(TileLibrary record) {
    Optional<LibrarySnapshot> snapshot;
    try {
      snapshot = snapshots.load(record.getId());
    } catch (UncheckedIOException | IllegalArgumentException e) {
      log.warn("Cannot read snapshot of library {}", record.getId(), e);
      return record;
    }
    if (snapshot.isEmpty()) {
      log.warn("Library {} is ready but has no snapshot", record.getId());
      return record;
    }
    try {
      LibrarySnapshot content = snapshot.get();
      TileLibrary loaded =
          record.withContent(
              content.tiles(), content.bucketIndex(record.getBucketIndex().quantization()));
      log.info("Rehydrated library {} with {} tiles", record.getId(), loaded.getTileCount());
      return loaded;
    } catch (IllegalStateException | IllegalArgumentException e) {
      log.warn("Snapshot of library {} is inconsistent", record.getId(), e);
      return record;
    }
  }

  /**
   * Applies {@code update} to an existing library and stores the result in both tiers.
   *
   * @return the updated library, or empty if it no longer exists
   */
  public Optional<TileLibrary> updateLibrary(LibraryId id, UnaryOperator<TileLibrary> update) {
    libraryLock.lock();
    try {
      TileLibrary current = libraries.get(id);
      if (current == null) {
        current = libraryRepository.findById(id).orElse(null);
      }
      if (current == null) {
        return Optional.empty();
      }
      TileLibrary updated = update.apply(current);
      libraryRepository.save(updated.withoutContent());
      libraries.put(id, updated);
      return Optional.of(updated);
    } finally {
      libraryLock.unlock();
    }
  }

  /** Removes a library from both tiers, then its snapshot and files. */
  public boolean deleteLibrary(LibraryId id) {
    boolean removed;
    libraryLock.lock();
    try {
      boolean cached = libraries.remove(id) != null;
      removed = libraryRepository.delete(id) || cached;
    } finally {
      libraryLock.unlock();
    }
    try {
      snapshots.delete(id);
      int files = storage.deleteRecursively(StorageLayout.libraryDir(id));
      log.debug("Deleted library {} and {} files", id, files);
    } catch (UncheckedIOException e) {
      log.warn("Failed to delete files of library {}", id, e);
    }
    return removed;
  }

  public boolean libraryExists(LibraryId id) {
    libraryLock.lock();
    try {
      return libraries.containsKey(id) || libraryRepository.findById(id).isPresent();
    } finally {
      libraryLock.unlock();
    }
  }

  /** Libraries of a session, oldest first, with content only where it is already cached. */
  public List<TileLibrary> listLibraries(SessionId sessionId) {
    libraryLock.lock();
    try {
      return libraryRepository.findBySession(sessionId).stream()
          .map(record -> libraries.getOrDefault(record.getId(), record))
          .sorted(Comparator.comparing(TileLibrary::getCreatedAt))
          .toList();
    } finally {
      libraryLock.unlock();
    }
  }

  public void saveJob(Job job) {
    jobLock.lock();
    try {
      jobRepository.save(job);
      jobs.put(job.getId(), job);
    } finally {
      jobLock.unlock();
    }
  }

  public Optional<Job> findJob(JobId id) {
    jobLock.lock();
    try {
      Job cached = jobs.get(id);
      if (cached != null) {
        return Optional.of(cached);
      }
      Optional<Job> stored = jobRepository.findById(id);
      stored.ifPresent(job -> jobs.put(id, job));
      return stored;
    } finally {
      jobLock.unlock();
    }
  }

  /**
   * Applies {@code update} to an existing job.
   *
   * @return the updated job, or empty if it no longer exists
   */
  public Optional<Job> updateJob(JobId id, UnaryOperator<Job> update) {
    jobLock.lock();
    try {
      Job current = jobs.get(id);
      if (current == null) {
        current = jobRepository.findById(id).orElse(null);
      }
      if (current == null) {
        return Optional.empty();
      }
      Job updated = update.apply(current);
      jobRepository.save(updated);
      jobs.put(id, updated);
      return Optional.of(updated);
    } finally {
      jobLock.unlock();
    }
  }

  /** Removes a job from both tiers, then its result file. */
  public boolean deleteJob(JobId id) {
    boolean removed;
    jobLock.lock();
    try {
      boolean cached = jobs.remove(id) != null;
      removed = jobRepository.delete(id) || cached;
    } finally {
      jobLock.unlock();
    }
    deleteQuietly(StorageLayout.resultPath(id));
    return removed;
  }

  public List<Job> listJobs(SessionId sessionId) {
    jobLock.lock();
    try {
      return jobRepository.findBySession(sessionId).stream()
          .map(record -> jobs.getOrDefault(record.getId(), record))
          .sorted(Comparator.comparing(Job::getCreatedAt))
          .toList();
    } finally {
      jobLock.unlock();
    }
  }

  public void saveTarget(Target target) {
    targetLock.lock();
    try {
      targetRepository.save(target);
      targets.put(target.id(), target);
    } finally {
      targetLock.unlock();
    }
  }

  public Optional<Target> findTarget(TargetId id) {
    targetLock.lock();
    try {
      Target cached = targets.get(id);
      if (cached != null) {
        return Optional.of(cached);
      }
      Optional<Target> stored = targetRepository.findById(id);
      stored.ifPresent(target -> targets.put(id, target));
      return stored;
    } finally {
      targetLock.unlock();
    }
  }

  /** Removes a target from both tiers, then its directory. */
  public boolean deleteTarget(TargetId id) {
    boolean removed;
    targetLock.lock();
    try {
      boolean cached = targets.remove(id) != null;
      removed = targetRepository.delete(id) || cached;
    } finally {
      targetLock.unlock();
    }
    try {
      storage.deleteRecursively(StorageLayout.targetDir(id));
    } catch (UncheckedIOException e) {
      log.warn("Failed to delete files of target {}", id, e);
    }
    return removed;
  }

  public List<Target> listTargets(SessionId sessionId) {
    targetLock.lock();
    try {
      return targetRepository.findBySession(sessionId).stream()
          .sorted(Comparator.comparing(Target::createdAt))
          .toList();
    } finally {
      targetLock.unlock();
    }
  }

  public Session touchSession(SessionId id, Instant now) {
    return sessionRepository.touch(id, now);
  }

  public boolean sessionExists(SessionId id) {
    return sessionRepository.exists(id);
  }

  public List<SessionId> inactiveSessions(Instant deadline) {
    return sessionRepository.findInactiveSince(deadline);
  }

  /**
   * Deletes everything a session owns, jobs first, then libraries and targets, and finally the
   * session itself.
   *
   * @return number of entities removed, the session not included
   */
  public int purgeSession(SessionId sessionId) {
    int removed = 0;
    for (Job job : listJobs(sessionId)) {
      removed += deleteJob(job.getId()) ? 1 : 0;
    }
    for (TileLibrary library : listLibraries(sessionId)) {
      removed += deleteLibrary(library.getId()) ? 1 : 0;
    }
    for (Target target : listTargets(sessionId)) {
      removed += deleteTarget(target.id()) ? 1 : 0;
    }
    sessionRepository.delete(sessionId);
    log.info("Purged session {} ({} entities)", sessionId, removed);
    return removed;
  }

  /**
   * Drops every cached entity. Later reads go to the durable repositories and library content is
   * rebuilt from snapshots.
   */
  public void evictCached() {
    libraryLock.lock();
    try {
      libraries.clear();
    } finally {
      libraryLock.unlock();
    }
    jobLock.lock();
    try {
      jobs.clear();
    } finally {
      jobLock.unlock();
    }
    targetLock.lock();
    try {
      targets.clear();
    } finally {
      targetLock.unlock();
    }
  }

  private void deleteQuietly(StoragePath path) {
    try {
      storage.delete(path);
    } catch (UncheckedIOException e) {
      log.warn("Failed to delete {}", path, e);
    }
  }
}
