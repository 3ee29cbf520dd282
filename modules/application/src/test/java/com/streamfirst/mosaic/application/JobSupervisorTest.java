package com.streamfirst.mosaic.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.mosaic.application.MosaicFixture.QueueingExecutor;
import com.streamfirst.mosaic.domain.EntityNotFoundException;
import com.streamfirst.mosaic.domain.JobId;
import com.streamfirst.mosaic.domain.JobParameters;
import com.streamfirst.mosaic.domain.JobStatus;
import com.streamfirst.mosaic.domain.JobView;
import com.streamfirst.mosaic.domain.LibraryId;
import com.streamfirst.mosaic.domain.LibraryStatus;
import com.streamfirst.mosaic.domain.LibraryView;
import com.streamfirst.mosaic.domain.ResourceExceededException;
import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.domain.Target;
import com.streamfirst.mosaic.domain.ValidationException;
import java.awt.image.BufferedImage;
import com.streamfirst.mosaic.adapters.InMemoryStorageAdapter;
import com.streamfirst.mosaic.domain.StoragePath;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class JobSupervisorTest {

  private static final JobParameters PARAMETERS = new JobParameters(16, 10, 0.35, 0.1);

  private final SessionId session = new SessionId("alice");
  private MosaicFixture fixture = new MosaicFixture();

  private static byte[] archive(int images) {
    Map<String, byte[]> entries = new LinkedHashMap<>();
    for (int i = 0; i < images; i++) {
      entries.put("img" + i + ".png", TestImages.solidPng(48, 48, TestImages.palette(i)));
    }
    return TestImages.zip(entries);
  }

  private LibraryId submitLibrary(SessionId owner) {
    return fixture.supervisor.submitLibrary(owner, "tiles.zip", new ByteArrayInputStream(archive(12)));
  }

  private Target registerTarget(SessionId owner) {
    byte[] png = TestImages.png(TestImages.gradient(96, 64));
    return fixture.targets.register(owner, "photo.png", new ByteArrayInputStream(png));
  }

  @Test
  void rendersMosaicEndToEnd() throws Exception {
    LibraryId libraryId = submitLibrary(session);
    Target target = registerTarget(session);

    LibraryView library = fixture.supervisor.libraryView(session, libraryId);
    assertThat(library.status()).isEqualTo(LibraryStatus.READY);
    assertThat(library.tileCount()).isEqualTo(12);

    JobId jobId = fixture.supervisor.submitJob(session, target.id(), libraryId, PARAMETERS);

    JobView job = fixture.supervisor.jobView(session, jobId);
    assertThat(job.status()).isEqualTo(JobStatus.DONE);
    assertThat(job.progress()).isEqualTo(100);
    assertThat(job.message()).isEqualTo("Done!");
    BufferedImage result = TileImages.decode(fixture.supervisor.result(session, jobId));
    assertThat(result.getWidth()).isEqualTo(96);
    assertThat(result.getHeight()).isEqualTo(64);
    assertThat(fixture.storage.exists(StorageLayout.resultPath(jobId))).isTrue();
  }

  @Test
  void rejectsJobAgainstLibraryStillProcessing() {
    QueueingExecutor executor = new QueueingExecutor();
    fixture = new MosaicFixture(MosaicSettings.defaults(), executor);
    LibraryId libraryId = submitLibrary(session);
    fixture.store.updateLibrary(libraryId, library -> library.withStatus(LibraryStatus.PROCESSING));
    Target target = registerTarget(session);

    assertThatThrownBy(() -> fixture.supervisor.submitJob(session, target.id(), libraryId, PARAMETERS))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("not ready");
    assertThat(fixture.supervisor.listJobs(session)).isEmpty();
    assertThat(fixture.jobRepository.size()).isZero();
  }

  @Test
  void rejectsOutOfRangeParametersBeforeCreatingAnything() {
    LibraryId libraryId = submitLibrary(session);
    Target target = registerTarget(session);

    assertThatThrownBy(() -> fixture.supervisor.submitJob(session, target.id(), libraryId, 4, 30, 0.35, 0.0))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> fixture.supervisor.submitJob(session, target.id(), libraryId, 32, 30, 1.5, 0.0))
        .isInstanceOf(ValidationException.class);
    assertThat(fixture.jobRepository.size()).isZero();
  }

  @Test
  void rejectsReferencesOwnedByAnotherSession() {
    SessionId bob = new SessionId("bob");
    LibraryId bobsLibrary = submitLibrary(bob);
    Target bobsTarget = registerTarget(bob);
    LibraryId libraryId = submitLibrary(session);
    Target target = registerTarget(session);

    assertThatThrownBy(() -> fixture.supervisor.submitJob(session, target.id(), bobsLibrary, PARAMETERS))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> fixture.supervisor.submitJob(session, bobsTarget.id(), libraryId, PARAMETERS))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> fixture.supervisor.libraryView(session, bobsLibrary))
        .isInstanceOf(EntityNotFoundException.class);
    assertThat(fixture.jobRepository.size()).isZero();
  }

  @Test
  void failingJobDoesNotAffectOthers() {
    QueueingExecutor executor = new QueueingExecutor();
    fixture = new MosaicFixture(MosaicSettings.defaults(), executor);
    LibraryId libraryId = submitLibrary(session);
    executor.runAll();
    Target broken = registerTarget(session);
    Target healthy = registerTarget(session);
    JobId failing = fixture.supervisor.submitJob(session, broken.id(), libraryId, PARAMETERS);
    JobId passing = fixture.supervisor.submitJob(session, healthy.id(), libraryId, PARAMETERS);
    fixture.storage.delete(broken.storagePath());

    executor.runAll();

    JobView failed = fixture.supervisor.jobView(session, failing);
    assertThat(failed.status()).isEqualTo(JobStatus.ERROR);
    assertThat(failed.message()).contains(broken.storagePath().path());
    assertThat(fixture.supervisor.jobView(session, passing).status()).isEqualTo(JobStatus.DONE);
  }

  @Test
  void resultIsUnavailableUntilDone() {
    QueueingExecutor executor = new QueueingExecutor();
    fixture = new MosaicFixture(MosaicSettings.defaults(), executor);
    LibraryId libraryId = submitLibrary(session);
    executor.runAll();
    Target target = registerTarget(session);
    JobId jobId = fixture.supervisor.submitJob(session, target.id(), libraryId, PARAMETERS);

    assertThat(fixture.supervisor.jobView(session, jobId).status()).isEqualTo(JobStatus.QUEUED);
    assertThatThrownBy(() -> fixture.supervisor.result(session, jobId))
        .isInstanceOf(EntityNotFoundException.class);

    executor.runAll();

    assertThat(fixture.supervisor.result(session, jobId)).isNotEmpty();
  }

  @Test
  void jobFailsWhenItsLibraryVanishes() {
    QueueingExecutor executor = new QueueingExecutor();
    fixture = new MosaicFixture(MosaicSettings.defaults(), executor);
    LibraryId libraryId = submitLibrary(session);
    executor.runAll();
    Target target = registerTarget(session);
    JobId jobId = fixture.supervisor.submitJob(session, target.id(), libraryId, PARAMETERS);
    fixture.supervisor.deleteLibrary(session, libraryId);

    executor.runAll();

    JobView job = fixture.supervisor.jobView(session, jobId);
    assertThat(job.status()).isEqualTo(JobStatus.ERROR);
    assertThat(job.message()).contains("no longer exists");
  }

  @Test
  void deletingLibraryCancelsPendingIndexing() {
    QueueingExecutor executor = new QueueingExecutor();
    fixture = new MosaicFixture(MosaicSettings.defaults(), executor);
    LibraryId libraryId = submitLibrary(session);

    fixture.supervisor.deleteLibrary(session, libraryId);
    executor.runAll();

    assertThat(fixture.supervisor.listLibraries(session)).isEmpty();
    assertThat(fixture.storage.list(StorageLayout.libraryDir(libraryId))).isEmpty();
  }

  @Test
  void readyLibrarySurvivesRestart() {
    LibraryId libraryId = submitLibrary(session);
    Target target = registerTarget(session);

    fixture.restart();
    JobId jobId = fixture.supervisor.submitJob(session, target.id(), libraryId, PARAMETERS);

    assertThat(fixture.supervisor.jobView(session, jobId).status()).isEqualTo(JobStatus.DONE);
  }

  @Test
  void libraryWithoutSnapshotIsNotUsableAfterRestart() {
    LibraryId libraryId = submitLibrary(session);
    Target target = registerTarget(session);
    fixture.snapshots.delete(libraryId);

    fixture.restart();

    assertThatThrownBy(() -> fixture.supervisor.submitJob(session, target.id(), libraryId, PARAMETERS))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("unavailable");
  }

  @Test
  void saturatedPoolFailsTheNewJob() {
    LibraryId libraryId = submitLibrary(session);
    Target target = registerTarget(session);
    Executor full = command -> {
      throw new RejectedExecutionException("queue full");
    };
    JobSupervisor busy = new JobSupervisor(fixture.store, fixture.indexer, fixture.compositor,
        fixture.storage, full, fixture.clock, fixture.settings);

    assertThatThrownBy(() -> busy.submitJob(session, target.id(), libraryId, PARAMETERS))
        .isInstanceOf(ResourceExceededException.class);

    assertThat(busy.listJobs(session)).singleElement()
        .satisfies(job -> {
          assertThat(job.status()).isEqualTo(JobStatus.ERROR);
          assertThat(job.message()).isEqualTo(JobSupervisor.BUSY_MESSAGE);
        });
  }

  @Test
  void saturatedPoolFailsTheNewLibrary() {
    Executor full = command -> {
      throw new RejectedExecutionException("queue full");
    };
    fixture = new MosaicFixture(MosaicSettings.defaults(), full);

    assertThatThrownBy(() -> submitLibrary(session)).isInstanceOf(ResourceExceededException.class);

    assertThat(fixture.supervisor.listLibraries(session)).singleElement()
        .satisfies(library -> assertThat(library.status()).isEqualTo(LibraryStatus.ERROR));
    assertThat(fixture.storage.getTotalFileCount()).isZero();
  }

  @Test
  void deletedJobDisappearsWithItsResult() {
    LibraryId libraryId = submitLibrary(session);
    Target target = registerTarget(session);
    JobId jobId = fixture.supervisor.submitJob(session, target.id(), libraryId, PARAMETERS);

    fixture.supervisor.deleteJob(session, jobId);

    assertThat(fixture.storage.exists(StorageLayout.resultPath(jobId))).isFalse();
    assertThatThrownBy(() -> fixture.supervisor.jobView(session, jobId))
        .isInstanceOf(EntityNotFoundException.class);
  }

  @Test
  void pollingKeepsTheSessionAlive() {
    QueueingExecutor executor = new QueueingExecutor();
    fixture = new MosaicFixture(MosaicSettings.defaults(), executor);
    LibraryId libraryId = submitLibrary(session);

    fixture.clock.advance(Duration.ofMinutes(10));
    fixture.supervisor.libraryView(session, libraryId);
    fixture.supervisor.listJobs(session);
    fixture.clock.advance(Duration.ofMinutes(10));
    fixture.supervisor.libraryView(session, libraryId);
    fixture.clock.advance(Duration.ofMinutes(10));

    assertThat(fixture.sweeper.sweepExpired()).isZero();
    executor.runAll();
    assertThat(fixture.supervisor.libraryView(session, libraryId).status())
        .isEqualTo(LibraryStatus.READY);
  }

  @Test
  void errorThrownWhileIndexingFailsTheLibrary() {
    InMemoryStorageAdapter exhausted = new InMemoryStorageAdapter() {
      @Override
      public InputStream openStream(StoragePath path) {
        throw new OutOfMemoryError("Java heap space");
      }
    };
    fixture = new MosaicFixture(MosaicSettings.defaults(), Runnable::run, exhausted);

    LibraryId libraryId = submitLibrary(session);

    LibraryView library = fixture.supervisor.libraryView(session, libraryId);
    assertThat(library.status()).isEqualTo(LibraryStatus.ERROR);
    assertThat(library.message()).isEqualTo("Java heap space");
    assertThat(fixture.storage.exists(StorageLayout.archivePath(libraryId))).isFalse();
  }

  @Test
  void errorThrownWhileRenderingFailsOnlyThatJob() {
    AtomicBoolean armed = new AtomicBoolean();
    InMemoryStorageAdapter flaky = new InMemoryStorageAdapter() {
      @Override
      public byte[] read(StoragePath path) {
        if (armed.get() && path.path().startsWith("targets/")) {
          throw new StackOverflowError();
        }
        return super.read(path);
      }
    };
    fixture = new MosaicFixture(MosaicSettings.defaults(), Runnable::run, flaky);
    LibraryId libraryId = submitLibrary(session);
    Target target = registerTarget(session);

    armed.set(true);
    JobId failing = fixture.supervisor.submitJob(session, target.id(), libraryId, PARAMETERS);
    armed.set(false);
    JobId passing = fixture.supervisor.submitJob(session, target.id(), libraryId, PARAMETERS);

    JobView failed = fixture.supervisor.jobView(session, failing);
    assertThat(failed.status()).isEqualTo(JobStatus.ERROR);
    assertThat(failed.message()).isEqualTo("StackOverflowError");
    assertThat(fixture.supervisor.jobView(session, passing).status()).isEqualTo(JobStatus.DONE);
  }
}
