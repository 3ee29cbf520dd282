package com.streamfirst.mosaic.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class JobTest {

    private final Job queued = Job.queued(JobId.random(), SessionId.LEGACY, TargetId.random(),
            LibraryId.random(), JobParameters.DEFAULTS, Instant.EPOCH);

    @Test
    void runsThroughToDone() {
        StoragePath result = StoragePath.of("results", "x.jpg");

        Job done = queued.start("Loading").advance(40, "Compositing").complete(result);

        assertThat(done.getStatus()).isEqualTo(JobStatus.DONE);
        assertThat(done.getProgress()).isEqualTo(100);
        assertThat(done.getMessage()).isEqualTo("Done!");
        assertThat(done.getResultRef()).contains(result);
    }

    @Test
    void progressNeverMovesBackwards() {
        Job running = queued.start("Loading").advance(60, "Compositing");

        Job later = running.advance(30, null);

        assertThat(later.getProgress()).isEqualTo(60);
        assertThat(later.getMessage()).isEqualTo("Compositing");
        assertThat(running.advance(150, "x").getProgress()).isEqualTo(100);
    }

    @Test
    void terminalJobsDoNotChange() {
        Job failed = queued.fail("boom");

        assertThat(failed.getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(failed.getResultRef()).isEmpty();
        assertThatThrownBy(() -> failed.fail("again")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> failed.start("again")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cannotCompleteQueuedJob() {
        assertThatThrownBy(() -> queued.complete(StoragePath.of("r.jpg")))
                .isInstanceOf(IllegalStateException.class);
    }
}
