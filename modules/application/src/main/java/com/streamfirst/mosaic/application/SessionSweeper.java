package com.streamfirst.mosaic.application;

import com.streamfirst.mosaic.domain.SessionId;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically deletes sessions that have been idle longer than the configured TTL, together with
 * everything they own.
 */
@Slf4j
public class SessionSweeper implements AutoCloseable {

  private final MosaicStateStore store;
  private final Clock clock;
  private final MosaicSettings settings;
  private ScheduledExecutorService scheduler;

  public SessionSweeper(MosaicStateStore store, Clock clock, MosaicSettings settings) {
    this.store = store;
    this.clock = clock;
    this.settings = settings;
  }

  /** Starts the background sweep; calling it again has no effect. */
  public synchronized void start() {
    if (scheduler != null) {
      return;
    }
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "session-sweeper");
              thread.setDaemon(true);
              return thread;
            });
    long interval = settings.getSweepInterval().toMillis();
    scheduler.scheduleWithFixedDelay(this::sweepSafely, interval, interval, TimeUnit.MILLISECONDS);
    log.info(
        "Session sweeper started: ttl {}, interval {}",
        settings.getSessionTtl(),
        settings.getSweepInterval());
  }

  /**
   * Deletes every session idle for longer than the TTL.
   *
   * @return number of sessions deleted
   */
  public int sweepExpired() {
    Instant deadline = clock.instant().minus(settings.getSessionTtl());
    List<SessionId> expired = store.inactiveSessions(deadline);
    int closed = 0;
    for (SessionId sessionId : expired) {
      try {
        closeSession(sessionId);
        closed++;
      } catch (RuntimeException e) {
        log.error("Failed to purge expired session {}", sessionId, e);
      }
    }
    if (closed > 0) {
      log.info("Swept {} expired sessions", closed);
    }
    return closed;
  }

  /** Deletes a session and everything it owns right away. */
  public void closeSession(SessionId sessionId) {
    store.purgeSession(sessionId);
  }

  private void sweepSafely() {
    try {
      sweepExpired();
    } catch (Exception e) {
      log.error("Session sweep failed", e);
    }
  }

  @Override
  public synchronized void close() {
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
      log.info("Session sweeper stopped");
    }
  }
}
