package offlinesync.sync;

import offlinesync.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic sync trigger for entries left pending after a failed attempt while the
 * device stays online.
 *
 * <p>Ticks that find the device offline or a run in progress are skipped by the
 * coordinator and have no effect.
 */
public final class SyncScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncScheduler.class.getName());

  private final SyncCoordinator coordinator;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  public SyncScheduler(SyncCoordinator coordinator, Duration interval) {
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.intervalMs = interval.toMillis();
  }

  /**
   * Starts the schedule. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SyncScheduler has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("offlinesync-resync-"));
    task = scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Triggers one sync. Called by the scheduler, but may also be invoked directly.
   */
  public void tick() {
    if (closed) {
      return;
    }
    try {
      coordinator.syncQueue();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Scheduled sync trigger failed", e);
    }
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (task != null) {
      task.cancel(false);
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
  }
}
