package offlinesync.sync;

import offlinesync.DeliveryResult;
import offlinesync.MessageDelivery;
import offlinesync.MessageNotFoundException;
import offlinesync.StorageException;
import offlinesync.connectivity.ConnectivityMonitor;
import offlinesync.event.EventBus;
import offlinesync.event.QueueEvent;
import offlinesync.model.MessageUpdate;
import offlinesync.model.QueuedMessage;
import offlinesync.queue.QueueManager;
import offlinesync.spi.MetricsExporter;
import offlinesync.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains pending queue entries through the {@link MessageDelivery} transport.
 *
 * <p>A run delivers every pending entry sequentially, oldest first. A delivered entry
 * is removed and reported with {@code MESSAGE_SYNCED}. A failed attempt increments the
 * entry's retry count; the attempt that reaches {@code maxRetries} moves the entry to
 * {@code FAILED} and reports {@code MESSAGE_FAILED}. Each attempt is bounded by the
 * delivery timeout.
 *
 * <p>Only one run executes at a time. A trigger that arrives while offline, while a run
 * is in progress, or after {@link #close()} completes immediately with a skipped
 * {@link SyncResult}; it is dropped, not queued. Runs execute on a dedicated daemon
 * thread, so {@link #syncQueue()} never blocks the caller.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see SyncCoordinator.Builder
 */
public final class SyncCoordinator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncCoordinator.class.getName());

  private final QueueManager queue;
  private final MessageDelivery delivery;
  private final ConnectivityMonitor connectivity;
  private final EventBus eventBus;
  private final MetricsExporter metrics;
  private final Duration deliveryTimeout;
  private final long drainTimeoutMs;
  private final Clock clock;

  private final Semaphore runPermit = new Semaphore(1);
  private final ExecutorService syncExecutor;
  private final ExecutorService deliveryExecutor;
  private volatile CompletableFuture<SyncResult> currentRun;
  private volatile boolean closed;

  private SyncCoordinator(Builder builder) {
    this.queue = Objects.requireNonNull(builder.queueManager, "queueManager");
    this.delivery = Objects.requireNonNull(builder.delivery, "delivery");
    this.connectivity = Objects.requireNonNull(builder.connectivityMonitor, "connectivityMonitor");
    this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
    Objects.requireNonNull(builder.deliveryTimeout, "deliveryTimeout");
    if (builder.deliveryTimeout.isNegative()) {
      throw new IllegalArgumentException("deliveryTimeout must be >= 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.deliveryTimeout = builder.deliveryTimeout;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.syncExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("offlinesync-sync-"));
    this.deliveryExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("offlinesync-delivery-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Triggers a sync run.
   *
   * <p>The connectivity and in-progress checks happen on the calling thread, so the
   * returned future is already complete when the trigger is skipped. The future never
   * completes exceptionally: storage failures are reported as {@link SyncResult#error}.
   *
   * @return the outcome of the run, or of the rejected trigger
   */
  public CompletableFuture<SyncResult> syncQueue() {
    if (closed) {
      return skip(SyncResult.SkipReason.CLOSED);
    }
    if (!connectivity.isOnline()) {
      logger.log(Level.FINE, "Sync skipped: offline");
      return skip(SyncResult.SkipReason.OFFLINE);
    }
    if (!runPermit.tryAcquire()) {
      logger.log(Level.FINE, "Sync skipped: a run is already in progress");
      return skip(SyncResult.SkipReason.SYNC_IN_PROGRESS);
    }
    CompletableFuture<SyncResult> run = new CompletableFuture<>();
    currentRun = run;
    try {
      syncExecutor.execute(() -> runAndRelease(run));
    } catch (RejectedExecutionException e) {
      runPermit.release();
      return skip(SyncResult.SkipReason.CLOSED);
    }
    return run;
  }

  /**
   * Returns whether a run is currently executing.
   *
   * @return {@code true} while a run holds the guard
   */
  public boolean isSyncInProgress() {
    return runPermit.availablePermits() == 0;
  }

  private CompletableFuture<SyncResult> skip(SyncResult.SkipReason reason) {
    metrics.incrementSyncSkipped();
    return CompletableFuture.completedFuture(SyncResult.skipped(reason));
  }

  private void runAndRelease(CompletableFuture<SyncResult> run) {
    SyncResult result;
    try {
      result = drain();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Sync run failed unexpectedly", e);
      result = SyncResult.error(describe(e), 0, 0);
    } finally {
      runPermit.release();
    }
    if (result.success()) {
      eventBus.publish(new QueueEvent.SyncCompleted(result.syncedCount(), result.failedCount()));
    } else {
      eventBus.publish(new QueueEvent.SyncError(result.error()));
    }
    run.complete(result);
  }

  private SyncResult drain() {
    metrics.incrementSyncRuns();
    eventBus.publish(new QueueEvent.SyncStarted());
    int synced = 0;
    int failed = 0;
    try {
      List<QueuedMessage> pending = queue.list();
      logger.log(Level.FINE, "Sync started with {0} pending messages", pending.size());
      for (QueuedMessage message : pending) {
        Outcome outcome = closed || Thread.currentThread().isInterrupted() ? Outcome.STOPPED : attempt(message);
        if (outcome == Outcome.STOPPED) {
          logger.log(Level.INFO, "Sync stopped by shutdown at message {0}; remaining messages stay queued",
              message.id());
          return SyncResult.completed(synced, failed);
        }
        if (outcome == Outcome.DELIVERED) {
          synced++;
        } else {
          failed++;
        }
      }
      recordQueueGauges();
    } catch (StorageException e) {
      logger.log(Level.SEVERE, "Sync aborted by storage failure", e);
      return SyncResult.error(describe(e), synced, failed);
    }
    logger.log(Level.INFO, "Sync completed: {0} synced, {1} failed", new Object[]{synced, failed});
    return SyncResult.completed(synced, failed);
  }

  /** Result of one delivery attempt. */
  private enum Outcome {
    DELIVERED,
    FAILED,
    /** Shutdown cut the attempt short; the entry was left as it was. */
    STOPPED
  }

  /**
   * Delivers one entry and records the outcome. An attempt cut short by shutdown
   * is not a failed attempt: the entry keeps its retry count and stays pending.
   *
   * @throws StorageException if the outcome cannot be recorded
   */
  private Outcome attempt(QueuedMessage message) {
    long start = System.nanoTime();
    String error;
    try {
      DeliveryResult result = deliverWithTimeout(message);
      if (result != null && result.success()) {
        metrics.recordDeliveryDurationMs(elapsedMs(start));
        queue.remove(message.id());
        metrics.incrementDeliverySuccess();
        logger.log(Level.FINE, "Delivered message {0} of chat {1}", new Object[]{message.id(), message.chatId()});
        eventBus.publish(new QueueEvent.MessageSynced(message.chatId(), message.id(), result.deliveredId()));
        return Outcome.DELIVERED;
      }
      error = result == null || result.reason() == null ? "Delivery rejected" : result.reason();
    } catch (TimeoutException e) {
      logger.log(Level.WARNING, "Delivery of message {0} timed out after {1} ms",
          new Object[]{message.id(), deliveryTimeout.toMillis()});
      error = "Delivery timed out after " + deliveryTimeout.toMillis() + " ms";
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      logger.log(Level.FINE, "Delivery of message " + message.id() + " failed", cause);
      error = describe(cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Outcome.STOPPED;
    } catch (RejectedExecutionException e) {
      return Outcome.STOPPED;
    }
    metrics.recordDeliveryDurationMs(elapsedMs(start));
    recordFailure(message, error);
    return Outcome.FAILED;
  }

  private DeliveryResult deliverWithTimeout(QueuedMessage message)
      throws ExecutionException, TimeoutException, InterruptedException {
    Future<DeliveryResult> future =
        deliveryExecutor.submit(() -> delivery.deliver(message.chatId(), message.payloadJson()));
    try {
      if (deliveryTimeout.isZero()) {
        return future.get();
      }
      return future.get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException | InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }

  private void recordFailure(QueuedMessage message, String error) {
    int retryCount = message.retryCount() + 1;
    Instant now = clock.instant();
    try {
      if (message.isLastAttempt()) {
        queue.update(message.id(), MessageUpdate.failed(retryCount, error, now));
        metrics.incrementDeliveryExhausted();
        logger.log(Level.WARNING, "Message {0} of chat {1} failed after {2} attempts: {3}",
            new Object[]{message.id(), message.chatId(), retryCount, error});
        eventBus.publish(new QueueEvent.MessageFailed(message.chatId(), message.id(), error));
      } else {
        queue.update(message.id(), MessageUpdate.retry(retryCount, error, now));
        metrics.incrementDeliveryFailure();
        logger.log(Level.FINE, "Message {0} attempt {1}/{2} failed: {3}",
            new Object[]{message.id(), retryCount, message.maxRetries(), error});
      }
    } catch (MessageNotFoundException e) {
      logger.log(Level.FINE, "Message {0} was removed during sync", message.id());
    }
  }

  private void recordQueueGauges() {
    metrics.recordQueueDepth(queue.count());
    Optional<QueuedMessage> oldest = queue.oldestPending();
    long lagMs = oldest.map(m -> Duration.between(m.queuedAt(), clock.instant()).toMillis()).orElse(0L);
    metrics.recordOldestLagMs(Math.max(0L, lagMs));
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private static String describe(Throwable t) {
    String message = t.getMessage();
    return message != null ? message : t.getClass().getName();
  }

  /**
   * Rejects new triggers, lets the running delivery finish within the drain timeout
   * and stops the worker threads. A run cut short by shutdown completes with
   * {@link SyncResult.SkipReason#CLOSED} if it has not completed already.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    syncExecutor.shutdown();
    try {
      if (!syncExecutor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting sync run");
        syncExecutor.shutdownNow();
        syncExecutor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      syncExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      deliveryExecutor.shutdownNow();
      CompletableFuture<SyncResult> run = currentRun;
      if (run != null) {
        run.complete(SyncResult.skipped(SyncResult.SkipReason.CLOSED));
      }
    }
  }

  /**
   * Builder for {@link SyncCoordinator}.
   */
  public static final class Builder {
    private QueueManager queueManager;
    private MessageDelivery delivery;
    private ConnectivityMonitor connectivityMonitor;
    private EventBus eventBus;
    private MetricsExporter metrics;
    private Duration deliveryTimeout = Duration.ofSeconds(30);
    private long drainTimeoutMs = 5000;
    private Clock clock;

    private Builder() {
    }

    public Builder queueManager(QueueManager queueManager) {
      this.queueManager = queueManager;
      return this;
    }

    public Builder delivery(MessageDelivery delivery) {
      this.delivery = delivery;
      return this;
    }

    public Builder connectivityMonitor(ConnectivityMonitor connectivityMonitor) {
      this.connectivityMonitor = connectivityMonitor;
      return this;
    }

    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the upper bound of a single delivery attempt. {@link Duration#ZERO} waits
     * indefinitely. Defaults to 30 seconds.
     */
    public Builder deliveryTimeout(Duration deliveryTimeout) {
      this.deliveryTimeout = deliveryTimeout;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for a running sync. Defaults to {@code 5000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public SyncCoordinator build() {
      return new SyncCoordinator(this);
    }
  }
}
