package offlinesync.status;

import offlinesync.StorageException;
import offlinesync.event.QueueEvent;
import offlinesync.event.QueueEventListener;
import offlinesync.queue.FailedMessageManager;
import offlinesync.queue.QueueManager;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Event listener that maintains a {@link SyncStatus} snapshot for UI layers.
 *
 * <p>Counts are reloaded from the store whenever an event changes the queue and after
 * every sync run. If the reload fails the previous counts are kept.
 */
public final class SyncStatusTracker implements QueueEventListener {
  private static final Logger logger = Logger.getLogger(SyncStatusTracker.class.getName());

  private final QueueManager queue;
  private final FailedMessageManager failedMessages;
  private final Clock clock;

  private volatile boolean online;
  private volatile boolean syncing;
  private volatile int queuedCount;
  private volatile int failedCount;
  private volatile Instant lastSyncAt;

  public SyncStatusTracker(QueueManager queue, FailedMessageManager failedMessages, boolean initiallyOnline, Clock clock) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.failedMessages = Objects.requireNonNull(failedMessages, "failedMessages");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.online = initiallyOnline;
  }

  /**
   * Returns the current snapshot.
   */
  public SyncStatus snapshot() {
    return new SyncStatus(online, syncing, queuedCount, failedCount, lastSyncAt);
  }

  @Override
  public void onEvent(QueueEvent event) {
    switch (event.type()) {
      case ONLINE -> online = true;
      case OFFLINE -> online = false;
      case SYNC_STARTED -> syncing = true;
      case SYNC_COMPLETED, SYNC_ERROR -> {
        syncing = false;
        lastSyncAt = clock.instant();
        refreshCounts();
      }
      case MESSAGE_QUEUED, MESSAGE_REMOVED, MESSAGE_FAILED, MESSAGE_REQUEUED, ALL_QUEUES_CLEARED -> refreshCounts();
      case MESSAGE_SYNCED -> {
        // delivered entries are counted through MESSAGE_REMOVED
      }
    }
  }

  /**
   * Reloads the pending and failed counts from the store.
   */
  public void refreshCounts() {
    try {
      queuedCount = queue.count();
      failedCount = failedMessages.count(null);
    } catch (StorageException e) {
      logger.log(Level.WARNING, "Failed to refresh queue counts", e);
    }
  }
}
