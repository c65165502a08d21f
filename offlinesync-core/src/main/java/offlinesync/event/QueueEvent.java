package offlinesync.event;

import java.util.Objects;

/**
 * Lifecycle event published by the queue, the sync coordinator and the connectivity monitor.
 *
 * <p>Each event carries only the identifiers a listener needs to refresh its view.
 */
public sealed interface QueueEvent permits
    QueueEvent.Online,
    QueueEvent.Offline,
    QueueEvent.MessageQueued,
    QueueEvent.MessageRemoved,
    QueueEvent.MessageSynced,
    QueueEvent.MessageFailed,
    QueueEvent.MessageRequeued,
    QueueEvent.SyncStarted,
    QueueEvent.SyncCompleted,
    QueueEvent.SyncError,
    QueueEvent.AllQueuesCleared {

  QueueEventType type();

  /** Connectivity transitioned to online. */
  record Online() implements QueueEvent {
    @Override
    public QueueEventType type() {
      return QueueEventType.ONLINE;
    }
  }

  /** Connectivity transitioned to offline. */
  record Offline() implements QueueEvent {
    @Override
    public QueueEventType type() {
      return QueueEventType.OFFLINE;
    }
  }

  /** A message was durably enqueued. */
  record MessageQueued(String chatId, long queueId) implements QueueEvent {
    public MessageQueued {
      Objects.requireNonNull(chatId, "chatId");
    }

    @Override
    public QueueEventType type() {
      return QueueEventType.MESSAGE_QUEUED;
    }
  }

  /** A message was removed by an explicit remove or clear. */
  record MessageRemoved(long queueId) implements QueueEvent {
    @Override
    public QueueEventType type() {
      return QueueEventType.MESSAGE_REMOVED;
    }
  }

  /**
   * A message was delivered and removed from the queue.
   *
   * @param deliveredId backend-assigned id, or {@code null} if the transport returned none
   */
  record MessageSynced(String chatId, long queueId, String deliveredId) implements QueueEvent {
    public MessageSynced {
      Objects.requireNonNull(chatId, "chatId");
    }

    @Override
    public QueueEventType type() {
      return QueueEventType.MESSAGE_SYNCED;
    }
  }

  /** A message exhausted its retry budget and is now FAILED. */
  record MessageFailed(String chatId, long queueId, String error) implements QueueEvent {
    public MessageFailed {
      Objects.requireNonNull(chatId, "chatId");
    }

    @Override
    public QueueEventType type() {
      return QueueEventType.MESSAGE_FAILED;
    }
  }

  /** A FAILED message was put back into the active queue. */
  record MessageRequeued(String chatId, long queueId) implements QueueEvent {
    public MessageRequeued {
      Objects.requireNonNull(chatId, "chatId");
    }

    @Override
    public QueueEventType type() {
      return QueueEventType.MESSAGE_REQUEUED;
    }
  }

  /** A sync run started. */
  record SyncStarted() implements QueueEvent {
    @Override
    public QueueEventType type() {
      return QueueEventType.SYNC_STARTED;
    }
  }

  /** A sync run finished processing every pending message. */
  record SyncCompleted(int successCount, int failedCount) implements QueueEvent {
    @Override
    public QueueEventType type() {
      return QueueEventType.SYNC_COMPLETED;
    }
  }

  /** A sync run was aborted by a storage failure. */
  record SyncError(String error) implements QueueEvent {
    @Override
    public QueueEventType type() {
      return QueueEventType.SYNC_ERROR;
    }
  }

  /** Every queue entry was deleted. */
  record AllQueuesCleared(int cleared) implements QueueEvent {
    @Override
    public QueueEventType type() {
      return QueueEventType.ALL_QUEUES_CLEARED;
    }
  }
}
