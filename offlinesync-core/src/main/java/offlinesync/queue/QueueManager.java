package offlinesync.queue;

import offlinesync.MessageNotFoundException;
import offlinesync.StorageException;
import offlinesync.event.EventBus;
import offlinesync.event.QueueEvent;
import offlinesync.model.MessageStatus;
import offlinesync.model.MessageUpdate;
import offlinesync.model.QueuedMessage;
import offlinesync.spi.ConnectionProvider;
import offlinesync.spi.MessageStore;
import offlinesync.spi.MetricsExporter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Enqueue, inspect and clear operations on the persistent offline queue.
 *
 * <p>Every operation is a synchronous store call on its own connection. Enqueuing
 * never attempts delivery; the {@link offlinesync.sync.SyncCoordinator} drains the
 * queue when the device is online. Storage failures surface as {@link StorageException}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class QueueManager {
  private static final Logger logger = Logger.getLogger(QueueManager.class.getName());

  /** Retry budget given to new entries unless configured otherwise. */
  public static final int DEFAULT_MAX_RETRIES = 3;

  private final StoreAccess access;
  private final EventBus eventBus;
  private final MetricsExporter metrics;
  private final int maxRetries;
  private final Clock clock;

  private QueueManager(Builder builder) {
    this.access = new StoreAccess(builder.connectionProvider, builder.messageStore);
    this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
    if (builder.maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
    this.maxRetries = builder.maxRetries;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates or migrates the queue schema in one transaction. Safe to call on every startup.
   *
   * @throws StorageException if the schema cannot be prepared
   */
  public void open() {
    access.inTransaction("open message store", (store, conn) -> {
      store.open(conn);
      return null;
    });
  }

  /**
   * Durably stores a message for later delivery and publishes {@code MESSAGE_QUEUED}.
   *
   * @param chatId      the conversation id
   * @param payloadJson the opaque payload handed to the delivery function
   * @return the queue id of the new entry
   * @throws IllegalArgumentException if {@code chatId} is blank
   * @throws StorageException if the write fails; nothing is queued in that case
   */
  public long enqueue(String chatId, String payloadJson) {
    Objects.requireNonNull(chatId, "chatId");
    Objects.requireNonNull(payloadJson, "payloadJson");
    if (chatId.isBlank()) {
      throw new IllegalArgumentException("chatId must not be blank");
    }
    Instant now = clock.instant();
    long queueId = access.withConnection("enqueue message for chat " + chatId,
        (store, conn) -> store.insert(conn, chatId, payloadJson, now, maxRetries));
    metrics.incrementEnqueued();
    logger.log(Level.FINE, "Queued message {0} for chat {1}", new Object[]{queueId, chatId});
    eventBus.publish(new QueueEvent.MessageQueued(chatId, queueId));
    return queueId;
  }

  /**
   * Returns every pending entry, oldest first.
   */
  public List<QueuedMessage> list() {
    return list(null);
  }

  /**
   * Returns pending entries of one chat, oldest first.
   *
   * @param chatId the conversation id, or {@code null} for all chats
   * @return pending entries ordered by enqueue time
   */
  public List<QueuedMessage> list(String chatId) {
    return access.withConnection("list queued messages",
        (store, conn) -> store.findByStatus(conn, MessageStatus.PENDING, chatId, Integer.MAX_VALUE));
  }

  /**
   * Returns every stored entry, including failed ones, oldest first.
   *
   * @param chatId the conversation id, or {@code null} for all chats
   * @return all entries ordered by enqueue time
   */
  public List<QueuedMessage> listAll(String chatId) {
    return access.withConnection("list all messages",
        (store, conn) -> store.findAll(conn, chatId));
  }

  /**
   * Returns the number of pending entries.
   */
  public int count() {
    return count(null);
  }

  /**
   * Returns the number of pending entries of one chat.
   *
   * @param chatId the conversation id, or {@code null} for all chats
   * @return the pending count
   */
  public int count(String chatId) {
    return access.withConnection("count queued messages",
        (store, conn) -> store.countByStatus(conn, MessageStatus.PENDING, chatId));
  }

  /**
   * Looks up an entry by id, whatever its status.
   *
   * @param queueId the queue id
   * @return the entry, or empty if it does not exist
   */
  public Optional<QueuedMessage> get(long queueId) {
    return access.withConnection("load message " + queueId,
        (store, conn) -> store.findById(conn, queueId));
  }

  /**
   * Deletes an entry and publishes {@code MESSAGE_REMOVED} if it existed.
   *
   * @param queueId the queue id
   * @return {@code true} if an entry was deleted
   */
  public boolean remove(long queueId) {
    int deleted = access.withConnection("remove message " + queueId,
        (store, conn) -> store.delete(conn, queueId));
    if (deleted == 0) {
      return false;
    }
    eventBus.publish(new QueueEvent.MessageRemoved(queueId));
    return true;
  }

  /**
   * Returns the oldest pending entry.
   *
   * @return the entry, or empty if nothing is pending
   */
  public Optional<QueuedMessage> oldestPending() {
    List<QueuedMessage> oldest = access.withConnection("load oldest queued message",
        (store, conn) -> store.findByStatus(conn, MessageStatus.PENDING, null, 1));
    return oldest.isEmpty() ? Optional.empty() : Optional.of(oldest.get(0));
  }

  /**
   * Applies a partial update to an entry.
   *
   * @param queueId the queue id
   * @param update  the fields to change
   * @throws MessageNotFoundException if the entry no longer exists
   */
  public void update(long queueId, MessageUpdate update) {
    Objects.requireNonNull(update, "update");
    int updated = access.withConnection("update message " + queueId,
        (store, conn) -> store.update(conn, queueId, update));
    if (updated == 0) {
      throw new MessageNotFoundException(queueId);
    }
  }

  /**
   * Removes every pending entry of one chat in a single transaction, publishing
   * {@code MESSAGE_REMOVED} for each. Failed entries of the chat are kept.
   *
   * @param chatId the conversation id
   * @return the number of entries removed
   */
  public int clearChat(String chatId) {
    Objects.requireNonNull(chatId, "chatId");
    List<Long> removed = access.inTransaction("clear queue of chat " + chatId, (store, conn) -> {
      List<Long> ids = new ArrayList<>();
      for (QueuedMessage message : store.findByStatus(conn, MessageStatus.PENDING, chatId, Integer.MAX_VALUE)) {
        if (store.delete(conn, message.id()) > 0) {
          ids.add(message.id());
        }
      }
      return ids;
    });
    for (Long queueId : removed) {
      eventBus.publish(new QueueEvent.MessageRemoved(queueId));
    }
    logger.log(Level.FINE, "Cleared {0} queued messages of chat {1}", new Object[]{removed.size(), chatId});
    return removed.size();
  }

  /**
   * Deletes every entry, pending or failed, and publishes {@code ALL_QUEUES_CLEARED}.
   *
   * @return the number of entries deleted
   */
  public int clearAll() {
    int cleared = access.withConnection("clear all queues", MessageStore::clear);
    logger.log(Level.INFO, "Cleared all queues ({0} messages)", cleared);
    eventBus.publish(new QueueEvent.AllQueuesCleared(cleared));
    return cleared;
  }

  /**
   * Returns the configured retry budget for new entries.
   */
  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Builder for {@link QueueManager}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private MessageStore messageStore;
    private EventBus eventBus;
    private MetricsExporter metrics;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private Clock clock;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder messageStore(MessageStore messageStore) {
      this.messageStore = messageStore;
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
     * Sets the retry budget given to new entries. Defaults to {@value QueueManager#DEFAULT_MAX_RETRIES}.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public QueueManager build() {
      return new QueueManager(this);
    }
  }
}
