package offlinesync.queue;

import offlinesync.event.EventBus;
import offlinesync.event.QueueEvent;
import offlinesync.model.MessageStatus;
import offlinesync.model.QueuedMessage;
import offlinesync.spi.ConnectionProvider;
import offlinesync.spi.MessageStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Facade for querying, counting, requeuing and discarding messages whose retry budget
 * is exhausted.
 *
 * <p>Failed messages are never purged automatically; they stay in the store until
 * requeued, discarded or cleared.
 */
public final class FailedMessageManager {
  private static final Logger logger = Logger.getLogger(FailedMessageManager.class.getName());

  private final StoreAccess access;
  private final EventBus eventBus;

  public FailedMessageManager(ConnectionProvider connectionProvider, MessageStore messageStore, EventBus eventBus) {
    this.access = new StoreAccess(connectionProvider, messageStore);
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
  }

  /**
   * Queries failed messages.
   *
   * @param chatId optional conversation filter ({@code null} for all)
   * @param limit  maximum number of messages to return
   * @return failed messages, oldest first
   */
  public List<QueuedMessage> query(String chatId, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return access.withConnection("query failed messages",
        (store, conn) -> store.findByStatus(conn, MessageStatus.FAILED, chatId, limit));
  }

  /**
   * Counts failed messages.
   *
   * @param chatId optional conversation filter ({@code null} for all)
   * @return the number of failed messages
   */
  public int count(String chatId) {
    return access.withConnection("count failed messages",
        (store, conn) -> store.countByStatus(conn, MessageStatus.FAILED, chatId));
  }

  /**
   * Puts a failed message back into the active queue with a fresh retry budget and
   * publishes {@code MESSAGE_REQUEUED}. It is delivered by the next sync run.
   *
   * @param queueId the queue id
   * @return {@code true} if the message was requeued, {@code false} if not found or not failed
   */
  public boolean retry(long queueId) {
    Optional<QueuedMessage> requeued = access.withConnection("requeue message " + queueId, (store, conn) -> {
      if (store.requeueFailed(conn, queueId) == 0) {
        return Optional.<QueuedMessage>empty();
      }
      return store.findById(conn, queueId);
    });
    requeued.ifPresent(message -> {
      logger.log(Level.INFO, "Requeued failed message {0}", queueId);
      eventBus.publish(new QueueEvent.MessageRequeued(message.chatId(), queueId));
    });
    return requeued.isPresent();
  }

  /**
   * Requeues every failed message, optionally limited to one chat.
   *
   * @param chatId optional conversation filter ({@code null} for all)
   * @return the number of messages requeued
   */
  public int retryAll(String chatId) {
    List<QueuedMessage> failed = access.withConnection("query failed messages",
        (store, conn) -> store.findByStatus(conn, MessageStatus.FAILED, chatId, Integer.MAX_VALUE));
    int requeued = 0;
    for (QueuedMessage message : failed) {
      if (retry(message.id())) {
        requeued++;
      }
    }
    return requeued;
  }

  /**
   * Deletes a failed message and publishes {@code MESSAGE_REMOVED}. Pending messages
   * are not touched.
   *
   * @param queueId the queue id
   * @return {@code true} if a failed message was deleted
   */
  public boolean discard(long queueId) {
    boolean deleted = access.inTransaction("discard message " + queueId, (store, conn) -> {
      Optional<QueuedMessage> message = store.findById(conn, queueId);
      if (message.isEmpty() || message.get().status() != MessageStatus.FAILED) {
        return false;
      }
      return store.delete(conn, queueId) > 0;
    });
    if (deleted) {
      eventBus.publish(new QueueEvent.MessageRemoved(queueId));
    }
    return deleted;
  }
}
