package offlinesync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A message persisted in the offline queue, as read back from the store.
 *
 * @param id            store-assigned identifier, increasing with insertion order
 * @param chatId        conversation the message belongs to
 * @param payloadJson   opaque message payload, never interpreted by the engine
 * @param queuedAt      time the message was enqueued; FIFO ordering key
 * @param status        current lifecycle status
 * @param retryCount    number of failed delivery attempts so far
 * @param maxRetries    retry budget fixed when the message was enqueued
 * @param lastError     reason of the last failed attempt, or {@code null}
 * @param lastAttemptAt time of the last failed attempt, or {@code null} if never attempted
 */
public record QueuedMessage(
    long id,
    String chatId,
    String payloadJson,
    Instant queuedAt,
    MessageStatus status,
    int retryCount,
    int maxRetries,
    String lastError,
    Instant lastAttemptAt
) {
  public QueuedMessage {
    Objects.requireNonNull(chatId, "chatId");
    Objects.requireNonNull(payloadJson, "payloadJson");
    Objects.requireNonNull(queuedAt, "queuedAt");
    Objects.requireNonNull(status, "status");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
  }

  /**
   * Returns whether this message is still eligible for automatic sync.
   *
   * @return {@code true} if the status is {@link MessageStatus#PENDING}
   */
  public boolean isPending() {
    return status == MessageStatus.PENDING;
  }

  /**
   * Returns whether the next failed attempt exhausts the retry budget.
   *
   * @return {@code true} if one more failure moves the message to {@link MessageStatus#FAILED}
   */
  public boolean isLastAttempt() {
    return retryCount + 1 >= maxRetries;
  }
}
