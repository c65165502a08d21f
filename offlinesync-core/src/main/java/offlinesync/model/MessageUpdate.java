package offlinesync.model;

import java.time.Instant;

/**
 * Partial update applied to a queued message. {@code null} fields are left unchanged.
 *
 * @param retryCount    new retry count, or {@code null}
 * @param status        new status, or {@code null}
 * @param lastError     new error description, or {@code null}
 * @param lastAttemptAt new last-attempt time, or {@code null}
 */
public record MessageUpdate(
    Integer retryCount,
    MessageStatus status,
    String lastError,
    Instant lastAttemptAt
) {
  public MessageUpdate {
    if (retryCount != null && retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
  }

  /**
   * Records a failed attempt that leaves the message pending.
   */
  public static MessageUpdate retry(int retryCount, String error, Instant attemptedAt) {
    return new MessageUpdate(retryCount, MessageStatus.PENDING, error, attemptedAt);
  }

  /**
   * Records the failed attempt that exhausts the retry budget.
   */
  public static MessageUpdate failed(int retryCount, String error, Instant attemptedAt) {
    return new MessageUpdate(retryCount, MessageStatus.FAILED, error, attemptedAt);
  }

  /**
   * Returns whether this update changes nothing.
   *
   * @return {@code true} if every field is {@code null}
   */
  public boolean isEmpty() {
    return retryCount == null && status == null && lastError == null && lastAttemptAt == null;
  }
}
