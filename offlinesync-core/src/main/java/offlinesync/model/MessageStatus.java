package offlinesync.model;

/**
 * Lifecycle status of a queued message.
 *
 * <p>Delivered messages are deleted from the queue, so there is no "sent" status.
 * Each constant carries a stable integer {@link #code()} persisted in the database.
 */
public enum MessageStatus {
  /** Waiting for delivery; picked up by every sync run. */
  PENDING(0),
  /** Retry budget exhausted; excluded from automatic sync. */
  FAILED(1);

  private final int code;

  MessageStatus(int code) {
    this.code = code;
  }

  /**
   * Returns the integer code stored in the database.
   *
   * @return the status code
   */
  public int code() {
    return code;
  }

  /**
   * Resolves a status from its database code.
   *
   * @param code the persisted status code
   * @return the matching status
   * @throws IllegalArgumentException if no status has the given code
   */
  public static MessageStatus fromCode(int code) {
    for (MessageStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown message status code: " + code);
  }
}
