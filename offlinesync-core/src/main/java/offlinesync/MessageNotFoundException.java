package offlinesync;

/**
 * Thrown when an update targets a queue entry that no longer exists,
 * for example because it was cleared while a sync run was in progress.
 */
public class MessageNotFoundException extends StorageException {
  private final long queueId;

  public MessageNotFoundException(long queueId) {
    super("Message not found: " + queueId);
    this.queueId = queueId;
  }

  public long queueId() {
    return queueId;
  }
}
