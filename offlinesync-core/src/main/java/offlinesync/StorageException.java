package offlinesync;

/**
 * Thrown when the persistent queue cannot be opened, read or written.
 *
 * <p>Storage failures are never retried automatically. Callers of queue operations
 * receive this exception directly; inside a sync run it aborts the run and is
 * reported through a {@code SYNC_ERROR} event.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
