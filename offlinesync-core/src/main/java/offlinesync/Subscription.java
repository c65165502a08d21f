package offlinesync;

/**
 * Handle returned by listener registrations. Unsubscribing more than once is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

  /**
   * Stops further notifications to the registered listener.
   */
  void unsubscribe();

  @Override
  default void close() {
    unsubscribe();
  }
}
