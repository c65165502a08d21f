package offlinesync.event;

/**
 * Receives events published on an {@link EventBus}.
 *
 * <p>Listeners run synchronously on the publishing thread and should return quickly.
 * Exceptions thrown by a listener are logged by the bus and do not reach the publisher.
 */
@FunctionalInterface
public interface QueueEventListener {

  void onEvent(QueueEvent event);
}
