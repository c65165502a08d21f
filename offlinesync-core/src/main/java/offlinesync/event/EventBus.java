package offlinesync.event;

import offlinesync.Subscription;

/**
 * Synchronous publish/subscribe channel for queue lifecycle events.
 *
 * @see DefaultEventBus
 */
public interface EventBus {

  /**
   * Subscribes a listener to every event type.
   *
   * @param listener the listener
   * @return a handle that removes the listener
   */
  Subscription subscribe(QueueEventListener listener);

  /**
   * Subscribes a listener to a single event type.
   *
   * @param type     the event type of interest
   * @param listener the listener
   * @return a handle that removes the listener
   */
  Subscription subscribe(QueueEventType type, QueueEventListener listener);

  /**
   * Delivers an event to every matching listener, in subscription order.
   *
   * @param event the event to publish
   */
  void publish(QueueEvent event);
}
