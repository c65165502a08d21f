package offlinesync.event;

import offlinesync.Subscription;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link EventBus} backed by a copy-on-write listener list.
 *
 * <p>Listeners may subscribe or unsubscribe while an event is being published;
 * the change applies from the next publish. A listener that throws is logged
 * and skipped so that the remaining listeners still receive the event.
 */
public final class DefaultEventBus implements EventBus {
  private static final Logger logger = Logger.getLogger(DefaultEventBus.class.getName());

  private final List<Registration> registrations = new CopyOnWriteArrayList<>();

  @Override
  public Subscription subscribe(QueueEventListener listener) {
    return register(new Registration(null, Objects.requireNonNull(listener, "listener")));
  }

  @Override
  public Subscription subscribe(QueueEventType type, QueueEventListener listener) {
    Objects.requireNonNull(type, "type");
    return register(new Registration(type, Objects.requireNonNull(listener, "listener")));
  }

  @Override
  public void publish(QueueEvent event) {
    Objects.requireNonNull(event, "event");
    for (Registration registration : registrations) {
      if (registration.type != null && registration.type != event.type()) {
        continue;
      }
      try {
        registration.listener.onEvent(event);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Listener failed for event " + event.type().eventName(), e);
      }
    }
  }

  /**
   * Returns the number of active subscriptions.
   *
   * @return the subscription count
   */
  public int listenerCount() {
    return registrations.size();
  }

  private Subscription register(Registration registration) {
    registrations.add(registration);
    return () -> registrations.remove(registration);
  }

  // Identity equality: the same listener may be registered twice.
  private static final class Registration {
    final QueueEventType type;
    final QueueEventListener listener;

    Registration(QueueEventType type, QueueEventListener listener) {
      this.type = type;
      this.listener = listener;
    }
  }
}
