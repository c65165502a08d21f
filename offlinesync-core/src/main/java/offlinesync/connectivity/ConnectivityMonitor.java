package offlinesync.connectivity;

import offlinesync.Subscription;
import offlinesync.event.EventBus;
import offlinesync.event.QueueEvent;
import offlinesync.spi.ConnectivityProbe;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks online/offline state from a {@link ConnectivityProbe} and reacts to transitions.
 *
 * <p>The state starts from {@link ConnectivityProbe#current()}. Exactly one
 * {@code ONLINE} or {@code OFFLINE} event is published per transition; repeated
 * reports of the current state are ignored. On a transition to online every
 * registered online hook runs on the reporting thread, so hooks must not block.
 * Going offline does not interrupt work already in progress.
 */
public final class ConnectivityMonitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectivityMonitor.class.getName());

  private final ConnectivityProbe probe;
  private final EventBus eventBus;
  private final AtomicBoolean online;
  private final List<Runnable> onlineHooks = new CopyOnWriteArrayList<>();

  private Subscription probeSubscription;
  private boolean started;
  private volatile boolean closed;

  public ConnectivityMonitor(ConnectivityProbe probe, EventBus eventBus) {
    this.probe = Objects.requireNonNull(probe, "probe");
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    this.online = new AtomicBoolean(probe.current());
  }

  /**
   * Registers a hook run on every offline-to-online transition.
   *
   * @param hook the hook, typically a sync trigger
   * @return a handle that removes the hook
   */
  public Subscription onOnline(Runnable hook) {
    Objects.requireNonNull(hook, "hook");
    onlineHooks.add(hook);
    return () -> onlineHooks.remove(hook);
  }

  /**
   * Starts the probe and subscribes to its reports. A transition that happened
   * between construction and this call is published here.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ConnectivityMonitor has been closed");
    }
    if (started) {
      return;
    }
    started = true;
    probe.start();
    probeSubscription = probe.onChange(this::observe);
    observe(probe.current());
  }

  /**
   * Returns the current connectivity state.
   *
   * @return {@code true} if online
   */
  public boolean isOnline() {
    return online.get();
  }

  /**
   * Applies an observed state. Only a change from the current state has any effect.
   * Reports are applied one at a time so events are published in transition order.
   *
   * @param nowOnline the observed state
   */
  public synchronized void observe(boolean nowOnline) {
    if (closed) {
      return;
    }
    boolean previous = online.getAndSet(nowOnline);
    if (previous == nowOnline) {
      return;
    }
    if (nowOnline) {
      logger.log(Level.INFO, "Connectivity restored");
      eventBus.publish(new QueueEvent.Online());
      for (Runnable hook : onlineHooks) {
        try {
          hook.run();
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Online hook failed", e);
        }
      }
    } else {
      logger.log(Level.INFO, "Connectivity lost");
      eventBus.publish(new QueueEvent.Offline());
    }
  }

  /**
   * Stops listening to the probe. The probe itself is not closed.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (probeSubscription != null) {
      probeSubscription.unsubscribe();
      probeSubscription = null;
    }
    onlineHooks.clear();
  }
}
