package offlinesync.connectivity;

import offlinesync.Subscription;
import offlinesync.spi.ConnectivityProbe;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Probe whose state is set by the host application, typically from a platform
 * network callback, or by tests.
 *
 * <p>Every {@link #setOnline(boolean)} call is forwarded to subscribers, including
 * re-confirmations of the current state.
 */
public final class ManualConnectivityProbe implements ConnectivityProbe {
  private final List<Consumer<Boolean>> callbacks = new CopyOnWriteArrayList<>();
  private volatile boolean online;

  public ManualConnectivityProbe(boolean initiallyOnline) {
    this.online = initiallyOnline;
  }

  @Override
  public boolean current() {
    return online;
  }

  @Override
  public Subscription onChange(Consumer<Boolean> callback) {
    Objects.requireNonNull(callback, "callback");
    callbacks.add(callback);
    return () -> callbacks.remove(callback);
  }

  /**
   * Reports a new reachability state to subscribers.
   *
   * @param online {@code true} if the backend is reachable
   */
  public void setOnline(boolean online) {
    this.online = online;
    for (Consumer<Boolean> callback : callbacks) {
      callback.accept(online);
    }
  }
}
