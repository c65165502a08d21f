package offlinesync.connectivity;

import offlinesync.Subscription;
import offlinesync.spi.ConnectivityProbe;
import offlinesync.util.DaemonThreadFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Probe that periodically checks whether the backend host accepts TCP connections.
 *
 * <p>{@link #start()} performs one check synchronously, so {@link #current()} reflects
 * a real observation as soon as the probe is started, then repeats the check with a
 * fixed delay on a daemon thread. Each result is reported to subscribers.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class HeartbeatConnectivityProbe implements ConnectivityProbe {
  private static final Logger logger = Logger.getLogger(HeartbeatConnectivityProbe.class.getName());

  /**
   * Single reachability check. The default implementation opens and closes a TCP socket.
   */
  @FunctionalInterface
  public interface ReachabilityCheck {
    boolean isReachable() throws IOException;
  }

  private final ReachabilityCheck check;
  private final Duration interval;
  private final List<Consumer<Boolean>> callbacks = new CopyOnWriteArrayList<>();

  private volatile boolean online;
  private ScheduledExecutorService scheduler;
  private volatile boolean closed;

  private HeartbeatConnectivityProbe(Builder builder) {
    Objects.requireNonNull(builder.interval, "interval");
    if (builder.interval.isZero() || builder.interval.isNegative()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    if (builder.check != null) {
      this.check = builder.check;
    } else {
      Objects.requireNonNull(builder.host, "host");
      if (builder.port <= 0 || builder.port > 65535) {
        throw new IllegalArgumentException("port must be in 1..65535");
      }
      Objects.requireNonNull(builder.connectTimeout, "connectTimeout");
      if (builder.connectTimeout.isNegative()) {
        throw new IllegalArgumentException("connectTimeout must be >= 0");
      }
      this.check = tcpCheck(builder.host, builder.port, (int) builder.connectTimeout.toMillis());
    }
    this.interval = builder.interval;
    this.online = builder.initiallyOnline;
  }

  public static Builder builder() {
    return new Builder();
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
   * Runs a first check and starts the periodic heartbeat. Subsequent calls are no-ops.
   */
  @Override
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("HeartbeatConnectivityProbe has been closed");
    }
    if (scheduler != null) {
      return;
    }
    checkNow();
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("offlinesync-heartbeat-"));
    long delayMs = interval.toMillis();
    scheduler.scheduleWithFixedDelay(this::checkNow, delayMs, delayMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Performs one reachability check and notifies subscribers. Called by the scheduler,
   * but may also be invoked directly.
   */
  public void checkNow() {
    if (closed) {
      return;
    }
    boolean reachable;
    try {
      reachable = check.isReachable();
    } catch (IOException e) {
      logger.log(Level.FINE, "Heartbeat check failed", e);
      reachable = false;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Heartbeat check threw unexpectedly", e);
      reachable = false;
    }
    online = reachable;
    for (Consumer<Boolean> callback : callbacks) {
      try {
        callback.accept(reachable);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Connectivity callback failed", e);
      }
    }
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
  }

  private static ReachabilityCheck tcpCheck(String host, int port, int timeoutMs) {
    return () -> {
      try (Socket socket = new Socket()) {
        socket.connect(new InetSocketAddress(host, port), timeoutMs);
        return true;
      }
    };
  }

  /**
   * Builder for {@link HeartbeatConnectivityProbe}.
   */
  public static final class Builder {
    private String host;
    private int port = 443;
    private Duration interval = Duration.ofSeconds(10);
    private Duration connectTimeout = Duration.ofSeconds(3);
    private boolean initiallyOnline;
    private ReachabilityCheck check;

    private Builder() {
    }

    /**
     * Sets the host to connect to. Required unless a custom {@link #check} is set.
     */
    public Builder host(String host) {
      this.host = host;
      return this;
    }

    /**
     * Sets the TCP port. Defaults to {@code 443}.
     */
    public Builder port(int port) {
      this.port = port;
      return this;
    }

    /**
     * Sets the delay between checks. Defaults to 10 seconds.
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Sets the connect timeout of a single check. Defaults to 3 seconds.
     */
    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    /**
     * Sets the state reported by {@link #current()} before the first check. Defaults to offline.
     */
    public Builder initiallyOnline(boolean initiallyOnline) {
      this.initiallyOnline = initiallyOnline;
      return this;
    }

    /**
     * Replaces the TCP connect check.
     */
    public Builder check(ReachabilityCheck check) {
      this.check = check;
      return this;
    }

    public HeartbeatConnectivityProbe build() {
      return new HeartbeatConnectivityProbe(this);
    }
  }
}
