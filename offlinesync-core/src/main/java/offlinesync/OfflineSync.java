package offlinesync;

import offlinesync.connectivity.ConnectivityMonitor;
import offlinesync.event.DefaultEventBus;
import offlinesync.event.EventBus;
import offlinesync.event.QueueEventListener;
import offlinesync.event.QueueEventType;
import offlinesync.model.QueuedMessage;
import offlinesync.queue.FailedMessageManager;
import offlinesync.queue.QueueManager;
import offlinesync.spi.ConnectionProvider;
import offlinesync.spi.ConnectivityProbe;
import offlinesync.spi.MessageStore;
import offlinesync.spi.MetricsExporter;
import offlinesync.status.SyncStatus;
import offlinesync.status.SyncStatusTracker;
import offlinesync.sync.SyncCoordinator;
import offlinesync.sync.SyncResult;
import offlinesync.sync.SyncScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the queue, connectivity monitor, sync coordinator
 * and status tracker into a single {@link AutoCloseable} unit.
 *
 * <p>Building opens (and if needed migrates) the store, starts the connectivity probe
 * and, when online, runs one sync for messages left over from a previous process.
 * From then on every offline-to-online transition triggers a sync.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (OfflineSync sync = OfflineSync.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .messageStore(new SqliteMessageStore())
 *     .delivery((chatId, payload) -> DeliveryResult.delivered(api.send(chatId, payload)))
 *     .connectivityProbe(probe)
 *     .build()) {
 *   sync.subscribe(QueueEventType.MESSAGE_FAILED, event -> showRetryBadge(event));
 *   sync.enqueue("chat-42", "{\"body\":\"hello\"}");
 * }
 * }</pre>
 *
 * @see QueueManager
 * @see SyncCoordinator
 * @see ConnectivityMonitor
 */
public final class OfflineSync implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OfflineSync.class.getName());

  private final QueueManager queue;
  private final FailedMessageManager failedMessages;
  private final EventBus eventBus;
  private final ConnectivityMonitor connectivity;
  private final ConnectivityProbe probe;
  private final SyncCoordinator coordinator;
  private final SyncScheduler scheduler;
  private final SyncStatusTracker statusTracker;
  private final MetricsExporter metrics;

  private OfflineSync(QueueManager queue, FailedMessageManager failedMessages, EventBus eventBus,
      ConnectivityMonitor connectivity, ConnectivityProbe probe, SyncCoordinator coordinator,
      SyncScheduler scheduler, SyncStatusTracker statusTracker, MetricsExporter metrics) {
    this.queue = queue;
    this.failedMessages = failedMessages;
    this.eventBus = eventBus;
    this.connectivity = connectivity;
    this.probe = probe;
    this.coordinator = coordinator;
    this.scheduler = scheduler;
    this.statusTracker = statusTracker;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Durably queues a message for delivery.
   *
   * @see QueueManager#enqueue(String, String)
   */
  public long enqueue(String chatId, String payloadJson) {
    return queue.enqueue(chatId, payloadJson);
  }

  /**
   * Returns the pending messages of one chat, or of all chats if {@code chatId} is {@code null}.
   */
  public List<QueuedMessage> queuedMessages(String chatId) {
    return queue.list(chatId);
  }

  /**
   * Triggers a sync run.
   *
   * @see SyncCoordinator#syncQueue()
   */
  public CompletableFuture<SyncResult> syncQueue() {
    return coordinator.syncQueue();
  }

  /**
   * Removes the pending messages of one chat.
   *
   * @return the number of messages removed
   */
  public int clearChatQueue(String chatId) {
    return queue.clearChat(chatId);
  }

  /**
   * Removes every queued message.
   *
   * @return the number of messages removed
   */
  public int clearAllQueues() {
    return queue.clearAll();
  }

  public Subscription subscribe(QueueEventListener listener) {
    return eventBus.subscribe(listener);
  }

  public Subscription subscribe(QueueEventType type, QueueEventListener listener) {
    return eventBus.subscribe(type, listener);
  }

  public boolean isOnline() {
    return connectivity.isOnline();
  }

  public SyncStatus status() {
    return statusTracker.snapshot();
  }

  public QueueManager queue() {
    return queue;
  }

  public FailedMessageManager failedMessages() {
    return failedMessages;
  }

  public SyncCoordinator coordinator() {
    return coordinator;
  }

  public EventBus eventBus() {
    return eventBus;
  }

  public ConnectivityMonitor connectivity() {
    return connectivity;
  }

  /**
   * Shuts down components in order: scheduler, connectivity monitor and probe, coordinator.
   * Queued messages stay in the store for the next start.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (scheduler != null) {
      try {
        scheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      connectivity.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      probe.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      coordinator.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link OfflineSync}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private MessageStore messageStore;
    private MessageDelivery delivery;
    private ConnectivityProbe connectivityProbe;
    private EventBus eventBus;
    private MetricsExporter metrics;
    private int maxRetries = QueueManager.DEFAULT_MAX_RETRIES;
    private Duration deliveryTimeout = Duration.ofSeconds(30);
    private boolean syncOnStart = true;
    private Duration resyncInterval = Duration.ZERO;
    private long drainTimeoutMs = 5000;
    private Clock clock;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Sets the connection provider for the queue database.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the message store.
     *
     * <p><b>Required.</b>
     */
    public Builder messageStore(MessageStore messageStore) {
      this.messageStore = messageStore;
      return this;
    }

    /**
     * Sets the transport used to deliver queued messages.
     *
     * <p><b>Required.</b>
     */
    public Builder delivery(MessageDelivery delivery) {
      this.delivery = delivery;
      return this;
    }

    /**
     * Sets the source of the online/offline signal.
     *
     * <p><b>Required.</b> The probe is started on build and closed with the composite.
     */
    public Builder connectivityProbe(ConnectivityProbe connectivityProbe) {
      this.connectivityProbe = connectivityProbe;
      return this;
    }

    /**
     * Sets the event bus.
     *
     * <p>Optional. Defaults to a new {@link DefaultEventBus}.
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the retry budget of newly queued messages.
     *
     * <p>Optional. Defaults to {@code 3}.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the upper bound of a single delivery attempt; {@link Duration#ZERO} disables it.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder deliveryTimeout(Duration deliveryTimeout) {
      this.deliveryTimeout = deliveryTimeout;
      return this;
    }

    /**
     * Sets whether a sync runs right after build when the device is online.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder syncOnStart(boolean syncOnStart) {
      this.syncOnStart = syncOnStart;
      return this;
    }

    /**
     * Sets the interval of the periodic sync trigger; {@link Duration#ZERO} disables it.
     *
     * <p>Optional. Defaults to disabled.
     */
    public Builder resyncInterval(Duration resyncInterval) {
      this.resyncInterval = resyncInterval;
      return this;
    }

    /**
     * Sets how long {@link OfflineSync#close()} waits for a running sync.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the clock used for enqueue and attempt timestamps.
     *
     * <p>Optional. Defaults to the system UTC clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Opens the store and starts the engine. If a later step fails, components
     * already started are closed before rethrowing.
     *
     * @throws StorageException if the store cannot be opened
     * @throws IllegalStateException if called more than once
     */
    public OfflineSync build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(messageStore, "messageStore");
      Objects.requireNonNull(delivery, "delivery");
      Objects.requireNonNull(connectivityProbe, "connectivityProbe");
      Objects.requireNonNull(resyncInterval, "resyncInterval");
      if (resyncInterval.isNegative()) {
        throw new IllegalArgumentException("resyncInterval must be >= 0");
      }

      EventBus bus = eventBus != null ? eventBus : new DefaultEventBus();
      MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();

      QueueManager queue = QueueManager.builder()
          .connectionProvider(connectionProvider)
          .messageStore(messageStore)
          .eventBus(bus)
          .metrics(exporter)
          .maxRetries(maxRetries)
          .clock(effectiveClock)
          .build();
      queue.open();
      FailedMessageManager failed = new FailedMessageManager(connectionProvider, messageStore, bus);

      ConnectivityMonitor monitor = new ConnectivityMonitor(connectivityProbe, bus);
      SyncCoordinator coordinator = SyncCoordinator.builder()
          .queueManager(queue)
          .delivery(delivery)
          .connectivityMonitor(monitor)
          .eventBus(bus)
          .metrics(exporter)
          .deliveryTimeout(deliveryTimeout)
          .drainTimeoutMs(drainTimeoutMs)
          .clock(effectiveClock)
          .build();
      SyncScheduler scheduler = null;
      try {
        SyncStatusTracker tracker = new SyncStatusTracker(queue, failed, monitor.isOnline(), effectiveClock);
        bus.subscribe(tracker);
        tracker.refreshCounts();

        monitor.onOnline(coordinator::syncQueue);
        monitor.start();
        if (!resyncInterval.isZero()) {
          scheduler = new SyncScheduler(coordinator, resyncInterval);
          scheduler.start();
        }
        if (syncOnStart && monitor.isOnline()) {
          coordinator.syncQueue();
        }
        logger.log(Level.INFO, "Offline sync started (online={0}, pending={1})",
            new Object[]{monitor.isOnline(), tracker.snapshot().queuedCount()});
        return new OfflineSync(queue, failed, bus, monitor, connectivityProbe, coordinator,
            scheduler, tracker, exporter);
      } catch (RuntimeException e) {
        if (scheduler != null) {
          scheduler.close();
        }
        monitor.close();
        coordinator.close();
        throw e;
      }
    }
  }
}
