package offlinesync.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import offlinesync.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code offlinesync.enqueued}: messages durably queued</li>
 *   <li>{@code offlinesync.delivery.success}: messages delivered and removed</li>
 *   <li>{@code offlinesync.delivery.failure}: failed attempts left pending for retry</li>
 *   <li>{@code offlinesync.delivery.exhausted}: messages moved to FAILED</li>
 *   <li>{@code offlinesync.sync.runs}: sync runs started</li>
 *   <li>{@code offlinesync.sync.skipped}: sync triggers rejected</li>
 * </ul>
 *
 * <h3>Timers and gauges</h3>
 * <ul>
 *   <li>{@code offlinesync.delivery.duration}: duration of single delivery attempts</li>
 *   <li>{@code offlinesync.queue.depth}: pending messages after the last run</li>
 *   <li>{@code offlinesync.lag.oldest.ms}: age of the oldest pending message</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  /** Meter name prefix used unless another is given. */
  public static final String DEFAULT_PREFIX = "offlinesync";

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Counter deliveryExhausted;
  private final Counter syncRuns;
  private final Counter syncSkipped;
  private final Timer deliveryDuration;
  private final Gauge depthGauge;
  private final Gauge lagGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "offlinesync"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for apps running several queues.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "chat.offline"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.enqueued = Counter.builder(namePrefix + ".enqueued")
        .description("Messages durably queued")
        .register(registry);
    this.deliverySuccess = Counter.builder(namePrefix + ".delivery.success")
        .description("Messages delivered and removed from the queue")
        .register(registry);
    this.deliveryFailure = Counter.builder(namePrefix + ".delivery.failure")
        .description("Failed delivery attempts (will retry)")
        .register(registry);
    this.deliveryExhausted = Counter.builder(namePrefix + ".delivery.exhausted")
        .description("Messages moved to FAILED after exhausting retries")
        .register(registry);
    this.syncRuns = Counter.builder(namePrefix + ".sync.runs")
        .description("Sync runs started")
        .register(registry);
    this.syncSkipped = Counter.builder(namePrefix + ".sync.skipped")
        .description("Sync triggers rejected (offline, in progress or closed)")
        .register(registry);
    this.deliveryDuration = Timer.builder(namePrefix + ".delivery.duration")
        .description("Duration of single delivery attempts")
        .register(registry);

    this.depthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .description("Pending messages")
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .description("Age of the oldest pending message in milliseconds")
        .register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementDeliveryExhausted() {
    if (closed) return;
    deliveryExhausted.increment();
  }

  @Override
  public void incrementSyncRuns() {
    if (closed) return;
    syncRuns.increment();
  }

  @Override
  public void incrementSyncSkipped() {
    if (closed) return;
    syncSkipped.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    if (closed) return;
    oldestLagMs.set(lagMs);
  }

  @Override
  public void recordDeliveryDurationMs(long durationMs) {
    if (closed) return;
    deliveryDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link offlinesync.OfflineSync#close()} calls this so that a closed queue
   * leaves no stale gauges behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(enqueued, deliverySuccess, deliveryFailure, deliveryExhausted,
        syncRuns, syncSkipped, deliveryDuration, depthGauge, lagGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
