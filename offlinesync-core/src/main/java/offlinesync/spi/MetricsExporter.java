package offlinesync.spi;

/**
 * Observability hook for exporting queue and sync counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of messages durably enqueued.
     */
    void incrementEnqueued();

    /**
     * Increments the count of messages delivered and removed from the queue.
     */
    void incrementDeliverySuccess();

    /**
     * Increments the count of failed attempts that left the message pending.
     */
    void incrementDeliveryFailure();

    /**
     * Increments the count of messages moved to FAILED (retry budget exhausted).
     */
    void incrementDeliveryExhausted();

    /**
     * Increments the count of sync runs that actually started.
     */
    default void incrementSyncRuns() {
    }

    /**
     * Increments the count of sync triggers rejected because the device was offline
     * or another run was in progress.
     */
    default void incrementSyncSkipped() {
    }

    /**
     * Records the number of pending messages.
     *
     * @param depth pending message count
     */
    void recordQueueDepth(int depth);

    /**
     * Records the age (in milliseconds) of the oldest pending message.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    void recordOldestLagMs(long lagMs);

    /**
     * Records the duration of a single delivery attempt.
     *
     * @param durationMs attempt duration in milliseconds (always non-negative)
     */
    default void recordDeliveryDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }

        @Override
        public void incrementDeliveryExhausted() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
