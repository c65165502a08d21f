package offlinesync.spi;

import offlinesync.Subscription;

import java.util.function.Consumer;

/**
 * Source of the platform's network reachability signal.
 *
 * <p>A probe may report the same state repeatedly; the
 * {@link offlinesync.connectivity.ConnectivityMonitor} filters out re-confirmations
 * and only reacts to transitions.
 */
public interface ConnectivityProbe extends AutoCloseable {

    /**
     * Returns the last known reachability state.
     *
     * @return {@code true} if the backend is believed reachable
     */
    boolean current();

    /**
     * Registers a callback invoked with the observed state whenever the probe
     * learns about it.
     *
     * @param callback receives {@code true} for online, {@code false} for offline
     * @return a handle that stops further callbacks
     */
    Subscription onChange(Consumer<Boolean> callback);

    /**
     * Starts any background observation. Called once by the monitor before subscribing.
     */
    default void start() {
    }

    /**
     * Stops background observation and releases resources.
     */
    @Override
    default void close() {
    }
}
