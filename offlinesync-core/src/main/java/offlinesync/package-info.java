/**
 * Durable offline message queue with connectivity-driven sync.
 *
 * <p>{@link offlinesync.OfflineSync} is the entry point. Producers enqueue opaque payloads
 * per chat; when the {@link offlinesync.connectivity.ConnectivityMonitor} reports a return
 * to online, the {@link offlinesync.sync.SyncCoordinator} delivers pending messages oldest
 * first through the injected {@link offlinesync.MessageDelivery}, retrying each up to its
 * retry budget. Progress is broadcast on the {@link offlinesync.event.EventBus}.
 */
package offlinesync;
