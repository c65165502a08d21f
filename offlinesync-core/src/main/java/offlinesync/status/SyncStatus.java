package offlinesync.status;

import java.time.Instant;

/**
 * Snapshot of the queue and connectivity state for display.
 *
 * @param online      whether the device is online
 * @param syncing     whether a sync run is in progress
 * @param queuedCount number of pending messages
 * @param failedCount number of messages whose retry budget is exhausted
 * @param lastSyncAt  time the last sync run finished, or {@code null} if none has
 */
public record SyncStatus(boolean online, boolean syncing, int queuedCount, int failedCount, Instant lastSyncAt) {
}
