/**
 * Display state: {@link offlinesync.status.SyncStatusTracker} folds queue events into a
 * {@link offlinesync.status.SyncStatus} snapshot.
 */
package offlinesync.status;
