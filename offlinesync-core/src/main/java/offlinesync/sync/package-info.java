/**
 * Sync runs: the single-flight {@link offlinesync.sync.SyncCoordinator}, its
 * {@link offlinesync.sync.SyncResult} and the optional periodic {@link offlinesync.sync.SyncScheduler}.
 */
package offlinesync.sync;
