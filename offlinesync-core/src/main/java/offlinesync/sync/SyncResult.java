package offlinesync.sync;

/**
 * Outcome of a {@link SyncCoordinator#syncQueue()} call.
 *
 * <p>Exactly one of three shapes: a completed run ({@code success} true, counts set),
 * a skipped trigger ({@code skipReason} set) or a run aborted by a storage failure
 * ({@code error} set, counts reflect the entries processed before the failure).
 *
 * @param success     whether a run started and processed every pending entry
 * @param skipReason  why the trigger was rejected, or {@code null}
 * @param syncedCount entries delivered and removed
 * @param failedCount entries whose attempt failed in this run
 * @param error       storage failure description, or {@code null}
 */
public record SyncResult(boolean success, SkipReason skipReason, int syncedCount, int failedCount, String error) {

  /**
   * Reasons a sync trigger is rejected without touching the queue.
   */
  public enum SkipReason {
    OFFLINE("offline"),
    SYNC_IN_PROGRESS("sync_in_progress"),
    CLOSED("closed");

    private final String reason;

    SkipReason(String reason) {
      this.reason = reason;
    }

    public String reason() {
      return reason;
    }
  }

  public static SyncResult completed(int syncedCount, int failedCount) {
    return new SyncResult(true, null, syncedCount, failedCount, null);
  }

  public static SyncResult skipped(SkipReason reason) {
    return new SyncResult(false, reason, 0, 0, null);
  }

  public static SyncResult error(String error, int syncedCount, int failedCount) {
    return new SyncResult(false, null, syncedCount, failedCount, error);
  }

  /**
   * Returns whether the trigger was rejected before a run started.
   */
  public boolean isSkipped() {
    return skipReason != null;
  }
}
