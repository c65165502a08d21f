package offlinesync.event;

/**
 * Kinds of lifecycle events broadcast on the {@link EventBus}.
 */
public enum QueueEventType {
  ONLINE("online"),
  OFFLINE("offline"),
  MESSAGE_QUEUED("messageQueued"),
  MESSAGE_REMOVED("messageRemoved"),
  MESSAGE_SYNCED("messageSynced"),
  MESSAGE_FAILED("messageFailed"),
  MESSAGE_REQUEUED("messageRequeued"),
  SYNC_STARTED("syncStarted"),
  SYNC_COMPLETED("syncCompleted"),
  SYNC_ERROR("syncError"),
  ALL_QUEUES_CLEARED("allQueuesCleared");

  private final String eventName;

  QueueEventType(String eventName) {
    this.eventName = eventName;
  }

  /**
   * Returns the wire name used when events are forwarded to a UI layer.
   *
   * @return the event name, e.g. {@code "messageQueued"}
   */
  public String eventName() {
    return eventName;
  }
}
