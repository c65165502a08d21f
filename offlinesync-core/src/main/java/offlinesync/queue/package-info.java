/**
 * Queue operations over the persistent store: {@link offlinesync.queue.QueueManager} for the
 * active queue and {@link offlinesync.queue.FailedMessageManager} for exhausted entries.
 */
package offlinesync.queue;
