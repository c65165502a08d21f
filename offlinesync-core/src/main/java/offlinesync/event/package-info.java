/**
 * Lifecycle events and the synchronous {@link offlinesync.event.EventBus} that fans them
 * out to UI, metrics and status listeners.
 */
package offlinesync.event;
