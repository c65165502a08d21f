/**
 * Queue entry model: {@link offlinesync.model.QueuedMessage}, its
 * {@link offlinesync.model.MessageStatus} and partial {@link offlinesync.model.MessageUpdate}s.
 */
package offlinesync.model;
