package offlinesync.spi;

import offlinesync.model.MessageStatus;
import offlinesync.model.MessageUpdate;
import offlinesync.model.QueuedMessage;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the offline message queue.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Once {@link #insert} returns on a committed connection the
 * entry survives process restart until it is deleted. Implementations report
 * database failures as {@link offlinesync.StorageException} and live in the
 * {@code offlinesync-jdbc} module.
 *
 * @see offlinesync.jdbc.store.AbstractJdbcMessageStore
 */
public interface MessageStore {

    /**
     * Creates the queue schema on first use and migrates older schema versions.
     * Safe to call on every startup.
     *
     * @param conn the JDBC connection
     * @throws offlinesync.StorageException if the schema cannot be created or migrated
     */
    void open(Connection conn);

    /**
     * Inserts a new {@link MessageStatus#PENDING} entry with a retry count of zero.
     *
     * @param conn        the JDBC connection
     * @param chatId      conversation id
     * @param payloadJson opaque payload
     * @param queuedAt    enqueue time
     * @param maxRetries  retry budget for this entry
     * @return the store-assigned id
     */
    long insert(Connection conn, String chatId, String payloadJson, Instant queuedAt, int maxRetries);

    /**
     * Finds an entry by id, whatever its status.
     *
     * @param conn the JDBC connection
     * @param id   the entry id
     * @return the entry, or empty if it does not exist
     */
    Optional<QueuedMessage> findById(Connection conn, long id);

    /**
     * Returns every stored entry, oldest first.
     *
     * @param conn   the JDBC connection
     * @param chatId optional conversation filter ({@code null} for all)
     * @return entries ordered by enqueue time, then id
     */
    List<QueuedMessage> findAll(Connection conn, String chatId);

    /**
     * Returns entries with the given status, oldest first.
     *
     * @param conn   the JDBC connection
     * @param status the status to match
     * @param chatId optional conversation filter ({@code null} for all)
     * @param limit  maximum number of entries to return
     * @return entries ordered by enqueue time, then id
     */
    List<QueuedMessage> findByStatus(Connection conn, MessageStatus status, String chatId, int limit);

    /**
     * Counts entries with the given status.
     *
     * @param conn   the JDBC connection
     * @param status the status to match
     * @param chatId optional conversation filter ({@code null} for all)
     * @return the number of matching entries
     */
    int countByStatus(Connection conn, MessageStatus status, String chatId);

    /**
     * Applies the non-null fields of {@code update} to an entry.
     *
     * @param conn   the JDBC connection
     * @param id     the entry id
     * @param update the fields to change
     * @return the number of rows updated (0 or 1)
     */
    int update(Connection conn, long id, MessageUpdate update);

    /**
     * Deletes an entry.
     *
     * @param conn the JDBC connection
     * @param id   the entry id
     * @return the number of rows deleted (0 or 1)
     */
    int delete(Connection conn, long id);

    /**
     * Deletes every entry.
     *
     * @param conn the JDBC connection
     * @return the number of rows deleted
     */
    int clear(Connection conn);

    /**
     * Puts a {@link MessageStatus#FAILED} entry back into the active queue with a
     * retry count of zero and no recorded error. Entries in any other status are left alone.
     *
     * @param conn the JDBC connection
     * @param id   the entry id
     * @return the number of rows updated (0 or 1)
     */
    int requeueFailed(Connection conn, long id);
}
