package offlinesync.jdbc;

import offlinesync.jdbc.store.AbstractJdbcMessageStore;
import offlinesync.model.MessageStatus;
import offlinesync.model.MessageUpdate;
import offlinesync.model.QueuedMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store behaviour shared by every database. Subclasses provide the DataSource and store.
 */
abstract class AbstractMessageStoreIntegrationTest {
    protected static final Instant T0 = Instant.parse("2024-03-01T10:00:00.123Z");

    abstract DataSource dataSource();

    abstract AbstractJdbcMessageStore store();

    @BeforeEach
    void openAndClear() throws Exception {
        try (Connection conn = connection()) {
            store().open(conn);
            store().clear(conn);
        }
    }

    protected Connection connection() throws Exception {
        Connection conn = dataSource().getConnection();
        conn.setAutoCommit(true);
        return conn;
    }

    @Test
    void insertAssignsIncreasingIdsAndRoundTripsFields() throws Exception {
        try (Connection conn = connection()) {
            long first = store().insert(conn, "chat-1", "{\"body\":\"héllo ✓\"}", T0, 3);
            long second = store().insert(conn, "chat-1", "{}", T0.plusMillis(1), 5);
            assertTrue(second > first);

            QueuedMessage stored = store().findById(conn, first).orElseThrow();
            assertEquals("chat-1", stored.chatId());
            assertEquals("{\"body\":\"héllo ✓\"}", stored.payloadJson());
            assertEquals(T0, stored.queuedAt());
            assertEquals(MessageStatus.PENDING, stored.status());
            assertEquals(0, stored.retryCount());
            assertEquals(3, stored.maxRetries());
            assertNull(stored.lastError());
            assertNull(stored.lastAttemptAt());
            assertEquals(5, store().findById(conn, second).orElseThrow().maxRetries());
        }
    }

    @Test
    void findByIdOfMissingEntryIsEmpty() throws Exception {
        try (Connection conn = connection()) {
            assertTrue(store().findById(conn, 424242).isEmpty());
        }
    }

    @Test
    void pendingEntriesAreReturnedOldestFirst() throws Exception {
        try (Connection conn = connection()) {
            long late = store().insert(conn, "A", "late", T0.plusSeconds(10), 3);
            long early = store().insert(conn, "B", "early", T0, 3);
            long tieA = store().insert(conn, "A", "tie-1", T0.plusSeconds(5), 3);
            long tieB = store().insert(conn, "A", "tie-2", T0.plusSeconds(5), 3);

            List<Long> ids = store().findByStatus(conn, MessageStatus.PENDING, null, 100).stream()
                    .map(QueuedMessage::id).toList();
            assertEquals(List.of(early, tieA, tieB, late), ids);

            List<Long> chatA = store().findByStatus(conn, MessageStatus.PENDING, "A", 2).stream()
                    .map(QueuedMessage::id).toList();
            assertEquals(List.of(tieA, tieB), chatA);
        }
    }

    @Test
    void statusFiltersSeparatePendingFromFailed() throws Exception {
        try (Connection conn = connection()) {
            long pending = store().insert(conn, "A", "1", T0, 3);
            long failed = store().insert(conn, "A", "2", T0, 3);
            store().update(conn, failed, MessageUpdate.failed(3, "HTTP 500", T0.plusSeconds(1)));

            assertEquals(1, store().countByStatus(conn, MessageStatus.PENDING, null));
            assertEquals(1, store().countByStatus(conn, MessageStatus.FAILED, "A"));
            assertEquals(0, store().countByStatus(conn, MessageStatus.FAILED, "B"));
            assertEquals(List.of(failed), store().findByStatus(conn, MessageStatus.FAILED, null, 10).stream()
                    .map(QueuedMessage::id).toList());
            assertEquals(2, store().findAll(conn, null).size());
            assertEquals(List.of(pending, failed), store().findAll(conn, "A").stream()
                    .map(QueuedMessage::id).toList());
        }
    }

    @Test
    void updateChangesOnlyGivenFields() throws Exception {
        try (Connection conn = connection()) {
            long id = store().insert(conn, "A", "1", T0, 3);

            assertEquals(1, store().update(conn, id, MessageUpdate.retry(1, "timeout", T0.plusSeconds(2))));
            assertEquals(1, store().update(conn, id, new MessageUpdate(2, null, null, null)));

            QueuedMessage stored = store().findById(conn, id).orElseThrow();
            assertEquals(2, stored.retryCount());
            assertEquals(MessageStatus.PENDING, stored.status());
            assertEquals("timeout", stored.lastError());
            assertEquals(T0.plusSeconds(2), stored.lastAttemptAt());
        }
    }

    @Test
    void updateOfMissingEntryReturnsZero() throws Exception {
        try (Connection conn = connection()) {
            assertEquals(0, store().update(conn, 999, MessageUpdate.retry(1, "x", T0)));
            assertEquals(0, store().update(conn, 999, new MessageUpdate(null, null, null, null)));
        }
    }

    @Test
    void longErrorsAreTruncated() throws Exception {
        try (Connection conn = connection()) {
            long id = store().insert(conn, "A", "1", T0, 3);
            store().update(conn, id, MessageUpdate.retry(1, "x".repeat(5000), T0));

            assertEquals(4000, store().findById(conn, id).orElseThrow().lastError().length());
        }
    }

    @Test
    void deleteAndClear() throws Exception {
        try (Connection conn = connection()) {
            long a = store().insert(conn, "A", "1", T0, 3);
            store().insert(conn, "B", "1", T0, 3);
            store().insert(conn, "C", "1", T0, 3);

            assertEquals(1, store().delete(conn, a));
            assertEquals(0, store().delete(conn, a));
            assertEquals(2, store().clear(conn));
            assertEquals(0, store().clear(conn));
        }
    }

    @Test
    void requeueFailedResetsOnlyFailedEntries() throws Exception {
        try (Connection conn = connection()) {
            long pending = store().insert(conn, "A", "1", T0, 3);
            long failed = store().insert(conn, "A", "2", T0, 3);
            store().update(conn, failed, MessageUpdate.failed(3, "gone", T0));

            assertEquals(0, store().requeueFailed(conn, pending));
            assertEquals(1, store().requeueFailed(conn, failed));

            QueuedMessage requeued = store().findById(conn, failed).orElseThrow();
            assertEquals(MessageStatus.PENDING, requeued.status());
            assertEquals(0, requeued.retryCount());
            assertNull(requeued.lastError());
        }
    }

    @Test
    void openIsIdempotent() throws Exception {
        try (Connection conn = connection()) {
            long id = store().insert(conn, "A", "1", T0, 3);
            store().open(conn);
            store().open(conn);

            assertTrue(store().findById(conn, id).isPresent());
            assertEquals(AbstractJdbcMessageStore.SCHEMA_VERSION, store().schemaVersion(conn));
        }
    }
}
