package offlinesync.jdbc;

import offlinesync.StorageException;
import offlinesync.jdbc.store.AbstractJdbcMessageStore;
import offlinesync.jdbc.store.H2MessageStore;
import offlinesync.model.MessageStatus;
import offlinesync.model.QueuedMessage;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class H2MessageStoreTest extends AbstractMessageStoreIntegrationTest {
  private final JdbcDataSource dataSource = newDataSource();
  private final H2MessageStore store = new H2MessageStore();

  private static JdbcDataSource newDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    return ds;
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcMessageStore store() {
    return store;
  }

  @Test
  void migratesVersionOneTableInPlace() throws Exception {
    JdbcDataSource fresh = newDataSource();
    try (Connection conn = fresh.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("CREATE TABLE offline_message_queue (" +
          "id BIGINT AUTO_INCREMENT PRIMARY KEY, chat_id VARCHAR(255) NOT NULL, payload CLOB NOT NULL, " +
          "queued_at BIGINT NOT NULL, status SMALLINT NOT NULL, retry_count INT NOT NULL, " +
          "max_retries INT NOT NULL, last_error CLOB)");
      stmt.execute("CREATE TABLE offline_message_queue_schema (version INT NOT NULL)");
      stmt.execute("INSERT INTO offline_message_queue_schema (version) VALUES (1)");
      stmt.execute("INSERT INTO offline_message_queue " +
          "(chat_id, payload, queued_at, status, retry_count, max_retries, last_error) " +
          "VALUES ('chat-1', '{\"text\":\"hi\"}', 1700000000000, 0, 1, 3, 'timeout')");

      H2MessageStore upgraded = new H2MessageStore();
      upgraded.open(conn);

      assertEquals(2, upgraded.schemaVersion(conn));
      QueuedMessage survivor = upgraded.findAll(conn, "chat-1").get(0);
      assertEquals("{\"text\":\"hi\"}", survivor.payloadJson());
      assertEquals(1, survivor.retryCount());
      assertEquals("timeout", survivor.lastError());
      assertNull(survivor.lastAttemptAt());
    }
  }

  @Test
  void resumesMigrationThatStoppedBeforeRecordingItsVersion() throws Exception {
    JdbcDataSource fresh = newDataSource();
    try (Connection conn = fresh.getConnection(); Statement stmt = conn.createStatement()) {
      H2MessageStore first = new H2MessageStore();
      first.open(conn);
      long id = first.insert(conn, "chat-1", "{}", T0, 3);
      stmt.execute("DELETE FROM offline_message_queue_schema WHERE version = 2");

      H2MessageStore reopened = new H2MessageStore();
      reopened.open(conn);

      assertEquals(2, reopened.schemaVersion(conn));
      assertEquals(id, reopened.findById(conn, id).orElseThrow().id());
    }
  }

  @Test
  void replaysEveryMigrationOverExistingSchema() throws Exception {
    JdbcDataSource fresh = newDataSource();
    try (Connection conn = fresh.getConnection(); Statement stmt = conn.createStatement()) {
      H2MessageStore first = new H2MessageStore();
      first.open(conn);
      first.insert(conn, "chat-1", "{}", T0, 3);
      stmt.execute("DROP INDEX offline_message_queue_status_idx");
      stmt.execute("DELETE FROM offline_message_queue_schema");

      H2MessageStore reopened = new H2MessageStore();
      reopened.open(conn);

      assertEquals(2, reopened.schemaVersion(conn));
      assertEquals(1, reopened.countByStatus(conn, MessageStatus.PENDING, null));
      try (ResultSet rs = conn.getMetaData().getIndexInfo(null, null, "OFFLINE_MESSAGE_QUEUE", false, false)) {
        boolean found = false;
        while (rs.next()) {
          found |= "OFFLINE_MESSAGE_QUEUE_STATUS_IDX".equalsIgnoreCase(rs.getString("INDEX_NAME"));
        }
        assertTrue(found);
      }
    }
  }

  @Test
  void rejectsSchemaNewerThanSupported() throws Exception {
    JdbcDataSource fresh = newDataSource();
    try (Connection conn = fresh.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("CREATE TABLE offline_message_queue_schema (version INT NOT NULL)");
      stmt.execute("INSERT INTO offline_message_queue_schema (version) VALUES (99)");

      StorageException ex = assertThrows(StorageException.class, () -> new H2MessageStore().open(conn));
      assertTrue(ex.getCause().getMessage().contains("newer than supported"));
    }
  }

  @Test
  void freshDatabaseReportsVersionZeroUntilOpened() throws Exception {
    JdbcDataSource fresh = newDataSource();
    try (Connection conn = fresh.getConnection()) {
      H2MessageStore unopened = new H2MessageStore();
      assertEquals(0, unopened.schemaVersion(conn));
      unopened.open(conn);
      assertEquals(AbstractJdbcMessageStore.SCHEMA_VERSION, unopened.schemaVersion(conn));
    }
  }

  @Test
  void customTablesAreIndependent() throws Exception {
    H2MessageStore other = new H2MessageStore("drafts_queue");
    try (Connection conn = dataSource.getConnection()) {
      other.open(conn);
      other.insert(conn, "chat-1", "{}", T0, 3);

      assertEquals(1, other.countByStatus(conn, MessageStatus.PENDING, null));
      assertEquals(0, store.countByStatus(conn, MessageStatus.PENDING, null));
    }
  }

  @Test
  void invalidTableNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new H2MessageStore("queue; DROP TABLE x"));
  }
}
