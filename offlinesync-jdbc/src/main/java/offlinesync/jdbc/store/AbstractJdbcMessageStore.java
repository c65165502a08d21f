package offlinesync.jdbc.store;

import offlinesync.StorageException;
import offlinesync.jdbc.JdbcTemplate;
import offlinesync.jdbc.TableNames;
import offlinesync.model.MessageStatus;
import offlinesync.model.MessageUpdate;
import offlinesync.model.QueuedMessage;
import offlinesync.spi.MessageStore;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC message store with standard SQL implementations.
 *
 * <p>Timestamps are stored as epoch milliseconds. The schema is versioned in a
 * companion {@code <table>_schema} table and migrated forward by {@link #open}:
 * <ol>
 *   <li>version 1 creates the queue table and its chat, time and status indexes;</li>
 *   <li>version 2 adds the {@code last_attempt_at} column.</li>
 * </ol>
 *
 * <p>Subclasses supply the dialect-specific column types. Register custom
 * implementations via {@code META-INF/services/offlinesync.jdbc.store.AbstractJdbcMessageStore}.
 *
 * @see JdbcMessageStores
 */
public abstract class AbstractJdbcMessageStore implements MessageStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcMessageStore.class.getName());

  /** Schema version written by this release. */
  public static final int SCHEMA_VERSION = 2;
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS =
      "id, chat_id, payload, queued_at, status, retry_count, max_retries, last_error, last_attempt_at";

  protected static final JdbcTemplate.RowMapper<QueuedMessage> MESSAGE_ROW_MAPPER = rs -> {
    long lastAttempt = rs.getLong("last_attempt_at");
    Instant lastAttemptAt = rs.wasNull() ? null : Instant.ofEpochMilli(lastAttempt);
    return new QueuedMessage(
        rs.getLong("id"),
        rs.getString("chat_id"),
        rs.getString("payload"),
        Instant.ofEpochMilli(rs.getLong("queued_at")),
        MessageStatus.fromCode(rs.getInt("status")),
        rs.getInt("retry_count"),
        rs.getInt("max_retries"),
        rs.getString("last_error"),
        lastAttemptAt);
  };

  private final String tableName;

  protected AbstractJdbcMessageStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcMessageStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this message store (e.g., "sqlite", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this message store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /** Column definition of the auto-generated primary key. */
  protected abstract String idColumnDefinition();

  /** Column type for unbounded text (payload and error). */
  protected String textType() {
    return "TEXT";
  }

  /** DDL creating a secondary index. */
  protected String createIndexSql(String indexName, String column) {
    return "CREATE INDEX IF NOT EXISTS " + indexName + " ON " + tableName() + " (" + column + ")";
  }

  public String tableName() {
    return tableName;
  }

  // ── Schema ───────────────────────────────────────────────────────

  /**
   * Migrates the schema forward, one version at a time. Every step checks the
   * catalog before changing it, so a migration interrupted before its version row
   * was written is completed on the next open. Callers should pass a connection in
   * a transaction where the database supports transactional DDL.
   */
  @Override
  public void open(Connection conn) {
    String schemaTable = TableNames.schemaTable(tableName());
    try {
      JdbcTemplate.execute(conn, "CREATE TABLE IF NOT EXISTS " + schemaTable + " (version INT NOT NULL)");
      int current = JdbcTemplate.queryInt(conn, "SELECT COALESCE(MAX(version), 0) FROM " + schemaTable);
      if (current > SCHEMA_VERSION) {
        throw new StorageException("Schema version " + current + " of " + tableName()
            + " is newer than supported version " + SCHEMA_VERSION);
      }
      for (int version = current + 1; version <= SCHEMA_VERSION; version++) {
        migrate(conn, version);
        JdbcTemplate.update(conn, "INSERT INTO " + schemaTable + " (version) VALUES (?)", version);
        logger.log(Level.INFO, "Migrated {0} to schema version {1}", new Object[]{tableName(), version});
      }
    } catch (StorageException e) {
      throw new StorageException("Failed to open message store " + tableName(), e);
    }
  }

  /**
   * Upgrades the schema to {@code version}. Each step must be safe to repeat.
   */
  protected void migrate(Connection conn, int version) {
    switch (version) {
      case 1:
        JdbcTemplate.execute(conn, "CREATE TABLE IF NOT EXISTS " + tableName() + " (" +
            "id " + idColumnDefinition() + ", " +
            "chat_id VARCHAR(255) NOT NULL, " +
            "payload " + textType() + " NOT NULL, " +
            "queued_at BIGINT NOT NULL, " +
            "status SMALLINT NOT NULL, " +
            "retry_count INT NOT NULL, " +
            "max_retries INT NOT NULL, " +
            "last_error " + textType() + ")");
        createIndexIfMissing(conn, tableName() + "_chat_idx", "chat_id");
        createIndexIfMissing(conn, tableName() + "_queued_idx", "queued_at");
        createIndexIfMissing(conn, tableName() + "_status_idx", "status");
        break;
      case 2:
        if (!columnExists(conn, "last_attempt_at")) {
          JdbcTemplate.execute(conn, "ALTER TABLE " + tableName() + " ADD COLUMN last_attempt_at BIGINT");
        }
        break;
      default:
        throw new IllegalArgumentException("Unknown schema version: " + version);
    }
  }

  private void createIndexIfMissing(Connection conn, String indexName, String column) {
    if (!indexExists(conn, indexName)) {
      JdbcTemplate.execute(conn, createIndexSql(indexName, column));
    }
  }

  /**
   * Returns whether the queue table has the given column.
   */
  protected boolean columnExists(Connection conn, String column) {
    try {
      DatabaseMetaData meta = conn.getMetaData();
      try (ResultSet rs = meta.getColumns(conn.getCatalog(), null, catalogName(meta, tableName()), null)) {
        while (rs.next()) {
          if (tableName().equalsIgnoreCase(rs.getString("TABLE_NAME"))
              && column.equalsIgnoreCase(rs.getString("COLUMN_NAME"))) {
            return true;
          }
        }
      }
      return false;
    } catch (SQLException e) {
      throw new StorageException("Failed to read columns of " + tableName(), e);
    }
  }

  /**
   * Returns whether an index with the given name exists on the queue table.
   */
  protected boolean indexExists(Connection conn, String indexName) {
    try {
      DatabaseMetaData meta = conn.getMetaData();
      try (ResultSet rs = meta.getIndexInfo(conn.getCatalog(), null, catalogName(meta, tableName()), false, false)) {
        while (rs.next()) {
          if (indexName.equalsIgnoreCase(rs.getString("INDEX_NAME"))) {
            return true;
          }
        }
      }
      return false;
    } catch (SQLException e) {
      throw new StorageException("Failed to read indexes of " + tableName(), e);
    }
  }

  /** Unquoted identifier as the database stores it in its catalog. */
  private static String catalogName(DatabaseMetaData meta, String identifier) throws SQLException {
    if (meta.storesUpperCaseIdentifiers()) {
      return identifier.toUpperCase(Locale.ROOT);
    }
    if (meta.storesLowerCaseIdentifiers()) {
      return identifier.toLowerCase(Locale.ROOT);
    }
    return identifier;
  }

  /**
   * Returns the schema version recorded for this table, or 0 if it was never opened.
   */
  public int schemaVersion(Connection conn) {
    String schemaTable = TableNames.schemaTable(tableName());
    JdbcTemplate.execute(conn, "CREATE TABLE IF NOT EXISTS " + schemaTable + " (version INT NOT NULL)");
    return JdbcTemplate.queryInt(conn, "SELECT COALESCE(MAX(version), 0) FROM " + schemaTable);
  }

  // ── Queue operations ─────────────────────────────────────────────

  @Override
  public long insert(Connection conn, String chatId, String payloadJson, Instant queuedAt, int maxRetries) {
    return JdbcTemplate.insert(conn, insertSql(),
        chatId, payloadJson, queuedAt.toEpochMilli(), MessageStatus.PENDING.code(), maxRetries);
  }

  /** INSERT of a new pending entry; parameters are chat id, payload, queued-at, status, max retries. */
  protected String insertSql() {
    return "INSERT INTO " + tableName() +
        " (chat_id, payload, queued_at, status, retry_count, max_retries, last_error, last_attempt_at)" +
        " VALUES (?,?,?,?,0,?,NULL,NULL)";
  }

  @Override
  public Optional<QueuedMessage> findById(Connection conn, long id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    List<QueuedMessage> rows = JdbcTemplate.query(conn, sql, MESSAGE_ROW_MAPPER, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<QueuedMessage> findAll(Connection conn, String chatId) {
    if (chatId == null) {
      return JdbcTemplate.query(conn,
          "SELECT " + COLUMNS + " FROM " + tableName() + " ORDER BY queued_at, id",
          MESSAGE_ROW_MAPPER);
    }
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE chat_id=? ORDER BY queued_at, id",
        MESSAGE_ROW_MAPPER, chatId);
  }

  @Override
  public List<QueuedMessage> findByStatus(Connection conn, MessageStatus status, String chatId, int limit) {
    if (chatId == null) {
      return JdbcTemplate.query(conn,
          "SELECT " + COLUMNS + " FROM " + tableName() +
              " WHERE status=? ORDER BY queued_at, id LIMIT ?",
          MESSAGE_ROW_MAPPER, status.code(), limit);
    }
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() +
            " WHERE status=? AND chat_id=? ORDER BY queued_at, id LIMIT ?",
        MESSAGE_ROW_MAPPER, status.code(), chatId, limit);
  }

  @Override
  public int countByStatus(Connection conn, MessageStatus status, String chatId) {
    if (chatId == null) {
      return JdbcTemplate.queryInt(conn,
          "SELECT COUNT(*) FROM " + tableName() + " WHERE status=?", status.code());
    }
    return JdbcTemplate.queryInt(conn,
        "SELECT COUNT(*) FROM " + tableName() + " WHERE status=? AND chat_id=?", status.code(), chatId);
  }

  @Override
  public int update(Connection conn, long id, MessageUpdate update) {
    List<String> assignments = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    if (update.retryCount() != null) {
      assignments.add("retry_count=?");
      params.add(update.retryCount());
    }
    if (update.status() != null) {
      assignments.add("status=?");
      params.add(update.status().code());
    }
    if (update.lastError() != null) {
      assignments.add("last_error=?");
      params.add(truncateError(update.lastError()));
    }
    if (update.lastAttemptAt() != null) {
      assignments.add("last_attempt_at=?");
      params.add(update.lastAttemptAt().toEpochMilli());
    }
    if (assignments.isEmpty()) {
      return JdbcTemplate.queryInt(conn, "SELECT COUNT(*) FROM " + tableName() + " WHERE id=?", id);
    }
    params.add(id);
    String sql = "UPDATE " + tableName() + " SET " + String.join(", ", assignments) + " WHERE id=?";
    return JdbcTemplate.update(conn, sql, params.toArray());
  }

  @Override
  public int delete(Connection conn, long id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE id=?", id);
  }

  @Override
  public int clear(Connection conn) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName());
  }

  @Override
  public int requeueFailed(Connection conn, long id) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + MessageStatus.PENDING.code() + ", retry_count=0, last_error=NULL" +
        " WHERE id=? AND status=" + MessageStatus.FAILED.code();
    return JdbcTemplate.update(conn, sql, id);
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
