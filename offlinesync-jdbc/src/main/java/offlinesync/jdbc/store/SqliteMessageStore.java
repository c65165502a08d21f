package offlinesync.jdbc.store;

import offlinesync.jdbc.JdbcTemplate;
import offlinesync.model.MessageStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * SQLite message store for on-device queues backed by a single database file.
 *
 * <p>{@code AUTOINCREMENT} keeps ids increasing even after the newest rows are deleted,
 * so a queue id is never reused within one database file. New ids are read back with
 * {@code last_insert_rowid()} on the inserting connection.
 */
public final class SqliteMessageStore extends AbstractJdbcMessageStore {

  public SqliteMessageStore() {
    super();
  }

  public SqliteMessageStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "sqlite";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:sqlite:");
  }

  @Override
  protected String idColumnDefinition() {
    return "INTEGER PRIMARY KEY AUTOINCREMENT";
  }

  @Override
  public long insert(Connection conn, String chatId, String payloadJson, Instant queuedAt, int maxRetries) {
    JdbcTemplate.update(conn, insertSql(),
        chatId, payloadJson, queuedAt.toEpochMilli(), MessageStatus.PENDING.code(), maxRetries);
    return JdbcTemplate.queryLong(conn, "SELECT last_insert_rowid()");
  }
}
