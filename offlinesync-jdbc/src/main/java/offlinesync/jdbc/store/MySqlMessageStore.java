package offlinesync.jdbc.store;

import java.util.List;

/**
 * MySQL/MariaDB message store.
 *
 * <p>MySQL has no {@code CREATE INDEX IF NOT EXISTS}; the migration looks each index
 * up in the catalog before creating it.
 */
public final class MySqlMessageStore extends AbstractJdbcMessageStore {

  public MySqlMessageStore() {
    super();
  }

  public MySqlMessageStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  protected String idColumnDefinition() {
    return "BIGINT AUTO_INCREMENT PRIMARY KEY";
  }

  @Override
  protected String textType() {
    return "LONGTEXT";
  }

  @Override
  protected String createIndexSql(String indexName, String column) {
    return "CREATE INDEX " + indexName + " ON " + tableName() + " (" + column + ")";
  }
}
