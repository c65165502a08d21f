package offlinesync.jdbc.store;

import java.util.List;

/**
 * PostgreSQL message store, for server-side relays that queue on behalf of clients.
 */
public final class PostgresMessageStore extends AbstractJdbcMessageStore {

  public PostgresMessageStore() {
    super();
  }

  public PostgresMessageStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String idColumnDefinition() {
    return "BIGSERIAL PRIMARY KEY";
  }
}
