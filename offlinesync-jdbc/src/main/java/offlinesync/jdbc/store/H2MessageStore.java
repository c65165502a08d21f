package offlinesync.jdbc.store;

import java.util.List;

/**
 * H2 message store. Used for tests and embedded JVM deployments.
 */
public final class H2MessageStore extends AbstractJdbcMessageStore {

  public H2MessageStore() {
    super();
  }

  public H2MessageStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String idColumnDefinition() {
    return "BIGINT AUTO_INCREMENT PRIMARY KEY";
  }

  @Override
  protected String textType() {
    return "CLOB";
  }
}
