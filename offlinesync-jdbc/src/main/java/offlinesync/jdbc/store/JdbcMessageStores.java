package offlinesync.jdbc.store;

import offlinesync.jdbc.TableNames;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC message stores with auto-detection support.
 *
 * <p>Message stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/offlinesync.jdbc.store.AbstractJdbcMessageStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcMessageStore store = JdbcMessageStores.detect(dataSource);
 *
 * // Auto-detect with a custom table name
 * AbstractJdbcMessageStore store = JdbcMessageStores.detect(dataSource, "chat_outgoing");
 *
 * // Get by name
 * AbstractJdbcMessageStore store = JdbcMessageStores.get("sqlite");
 * }</pre>
 */
public final class JdbcMessageStores {

  private static final List<AbstractJdbcMessageStore> STORES;
  private static final Map<String, AbstractJdbcMessageStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcMessageStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcMessageStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcMessageStores() {
  }

  /**
   * Returns all registered message stores.
   */
  public static List<AbstractJdbcMessageStore> all() {
    return STORES;
  }

  /**
   * Gets a message store by name.
   *
   * @param name message store name (case-insensitive)
   * @return the message store
   * @throws IllegalArgumentException if no message store has that name
   */
  public static AbstractJdbcMessageStore get(String name) {
    AbstractJdbcMessageStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown message store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the message store from a DataSource.
   *
   * @param dataSource the data source
   * @return detected message store using the default table
   * @throws IllegalStateException if the connection metadata cannot be read
   */
  public static AbstractJdbcMessageStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect message store from DataSource", e);
    }
  }

  /**
   * Auto-detects the message store from a DataSource and binds it to a table.
   *
   * @param dataSource the data source
   * @param tableName  the queue table name
   * @return a message store for the detected database and the given table
   */
  public static AbstractJdbcMessageStore detect(DataSource dataSource, String tableName) {
    AbstractJdbcMessageStore detected = detect(dataSource);
    if (TableNames.DEFAULT_TABLE.equals(tableName)) {
      return detected;
    }
    return switch (detected.name()) {
      case "h2" -> new H2MessageStore(tableName);
      case "sqlite" -> new SqliteMessageStore(tableName);
      case "mysql" -> new MySqlMessageStore(tableName);
      case "postgresql" -> new PostgresMessageStore(tableName);
      default -> throw new IllegalArgumentException(
          "Message store " + detected.name() + " does not support custom table names");
    };
  }

  /**
   * Auto-detects the message store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected message store
   * @throws IllegalArgumentException if no registered store handles the URL
   */
  public static AbstractJdbcMessageStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    for (AbstractJdbcMessageStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No message store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
