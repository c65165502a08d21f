package offlinesync.jdbc;

import java.util.Objects;

/**
 * Table name defaults and validation for the JDBC message stores.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "offline_message_queue";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * Returns the name unchanged if it is a plain SQL identifier.
   *
   * @throws IllegalArgumentException if the name could inject SQL
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /** Name of the table that records the applied schema version. */
  public static String schemaTable(String tableName) {
    return tableName + "_schema";
  }
}
