package offlinesync.queue;

import offlinesync.StorageException;
import offlinesync.spi.ConnectionProvider;
import offlinesync.spi.MessageStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Runs store calls on a fresh connection, converting JDBC failures to {@link StorageException}.
 */
final class StoreAccess {

  @FunctionalInterface
  interface StoreAction<T> {
    T apply(MessageStore store, Connection conn) throws SQLException;
  }

  private final ConnectionProvider connectionProvider;
  private final MessageStore store;

  StoreAccess(ConnectionProvider connectionProvider, MessageStore store) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "messageStore");
  }

  /** Runs a single statement in auto-commit mode. */
  <T> T withConnection(String description, StoreAction<T> action) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return action.apply(store, conn);
    } catch (SQLException e) {
      throw new StorageException("Failed to " + description, e);
    }
  }

  /** Runs several statements in one transaction, rolling back on any failure. */
  <T> T inTransaction(String description, StoreAction<T> action) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = action.apply(store, conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to " + description, e);
    }
  }
}
