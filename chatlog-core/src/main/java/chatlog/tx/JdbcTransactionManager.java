package chatlog.tx;

import chatlog.StoreUnavailableException;
import chatlog.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager over a {@link ConnectionProvider}. Obtains a connection,
 * disables auto-commit, and closes it when the transaction completes.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     archiveStore.upsertBatch(tx.connection(), chunk);
 *     liveStore.deleteAll(tx.connection(), ids);
 *     tx.commit();
 * }
 * }</pre>
 * or through {@link #inTransaction} / {@link #withConnection}, which translate
 * {@link SQLException} into {@link StoreUnavailableException}.
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Unit of work against an open connection.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface Work<T> {
    T run(Connection conn);
  }

  /**
   * Begins a new transaction.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection);
  }

  /**
   * Runs {@code work} in its own transaction and commits. Any failure rolls back.
   *
   * @throws StoreUnavailableException if the connection, commit or rollback fails
   */
  public <T> T inTransaction(Work<T> work) {
    try (Transaction tx = begin()) {
      T result = work.run(tx.connection());
      tx.commit();
      return result;
    } catch (SQLException e) {
      throw new StoreUnavailableException("Transaction failed", e);
    }
  }

  /**
   * Runs {@code work} on an auto-commit connection.
   *
   * @throws StoreUnavailableException if the connection cannot be obtained
   */
  public <T> T withConnection(Work<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return work.run(conn);
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to obtain connection", e);
    }
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private boolean completed;

    private Transaction(Connection connection) {
      this.connection = connection;
    }

    public Connection connection() {
      return connection;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        safeRollback(e);
        throw e;
      } finally {
        finish();
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finish();
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finish() throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } finally {
        connection.close();
      }
    }

    private void safeRollback(SQLException original) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        original.addSuppressed(e);
        logger.log(Level.WARNING, "Rollback after failed commit also failed", e);
      }
    }
  }
}
