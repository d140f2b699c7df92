package chatlog.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the message tables. Each chat log operation borrows one
 * connection and closes it when done.
 *
 * @see chatlog.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
