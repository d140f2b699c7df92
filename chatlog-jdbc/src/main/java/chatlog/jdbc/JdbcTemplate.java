package chatlog.jdbc;

import chatlog.ConfigurationException;
import chatlog.MalformedInputException;
import chatlog.StoreUnavailableException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;
import java.util.TimeZone;

/**
 * Lightweight JDBC helper for the message stores.
 *
 * <p>Every statement carries a query timeout. {@link SQLException}s are translated by SQL
 * state: integrity violations (class {@code 23}) become {@link MalformedInputException},
 * syntax or missing-object errors (class {@code 42}) become {@link ConfigurationException},
 * anything else {@link StoreUnavailableException}.
 *
 * <p>Timestamps are bound and read as UTC wall time, independent of the JVM default zone.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE/MERGE, return rows affected. */
  public static int update(Connection conn, int timeoutSeconds, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(timeoutSeconds);
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw translate("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, int timeoutSeconds, String sql, RowMapper<T> mapper,
      Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(timeoutSeconds);
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw translate("Failed to execute query", e);
    }
  }

  /** Execute a single-column integer SELECT such as {@code COUNT(*)}. */
  public static int queryForInt(Connection conn, int timeoutSeconds, String sql, Object... params) {
    List<Integer> rows = query(conn, timeoutSeconds, sql, rs -> rs.getInt(1), params);
    return rows.isEmpty() ? 0 : rows.get(0);
  }

  /**
   * Reads a timestamp column written by this helper, or {@code null} for SQL NULL.
   */
  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column, utc());
    return ts == null ? null : ts.toInstant();
  }

  static RuntimeException translate(String message, SQLException e) {
    String state = e.getSQLState();
    if (state != null && state.startsWith("23")) {
      return new MalformedInputException(message + ": constraint violation", e);
    }
    if (state != null && state.startsWith("42")) {
      return new ConfigurationException(message + ": " + e.getMessage(), e);
    }
    return new StoreUnavailableException(message, e);
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant), utc());
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts, utc());
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  // Calendar is mutable and drivers may modify it, so every call gets its own.
  private static Calendar utc() {
    return Calendar.getInstance(TimeZone.getTimeZone("UTC"));
  }

  private JdbcTemplate() {}
}
