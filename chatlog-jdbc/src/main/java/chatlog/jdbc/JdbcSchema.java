package chatlog.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Creates the live and archive tables from the scripts shipped under {@code schema/}.
 * Scripts use {@code IF NOT EXISTS}, so running them against an initialized database is
 * harmless.
 */
public final class JdbcSchema {
  private static final Pattern DEFAULT_NAMES = Pattern.compile(
      Pattern.quote(TableNames.DEFAULT_LIVE_TABLE) + "|" + Pattern.quote(TableNames.DEFAULT_ARCHIVE_TABLE));

  private JdbcSchema() {}

  /**
   * Runs the schema script of {@code storeName} with the default table names.
   *
   * @param storeName one of {@code h2}, {@code mysql}, {@code postgresql}
   */
  public static void create(Connection conn, String storeName) throws SQLException {
    create(conn, storeName, TableNames.DEFAULT_LIVE_TABLE, TableNames.DEFAULT_ARCHIVE_TABLE);
  }

  /**
   * Runs the schema script of {@code storeName}, renaming the tables (and their indexes).
   */
  public static void create(Connection conn, String storeName, String liveTable, String archiveTable)
      throws SQLException {
    Objects.requireNonNull(conn, "conn");
    TableNames.validate(liveTable);
    TableNames.validate(archiveTable);
    for (String statement : statements(storeName)) {
      String sql = rename(statement, liveTable, archiveTable);
      try (Statement st = conn.createStatement()) {
        st.execute(sql);
      }
    }
  }

  /**
   * Substitutes both default table names in one pass, so a custom name that contains the
   * other default is left alone.
   */
  static String rename(String statement, String liveTable, String archiveTable) {
    Matcher matcher = DEFAULT_NAMES.matcher(statement);
    StringBuilder sql = new StringBuilder();
    while (matcher.find()) {
      String replacement = matcher.group().equals(TableNames.DEFAULT_LIVE_TABLE) ? liveTable : archiveTable;
      matcher.appendReplacement(sql, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(sql);
    return sql.toString();
  }

  /**
   * Returns the statements of {@code schema/<storeName>.sql}.
   *
   * @throws IllegalArgumentException if no script exists for the store
   */
  public static List<String> statements(String storeName) {
    String resource = "schema/" + storeName + ".sql";
    ClassLoader loader = JdbcSchema.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema script for store: " + storeName);
      }
      String script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      List<String> statements = new ArrayList<>();
      for (String part : script.split(";")) {
        if (!part.isBlank()) {
          statements.add(part.trim());
        }
      }
      return statements;
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + resource, e);
    }
  }
}
