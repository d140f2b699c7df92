package chatlog.jdbc;

import java.util.Objects;

/**
 * Default table names and table name validation for the JDBC stores.
 */
public final class TableNames {
  public static final String DEFAULT_LIVE_TABLE = "live_message";
  public static final String DEFAULT_ARCHIVE_TABLE = "archive_message";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * Returns {@code tableName} if it is a plain SQL identifier.
   *
   * @throws IllegalArgumentException otherwise
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
