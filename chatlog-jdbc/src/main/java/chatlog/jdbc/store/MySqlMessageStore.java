package chatlog.jdbc.store;

import chatlog.jdbc.JdbcTemplate;
import chatlog.model.ArchivedMessage;
import chatlog.util.JsonCodec;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL message store. Also compatible with TiDB.
 *
 * <p>Archive upserts use {@code INSERT ... ON DUPLICATE KEY UPDATE}; the row keeps its
 * original {@code seq}.
 */
public final class MySqlMessageStore extends AbstractJdbcMessageStore {
  private static final String UPDATE_ALL =
      "sender=VALUES(sender), recipient=VALUES(recipient), body=VALUES(body), kind=VALUES(kind), " +
      "ts_time=VALUES(ts_time), ts_text=VALUES(ts_text), ts_epoch=VALUES(ts_epoch), " +
      "revision=VALUES(revision), thought_type=VALUES(thought_type), tags=VALUES(tags), " +
      "archived_at=VALUES(archived_at)";

  public MySqlMessageStore() {
    super();
  }

  public MySqlMessageStore(String liveTable, String archiveTable, JsonCodec jsonCodec, int queryTimeoutSeconds) {
    super(liveTable, archiveTable, jsonCodec, queryTimeoutSeconds);
  }

  @Override
  public AbstractJdbcMessageStore configure(String liveTable, String archiveTable, JsonCodec jsonCodec,
      int queryTimeoutSeconds) {
    return new MySqlMessageStore(liveTable, archiveTable, jsonCodec, queryTimeoutSeconds);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public void upsert(Connection conn, ArchivedMessage message) {
    String sql = "INSERT INTO " + archiveTable() + " (" + COLUMNS + ", archived_at) VALUES (" +
        PLACEHOLDERS + ",?) ON DUPLICATE KEY UPDATE " + UPDATE_ALL;
    JdbcTemplate.update(conn, timeout(), sql, archivedParams(message));
  }
}
