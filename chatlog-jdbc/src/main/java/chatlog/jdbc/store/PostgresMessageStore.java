package chatlog.jdbc.store;

import chatlog.jdbc.JdbcTemplate;
import chatlog.model.ArchivedMessage;
import chatlog.util.JsonCodec;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL message store.
 *
 * <p>Archive upserts use {@code INSERT ... ON CONFLICT (id) DO UPDATE}.
 */
public final class PostgresMessageStore extends AbstractJdbcMessageStore {
  private static final String UPDATE_ALL =
      "sender=EXCLUDED.sender, recipient=EXCLUDED.recipient, body=EXCLUDED.body, kind=EXCLUDED.kind, " +
      "ts_time=EXCLUDED.ts_time, ts_text=EXCLUDED.ts_text, ts_epoch=EXCLUDED.ts_epoch, " +
      "revision=EXCLUDED.revision, thought_type=EXCLUDED.thought_type, tags=EXCLUDED.tags, " +
      "archived_at=EXCLUDED.archived_at";

  public PostgresMessageStore() {
    super();
  }

  public PostgresMessageStore(String liveTable, String archiveTable, JsonCodec jsonCodec, int queryTimeoutSeconds) {
    super(liveTable, archiveTable, jsonCodec, queryTimeoutSeconds);
  }

  @Override
  public AbstractJdbcMessageStore configure(String liveTable, String archiveTable, JsonCodec jsonCodec,
      int queryTimeoutSeconds) {
    return new PostgresMessageStore(liveTable, archiveTable, jsonCodec, queryTimeoutSeconds);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void upsert(Connection conn, ArchivedMessage message) {
    String sql = "INSERT INTO " + archiveTable() + " (" + COLUMNS + ", archived_at) VALUES (" +
        PLACEHOLDERS + ",?) ON CONFLICT (id) DO UPDATE SET " + UPDATE_ALL;
    JdbcTemplate.update(conn, timeout(), sql, archivedParams(message));
  }
}
