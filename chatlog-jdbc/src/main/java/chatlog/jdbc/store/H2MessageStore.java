package chatlog.jdbc.store;

import chatlog.jdbc.JdbcTemplate;
import chatlog.model.ArchivedMessage;
import chatlog.util.JsonCodec;

import java.sql.Connection;
import java.util.List;

/**
 * H2 message store. Primarily for testing.
 *
 * <p>Archive upserts use {@code MERGE INTO ... KEY (id)}.
 */
public final class H2MessageStore extends AbstractJdbcMessageStore {

  public H2MessageStore() {
    super();
  }

  public H2MessageStore(String liveTable, String archiveTable) {
    this(liveTable, archiveTable, JsonCodec.getDefault(), DEFAULT_QUERY_TIMEOUT_SECONDS);
  }

  public H2MessageStore(String liveTable, String archiveTable, JsonCodec jsonCodec, int queryTimeoutSeconds) {
    super(liveTable, archiveTable, jsonCodec, queryTimeoutSeconds);
  }

  @Override
  public AbstractJdbcMessageStore configure(String liveTable, String archiveTable, JsonCodec jsonCodec,
      int queryTimeoutSeconds) {
    return new H2MessageStore(liveTable, archiveTable, jsonCodec, queryTimeoutSeconds);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public void upsert(Connection conn, ArchivedMessage message) {
    String sql = "MERGE INTO " + archiveTable() + " (" + COLUMNS + ", archived_at) KEY (id) VALUES (" +
        PLACEHOLDERS + ",?)";
    JdbcTemplate.update(conn, timeout(), sql, archivedParams(message));
  }
}
