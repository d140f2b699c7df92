package chatlog.jdbc.store;

import chatlog.jdbc.JdbcTemplate;
import chatlog.jdbc.TableNames;
import chatlog.model.ArchivedMessage;
import chatlog.model.MessageKind;
import chatlog.model.StoredMessage;
import chatlog.model.StoredTimestamp;
import chatlog.spi.ArchiveMessageStore;
import chatlog.spi.LiveMessageStore;
import chatlog.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC message store implementing both the live and the archive contract over two
 * tables with the same column layout (the archive adds {@code archived_at}).
 *
 * <p>Rows are always read in {@code seq} order, the insertion order assigned by the
 * database. Subclasses supply the database-specific archive upsert. Register custom
 * implementations via {@code META-INF/services/chatlog.jdbc.store.AbstractJdbcMessageStore}.
 *
 * @see JdbcMessageStores
 */
public abstract class AbstractJdbcMessageStore implements LiveMessageStore, ArchiveMessageStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcMessageStore.class.getName());

  public static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 10;

  protected static final String COLUMNS =
      "id, sender, recipient, body, kind, ts_time, ts_text, ts_epoch, revision, thought_type, tags";
  protected static final String PLACEHOLDERS = "?,?,?,?,?,?,?,?,?,?,?";

  private final String liveTable;
  private final String archiveTable;
  private final JsonCodec jsonCodec;
  private final int queryTimeoutSeconds;

  protected AbstractJdbcMessageStore() {
    this(TableNames.DEFAULT_LIVE_TABLE, TableNames.DEFAULT_ARCHIVE_TABLE, JsonCodec.getDefault(),
        DEFAULT_QUERY_TIMEOUT_SECONDS);
  }

  protected AbstractJdbcMessageStore(String liveTable, String archiveTable, JsonCodec jsonCodec,
      int queryTimeoutSeconds) {
    this.liveTable = TableNames.validate(liveTable);
    this.archiveTable = TableNames.validate(archiveTable);
    if (liveTable.equalsIgnoreCase(archiveTable)) {
      throw new IllegalArgumentException("Live and archive tables must differ: " + liveTable);
    }
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0, got: " + queryTimeoutSeconds);
    }
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same database type with different settings.
   */
  public abstract AbstractJdbcMessageStore configure(String liveTable, String archiveTable,
      JsonCodec jsonCodec, int queryTimeoutSeconds);

  public AbstractJdbcMessageStore withTables(String liveTable, String archiveTable) {
    return configure(liveTable, archiveTable, jsonCodec, queryTimeoutSeconds);
  }

  public AbstractJdbcMessageStore withJsonCodec(JsonCodec jsonCodec) {
    return configure(liveTable, archiveTable, jsonCodec, queryTimeoutSeconds);
  }

  /**
   * @param queryTimeoutSeconds statement timeout; {@code 0} disables it
   */
  public AbstractJdbcMessageStore withQueryTimeout(int queryTimeoutSeconds) {
    return configure(liveTable, archiveTable, jsonCodec, queryTimeoutSeconds);
  }

  public String liveTable() {
    return liveTable;
  }

  public String archiveTable() {
    return archiveTable;
  }

  public int queryTimeoutSeconds() {
    return queryTimeoutSeconds;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  protected int timeout() {
    return queryTimeoutSeconds;
  }

  // ---- live table ----

  @Override
  public void insert(Connection conn, StoredMessage message) {
    String sql = "INSERT INTO " + liveTable + " (" + COLUMNS + ") VALUES (" + PLACEHOLDERS + ")";
    JdbcTemplate.update(conn, timeout(), sql, messageParams(message));
  }

  @Override
  public List<StoredMessage> findAll(Connection conn) {
    String sql = "SELECT " + COLUMNS + " FROM " + liveTable + " ORDER BY seq";
    return JdbcTemplate.query(conn, timeout(), sql, this::mapMessage);
  }

  @Override
  public List<StoredMessage> findBySender(Connection conn, String sender) {
    String sql = "SELECT " + COLUMNS + " FROM " + liveTable + " WHERE sender=? ORDER BY seq";
    return JdbcTemplate.query(conn, timeout(), sql, this::mapMessage, sender);
  }

  @Override
  public Optional<StoredMessage> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + liveTable + " WHERE id=?";
    List<StoredMessage> rows = JdbcTemplate.query(conn, timeout(), sql, this::mapMessage, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public int updateMerged(Connection conn, String id, long expectedRevision, String text, Instant mergedAt) {
    String sql = "UPDATE " + liveTable +
        " SET body=?, ts_time=?, ts_text=NULL, ts_epoch=NULL, revision=revision+1" +
        " WHERE id=? AND revision=?";
    return JdbcTemplate.update(conn, timeout(), sql, text, storable(mergedAt), id, expectedRevision);
  }

  @Override
  public int delete(Connection conn, String id) {
    return JdbcTemplate.update(conn, timeout(), "DELETE FROM " + liveTable + " WHERE id=?", id);
  }

  @Override
  public int deleteIfUnchanged(Connection conn, String id, long expectedRevision) {
    String sql = "DELETE FROM " + liveTable + " WHERE id=? AND revision=?";
    return JdbcTemplate.update(conn, timeout(), sql, id, expectedRevision);
  }

  @Override
  public int deleteAll(Connection conn, Collection<String> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    if (ids.size() > MAX_BATCH_OPERATIONS) {
      throw new IllegalArgumentException("At most " + MAX_BATCH_OPERATIONS + " ids per call, got: " + ids.size());
    }
    String sql = "DELETE FROM " + liveTable + " WHERE id IN (" +
        String.join(",", Collections.nCopies(ids.size(), "?")) + ")";
    return JdbcTemplate.update(conn, timeout(), sql, ids.toArray());
  }

  @Override
  public int deleteBySender(Connection conn, String sender) {
    return JdbcTemplate.update(conn, timeout(), "DELETE FROM " + liveTable + " WHERE sender=?", sender);
  }

  @Override
  public int count(Connection conn) {
    return JdbcTemplate.queryForInt(conn, timeout(), "SELECT COUNT(*) FROM " + liveTable);
  }

  // ---- archive table ----

  /**
   * Portable upsert: delete any row with the same id, then insert. Subclasses override with
   * a native single-statement form.
   */
  @Override
  public void upsert(Connection conn, ArchivedMessage message) {
    JdbcTemplate.update(conn, timeout(), "DELETE FROM " + archiveTable + " WHERE id=?", message.id());
    String sql = "INSERT INTO " + archiveTable + " (" + COLUMNS + ", archived_at) VALUES (" +
        PLACEHOLDERS + ",?)";
    JdbcTemplate.update(conn, timeout(), sql, archivedParams(message));
  }

  @Override
  public List<ArchivedMessage> findAllArchived(Connection conn) {
    String sql = "SELECT " + COLUMNS + ", archived_at FROM " + archiveTable + " ORDER BY seq";
    return JdbcTemplate.query(conn, timeout(), sql, this::mapArchived);
  }

  @Override
  public Optional<ArchivedMessage> findArchivedById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + ", archived_at FROM " + archiveTable + " WHERE id=?";
    List<ArchivedMessage> rows = JdbcTemplate.query(conn, timeout(), sql, this::mapArchived, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public int deleteArchived(Connection conn, String id) {
    return JdbcTemplate.update(conn, timeout(), "DELETE FROM " + archiveTable + " WHERE id=?", id);
  }

  @Override
  public int countArchived(Connection conn) {
    return JdbcTemplate.queryForInt(conn, timeout(), "SELECT COUNT(*) FROM " + archiveTable);
  }

  // ---- mapping ----

  /**
   * Parameters for {@link #COLUMNS}, in order.
   */
  protected Object[] messageParams(StoredMessage m) {
    Instant tsTime = null;
    String tsText = null;
    Long tsEpoch = null;
    StoredTimestamp ts = m.timestamp();
    if (ts instanceof StoredTimestamp.Structured s) {
      tsTime = storable(s.instant());
    } else if (ts instanceof StoredTimestamp.Encoded e) {
      tsText = e.text();
    } else if (ts instanceof StoredTimestamp.EpochMillis e) {
      tsEpoch = e.millis();
    }
    return new Object[]{
        m.id(), m.sender(), m.recipient(), m.text(), m.kind().code(),
        tsTime, tsText, tsEpoch, m.revision(), m.thoughtType(), jsonCodec.toJson(m.tags())
    };
  }

  /**
   * Parameters for {@link #COLUMNS} followed by {@code archived_at}.
   */
  protected Object[] archivedParams(ArchivedMessage a) {
    Object[] base = messageParams(a.message());
    Object[] params = Arrays.copyOf(base, base.length + 1);
    params[base.length] = storable(a.archivedAt());
    return params;
  }

  protected StoredMessage mapMessage(ResultSet rs) throws SQLException {
    String id = rs.getString("id");
    return new StoredMessage(
        id,
        rs.getString("sender"),
        rs.getString("recipient"),
        rs.getString("body"),
        MessageKind.of(rs.getString("kind")),
        mapTimestamp(rs),
        rs.getLong("revision"),
        rs.getString("thought_type"),
        parseTags(id, rs.getString("tags")));
  }

  protected ArchivedMessage mapArchived(ResultSet rs) throws SQLException {
    return new ArchivedMessage(mapMessage(rs), JdbcTemplate.getInstant(rs, "archived_at"));
  }

  private static StoredTimestamp mapTimestamp(ResultSet rs) throws SQLException {
    Instant time = JdbcTemplate.getInstant(rs, "ts_time");
    if (time != null) {
      return StoredTimestamp.of(time);
    }
    String text = rs.getString("ts_text");
    if (text != null) {
      return StoredTimestamp.encoded(text);
    }
    long epoch = rs.getLong("ts_epoch");
    if (!rs.wasNull()) {
      return StoredTimestamp.epochMillis(epoch);
    }
    return StoredTimestamp.ABSENT;
  }

  private List<String> parseTags(String id, String json) {
    try {
      return jsonCodec.parseArray(json);
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Ignoring malformed tags of message " + id, e);
      return List.of();
    }
  }

  /** Truncates to microseconds, the finest precision all supported databases keep. */
  protected static Instant storable(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MICROS);
  }
}
