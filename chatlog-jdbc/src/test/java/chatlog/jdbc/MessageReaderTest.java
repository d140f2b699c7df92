package chatlog.jdbc;

import chatlog.MessageReader;
import chatlog.jdbc.store.H2MessageStore;
import chatlog.merge.MergeWindowCoalescer;
import chatlog.model.ChatMessage;
import chatlog.model.MessageKind;
import chatlog.model.StoredMessage;
import chatlog.model.StoredTimestamp;
import chatlog.time.TimestampExtractor;
import chatlog.tx.JdbcTransactionManager;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageReaderTest {

  private static final Instant T0 = Instant.parse("2026-02-09T10:00:00Z");

  private JdbcDataSource dataSource;
  private H2MessageStore store;
  private CountingMetrics metrics;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = TestDatabase.h2();
    store = new H2MessageStore();
    metrics = new CountingMetrics();
  }

  @Test
  void returnsCoalescedMessagesOldestFirst() throws SQLException {
    insert("1", "A", "hello", MessageKind.MESSAGE, StoredTimestamp.of(T0));
    insert("2", "A", "world", MessageKind.MESSAGE, StoredTimestamp.of(T0.plusSeconds(30)));
    insert("3", "B", "hi", MessageKind.MESSAGE, StoredTimestamp.of(T0.plusSeconds(40)));

    List<ChatMessage> recent = reader(300, 100).fetchRecent(0, null);

    assertEquals(2, recent.size());
    assertEquals("1", recent.get(0).id());
    assertEquals("hello\n\nworld", recent.get(0).text());
    assertEquals(T0.plusSeconds(30), recent.get(0).timestamp());
    assertEquals("3", recent.get(1).id());
    assertEquals(3, metrics.liveSize);
  }

  @Test
  void sortsByAuthoritativeTimestamp() throws SQLException {
    insert("late", "A", "late", MessageKind.MESSAGE, StoredTimestamp.of(T0.plusSeconds(3600)));
    insert("legacy", "B", "legacy", MessageKind.MESSAGE, StoredTimestamp.encoded("2026-02-09T09-00-00Z"));
    insert("2026-02-09T09-30-00Z_C", "C", "by id", MessageKind.MESSAGE, StoredTimestamp.ABSENT);
    insert("undated", "D", "undated", MessageKind.MESSAGE, StoredTimestamp.ABSENT);

    List<String> ids = reader(300, 100).fetchRecent(10, null).stream().map(ChatMessage::id).toList();

    assertEquals(List.of("undated", "legacy", "2026-02-09T09-30-00Z_C", "late"), ids);
  }

  @Test
  void windowOverrideWidensMerging() throws SQLException {
    insert("1", "A", "a", MessageKind.MESSAGE, StoredTimestamp.of(T0));
    insert("2", "A", "b", MessageKind.MESSAGE, StoredTimestamp.of(T0.plusSeconds(90)));

    assertEquals(2, reader(300, 100).fetchRecent(10, null).size());
    assertEquals(1, reader(300, 100).fetchRecent(10, Duration.ofSeconds(120)).size());
  }

  @Test
  void limitKeepsNewestEntries() throws SQLException {
    for (int i = 0; i < 10; i++) {
      insert("m" + i, "agent" + (i % 2), "text", MessageKind.MESSAGE, StoredTimestamp.of(T0.plusSeconds(i)));
    }

    List<ChatMessage> recent = reader(300, 100).fetchRecent(3, null);

    assertEquals(List.of("m7", "m8", "m9"), recent.stream().map(ChatMessage::id).toList());
  }

  @Test
  void scanLimitBoundsTheMergedSequence() throws SQLException {
    for (int i = 0; i < 10; i++) {
      insert("m" + i, "agent" + (i % 2), "text", MessageKind.MESSAGE, StoredTimestamp.of(T0.plusSeconds(i)));
    }

    assertEquals(4, reader(4, 100).fetchRecent(100, null).size());
  }

  @Test
  void readsDoNotPersistMerges() throws SQLException {
    insert("1", "A", "a", MessageKind.MESSAGE, StoredTimestamp.of(T0));
    insert("2", "A", "b", MessageKind.MESSAGE, StoredTimestamp.of(T0.plusSeconds(1)));

    reader(300, 100).fetchRecent(10, null);

    try (Connection conn = dataSource.getConnection()) {
      assertEquals(2, store.count(conn));
    }
  }

  @Test
  void nullFieldsAreNormalized() throws SQLException {
    insert("1", null, null, MessageKind.MESSAGE, StoredTimestamp.of(T0));

    ChatMessage m = reader(300, 100).fetchRecent(10, null).get(0);

    assertEquals(ChatMessage.UNKNOWN_SENDER, m.sender());
    assertEquals(ChatMessage.BROADCAST, m.recipient());
    assertEquals("", m.text());
    assertFalse(m.archived());
  }

  private MessageReader reader(int scanLimit, int defaultLimit) {
    Clock clock = Clock.fixed(T0.plusSeconds(7200), ZoneOffset.UTC);
    return new MessageReader(new JdbcTransactionManager(new DataSourceConnectionProvider(dataSource)), store,
        new TimestampExtractor(clock), new MergeWindowCoalescer(Duration.ofSeconds(60)), metrics,
        scanLimit, defaultLimit);
  }

  private void insert(String id, String sender, String text, MessageKind kind, StoredTimestamp ts)
      throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, StoredMessage.of(id, sender, null, text, kind, ts));
    }
  }
}
