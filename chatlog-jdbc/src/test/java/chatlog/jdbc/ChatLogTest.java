package chatlog.jdbc;

import chatlog.AppendResult;
import chatlog.ChatLog;
import chatlog.ConfigurationException;
import chatlog.NotFoundException;
import chatlog.StoreUnavailableException;
import chatlog.archive.ArchivePage;
import chatlog.compact.CompactionResult;
import chatlog.jdbc.store.H2MessageStore;
import chatlog.model.ChatMessage;
import chatlog.spi.ConnectionProvider;
import chatlog.thought.ThoughtSnapshot;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ChatLogTest {

  private static final Instant T0 = Instant.parse("2026-02-09T10:00:00Z");

  private JdbcDataSource dataSource;
  private H2MessageStore store;
  private MutableClock clock;
  private CountingMetrics metrics;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = TestDatabase.h2();
    store = new H2MessageStore();
    clock = new MutableClock(T0);
    metrics = new CountingMetrics();
  }

  @Test
  void appendFetchCompactAndPage() {
    try (ChatLog chatLog = builder(new DataSourceConnectionProvider(dataSource)).keepLive(2).build()) {
      chatLog.append("agent-1", null, "hello", null);
      clock.advance(Duration.ofSeconds(10));
      AppendResult merged = chatLog.append("agent-1", null, "again", null);
      assertTrue(merged.merged());
      clock.advance(Duration.ofSeconds(10));
      chatLog.append("agent-2", "agent-1", "reply", null);
      clock.advance(Duration.ofSeconds(10));
      chatLog.append("agent-3", null, "status", "task");
      clock.advance(Duration.ofSeconds(10));
      chatLog.append("agent-1", null, "done", null);

      List<ChatMessage> recent = chatLog.fetchRecent(10, 0);
      assertEquals(4, recent.size());
      assertEquals("hello\n\nagain", recent.get(0).text());
      assertEquals("agent-1", recent.get(1).recipient());

      CompactionResult result = chatLog.compact();
      assertEquals(new CompactionResult(2, 2), result);

      ArchivePage page = chatLog.fetchArchivePage(0, 0);
      assertEquals(2, page.total());
      assertEquals("hello\n\nagain", page.items().get(0).text());
      assertEquals(List.of("status", "done"), chatLog.fetchRecent(10, 0).stream().map(ChatMessage::text).toList());
    }
  }

  @Test
  void deleteOperations() {
    try (ChatLog chatLog = builder(new DataSourceConnectionProvider(dataSource)).build()) {
      String a = chatLog.append("x", null, "a", null).id();
      clock.advance(Duration.ofMinutes(5));
      String b = chatLog.append("x", null, "b", null).id();
      clock.advance(Duration.ofMinutes(5));
      chatLog.append("y", null, "c", null);
      clock.advance(Duration.ofMinutes(5));
      chatLog.append("z", null, "d", null);

      chatLog.deleteOne(a);
      assertThrows(NotFoundException.class, () -> chatLog.deleteOne(a));
      assertEquals(1, chatLog.deleteMany(List.of(b, "missing")));
      assertEquals(1, chatLog.deleteBySender("y"));
      clock.advance(Duration.ofDays(3));
      assertEquals(1, chatLog.deleteOlderThan(2));
      assertTrue(chatLog.fetchRecent(10, 0).isEmpty());
    }
  }

  @Test
  void thoughtsShareTheLiveTable() {
    try (ChatLog chatLog = builder(new DataSourceConnectionProvider(dataSource)).thinker("planner").build()) {
      chatLog.thoughts().post("consider sharding", "idea", List.of("scale"));

      ThoughtSnapshot snapshot = chatLog.thoughts().recent(10, null);
      assertEquals(1, snapshot.stats().total());
      List<ChatMessage> recent = chatLog.fetchRecent(10, 0);
      assertEquals("planner", recent.get(0).sender());
      assertEquals("thought", recent.get(0).kind().code());
    }
  }

  @Test
  void transientFailuresAreRetried() {
    AtomicInteger calls = new AtomicInteger();
    ConnectionProvider flaky = () -> {
      if (calls.incrementAndGet() == 1) {
        throw new SQLTransientConnectionException("pool exhausted");
      }
      return dataSource.getConnection();
    };
    try (ChatLog chatLog = builder(flaky).retryPolicy(attempts -> 1L).maxAttempts(2).build()) {
      assertFalse(chatLog.append("a", null, "hi", null).merged());
      assertEquals(2, calls.get());
    }
  }

  @Test
  void retriesGiveUpAfterMaxAttempts() {
    AtomicInteger calls = new AtomicInteger();
    ConnectionProvider down = () -> {
      calls.incrementAndGet();
      throw new SQLTransientConnectionException("down");
    };
    try (ChatLog chatLog = builder(down).retryPolicy(attempts -> 1L).maxAttempts(3).build()) {
      StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
          () -> chatLog.fetchRecent(10, 0));
      assertTrue(ex.retryable());
      assertEquals(3, calls.get());
    }
  }

  @Test
  void invalidConfigurationFailsAtBuild() {
    ConnectionProvider provider = new DataSourceConnectionProvider(dataSource);
    assertThrows(ConfigurationException.class, () -> builder(provider).mergeWindow(Duration.ZERO).build());
    assertThrows(ConfigurationException.class, () -> builder(provider).keepLive(-1).build());
    assertThrows(ConfigurationException.class, () -> builder(provider).relocationBatchSize(1_000).build());
    assertThrows(ConfigurationException.class, () -> builder(provider).maxPageSize(0).build());
  }

  @Test
  void builderIsSingleUse() {
    ChatLog.Builder builder = builder(new DataSourceConnectionProvider(dataSource));
    builder.build().close();
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void scheduledCompactionStopsOnClose() {
    ChatLog chatLog = builder(new DataSourceConnectionProvider(dataSource))
        .compactionIntervalSeconds(3600)
        .build();
    chatLog.close();
    chatLog.close();
  }

  private ChatLog.Builder builder(ConnectionProvider provider) {
    return ChatLog.builder()
        .connectionProvider(provider)
        .liveStore(store)
        .archiveStore(store)
        .clock(clock)
        .metrics(metrics);
  }
}
