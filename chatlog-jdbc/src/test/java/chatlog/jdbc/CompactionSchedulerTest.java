package chatlog.jdbc;

import chatlog.compact.CompactionResult;
import chatlog.compact.CompactionScheduler;
import chatlog.compact.Compactor;
import chatlog.jdbc.store.H2MessageStore;
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
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CompactionSchedulerTest {

  private static final Instant T0 = Instant.parse("2026-02-09T10:00:00Z");

  private JdbcDataSource dataSource;
  private H2MessageStore store;
  private Compactor compactor;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = TestDatabase.h2();
    store = new H2MessageStore();
    MutableClock clock = new MutableClock(T0.plusSeconds(3600));
    compactor = new Compactor(new JdbcTransactionManager(new DataSourceConnectionProvider(dataSource)), store,
        store, new TimestampExtractor(clock), clock, new CountingMetrics(), 250);
    try (Connection conn = dataSource.getConnection()) {
      for (int i = 0; i < 12; i++) {
        store.insert(conn, StoredMessage.of("m" + i, "agent", "team", "x", MessageKind.MESSAGE,
            StoredTimestamp.of(T0.plusSeconds(i))));
      }
    }
  }

  @Test
  void runOnceCompacts() throws SQLException {
    try (CompactionScheduler scheduler = CompactionScheduler.builder()
        .compactor(compactor)
        .keepLive(5)
        .maxPerRun(100)
        .build()) {
      CompactionResult result = scheduler.runOnce();

      assertEquals(new CompactionResult(7, 5), result);
    }
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(7, store.countArchived(conn));
    }
  }

  @Test
  void runOnceAfterCloseDoesNothing() {
    CompactionScheduler scheduler = CompactionScheduler.builder().compactor(compactor).keepLive(5).build();
    scheduler.close();

    assertNull(scheduler.runOnce());
  }

  @Test
  void failedCycleIsLoggedNotThrown() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute("DROP TABLE archive_message");
    }
    try (CompactionScheduler scheduler = CompactionScheduler.builder()
        .compactor(compactor)
        .keepLive(0)
        .build()) {
      assertNull(scheduler.runOnce());
    }
  }

  @Test
  void startAndClose() {
    CompactionScheduler scheduler = CompactionScheduler.builder()
        .compactor(compactor)
        .intervalSeconds(3600)
        .build();
    scheduler.start();
    scheduler.start();
    assertTrue(scheduler.isRunning());

    scheduler.close();
    assertFalse(scheduler.isRunning());
    assertThrows(IllegalStateException.class, scheduler::start);
  }

  @Test
  void invalidSettingsAreRejected() {
    assertThrows(NullPointerException.class, () -> CompactionScheduler.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> CompactionScheduler.builder().compactor(compactor).keepLive(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> CompactionScheduler.builder().compactor(compactor).maxPerRun(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> CompactionScheduler.builder().compactor(compactor).intervalSeconds(0).build());
  }
}
