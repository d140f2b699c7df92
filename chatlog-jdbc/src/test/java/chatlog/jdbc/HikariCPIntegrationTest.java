package chatlog.jdbc;

import chatlog.AppendResult;
import chatlog.ChatLog;
import chatlog.jdbc.store.H2MessageStore;
import chatlog.model.ChatMessage;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private H2MessageStore store;
  private ChatLog chatLog;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("chatlog-test-pool");

    hikariDs = new HikariDataSource(config);
    store = new H2MessageStore();
    try (Connection conn = hikariDs.getConnection()) {
      JdbcSchema.create(conn, "h2");
    }
    chatLog = ChatLog.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .liveStore(store)
        .archiveStore(store)
        .mergeWindow(Duration.ofMillis(1))
        .build();
  }

  @AfterEach
  void tearDown() {
    chatLog.close();
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void concurrentAppendsLoseNothing() throws Exception {
    int threads = 8;
    int perThread = 25;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<AppendResult>>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      String sender = "agent-" + t;
      futures.add(pool.submit(() -> {
        start.await();
        List<AppendResult> results = new ArrayList<>();
        for (int i = 0; i < perThread; i++) {
          results.add(chatLog.append(sender, null, sender + " #" + i, "task"));
        }
        return results;
      }));
    }
    start.countDown();

    Set<String> ids = ConcurrentHashMap.newKeySet();
    for (Future<List<AppendResult>> f : futures) {
      for (AppendResult r : f.get(30, TimeUnit.SECONDS)) {
        assertFalse(r.merged());
        ids.add(r.id());
      }
    }
    pool.shutdown();

    assertEquals(threads * perThread, ids.size());
    try (Connection conn = hikariDs.getConnection()) {
      assertEquals(threads * perThread, store.count(conn));
    }
  }

  @Test
  void concurrentMergesKeepEveryText() throws Exception {
    ChatLog merging = ChatLog.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .liveStore(store)
        .archiveStore(store)
        .mergeWindow(Duration.ofHours(1))
        .build();
    int threads = 4;
    int perThread = 20;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      int thread = t;
      futures.add(pool.submit(() -> {
        for (int i = 0; i < perThread; i++) {
          merging.append("agent", null, "line-" + thread + "-" + i, null);
        }
        return null;
      }));
    }
    for (Future<?> f : futures) {
      f.get(30, TimeUnit.SECONDS);
    }
    pool.shutdown();

    StringBuilder all = new StringBuilder();
    for (ChatMessage m : merging.fetchRecent(1_000, 0)) {
      all.append(m.text()).append("\n\n");
    }
    for (int t = 0; t < threads; t++) {
      for (int i = 0; i < perThread; i++) {
        assertTrue(all.toString().contains("line-" + t + "-" + i + "\n\n"), "missing line-" + t + "-" + i);
      }
    }
    merging.close();
  }
}
