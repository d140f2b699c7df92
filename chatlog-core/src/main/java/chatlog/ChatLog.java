package chatlog;

import chatlog.archive.ArchivePage;
import chatlog.archive.ArchivePaginator;
import chatlog.compact.CompactionResult;
import chatlog.compact.CompactionScheduler;
import chatlog.compact.Compactor;
import chatlog.merge.MergeWindowCoalescer;
import chatlog.model.ChatMessage;
import chatlog.retry.ExponentialBackoffRetryPolicy;
import chatlog.retry.RetryPolicy;
import chatlog.retry.StoreRetrier;
import chatlog.spi.ArchiveMessageStore;
import chatlog.spi.ConnectionProvider;
import chatlog.spi.LiveMessageStore;
import chatlog.spi.MetricsExporter;
import chatlog.thought.ThoughtLog;
import chatlog.time.TimestampExtractor;
import chatlog.tx.JdbcTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that wires the writer, reader, deleter, compactor, archive paginator and
 * thought log over one pair of live/archive stores.
 *
 * <p>Store-facing calls are retried with backoff when the store is unavailable. Compaction
 * is not retried as a whole: a {@link PartialCompactionException} reaches the caller, who
 * may simply call {@link #compact()} again.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (ChatLog chatLog = ChatLog.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .liveStore(store)
 *     .archiveStore(store)
 *     .compactionIntervalSeconds(300)
 *     .build()) {
 *   chatLog.append("agent-7", null, "build is green", null);
 *   List<ChatMessage> recent = chatLog.fetchRecent(50, 60);
 * }
 * }</pre>
 */
public final class ChatLog implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ChatLog.class.getName());

  private final MessageWriter writer;
  private final MessageReader reader;
  private final MessageDeleter deleter;
  private final Compactor compactor;
  private final ArchivePaginator paginator;
  private final ThoughtLog thoughts;
  private final CompactionScheduler scheduler;
  private final StoreRetrier retrier;
  private final MetricsExporter metrics;
  private final int keepLive;
  private final int maxPerRun;

  private ChatLog(Builder b, MessageWriter writer, MessageReader reader, MessageDeleter deleter,
      Compactor compactor, ArchivePaginator paginator, ThoughtLog thoughts,
      CompactionScheduler scheduler, StoreRetrier retrier) {
    this.writer = writer;
    this.reader = reader;
    this.deleter = deleter;
    this.compactor = compactor;
    this.paginator = paginator;
    this.thoughts = thoughts;
    this.scheduler = scheduler;
    this.retrier = retrier;
    this.metrics = b.metrics;
    this.keepLive = b.keepLive;
    this.maxPerRun = b.maxPerRun;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the newest coalesced live messages, oldest first.
   *
   * @param limit         most entries returned; {@code <= 0} uses the configured default
   * @param windowSeconds merge window in seconds; {@code <= 0} uses the configured window
   */
  public List<ChatMessage> fetchRecent(int limit, long windowSeconds) {
    Duration window = windowSeconds <= 0 ? null : Duration.ofSeconds(windowSeconds);
    return retrier.call("fetchRecent", () -> reader.fetchRecent(limit, window));
  }

  /**
   * Appends a message; blank sender, recipient or kind take the configured defaults.
   */
  public AppendResult append(String sender, String recipient, String text, String kind) {
    return append(AppendRequest.of(sender, recipient, text, kind));
  }

  public AppendResult append(AppendRequest request) {
    return retrier.call("append", () -> writer.append(request));
  }

  /**
   * @throws NotFoundException if no live message has this id
   */
  public void deleteOne(String id) {
    retrier.call("deleteOne", () -> {
      deleter.deleteOne(id);
      return null;
    });
  }

  public int deleteMany(Collection<String> ids) {
    return retrier.call("deleteMany", () -> deleter.deleteMany(ids));
  }

  public int deleteBySender(String sender) {
    return retrier.call("deleteBySender", () -> deleter.deleteBySender(sender));
  }

  public int deleteOlderThan(int days) {
    return retrier.call("deleteOlderThan", () -> deleter.deleteOlderThan(days));
  }

  public ArchivePage fetchArchivePage(int pageIndex, int pageSize) {
    return retrier.call("fetchArchivePage", () -> paginator.page(pageIndex, pageSize));
  }

  /**
   * Compacts with the configured {@code keepLive} and {@code maxPerRun}.
   */
  public CompactionResult compact() {
    return compact(keepLive, maxPerRun);
  }

  /**
   * @throws PartialCompactionException if a relocation batch failed
   */
  public CompactionResult compact(int keepLive, int maxPerRun) {
    return compactor.compact(keepLive, maxPerRun);
  }

  public ThoughtLog thoughts() {
    return thoughts;
  }

  /**
   * Stops the compaction scheduler, if one was configured, and closes a closeable
   * metrics exporter.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (scheduler != null) {
      try {
        scheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new IllegalStateException(
            "Failed to close metrics exporter", e);
        if (first == null) {
          first = re;
        } else {
          first.addSuppressed(re);
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link ChatLog}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private LiveMessageStore liveStore;
    private ArchiveMessageStore archiveStore;
    private Clock clock = Clock.systemUTC();
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Duration mergeWindow = Duration.ofSeconds(60);
    private String defaultSender = "operator";
    private String defaultRecipient = ChatMessage.BROADCAST;
    private int keepLive = 100;
    private int maxPerRun = 200;
    private int relocationBatchSize = LiveMessageStore.MAX_BATCH_OPERATIONS / 2;
    private int recentScanLimit = 300;
    private int recentLimit = 100;
    private int defaultPageSize = 50;
    private int maxPageSize = 200;
    private String thinker = "assistant";
    private RetryPolicy retryPolicy;
    private int maxAttempts = 3;
    private long compactionIntervalSeconds;
    private boolean built;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder liveStore(LiveMessageStore liveStore) {
      this.liveStore = liveStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder archiveStore(ArchiveMessageStore archiveStore) {
      this.archiveStore = archiveStore;
      return this;
    }

    /** Clock used for new timestamps and the future clamp. Defaults to UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Defaults to 60 seconds. Must be positive. */
    public Builder mergeWindow(Duration mergeWindow) {
      this.mergeWindow = mergeWindow;
      return this;
    }

    /** Sender used when a message has none. Defaults to {@code operator}. */
    public Builder defaultSender(String defaultSender) {
      this.defaultSender = defaultSender;
      return this;
    }

    /** Defaults to {@code team}. */
    public Builder defaultRecipient(String defaultRecipient) {
      this.defaultRecipient = defaultRecipient;
      return this;
    }

    /** Live messages kept by {@link ChatLog#compact()}. Defaults to 100. */
    public Builder keepLive(int keepLive) {
      this.keepLive = keepLive;
      return this;
    }

    /** Most messages relocated per compaction run. Defaults to 200. */
    public Builder maxPerRun(int maxPerRun) {
      this.maxPerRun = maxPerRun;
      return this;
    }

    /** Messages relocated per transaction. Defaults to 250, which is also the maximum. */
    public Builder relocationBatchSize(int relocationBatchSize) {
      this.relocationBatchSize = relocationBatchSize;
      return this;
    }

    /** Newest live messages considered by {@link ChatLog#fetchRecent}. Defaults to 300. */
    public Builder recentScanLimit(int recentScanLimit) {
      this.recentScanLimit = recentScanLimit;
      return this;
    }

    /** Default result size of {@link ChatLog#fetchRecent}. Defaults to 100. */
    public Builder recentLimit(int recentLimit) {
      this.recentLimit = recentLimit;
      return this;
    }

    public Builder defaultPageSize(int defaultPageSize) {
      this.defaultPageSize = defaultPageSize;
      return this;
    }

    public Builder maxPageSize(int maxPageSize) {
      this.maxPageSize = maxPageSize;
      return this;
    }

    /** Identity whose messages form the thought log. Defaults to {@code assistant}. */
    public Builder thinker(String thinker) {
      this.thinker = thinker;
      return this;
    }

    /** Defaults to exponential backoff from 200 ms capped at 5 s. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Attempts per store-facing call, including the first. Defaults to 3. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Starts a background {@link CompactionScheduler} with this delay. Defaults to
     * {@code 0}, meaning compaction only runs when {@link ChatLog#compact()} is called.
     */
    public Builder compactionIntervalSeconds(long compactionIntervalSeconds) {
      this.compactionIntervalSeconds = compactionIntervalSeconds;
      return this;
    }

    /**
     * @throws ConfigurationException if a required collaborator is missing or a setting is
     *                                out of range
     * @throws IllegalStateException  if called twice
     */
    public ChatLog build() {
      if (built) {
        throw new IllegalStateException("build() already called on this builder");
      }
      validate();
      built = true;

      JdbcTransactionManager txManager = new JdbcTransactionManager(connectionProvider);
      TimestampExtractor extractor = new TimestampExtractor(clock);
      MergeWindowCoalescer coalescer = new MergeWindowCoalescer(mergeWindow);
      RetryPolicy policy = retryPolicy != null ? retryPolicy : new ExponentialBackoffRetryPolicy(200, 5_000);

      try {
        MessageWriter writer = new MessageWriter(txManager, liveStore, coalescer, extractor, clock,
            metrics, defaultSender, defaultRecipient);
        MessageReader reader = new MessageReader(txManager, liveStore, extractor, coalescer, metrics,
            recentScanLimit, recentLimit);
        MessageDeleter deleter = new MessageDeleter(txManager, liveStore, extractor, clock, metrics);
        Compactor compactor = new Compactor(txManager, liveStore, archiveStore, extractor, clock,
            metrics, relocationBatchSize);
        ArchivePaginator paginator = new ArchivePaginator(txManager, archiveStore, extractor,
            defaultPageSize, maxPageSize);
        ThoughtLog thoughts = new ThoughtLog(txManager, liveStore, extractor, clock, metrics,
            thinker, defaultRecipient);

        CompactionScheduler scheduler = null;
        if (compactionIntervalSeconds > 0) {
          scheduler = CompactionScheduler.builder()
              .compactor(compactor)
              .keepLive(keepLive)
              .maxPerRun(maxPerRun)
              .intervalSeconds(compactionIntervalSeconds)
              .build();
          scheduler.start();
          logger.log(Level.INFO, "Scheduled compaction every {0}s keeping {1} live messages",
              new Object[]{compactionIntervalSeconds, keepLive});
        }
        return new ChatLog(this, writer, reader, deleter, compactor, paginator, thoughts,
            scheduler, new StoreRetrier(policy, maxAttempts));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Invalid chat log configuration: " + e.getMessage(), e);
      }
    }

    private void validate() {
      require(connectionProvider, "connectionProvider");
      require(liveStore, "liveStore");
      require(archiveStore, "archiveStore");
      require(clock, "clock");
      require(mergeWindow, "mergeWindow");
      require(defaultSender, "defaultSender");
      require(defaultRecipient, "defaultRecipient");
      require(thinker, "thinker");
      if (metrics == null) {
        metrics = MetricsExporter.NOOP;
      }
      if (mergeWindow.isZero() || mergeWindow.isNegative()) {
        throw new ConfigurationException("mergeWindow must be positive");
      }
      if (keepLive < 0) {
        throw new ConfigurationException("keepLive must be >= 0");
      }
      if (maxPerRun <= 0) {
        throw new ConfigurationException("maxPerRun must be > 0");
      }
      if (maxAttempts <= 0) {
        throw new ConfigurationException("maxAttempts must be > 0");
      }
      if (compactionIntervalSeconds < 0) {
        throw new ConfigurationException("compactionIntervalSeconds must be >= 0");
      }
    }

    private static void require(Object value, String name) {
      if (value == null) {
        throw new ConfigurationException(name + " is required");
      }
    }
  }
}
