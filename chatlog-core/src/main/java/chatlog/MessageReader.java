package chatlog;

import chatlog.merge.MergeWindowCoalescer;
import chatlog.model.ChatMessage;
import chatlog.model.StoredMessage;
import chatlog.spi.LiveMessageStore;
import chatlog.spi.MetricsExporter;
import chatlog.time.TimestampExtractor;
import chatlog.tx.JdbcTransactionManager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Reads the most recent live messages in chronological order, re-applying the merge
 * window so that bursts written concurrently by the same sender display as one entry.
 *
 * <p>Read-time merges only shape the returned view; stored rows are left untouched.
 */
public final class MessageReader {
  private final JdbcTransactionManager txManager;
  private final LiveMessageStore liveStore;
  private final TimestampExtractor extractor;
  private final MergeWindowCoalescer defaultCoalescer;
  private final MetricsExporter metrics;
  private final int scanLimit;
  private final int defaultLimit;

  public MessageReader(
      JdbcTransactionManager txManager,
      LiveMessageStore liveStore,
      TimestampExtractor extractor,
      MergeWindowCoalescer defaultCoalescer,
      MetricsExporter metrics,
      int scanLimit,
      int defaultLimit
  ) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.liveStore = Objects.requireNonNull(liveStore, "liveStore");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.defaultCoalescer = Objects.requireNonNull(defaultCoalescer, "defaultCoalescer");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    if (scanLimit <= 0) {
      throw new IllegalArgumentException("scanLimit must be > 0");
    }
    if (defaultLimit <= 0) {
      throw new IllegalArgumentException("defaultLimit must be > 0");
    }
    this.scanLimit = scanLimit;
    this.defaultLimit = defaultLimit;
  }

  /**
   * Returns up to {@code limit} coalesced messages, oldest first.
   *
   * @param limit  maximum entries returned; {@code <= 0} uses the configured default
   * @param window merge window; {@code null}, zero or negative uses the configured window
   * @return the newest coalesced entries in chronological order
   * @throws StoreUnavailableException if the store cannot be reached
   */
  public List<ChatMessage> fetchRecent(int limit, Duration window) {
    int effectiveLimit = limit <= 0 ? defaultLimit : limit;
    MergeWindowCoalescer coalescer = window == null || window.isZero() || window.isNegative()
        || window.equals(defaultCoalescer.window())
        ? defaultCoalescer
        : new MergeWindowCoalescer(window);

    List<StoredMessage> rows = txManager.withConnection(liveStore::findAll);
    metrics.recordLiveSize(rows.size());

    List<ChatMessage> ordered = chronological(rows, extractor, false);
    if (ordered.size() > scanLimit) {
      ordered = ordered.subList(ordered.size() - scanLimit, ordered.size());
    }
    List<ChatMessage> merged = coalescer.coalesce(ordered);
    if (merged.size() > effectiveLimit) {
      merged = merged.subList(merged.size() - effectiveLimit, merged.size());
    }
    return List.copyOf(merged);
  }

  /**
   * Converts rows to read views sorted by authoritative timestamp. The sort is stable, so
   * rows with equal timestamps keep their insertion order.
   */
  static List<ChatMessage> chronological(List<StoredMessage> rows, TimestampExtractor extractor,
      boolean archived) {
    List<ChatMessage> views = new ArrayList<>(rows.size());
    for (StoredMessage row : rows) {
      views.add(ChatMessage.from(row, extractor, archived));
    }
    views.sort(Comparator.comparing(ChatMessage::timestamp));
    return views;
  }
}
