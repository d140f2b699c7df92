package chatlog.thought;

import chatlog.MalformedInputException;
import chatlog.model.MessageKind;
import chatlog.model.StoredMessage;
import chatlog.model.StoredTimestamp;
import chatlog.spi.LiveMessageStore;
import chatlog.spi.MetricsExporter;
import chatlog.time.TimestampExtractor;
import chatlog.tx.JdbcTransactionManager;
import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Thoughts of one designated identity, the thinker: messages of kind {@code thought} that
 * carry a {@link ThoughtType} and tags. They share the live table with ordinary messages and
 * are compacted like them, but are always inserted as separate rows.
 */
public final class ThoughtLog {
  public static final int DEFAULT_LIMIT = 50;

  private final JdbcTransactionManager txManager;
  private final LiveMessageStore liveStore;
  private final TimestampExtractor extractor;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final String thinker;
  private final String recipient;

  public ThoughtLog(
      JdbcTransactionManager txManager,
      LiveMessageStore liveStore,
      TimestampExtractor extractor,
      Clock clock,
      MetricsExporter metrics,
      String thinker,
      String recipient
  ) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.liveStore = Objects.requireNonNull(liveStore, "liveStore");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    this.thinker = Objects.requireNonNull(thinker, "thinker");
    this.recipient = Objects.requireNonNull(recipient, "recipient");
  }

  public String thinker() {
    return thinker;
  }

  /**
   * Posts a thought. Unknown or missing types are stored as {@link ThoughtType#THOUGHT}.
   *
   * @throws MalformedInputException if {@code text} is blank
   */
  public PostedThought post(String text, String type, List<String> tags) {
    if (text == null || text.isBlank()) {
      throw new MalformedInputException("text is required");
    }
    ThoughtType thoughtType = ThoughtType.parse(type);
    String id = UlidCreator.getMonotonicUlid().toString();
    StoredMessage message = new StoredMessage(id, thinker, recipient, text, MessageKind.THOUGHT,
        StoredTimestamp.of(clock.instant()), 0L, thoughtType.name(), tags);
    txManager.withConnection(conn -> {
      liveStore.insert(conn, message);
      return null;
    });
    metrics.incrementAppended();
    return new PostedThought(id, thoughtType);
  }

  /**
   * Returns the thinker's newest {@code limit} live messages, newest first, narrowed to
   * {@code typeFilter} when it names a known type. The limit is applied before the filter.
   *
   * @param limit      most messages considered; {@code <= 0} uses {@value #DEFAULT_LIMIT}
   * @param typeFilter optional type name; unknown names are ignored
   */
  public ThoughtSnapshot recent(int limit, String typeFilter) {
    int effectiveLimit = limit <= 0 ? DEFAULT_LIMIT : limit;
    List<StoredMessage> rows = txManager.withConnection(conn -> liveStore.findBySender(conn, thinker));

    List<Thought> all = new ArrayList<>(rows.size());
    Map<ThoughtType, Integer> byType = new EnumMap<>(ThoughtType.class);
    for (StoredMessage row : rows) {
      Instant ts = extractor.extract(row.timestamp(), row.id());
      ThoughtType type = ThoughtType.parse(row.thoughtType());
      byType.merge(type, 1, Integer::sum);
      all.add(new Thought(row.id(), row.text() == null ? "" : row.text(), type,
          TimestampExtractor.isKnown(ts) ? ts : null, row.tags()));
    }
    // ascending stable sort then reverse: newest first, later inserts first on ties
    all.sort(Comparator.comparing(t -> t.timestamp() == null ? TimestampExtractor.UNKNOWN : t.timestamp()));
    Collections.reverse(all);

    List<Thought> selected = all.subList(0, Math.min(effectiveLimit, all.size()));
    Optional<ThoughtType> filter = ThoughtType.find(typeFilter);
    if (filter.isPresent()) {
      List<Thought> filtered = new ArrayList<>();
      for (Thought t : selected) {
        if (t.type() == filter.get()) {
          filtered.add(t);
        }
      }
      selected = filtered;
    }
    return new ThoughtSnapshot(selected, new ThoughtStats(rows.size(), byType));
  }
}
