package chatlog;

import chatlog.model.StoredMessage;
import chatlog.spi.LiveMessageStore;
import chatlog.spi.MetricsExporter;
import chatlog.time.TimestampExtractor;
import chatlog.tx.JdbcTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Explicit removal of live messages: by id, by a list of ids, by sender, or by age.
 *
 * <p>Bulk deletions run in transactions of at most
 * {@link LiveMessageStore#MAX_BATCH_OPERATIONS} rows.
 */
public final class MessageDeleter {
  private static final Logger logger = Logger.getLogger(MessageDeleter.class.getName());

  /**
   * Most ids honoured by one {@link #deleteMany} call; further ids are ignored.
   */
  public static final int MAX_IDS_PER_CALL = LiveMessageStore.MAX_BATCH_OPERATIONS;

  private final JdbcTransactionManager txManager;
  private final LiveMessageStore liveStore;
  private final TimestampExtractor extractor;
  private final Clock clock;
  private final MetricsExporter metrics;

  public MessageDeleter(
      JdbcTransactionManager txManager,
      LiveMessageStore liveStore,
      TimestampExtractor extractor,
      Clock clock,
      MetricsExporter metrics
  ) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.liveStore = Objects.requireNonNull(liveStore, "liveStore");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  /**
   * Deletes one live message.
   *
   * @throws NotFoundException if no live message has this id
   */
  public void deleteOne(String id) {
    if (id == null || id.isBlank()) {
      throw new MalformedInputException("id is required");
    }
    int deleted = txManager.withConnection(conn -> liveStore.delete(conn, id));
    if (deleted == 0) {
      throw new NotFoundException(id);
    }
    metrics.incrementDeleted(1);
  }

  /**
   * Deletes the given ids. Duplicates count once and only the first
   * {@value #MAX_IDS_PER_CALL} distinct ids are processed.
   *
   * @return number of messages actually deleted
   */
  public int deleteMany(Collection<String> ids) {
    if (ids == null || ids.isEmpty()) {
      throw new MalformedInputException("ids are required");
    }
    Set<String> distinct = new LinkedHashSet<>();
    for (String id : ids) {
      if (id != null && !id.isBlank()) {
        distinct.add(id);
      }
      if (distinct.size() == MAX_IDS_PER_CALL) {
        break;
      }
    }
    if (distinct.isEmpty()) {
      return 0;
    }
    int deleted = deleteInBatches(new ArrayList<>(distinct));
    logger.log(Level.INFO, "Deleted {0} of {1} requested messages",
        new Object[]{deleted, distinct.size()});
    return deleted;
  }

  /**
   * Deletes every live message of {@code sender}.
   *
   * @return number of messages deleted
   */
  public int deleteBySender(String sender) {
    if (sender == null || sender.isBlank()) {
      throw new MalformedInputException("sender is required");
    }
    int deleted = txManager.inTransaction(conn -> liveStore.deleteBySender(conn, sender));
    metrics.incrementDeleted(deleted);
    logger.log(Level.INFO, "Deleted {0} messages from {1}", new Object[]{deleted, sender});
    return deleted;
  }

  /**
   * Deletes live messages whose known timestamp is more than {@code days} days old.
   * Messages with an unknown timestamp are kept.
   *
   * @return number of messages deleted
   */
  public int deleteOlderThan(int days) {
    if (days <= 0) {
      throw new MalformedInputException("days must be > 0, got: " + days);
    }
    Instant cutoff = clock.instant().minus(Duration.ofDays(days));
    List<StoredMessage> all = txManager.withConnection(liveStore::findAll);
    List<String> expired = new ArrayList<>();
    for (StoredMessage m : all) {
      Instant ts = extractor.extract(m.timestamp(), m.id());
      if (TimestampExtractor.isKnown(ts) && ts.isBefore(cutoff)) {
        expired.add(m.id());
      }
    }
    if (expired.isEmpty()) {
      return 0;
    }
    int deleted = deleteInBatches(expired);
    logger.log(Level.INFO, "Deleted {0} messages older than {1}", new Object[]{deleted, cutoff});
    return deleted;
  }

  private int deleteInBatches(List<String> ids) {
    int total = 0;
    for (int from = 0; from < ids.size(); from += LiveMessageStore.MAX_BATCH_OPERATIONS) {
      List<String> chunk = ids.subList(from,
          Math.min(ids.size(), from + LiveMessageStore.MAX_BATCH_OPERATIONS));
      int deleted = txManager.inTransaction(conn -> liveStore.deleteAll(conn, chunk));
      metrics.incrementDeleted(deleted);
      total += deleted;
    }
    return total;
  }
}
