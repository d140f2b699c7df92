package chatlog;

import chatlog.merge.MergeWindowCoalescer;
import chatlog.model.StoredMessage;
import chatlog.model.StoredTimestamp;
import chatlog.spi.LiveMessageStore;
import chatlog.spi.MetricsExporter;
import chatlog.time.TimestampExtractor;
import chatlog.tx.JdbcTransactionManager;
import com.github.f4b6a3.ulid.UlidCreator;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Appends messages to the live log, merging a message into the newest stored one when
 * both come from the same sender within the merge window.
 *
 * <p>The merge is a conditional update on the newest row's revision. If another writer
 * changed that row in between, the decision is taken again once against a fresh read; a
 * second conflict falls back to inserting a new message. Each call therefore creates
 * exactly one row or updates exactly one row.
 */
public final class MessageWriter {
  private static final Logger logger = Logger.getLogger(MessageWriter.class.getName());
  private static final int MERGE_ATTEMPTS = 2;

  private final JdbcTransactionManager txManager;
  private final LiveMessageStore liveStore;
  private final MergeWindowCoalescer coalescer;
  private final TimestampExtractor extractor;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final String defaultSender;
  private final String defaultRecipient;

  public MessageWriter(
      JdbcTransactionManager txManager,
      LiveMessageStore liveStore,
      MergeWindowCoalescer coalescer,
      TimestampExtractor extractor,
      Clock clock,
      MetricsExporter metrics,
      String defaultSender,
      String defaultRecipient
  ) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.liveStore = Objects.requireNonNull(liveStore, "liveStore");
    this.coalescer = Objects.requireNonNull(coalescer, "coalescer");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    this.defaultSender = Objects.requireNonNull(defaultSender, "defaultSender");
    this.defaultRecipient = Objects.requireNonNull(defaultRecipient, "defaultRecipient");
  }

  /**
   * Appends one message.
   *
   * @param request the message
   * @return the id holding the text and whether it was merged
   * @throws StoreUnavailableException if the store cannot be reached
   */
  public AppendResult append(AppendRequest request) {
    Objects.requireNonNull(request, "request");
    String sender = request.sender() == null ? defaultSender : request.sender();
    return txManager.withConnection(conn -> {
      Instant now = clock.instant();
      if (request.id() == null) {
        for (int attempt = 1; attempt <= MERGE_ATTEMPTS; attempt++) {
          StoredMessage newest = newest(liveStore.findAll(conn));
          if (newest == null || !mergeable(newest, sender, request, now)) {
            break;
          }
          String previous = newest.text() == null ? "" : newest.text();
          int updated = liveStore.updateMerged(conn, newest.id(), newest.revision(),
              previous + "\n\n" + request.text(), now);
          if (updated == 1) {
            metrics.incrementMerged();
            logger.log(Level.FINE, "Merged message from {0} into {1}",
                new Object[]{sender, newest.id()});
            return new AppendResult(newest.id(), true);
          }
          logger.log(Level.WARNING, "Concurrent update of {0} while merging (attempt {1}/{2})",
              new Object[]{newest.id(), attempt, MERGE_ATTEMPTS});
        }
      }
      return insert(conn, request, sender, now);
    });
  }

  private AppendResult insert(Connection conn, AppendRequest request, String sender, Instant now) {
    String id = request.id() != null ? request.id() : UlidCreator.getMonotonicUlid().toString();
    StoredTimestamp ts = request.timestamp() != null ? request.timestamp() : StoredTimestamp.of(now);
    String recipient = request.recipient() == null ? defaultRecipient : request.recipient();
    liveStore.insert(conn, StoredMessage.of(id, sender, recipient, request.text(), request.kind(), ts));
    metrics.incrementAppended();
    return new AppendResult(id, false);
  }

  private boolean mergeable(StoredMessage newest, String sender, AppendRequest request, Instant now) {
    Instant newestTs = extractor.extract(newest.timestamp(), newest.id());
    return coalescer.canMerge(newest.sender(), newest.kind(), newestTs, sender, request.kind(), now);
  }

  /**
   * Returns the message with the latest authoritative timestamp; ties go to the row
   * inserted later.
   */
  private StoredMessage newest(List<StoredMessage> all) {
    metrics.recordLiveSize(all.size());
    StoredMessage best = null;
    Instant bestTs = null;
    for (StoredMessage m : all) {
      Instant ts = extractor.extract(m.timestamp(), m.id());
      if (best == null || ts.compareTo(bestTs) >= 0) {
        best = m;
        bestTs = ts;
      }
    }
    return best;
  }
}
