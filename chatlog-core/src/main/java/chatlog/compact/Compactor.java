package chatlog.compact;

import chatlog.MalformedInputException;
import chatlog.PartialCompactionException;
import chatlog.model.ArchivedMessage;
import chatlog.model.StoredMessage;
import chatlog.spi.ArchiveMessageStore;
import chatlog.spi.LiveMessageStore;
import chatlog.spi.MetricsExporter;
import chatlog.time.TimestampExtractor;
import chatlog.tx.JdbcTransactionManager;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves the oldest live messages into the archive so that the live table holds about
 * {@code keepLive} messages.
 *
 * <p>Candidates are chosen from a snapshot of the live table taken before anything is
 * deleted, ordered by authoritative timestamp with insertion order breaking ties. Each
 * batch runs in one transaction: a candidate is deleted from the live table only if its
 * revision is unchanged since the snapshot, and only deleted candidates are written to the
 * archive. A candidate merged or deleted concurrently therefore stays where it is.
 *
 * <p>Archive writes replace an existing row with the same id, so re-running after an
 * interrupted run never duplicates a message.
 */
public final class Compactor {
  private static final Logger logger = Logger.getLogger(Compactor.class.getName());

  private final JdbcTransactionManager txManager;
  private final LiveMessageStore liveStore;
  private final ArchiveMessageStore archiveStore;
  private final TimestampExtractor extractor;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final int batchSize;

  /**
   * @param batchSize messages relocated per transaction; each costs one delete and one
   *                  write, so at most {@code MAX_BATCH_OPERATIONS / 2}
   */
  public Compactor(
      JdbcTransactionManager txManager,
      LiveMessageStore liveStore,
      ArchiveMessageStore archiveStore,
      TimestampExtractor extractor,
      Clock clock,
      MetricsExporter metrics,
      int batchSize
  ) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.liveStore = Objects.requireNonNull(liveStore, "liveStore");
    this.archiveStore = Objects.requireNonNull(archiveStore, "archiveStore");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    int maxBatch = LiveMessageStore.MAX_BATCH_OPERATIONS / 2;
    if (batchSize <= 0 || batchSize > maxBatch) {
      throw new IllegalArgumentException("batchSize must be in [1, " + maxBatch + "], got: " + batchSize);
    }
    this.batchSize = batchSize;
  }

  /**
   * Relocates the oldest {@code min(total - keepLive, maxPerRun)} live messages.
   *
   * @param keepLive  live messages to keep; must be &ge; 0
   * @param maxPerRun most messages relocated by this call; must be &gt; 0
   * @return relocated count and the live count afterwards
   * @throws MalformedInputException     on invalid arguments
   * @throws PartialCompactionException  if a batch failed; earlier batches stay committed
   * @throws chatlog.StoreUnavailableException if the initial snapshot cannot be read
   */
  public CompactionResult compact(int keepLive, int maxPerRun) {
    if (keepLive < 0) {
      throw new MalformedInputException("keepLive must be >= 0, got: " + keepLive);
    }
    if (maxPerRun <= 0) {
      throw new MalformedInputException("maxPerRun must be > 0, got: " + maxPerRun);
    }

    List<StoredMessage> snapshot = txManager.withConnection(liveStore::findAll);
    int total = snapshot.size();
    metrics.recordLiveSize(total);
    if (total <= keepLive) {
      return new CompactionResult(0, total);
    }

    List<StoredMessage> candidates = oldestFirst(snapshot)
        .subList(0, Math.min(total - keepLive, maxPerRun));

    Instant archivedAt = clock.instant();
    int relocated = 0;
    for (int from = 0; from < candidates.size(); from += batchSize) {
      List<StoredMessage> batch = candidates.subList(from, Math.min(candidates.size(), from + batchSize));
      try {
        int moved = txManager.inTransaction(conn -> relocateBatch(conn, batch, archivedAt));
        relocated += moved;
        metrics.incrementRelocated(moved);
      } catch (RuntimeException e) {
        metrics.incrementCompactionFailure();
        logger.log(Level.WARNING, "Compaction batch failed after relocating " + relocated + " messages", e);
        throw new PartialCompactionException(relocated, e);
      }
    }

    int remaining = txManager.withConnection(liveStore::count);
    metrics.recordLiveSize(remaining);
    logger.log(Level.INFO, "Relocated {0} messages to the archive, {1} remain live",
        new Object[]{relocated, remaining});
    return new CompactionResult(relocated, remaining);
  }

  private int relocateBatch(Connection conn, List<StoredMessage> batch, Instant archivedAt) {
    List<ArchivedMessage> moved = new ArrayList<>(batch.size());
    for (StoredMessage m : batch) {
      if (liveStore.deleteIfUnchanged(conn, m.id(), m.revision()) == 1) {
        moved.add(new ArchivedMessage(m, archivedAt));
      } else {
        logger.log(Level.FINE, "Skipping {0}: changed or removed since snapshot", m.id());
      }
    }
    if (!moved.isEmpty()) {
      archiveStore.upsertBatch(conn, moved);
    }
    return moved.size();
  }

  private List<StoredMessage> oldestFirst(List<StoredMessage> snapshot) {
    List<Candidate> keyed = new ArrayList<>(snapshot.size());
    for (StoredMessage m : snapshot) {
      keyed.add(new Candidate(m, extractor.extract(m.timestamp(), m.id())));
    }
    keyed.sort(Comparator.comparing(Candidate::ts));
    List<StoredMessage> ordered = new ArrayList<>(keyed.size());
    for (Candidate c : keyed) {
      ordered.add(c.message());
    }
    return ordered;
  }

  private record Candidate(StoredMessage message, Instant ts) {
  }
}
