package chatlog.jdbc;

import chatlog.model.StoredMessage;
import chatlog.model.StoredTimestamp;
import chatlog.spi.LiveMessageStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live store that lets another writer change rows between a read and the following
 * conditional write, at points chosen by the test.
 */
final class ContendedLiveStore implements LiveMessageStore {

  private final LiveMessageStore delegate;
  private final AtomicInteger mergeConflicts = new AtomicInteger();
  private volatile String bumpAfterSnapshot;

  ContendedLiveStore(LiveMessageStore delegate) {
    this.delegate = delegate;
  }

  /** The next {@code n} merges lose against a concurrent merge into the same row. */
  void loseNextMerges(int n) {
    mergeConflicts.set(n);
  }

  /** The next full read is followed by a concurrent merge into {@code id}. */
  void mergeIntoAfterNextSnapshot(String id) {
    bumpAfterSnapshot = id;
  }

  @Override
  public int updateMerged(Connection conn, String id, long expectedRevision, String text, Instant mergedAt) {
    if (mergeConflicts.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      concurrentMerge(conn, id);
    }
    return delegate.updateMerged(conn, id, expectedRevision, text, mergedAt);
  }

  @Override
  public List<StoredMessage> findAll(Connection conn) {
    List<StoredMessage> snapshot = delegate.findAll(conn);
    String id = bumpAfterSnapshot;
    if (id != null) {
      bumpAfterSnapshot = null;
      concurrentMerge(conn, id);
    }
    return snapshot;
  }

  private void concurrentMerge(Connection conn, String id) {
    StoredMessage current = delegate.findById(conn, id).orElseThrow();
    Instant at = current.timestamp() instanceof StoredTimestamp.Structured s
        ? s.instant() : Instant.EPOCH;
    delegate.updateMerged(conn, id, current.revision(), current.text() + "\n\nother", at);
  }

  @Override
  public void insert(Connection conn, StoredMessage message) {
    delegate.insert(conn, message);
  }

  @Override
  public List<StoredMessage> findBySender(Connection conn, String sender) {
    return delegate.findBySender(conn, sender);
  }

  @Override
  public Optional<StoredMessage> findById(Connection conn, String id) {
    return delegate.findById(conn, id);
  }

  @Override
  public int delete(Connection conn, String id) {
    return delegate.delete(conn, id);
  }

  @Override
  public int deleteIfUnchanged(Connection conn, String id, long expectedRevision) {
    return delegate.deleteIfUnchanged(conn, id, expectedRevision);
  }

  @Override
  public int deleteAll(Connection conn, Collection<String> ids) {
    return delegate.deleteAll(conn, ids);
  }

  @Override
  public int deleteBySender(Connection conn, String sender) {
    return delegate.deleteBySender(conn, sender);
  }

  @Override
  public int count(Connection conn) {
    return delegate.count(conn);
  }
}
