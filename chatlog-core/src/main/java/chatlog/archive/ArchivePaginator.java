package chatlog.archive;

import chatlog.MalformedInputException;
import chatlog.model.ArchivedMessage;
import chatlog.model.ChatMessage;
import chatlog.spi.ArchiveMessageStore;
import chatlog.time.TimestampExtractor;
import chatlog.tx.JdbcTransactionManager;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Serves the archive newest page first. Page 0 holds the newest {@code pageSize} messages;
 * within a page messages are returned oldest first.
 *
 * <p>Ordering uses the authoritative timestamp, so rows whose stored timestamps use
 * different encodings still interleave correctly. Messages with an unknown timestamp sort
 * as the oldest and end up on the last page.
 */
public final class ArchivePaginator {
  private final JdbcTransactionManager txManager;
  private final ArchiveMessageStore archiveStore;
  private final TimestampExtractor extractor;
  private final int defaultPageSize;
  private final int maxPageSize;

  public ArchivePaginator(
      JdbcTransactionManager txManager,
      ArchiveMessageStore archiveStore,
      TimestampExtractor extractor,
      int defaultPageSize,
      int maxPageSize
  ) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.archiveStore = Objects.requireNonNull(archiveStore, "archiveStore");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    if (maxPageSize <= 0) {
      throw new IllegalArgumentException("maxPageSize must be > 0");
    }
    if (defaultPageSize <= 0 || defaultPageSize > maxPageSize) {
      throw new IllegalArgumentException("defaultPageSize must be in [1, maxPageSize]");
    }
    this.defaultPageSize = defaultPageSize;
    this.maxPageSize = maxPageSize;
  }

  /**
   * Returns one archive page.
   *
   * @param pageIndex zero-based page number; must be &ge; 0
   * @param pageSize  requested size; {@code <= 0} uses the default, larger values are capped
   * @throws MalformedInputException if {@code pageIndex} is negative
   */
  public ArchivePage page(int pageIndex, int pageSize) {
    if (pageIndex < 0) {
      throw new MalformedInputException("pageIndex must be >= 0, got: " + pageIndex);
    }
    int size = pageSize <= 0 ? defaultPageSize : Math.min(pageSize, maxPageSize);

    List<ArchivedMessage> rows = txManager.withConnection(archiveStore::findAllArchived);
    List<ChatMessage> ascending = new ArrayList<>(rows.size());
    for (ArchivedMessage row : rows) {
      ascending.add(ChatMessage.from(row.message(), extractor, true));
    }
    ascending.sort(Comparator.comparing(ChatMessage::timestamp));

    int total = ascending.size();
    long offset = (long) pageIndex * size;
    if (offset >= total) {
      return new ArchivePage(List.of(), pageIndex, size, total, false);
    }
    // newest-first slice [offset, offset + size) mapped onto the ascending list
    int end = total - (int) offset;
    int start = Math.max(0, end - size);
    return new ArchivePage(ascending.subList(start, end), pageIndex, size, total, offset + size < total);
  }
}
