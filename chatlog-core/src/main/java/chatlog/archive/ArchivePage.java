package chatlog.archive;

import chatlog.model.ChatMessage;

import java.util.List;

/**
 * One page of archived messages, in chronological order.
 *
 * @param items     messages of this page, oldest first
 * @param pageIndex zero-based page number, counted from the newest page
 * @param pageSize  effective page size after clamping
 * @param total     archived messages in total
 * @param hasMore   {@code true} if older pages exist
 */
public record ArchivePage(List<ChatMessage> items, int pageIndex, int pageSize, int total, boolean hasMore) {
  public ArchivePage {
    items = List.copyOf(items);
  }
}
