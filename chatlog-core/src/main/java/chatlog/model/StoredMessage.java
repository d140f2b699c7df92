package chatlog.model;

import java.util.List;
import java.util.Objects;

/**
 * A message row as persisted in either the live or the archive table.
 *
 * <p>{@code sender}, {@code recipient} and {@code text} are kept exactly as stored
 * and may be {@code null} for rows written by other clients. Use
 * {@link ChatMessage} for the normalized read view.
 *
 * @param id          unique message identifier
 * @param sender      writer identity (may be {@code null} in legacy rows)
 * @param recipient   logical destination (may be {@code null})
 * @param text        message body (may be {@code null})
 * @param kind        message category
 * @param timestamp   raw timestamp as stored
 * @param revision    optimistic-concurrency counter, bumped on every in-place merge
 * @param thoughtType thought category for {@link MessageKind#THOUGHT} rows, else {@code null}
 * @param tags        thought tags (never {@code null})
 */
public record StoredMessage(
    String id,
    String sender,
    String recipient,
    String text,
    MessageKind kind,
    StoredTimestamp timestamp,
    long revision,
    String thoughtType,
    List<String> tags
) {
  public StoredMessage {
    Objects.requireNonNull(id, "id");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
    kind = kind == null ? MessageKind.MESSAGE : kind;
    timestamp = timestamp == null ? StoredTimestamp.ABSENT : timestamp;
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  /**
   * Creates a plain message without thought metadata at revision 0.
   */
  public static StoredMessage of(String id, String sender, String recipient, String text,
      MessageKind kind, StoredTimestamp timestamp) {
    return new StoredMessage(id, sender, recipient, text, kind, timestamp, 0L, null, List.of());
  }
}
