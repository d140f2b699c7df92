package chatlog.model;

import chatlog.time.TimestampExtractor;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized read view of a message, carrying its authoritative timestamp.
 *
 * <p>Missing fields of legacy rows are filled in: sender {@value #UNKNOWN_SENDER},
 * recipient {@value #BROADCAST}, empty text.
 *
 * @param id        message id
 * @param sender    writer identity
 * @param recipient logical destination
 * @param text      message body
 * @param kind      message category
 * @param timestamp authoritative timestamp; {@link TimestampExtractor#UNKNOWN} when unknown
 * @param archived  {@code true} when read from the archive table
 */
public record ChatMessage(
    String id,
    String sender,
    String recipient,
    String text,
    MessageKind kind,
    Instant timestamp,
    boolean archived
) {
  public static final String UNKNOWN_SENDER = "unknown";
  public static final String BROADCAST = "team";

  public ChatMessage {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(timestamp, "timestamp");
    sender = sender == null ? UNKNOWN_SENDER : sender;
    recipient = recipient == null ? BROADCAST : recipient;
    text = text == null ? "" : text;
  }

  /**
   * Builds the view of a stored row using the given extractor.
   */
  public static ChatMessage from(StoredMessage stored, TimestampExtractor extractor, boolean archived) {
    Instant ts = extractor.extract(stored.timestamp(), stored.id());
    return new ChatMessage(stored.id(), stored.sender(), stored.recipient(), stored.text(),
        stored.kind(), ts, archived);
  }

  public boolean hasKnownTimestamp() {
    return TimestampExtractor.isKnown(timestamp);
  }

  /**
   * Returns the authoritative timestamp, or empty when it is unknown.
   */
  public Optional<Instant> knownTimestamp() {
    return hasKnownTimestamp() ? Optional.of(timestamp) : Optional.empty();
  }

  /**
   * Returns a copy with {@code more} appended after a blank line and the timestamp moved
   * to {@code latest}.
   */
  public ChatMessage append(String more, Instant latest) {
    return new ChatMessage(id, sender, recipient, text + "\n\n" + more, kind, latest, archived);
  }
}
