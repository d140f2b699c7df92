package chatlog.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A message relocated to the archive table, annotated with its relocation time.
 *
 * @param message    the message exactly as it was in the live table
 * @param archivedAt when the compactor moved it
 */
public record ArchivedMessage(StoredMessage message, Instant archivedAt) {
  public ArchivedMessage {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(archivedAt, "archivedAt");
  }

  public String id() {
    return message.id();
  }
}
