package chatlog.thought;

import java.time.Instant;
import java.util.List;

/**
 * A thought as returned by {@link ThoughtLog#recent}.
 *
 * @param id        message id
 * @param text      thought body
 * @param type      thought category
 * @param timestamp authoritative timestamp, or {@code null} when unknown
 * @param tags      free-form tags
 */
public record Thought(String id, String text, ThoughtType type, Instant timestamp, List<String> tags) {
  public Thought {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
