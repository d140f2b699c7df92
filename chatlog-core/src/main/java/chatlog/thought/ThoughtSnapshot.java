package chatlog.thought;

import java.util.List;

/**
 * Result of {@link ThoughtLog#recent}: the selected thoughts, newest first, and overall stats.
 */
public record ThoughtSnapshot(List<Thought> thoughts, ThoughtStats stats) {
  public ThoughtSnapshot {
    thoughts = List.copyOf(thoughts);
  }
}
