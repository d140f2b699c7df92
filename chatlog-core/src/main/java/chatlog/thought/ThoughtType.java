package chatlog.thought;

import java.util.Locale;
import java.util.Optional;

/**
 * Category of a thought posted by the thinker identity.
 */
public enum ThoughtType {
  THOUGHT,
  INSIGHT,
  FOCUS,
  QUESTION,
  IDEA,
  CONCERN,
  PROGRESS;

  /**
   * Looks up a type by name, ignoring case.
   *
   * @return the type, or empty for {@code null}, blank or unknown names
   */
  public static Optional<ThoughtType> find(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /**
   * Like {@link #find} but falls back to {@link #THOUGHT}.
   */
  public static ThoughtType parse(String name) {
    return find(name).orElse(THOUGHT);
  }
}
