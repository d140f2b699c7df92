package chatlog.model;

import java.util.Objects;
import java.util.Set;

/**
 * Category of a message, stored as a short string code.
 *
 * <p>The set of kinds is open: codes written by other clients are kept verbatim.
 * Kinds that trigger structured side effects ({@link #TASK_ADDED}, {@link #TASK},
 * {@link #SOLVING_MODE}, {@link #BASH_REQUEST}) are never merged with neighbours.
 */
public final class MessageKind {
  public static final MessageKind MESSAGE = new MessageKind("message");
  public static final MessageKind TASK_ADDED = new MessageKind("task_added");
  public static final MessageKind TASK = new MessageKind("task");
  public static final MessageKind SOLVING_MODE = new MessageKind("solving_mode");
  public static final MessageKind BASH_REQUEST = new MessageKind("bash_request");
  public static final MessageKind THOUGHT = new MessageKind("thought");

  private static final Set<String> NON_MERGEABLE = Set.of(
      TASK_ADDED.code, TASK.code, SOLVING_MODE.code, BASH_REQUEST.code);

  private final String code;

  private MessageKind(String code) {
    this.code = code;
  }

  /**
   * Returns the kind for a stored code. {@code null} or blank codes read as {@link #MESSAGE}.
   *
   * @param code the stored code
   * @return the kind (never {@code null})
   */
  public static MessageKind of(String code) {
    if (code == null || code.isBlank()) {
      return MESSAGE;
    }
    return new MessageKind(code.trim());
  }

  public String code() {
    return code;
  }

  /**
   * Returns {@code true} unless this kind carries side effects that make merging unsafe.
   */
  public boolean isMergeable() {
    return !NON_MERGEABLE.contains(code);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MessageKind)) return false;
    MessageKind that = (MessageKind) o;
    return code.equals(that.code);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code);
  }

  @Override
  public String toString() {
    return code;
  }
}
