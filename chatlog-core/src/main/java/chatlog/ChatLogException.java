package chatlog;

import java.util.Objects;

/**
 * Base class of all failures raised by the chat log. Every subclass carries a stable
 * {@link ErrorKind}.
 */
public abstract class ChatLogException extends RuntimeException {
  private final ErrorKind kind;

  protected ChatLogException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected ChatLogException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  public boolean retryable() {
    return kind.retryable();
  }
}
