package chatlog;

/**
 * Thrown when caller input is rejected, e.g. an append without text.
 */
public final class MalformedInputException extends ChatLogException {
  public MalformedInputException(String message) {
    super(ErrorKind.MALFORMED_INPUT, message);
  }

  public MalformedInputException(String message, Throwable cause) {
    super(ErrorKind.MALFORMED_INPUT, message, cause);
  }
}
