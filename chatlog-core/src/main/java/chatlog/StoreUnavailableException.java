package chatlog;

/**
 * Unchecked exception wrapping JDBC failures and timeouts. Retryable.
 */
public final class StoreUnavailableException extends ChatLogException {
  public StoreUnavailableException(String message, Throwable cause) {
    super(ErrorKind.STORE_UNAVAILABLE, message, cause);
  }
}
