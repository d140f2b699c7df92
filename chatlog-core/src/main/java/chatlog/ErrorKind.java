package chatlog;

/**
 * Stable classification of {@link ChatLogException} failures, suitable for mapping to
 * client-facing error codes.
 */
public enum ErrorKind {
  /** Required configuration or collaborator missing. Fatal at startup. */
  CONFIGURATION(false),
  /** Transient store failure or timeout. */
  STORE_UNAVAILABLE(true),
  /** Caller input rejected before touching the store. */
  MALFORMED_INPUT(false),
  /** A referenced message does not exist. */
  NOT_FOUND(false),
  /** A compaction run stopped after relocating only part of its selection. */
  PARTIAL_COMPACTION(true);

  private final boolean retryable;

  ErrorKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean retryable() {
    return retryable;
  }
}
