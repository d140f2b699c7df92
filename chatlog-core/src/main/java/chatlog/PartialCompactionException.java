package chatlog;

/**
 * Thrown when a relocation batch fails after earlier batches of the same run committed.
 *
 * <p>Committed batches are fully moved and the failed batch is rolled back, so no message
 * is in both tables. Running compaction again picks up where this run stopped.
 */
public final class PartialCompactionException extends ChatLogException {
  private final int relocated;

  public PartialCompactionException(int relocated, Throwable cause) {
    super(ErrorKind.PARTIAL_COMPACTION,
        "Compaction stopped after relocating " + relocated + " messages", cause);
    this.relocated = relocated;
  }

  /**
   * Returns how many messages were relocated before the failure.
   */
  public int relocated() {
    return relocated;
  }
}
