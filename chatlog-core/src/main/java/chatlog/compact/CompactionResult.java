package chatlog.compact;

/**
 * Outcome of one compaction run.
 *
 * @param relocated     messages moved from the live table to the archive
 * @param remainingLive live messages counted after the run
 */
public record CompactionResult(int relocated, int remainingLive) {
}
