package chatlog.spi;

/**
 * Observability hook for exporting chat log counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see chatlog.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of appends that inserted a new message.
   */
  void incrementAppended();

  /**
   * Increments the count of appends merged into the previous message.
   */
  void incrementMerged();

  /**
   * Adds to the count of messages moved from live to archive.
   *
   * @param count messages relocated by one batch
   */
  void incrementRelocated(int count);

  /**
   * Increments the count of compaction runs that failed.
   */
  void incrementCompactionFailure();

  /**
   * Adds to the count of explicitly deleted messages.
   *
   * @param count messages deleted by one call
   */
  default void incrementDeleted(int count) {
  }

  /**
   * Records the number of live messages observed by the last full read.
   *
   * @param size live message count
   */
  void recordLiveSize(int size);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementAppended() {
    }

    @Override
    public void incrementMerged() {
    }

    @Override
    public void incrementRelocated(int count) {
    }

    @Override
    public void incrementCompactionFailure() {
    }

    @Override
    public void recordLiveSize(int size) {
    }
  }
}
