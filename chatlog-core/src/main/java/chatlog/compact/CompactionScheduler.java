package chatlog.compact;

import chatlog.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs {@link Compactor#compact(int, int)} on a fixed delay from a single daemon thread.
 *
 * <p>A failed cycle is logged and the loop continues; the next cycle resumes where a
 * partial run stopped. Create instances via {@link #builder()}.
 */
public final class CompactionScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CompactionScheduler.class.getName());

  private final Compactor compactor;
  private final int keepLive;
  private final int maxPerRun;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> compactTask;
  private volatile boolean closed;

  private CompactionScheduler(Builder builder) {
    this.compactor = Objects.requireNonNull(builder.compactor, "compactor");
    if (builder.keepLive < 0) {
      throw new IllegalArgumentException("keepLive must be >= 0");
    }
    if (builder.maxPerRun <= 0) {
      throw new IllegalArgumentException("maxPerRun must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.keepLive = builder.keepLive;
    this.maxPerRun = builder.maxPerRun;
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the loop. Calling it again while running does nothing.
   *
   * @throws IllegalStateException if the scheduler was closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("CompactionScheduler has been closed");
    }
    if (compactTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("chatlog-compact-"));
    compactTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Runs one compaction cycle on the calling thread.
   *
   * @return the result, or {@code null} if closed or the cycle failed
   */
  public CompactionResult runOnce() {
    if (closed) {
      return null;
    }
    try {
      return compactor.compact(keepLive, maxPerRun);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Compaction cycle failed", e);
      return null;
    }
  }

  public boolean isRunning() {
    return compactTask != null && !closed;
  }

  /** Cancels the schedule and stops the thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (compactTask != null) {
      compactTask.cancel(false);
      compactTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          logger.warning("Compaction thread did not stop within 5 seconds");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link CompactionScheduler}. */
  public static final class Builder {
    private Compactor compactor;
    private int keepLive = 100;
    private int maxPerRun = 200;
    private long intervalSeconds = 300;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder compactor(Compactor compactor) {
      this.compactor = compactor;
      return this;
    }

    /**
     * Live messages to keep. Defaults to {@code 100}.
     */
    public Builder keepLive(int keepLive) {
      this.keepLive = keepLive;
      return this;
    }

    /**
     * Most messages relocated per cycle. Defaults to {@code 200}.
     */
    public Builder maxPerRun(int maxPerRun) {
      this.maxPerRun = maxPerRun;
      return this;
    }

    /**
     * Delay between cycles. Defaults to {@code 300} seconds.
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * @throws NullPointerException     if no compactor was set
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public CompactionScheduler build() {
      return new CompactionScheduler(this);
    }
  }
}
