package chatlog.retry;

import chatlog.StoreUnavailableException;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Re-runs an operation that failed with {@link StoreUnavailableException}, sleeping
 * according to a {@link RetryPolicy} between attempts. Other exceptions propagate at once.
 * When the attempts are exhausted the last store failure is rethrown.
 */
public final class StoreRetrier {
  private static final Logger logger = Logger.getLogger(StoreRetrier.class.getName());

  /**
   * Retrier that runs each operation exactly once.
   */
  public static final StoreRetrier NONE = new StoreRetrier(attempts -> 0L, 1);

  private final RetryPolicy policy;
  private final int maxAttempts;

  /**
   * @param policy      delay policy between attempts
   * @param maxAttempts total attempts including the first; must be &gt; 0
   */
  public StoreRetrier(RetryPolicy policy, int maxAttempts) {
    this.policy = Objects.requireNonNull(policy, "policy");
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Runs {@code action}, retrying on store unavailability.
   *
   * @param operation name used in log messages
   * @param action    the operation
   * @return the operation's result
   * @throws StoreUnavailableException if every attempt failed or the thread was interrupted
   */
  public <T> T call(String operation, Supplier<T> action) {
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        return action.get();
      } catch (StoreUnavailableException e) {
        if (attempt >= maxAttempts) {
          throw e;
        }
        long delayMs = policy.computeDelayMs(attempt);
        logger.log(Level.WARNING, "{0} failed (attempt {1}/{2}), retrying in {3} ms",
            new Object[]{operation, attempt, maxAttempts, delayMs});
        sleep(delayMs, e);
      }
    }
  }

  private static void sleep(long delayMs, StoreUnavailableException cause) {
    if (delayMs <= 0) {
      return;
    }
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      cause.addSuppressed(ie);
      throw cause;
    }
  }
}
