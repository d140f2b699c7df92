package chatlog.retry;

import chatlog.MalformedInputException;
import chatlog.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StoreRetrierTest {

  private final StoreRetrier retrier = new StoreRetrier(attempts -> 0L, 3);

  @Test
  void returnsFirstSuccess() {
    assertEquals("ok", retrier.call("op", () -> "ok"));
  }

  @Test
  void retriesStoreFailuresUntilSuccess() {
    AtomicInteger calls = new AtomicInteger();
    String result = retrier.call("op", () -> {
      if (calls.incrementAndGet() < 3) {
        throw new StoreUnavailableException("down", new SQLException("boom"));
      }
      return "ok";
    });
    assertEquals("ok", result);
    assertEquals(3, calls.get());
  }

  @Test
  void rethrowsLastFailureWhenExhausted() {
    AtomicInteger calls = new AtomicInteger();
    StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
        () -> retrier.call("op", () -> {
          calls.incrementAndGet();
          throw new StoreUnavailableException("down " + calls.get(), new SQLException("boom"));
        }));
    assertEquals(3, calls.get());
    assertEquals("down 3", ex.getMessage());
  }

  @Test
  void otherFailuresAreNotRetried() {
    AtomicInteger calls = new AtomicInteger();
    assertThrows(MalformedInputException.class, () -> retrier.call("op", () -> {
      calls.incrementAndGet();
      throw new MalformedInputException("bad");
    }));
    assertEquals(1, calls.get());
  }

  @Test
  void noneRunsOnce() {
    AtomicInteger calls = new AtomicInteger();
    assertThrows(StoreUnavailableException.class, () -> StoreRetrier.NONE.call("op", () -> {
      calls.incrementAndGet();
      throw new StoreUnavailableException("down", new SQLException("boom"));
    }));
    assertEquals(1, calls.get());
  }

  @Test
  void interruptDuringBackoffStopsRetrying() {
    StoreRetrier slow = new StoreRetrier(attempts -> 10_000L, 5);
    AtomicInteger calls = new AtomicInteger();
    Thread.currentThread().interrupt();
    try {
      StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
          () -> slow.call("op", () -> {
            calls.incrementAndGet();
            throw new StoreUnavailableException("down", new SQLException("boom"));
          }));
      assertEquals(1, calls.get());
      assertEquals(1, ex.getSuppressed().length);
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void rejectsNonPositiveAttempts() {
    assertThrows(IllegalArgumentException.class, () -> new StoreRetrier(attempts -> 0L, 0));
  }
}
