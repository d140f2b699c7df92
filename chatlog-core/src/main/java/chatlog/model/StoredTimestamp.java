package chatlog.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Timestamp field of a stored message, exactly as the writer encoded it.
 *
 * <ul>
 *   <li>{@link Structured}: a native point in time written by this library.</li>
 *   <li>{@link Encoded}: a string written by an external writer, possibly with
 *       hyphens as time-of-day separators ({@code 2026-02-09T01-10-00Z}).</li>
 *   <li>{@link EpochMillis}: milliseconds since the epoch.</li>
 *   <li>{@link Absent}: no timestamp was stored.</li>
 * </ul>
 *
 * <p>The raw value is never used for ordering directly; see
 * {@link chatlog.time.TimestampExtractor}.
 */
public sealed interface StoredTimestamp
    permits StoredTimestamp.Structured, StoredTimestamp.Encoded,
    StoredTimestamp.EpochMillis, StoredTimestamp.Absent {

  /**
   * Singleton for a missing timestamp.
   */
  Absent ABSENT = new Absent();

  static Structured of(Instant instant) {
    return new Structured(instant);
  }

  static Encoded encoded(String text) {
    return new Encoded(text);
  }

  static EpochMillis epochMillis(long millis) {
    return new EpochMillis(millis);
  }

  static Absent absent() {
    return ABSENT;
  }

  record Structured(Instant instant) implements StoredTimestamp {
    public Structured {
      Objects.requireNonNull(instant, "instant");
    }
  }

  record Encoded(String text) implements StoredTimestamp {
    public Encoded {
      Objects.requireNonNull(text, "text");
    }
  }

  record EpochMillis(long millis) implements StoredTimestamp {
  }

  record Absent() implements StoredTimestamp {
  }
}
