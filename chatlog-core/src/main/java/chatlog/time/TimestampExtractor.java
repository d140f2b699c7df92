package chatlog.time;

import chatlog.model.StoredTimestamp;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the authoritative point in time of a stored message.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>{@link StoredTimestamp.Structured}: returned as is.</li>
 *   <li>{@link StoredTimestamp.Encoded}: hyphenated time-of-day separators are repaired
 *       ({@code T01-10-00} becomes {@code T01:10:00}) and the string is parsed. A result more
 *       than {@link #FUTURE_TOLERANCE} ahead of now is clamped to now, since some writers
 *       label local time as UTC.</li>
 *   <li>{@link StoredTimestamp.EpochMillis}: milliseconds since the epoch.</li>
 *   <li>The message id, when it starts with a date-time such as
 *       {@code 2026-02-09T01-10-00Z_agent}.</li>
 * </ol>
 * If nothing yields a point in time the result is {@link #UNKNOWN}, which sorts before every
 * real timestamp. This class never throws on malformed input.
 */
public final class TimestampExtractor {
  /**
   * Sentinel for "no usable timestamp": the epoch origin, so it sorts first.
   */
  public static final Instant UNKNOWN = Instant.EPOCH;

  /**
   * How far ahead of now a parsed string timestamp may be before it is clamped.
   */
  public static final Duration FUTURE_TOLERANCE = Duration.ofMinutes(5);

  private static final Pattern HYPHENATED_TIME = Pattern.compile("T(\\d{2})-(\\d{2})-(\\d{2})");
  private static final Pattern ID_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}T[\\d-]+Z)");

  private static final List<Function<String, Instant>> PARSERS = List.of(
      s -> OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
      s -> LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
      s -> LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant(),
      s -> ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());

  private final Clock clock;

  public TimestampExtractor() {
    this(Clock.systemUTC());
  }

  public TimestampExtractor(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns {@code true} if {@code instant} is a real timestamp rather than {@link #UNKNOWN}.
   */
  public static boolean isKnown(Instant instant) {
    return instant != null && !UNKNOWN.equals(instant);
  }

  /**
   * Extracts the authoritative timestamp.
   *
   * @param timestamp the raw stored timestamp ({@code null} is treated as absent)
   * @param id        the message id, used as a last-resort source
   * @return the point in time, or {@link #UNKNOWN}
   */
  public Instant extract(StoredTimestamp timestamp, String id) {
    if (timestamp instanceof StoredTimestamp.Structured structured) {
      return structured.instant();
    }
    if (timestamp instanceof StoredTimestamp.Encoded encoded) {
      Optional<Instant> parsed = parse(encoded.text());
      if (parsed.isPresent()) {
        Instant now = clock.instant();
        Instant value = parsed.get();
        return value.isAfter(now.plus(FUTURE_TOLERANCE)) ? now : value;
      }
    }
    if (timestamp instanceof StoredTimestamp.EpochMillis epoch) {
      return Instant.ofEpochMilli(epoch.millis());
    }
    return fromId(id).orElse(UNKNOWN);
  }

  /**
   * Parses the date-time prefix of an id such as {@code 2026-02-09T01-10-00Z_agent}.
   * No future clamp is applied.
   */
  Optional<Instant> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    Matcher matcher = ID_PREFIX.matcher(id);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return parse(matcher.group(1));
  }

  /**
   * Repairs hyphenated time separators and parses the result as a calendar date-time.
   */
  static Optional<Instant> parse(String text) {
    if (text == null) {
      return Optional.empty();
    }
    String candidate = repair(text.trim());
    if (candidate.isEmpty()) {
      return Optional.empty();
    }
    for (Function<String, Instant> parser : PARSERS) {
      try {
        return Optional.of(parser.apply(candidate));
      } catch (DateTimeException e) {
        continue;
      }
    }
    return Optional.empty();
  }

  static String repair(String text) {
    return HYPHENATED_TIME.matcher(text).replaceFirst("T$1:$2:$3");
  }
}
