package chatlog.thought;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts over all live thoughts of the thinker.
 *
 * @param total  live messages of the thinker
 * @param byType counts per type; types without messages are absent
 */
public record ThoughtStats(int total, Map<ThoughtType, Integer> byType) {
  public ThoughtStats {
    byType = byType.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(byType));
  }

  public int count(ThoughtType type) {
    return byType.getOrDefault(type, 0);
  }
}
