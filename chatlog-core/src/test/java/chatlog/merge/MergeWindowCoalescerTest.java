package chatlog.merge;

import chatlog.model.ChatMessage;
import chatlog.model.MessageKind;
import chatlog.time.TimestampExtractor;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MergeWindowCoalescerTest {

  private static final Instant T0 = Instant.parse("2026-02-09T10:00:00Z");
  private final MergeWindowCoalescer coalescer = new MergeWindowCoalescer(Duration.ofSeconds(60));

  private static ChatMessage msg(String id, String sender, String text, MessageKind kind, long offsetSeconds) {
    return new ChatMessage(id, sender, "team", text, kind, T0.plusSeconds(offsetSeconds), false);
  }

  private static ChatMessage msg(String id, String sender, String text, long offsetSeconds) {
    return msg(id, sender, text, MessageKind.MESSAGE, offsetSeconds);
  }

  @Test
  void distinctSendersAreLeftAlone() {
    List<ChatMessage> input = List.of(msg("1", "a", "x", 0), msg("2", "b", "y", 1), msg("3", "c", "z", 2));
    assertEquals(input, coalescer.coalesce(input));
  }

  @Test
  void burstFromOneSenderMerges() {
    List<ChatMessage> out = coalescer.coalesce(List.of(msg("1", "A", "hello", 0), msg("2", "A", "world", 30)));
    assertEquals(1, out.size());
    ChatMessage merged = out.get(0);
    assertEquals("1", merged.id());
    assertEquals("hello\n\nworld", merged.text());
    assertEquals(T0.plusSeconds(30), merged.timestamp());
  }

  @Test
  void nonMergeableKindBreaksTheBurst() {
    List<ChatMessage> out = coalescer.coalesce(List.of(
        msg("1", "A", "hello", 0), msg("2", "A", "world", MessageKind.TASK_ADDED, 30)));
    assertEquals(2, out.size());
  }

  @Test
  void windowIsMeasuredFromTheLatestConstituent() {
    List<ChatMessage> out = coalescer.coalesce(List.of(
        msg("1", "A", "a", 0), msg("2", "A", "b", 50), msg("3", "A", "c", 100)));
    assertEquals(1, out.size());
    assertEquals("a\n\nb\n\nc", out.get(0).text());
    assertEquals(T0.plusSeconds(100), out.get(0).timestamp());
  }

  @Test
  void gapEqualToWindowDoesNotMerge() {
    assertEquals(2, coalescer.coalesce(List.of(msg("1", "A", "a", 0), msg("2", "A", "b", 60))).size());
  }

  @Test
  void unknownTimestampsNeverMerge() {
    ChatMessage unknown = new ChatMessage("2", "A", "team", "b", MessageKind.MESSAGE,
        TimestampExtractor.UNKNOWN, false);
    ChatMessage unknown2 = new ChatMessage("3", "A", "team", "c", MessageKind.MESSAGE,
        TimestampExtractor.UNKNOWN, false);
    assertEquals(2, coalescer.coalesce(List.of(unknown, unknown2)).size());
  }

  @Test
  void interleavedSenderSplitsBursts() {
    List<ChatMessage> out = coalescer.coalesce(List.of(
        msg("1", "A", "a", 0), msg("2", "B", "b", 5), msg("3", "A", "c", 10)));
    assertEquals(3, out.size());
  }

  @Test
  void inputIsNotModified() {
    List<ChatMessage> input = new ArrayList<>(List.of(msg("1", "A", "a", 0), msg("2", "A", "b", 5)));
    List<ChatMessage> copy = List.copyOf(input);
    coalescer.coalesce(input);
    assertEquals(copy, input);
  }

  @Test
  void coalescingTwiceChangesNothing() {
    List<ChatMessage> input = List.of(
        msg("1", "A", "a", 0), msg("2", "A", "b", 30), msg("3", "B", "c", 40),
        msg("4", "A", "d", 100), msg("5", "A", "e", 200), msg("6", "A", "f", 250),
        msg("7", "A", "g", MessageKind.BASH_REQUEST, 260), msg("8", "A", "h", 270));
    List<ChatMessage> once = coalescer.coalesce(input);
    assertEquals(once, coalescer.coalesce(once));
  }

  @Test
  void canMergeRequiresSameSender() {
    assertFalse(coalescer.canMerge("A", MessageKind.MESSAGE, T0, "B", MessageKind.MESSAGE, T0.plusSeconds(1)));
    assertFalse(coalescer.canMerge(null, MessageKind.MESSAGE, T0, "B", MessageKind.MESSAGE, T0));
    assertTrue(coalescer.canMerge("A", MessageKind.MESSAGE, T0, "A", MessageKind.THOUGHT, T0.plusSeconds(1)));
  }

  @Test
  void rejectsNonPositiveWindow() {
    assertThrows(IllegalArgumentException.class, () -> new MergeWindowCoalescer(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> new MergeWindowCoalescer(Duration.ofSeconds(-1)));
  }
}
