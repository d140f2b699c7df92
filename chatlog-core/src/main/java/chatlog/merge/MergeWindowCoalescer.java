package chatlog.merge;

import chatlog.model.ChatMessage;
import chatlog.model.MessageKind;
import chatlog.time.TimestampExtractor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds bursts of consecutive messages from the same sender into one entry.
 *
 * <p>A message is merged into the preceding entry when all of the following hold:
 * <ul>
 *   <li>both have the same sender;</li>
 *   <li>both have a known timestamp;</li>
 *   <li>the message is less than {@code window} after the entry's (already bumped) timestamp;</li>
 *   <li>neither kind is excluded by {@link MessageKind#isMergeable()}.</li>
 * </ul>
 * A merged entry keeps the first message's id, recipient and kind; its text gains the new
 * text after a blank line and its timestamp moves to the newest constituent.
 *
 * <p>Running the coalescer on its own output returns the same sequence: any two adjacent
 * outputs that still satisfied the rules would have been merged by the first pass.
 */
public final class MergeWindowCoalescer {
  private final Duration window;

  /**
   * @param window merge window; must be positive
   */
  public MergeWindowCoalescer(Duration window) {
    Objects.requireNonNull(window, "window");
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be > 0");
    }
    this.window = window;
  }

  public Duration window() {
    return window;
  }

  /**
   * Coalesces a chronologically ordered sequence. The input is not modified.
   *
   * @param ordered messages sorted by authoritative timestamp
   * @return the coalesced sequence, still ordered
   */
  public List<ChatMessage> coalesce(List<ChatMessage> ordered) {
    Objects.requireNonNull(ordered, "ordered");
    List<ChatMessage> out = new ArrayList<>(ordered.size());
    ChatMessage open = null;
    for (ChatMessage m : ordered) {
      if (open != null && canMerge(open.sender(), open.kind(), open.timestamp(),
          m.sender(), m.kind(), m.timestamp())) {
        open = open.append(m.text(), m.timestamp());
      } else {
        if (open != null) {
          out.add(open);
        }
        open = m;
      }
    }
    if (open != null) {
      out.add(open);
    }
    return out;
  }

  /**
   * Decides whether a message from {@code nextSender} at {@code nextTs} extends the entry
   * last written by {@code prevSender} at {@code prevTs}. Used for both the read-time pass
   * and the single write-time comparison.
   */
  public boolean canMerge(String prevSender, MessageKind prevKind, Instant prevTs,
      String nextSender, MessageKind nextKind, Instant nextTs) {
    if (prevSender == null || !prevSender.equals(nextSender)) {
      return false;
    }
    if (!TimestampExtractor.isKnown(prevTs) || !TimestampExtractor.isKnown(nextTs)) {
      return false;
    }
    if (!prevKind.isMergeable() || !nextKind.isMergeable()) {
      return false;
    }
    return Duration.between(prevTs, nextTs).compareTo(window) < 0;
  }
}
