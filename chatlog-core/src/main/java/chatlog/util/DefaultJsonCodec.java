package chatlog.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal JSON array-of-strings encoder and decoder.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(List<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < tags.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      String tag = tags.get(i);
      if (tag == null) {
        sb.append("null");
      } else {
        sb.append('"').append(escape(tag)).append('"');
      }
    }
    return sb.append(']').toString();
  }

  @Override
  public List<String> parseArray(String json) {
    if (json == null) {
      return List.of();
    }
    String in = json.trim();
    if (in.isEmpty() || "null".equals(in)) {
      return List.of();
    }
    if (in.charAt(0) != '[') {
      throw new IllegalArgumentException("Expected JSON array");
    }
    List<String> result = new ArrayList<>();
    int idx = skipWhitespace(in, 1);
    if (idx < in.length() && in.charAt(idx) == ']') {
      return checkTrailing(in, idx + 1, result);
    }
    while (true) {
      idx = skipWhitespace(in, idx);
      if (idx >= in.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON array");
      }
      if (in.startsWith("null", idx)) {
        idx += 4;
      } else if (in.charAt(idx) == '"') {
        idx = readString(in, idx + 1, result);
      } else {
        throw new IllegalArgumentException("Expected string element at " + idx);
      }
      idx = skipWhitespace(in, idx);
      if (idx >= in.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON array");
      }
      char next = in.charAt(idx);
      if (next == ']') {
        return checkTrailing(in, idx + 1, result);
      }
      if (next != ',') {
        throw new IllegalArgumentException("Expected ',' or ']' at " + idx);
      }
      idx++;
    }
  }

  private static List<String> checkTrailing(String in, int idx, List<String> result) {
    if (skipWhitespace(in, idx) != in.length()) {
      throw new IllegalArgumentException("Trailing content after JSON array");
    }
    return List.copyOf(result);
  }

  private static int skipWhitespace(String in, int index) {
    int i = index;
    while (i < in.length() && Character.isWhitespace(in.charAt(i))) {
      i++;
    }
    return i;
  }

  private static int readString(String in, int start, List<String> sink) {
    StringBuilder sb = new StringBuilder();
    int i = start;
    while (i < in.length()) {
      char c = in.charAt(i);
      if (c == '"') {
        sink.add(sb.toString());
        return i + 1;
      }
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= in.length()) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      char esc = in.charAt(i + 1);
      switch (esc) {
        case '"', '\\', '/' -> sb.append(esc);
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'n' -> sb.append('\n');
        case 'r' -> sb.append('\r');
        case 't' -> sb.append('\t');
        case 'u' -> {
          if (i + 5 >= in.length()) {
            throw new IllegalArgumentException("Invalid unicode escape");
          }
          try {
            sb.append((char) Integer.parseInt(in.substring(i + 2, i + 6), 16));
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid unicode escape", ex);
          }
          i += 4;
        }
        default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + esc);
      }
      i += 2;
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }
}
