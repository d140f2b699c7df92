package chatlog.util;

import java.util.List;

/**
 * Codec for the tag lists of thought messages, persisted as a JSON array of strings.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and only
 * understands flat arrays of strings. Applications that already carry a JSON library can
 * supply their own implementation to the JDBC stores.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes tags as a JSON array. Returns {@code null} for a {@code null} or empty list.
   *
   * @param tags the tags to encode
   * @return JSON string, or {@code null}
   */
  String toJson(List<String> tags);

  /**
   * Parses a JSON array of strings. {@code null}, blank and {@code "null"} yield an empty
   * list; {@code null} elements are skipped.
   *
   * @param json the JSON text
   * @return the tags (never {@code null})
   * @throws IllegalArgumentException if the input is not a JSON array of strings
   */
  List<String> parseArray(String json);
}
