package eventbook.util;

import java.util.List;

/**
 * Codec for the ordered string lists of an event ({@code agenda}, {@code tags}) stored as
 * JSON arrays in text columns.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and only
 * handles flat arrays of strings. Applications with Jackson or Gson on the classpath can
 * supply their own implementation to the stores.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a list of strings as a JSON array, e.g. {@code ["a","b"]}.
   *
   * @param values the values; must not contain {@code null}
   * @return the JSON array string
   */
  String toJsonArray(List<String> values);

  /**
   * Parses a JSON array of strings. Returns an empty list for {@code null} or blank input.
   *
   * @param json the JSON array string
   * @return the values in order (never {@code null})
   * @throws IllegalArgumentException if the input is not a JSON array of strings
   */
  List<String> parseArray(String json);
}
