package alertgate.util;

import java.util.Map;

/**
 * Codec for the JSON argument objects passed to remote operations.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no external dependencies and
 * handles the value types a command payload needs: strings, numbers, booleans, {@code null},
 * lists and nested maps. Users who already have Jackson or Gson on the classpath can implement
 * this interface to delegate to their preferred library.
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
   * Encodes a map as a JSON object string. Entry order is preserved.
   *
   * @param object the object to encode
   * @return JSON text, {@code "{}"} for an empty map
   * @throws NullPointerException     if {@code object} is null
   * @throws IllegalArgumentException if a key is null or a value has an unsupported type
   */
  String toJson(Map<String, ?> object);

  /**
   * Parses a JSON object. Arrays become {@link java.util.List}, objects become
   * {@link java.util.Map}, integral numbers become {@link Long} and other numbers
   * {@link Double}.
   *
   * @param json the JSON text
   * @return the parsed object (never {@code null})
   * @throws IllegalArgumentException if the input is not a valid JSON object
   */
  Map<String, Object> parseObject(String json);
}
