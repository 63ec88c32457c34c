package stagequeue.util;

import java.util.Map;

/**
 * Codec for scheduling-log detail maps to/from JSON.
 *
 * <p>Values may be {@code null}, {@link String}, {@link Boolean}, {@link Number},
 * {@link java.util.List} or nested {@link Map}. The default implementation
 * ({@link DefaultJsonCodec}) has no dependencies; integrators that already carry
 * Jackson can plug in {@code stagequeue.optimizer.process.JacksonJsonCodec} instead.
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
   * Encodes a map as a JSON object string. Returns {@code null} if the map is null.
   *
   * @param details the map to encode
   * @return JSON string, or {@code null}
   * @throws IllegalArgumentException if a value has an unsupported type
   */
  String toJson(Map<String, ?> details);

  /**
   * Parses a JSON object string into an ordered map. Returns an empty map for {@code null},
   * empty, or {@code "null"} input.
   *
   * @param json the JSON string to parse
   * @return parsed map (never {@code null})
   * @throws IllegalArgumentException if the input is not a valid JSON object
   */
  Map<String, Object> parseObject(String json);
}
