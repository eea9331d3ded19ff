package com.increase.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JsonSmartJsonProvider;
import com.jayway.jsonpath.spi.mapper.JsonSmartMappingProvider;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import net.minidev.json.JSONValue;
import org.apache.commons.lang3.StringUtils;

/**
 * JSON helpers shared by the transport and the response wrapper:
 * <ul>
 *   <li>request body serialization</li>
 *   <li>response body parsing into a {@link JsonNode} tree</li>
 *   <li>JSONPath-based value extraction</li>
 * </ul>
 *
 * Thread-safe. Maximum JSON size is limited to 10MB.
 */
@Slf4j
@UtilityClass
public class JsonUtils {

  public static final int MAX_JSON_LENGTH = 10_000_000; // 10MB
  private static final ObjectMapper objectMapper = new ObjectMapper();
  private static final Configuration jsonPathConfig;

  static {
    objectMapper.registerModule(new JavaTimeModule());
    // ISO-8601 instead of numeric timestamps, the API expects e.g. "2024-01-31T15:30:00Z"
    objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // Isolated json-smart configuration so other JsonPath providers on the classpath don't leak in
    jsonPathConfig =
        Configuration.builder()
            .jsonProvider(new JsonSmartJsonProvider())
            .mappingProvider(new JsonSmartMappingProvider())
            .options(EnumSet.noneOf(Option.class))
            .build();
  }

  /**
   * Serializes an object into its JSON string representation. Uses json-smart for speed and
   * falls back to Jackson for values json-smart cannot write. Null is serialized as "null".
   *
   * @param o the object to serialize
   * @return the JSON string representation of the object
   * @throws JsonProcessingException if object cannot be serialized to JSON
   */
  public static String toJson(Object o) throws JsonProcessingException {
    if (o == null) {
      return "null";
    }
    if (!requiresJackson(o)) {
      try {
        return JSONValue.toJSONString(o);
      } catch (Throwable t) {
        log.warn("Fast serialization failed: {}. Falling back to Jackson.", t.getMessage());
      }
    }
    return objectMapper.writeValueAsString(o);
  }

  /**
   * Parses a JSON string into a JsonNode tree.
   *
   * @param json the JSON string to parse
   * @return JsonNode representing the JSON structure
   * @throws JsonProcessingException if JSON is invalid or cannot be parsed
   * @throws IllegalArgumentException if json is null, blank, or exceeds size limit
   */
  public static JsonNode fromJson(String json) throws JsonProcessingException {
    validateJsonSize(json);
    return objectMapper.readTree(json);
  }

  /**
   * Converts an already parsed tree into another type, e.g. a {@code Map<String, Object>}.
   *
   * @param node    the tree to convert
   * @param typeRef the type reference describing the target type
   * @param <T>     the target type
   * @return the converted value
   * @throws IllegalArgumentException if node is null or cannot be converted
   */
  public static <T> T convert(JsonNode node, TypeReference<T> typeRef) {
    if (node == null) {
      throw new IllegalArgumentException("node must not be null");
    }
    return objectMapper.convertValue(node, typeRef);
  }

  public static ObjectNode emptyObject() {
    return objectMapper.createObjectNode();
  }

  /**
   * Extracts an optional value from a JSON string using a JSONPath expression.
   *
   * @param json the JSON string
   * @param jsonPathExpression the JSONPath expression to evaluate
   * @param <T> the expected type of the result
   * @return an Optional containing the extracted value, or empty if not found or null
   */
  public static <T> Optional<T> extractValue(String json, String jsonPathExpression) {
    validateJsonSize(json);
    notBlank(jsonPathExpression, "JSONPath expression must not be null");

    try {
      T value = JsonPath.using(jsonPathConfig).parse(json).read(jsonPathExpression);
      return Optional.ofNullable(value);
    } catch (PathNotFoundException e) {
      return Optional.empty();
    }
  }

  /**
   * Validates that the specified character sequence is neither null, empty, nor whitespace only.
   *
   * @param <T> the character sequence type
   * @param chars the character sequence to check
   * @param message the error message if invalid
   * @return the validated sequence
   * @throws IllegalArgumentException if chars is blank or if message is blank
   */
  public static <T extends CharSequence> T notBlank(T chars, String message) {
    if (StringUtils.isBlank(message)) {
      throw new IllegalArgumentException("Message must not be null or blank");
    }
    if (StringUtils.isBlank(chars)) {
      throw new IllegalArgumentException(message);
    }
    return chars;
  }

  private static void validateJsonSize(String json) {
    notBlank(json, "json must not be null or blank");
    if (json.length() > MAX_JSON_LENGTH) {
      throw new IllegalArgumentException(
          "JSON exceeds maximum allowed length of " + MAX_JSON_LENGTH + " characters");
    }
  }

  // json-smart only understands maps, lists, strings, numbers and booleans
  private static boolean requiresJackson(Object o) {
    if (o instanceof JsonNode) {
      return true;
    }
    if (o instanceof Map<?, ?> map) {
      return map.values().stream().anyMatch(v -> v != null && !isSmartValue(v));
    }
    return !isSmartValue(o);
  }

  private static boolean isSmartValue(Object v) {
    if (v instanceof Map<?, ?> map) {
      return map.values().stream().allMatch(x -> x == null || isSmartValue(x));
    }
    if (v instanceof Iterable<?> items) {
      for (Object item : items) {
        if (item != null && !isSmartValue(item)) {
          return false;
        }
      }
      return true;
    }
    return v instanceof CharSequence || v instanceof Number || v instanceof Boolean;
  }
}
