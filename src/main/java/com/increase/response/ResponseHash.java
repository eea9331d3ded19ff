package com.increase.response;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.increase.transport.TransportResponse;
import com.increase.util.JsonUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over a decoded API response, or over one item of a page.
 *
 * <p>Items taken from {@link #data()} share the {@link TransportResponse} of the page they came
 * from.
 */
public final class ResponseHash {

  public static final String DATA = "data";
  public static final String NEXT_CURSOR = "next_cursor";

  private final JsonNode node;
  private final TransportResponse response;

  public ResponseHash(JsonNode node, TransportResponse response) {
    this.node = node == null ? JsonUtils.emptyObject() : node;
    this.response = response;
  }

  public static ResponseHash of(JsonNode node) {
    return new ResponseHash(node, null);
  }

  /** The field value, or null when the field is absent. */
  public JsonNode get(String key) {
    return node.get(key);
  }

  public boolean has(String key) {
    return node.has(key);
  }

  /** Text of a scalar field, empty when absent or JSON null. */
  public Optional<String> text(String key) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      return Optional.empty();
    }
    return Optional.of(value.asText());
  }

  public Optional<String> id() {
    return text("id");
  }

  /**
   * The page items, wrapped. Empty when the response carries no {@code data} array, which is the
   * case for every non-paginating endpoint.
   */
  public Optional<List<ResponseHash>> data() {
    JsonNode data = node.get(DATA);
    if (data == null || !data.isArray()) {
      return Optional.empty();
    }
    List<ResponseHash> items = new ArrayList<>(data.size());
    data.forEach(item -> items.add(new ResponseHash(item, response)));
    return Optional.of(Collections.unmodifiableList(items));
  }

  /** Cursor for the following page; empty on the final page. */
  public Optional<String> nextCursor() {
    return text(NEXT_CURSOR);
  }

  /**
   * Reads a value with a JSONPath expression, e.g. {@code $.source.amount}.
   *
   * @return the value, empty when the path does not exist or points at null
   */
  public <T> Optional<T> read(String jsonPath) {
    return JsonUtils.extractValue(node.toString(), jsonPath);
  }

  public Map<String, Object> toMap() {
    return JsonUtils.convert(node, new TypeReference<Map<String, Object>>() {});
  }

  public JsonNode node() {
    return node;
  }

  /** The raw response this value was decoded from; null for hand-built values. */
  public TransportResponse response() {
    return response;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ResponseHash that)) return false;
    return node.equals(that.node);
  }

  @Override
  public int hashCode() {
    return Objects.hash(node);
  }

  @Override
  public String toString() {
    return node.toString();
  }
}
