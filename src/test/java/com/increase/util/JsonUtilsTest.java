package com.increase.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.jayway.jsonpath.InvalidPathException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class JsonUtilsTest {

  private static final String EVENT_JSON = """
        {
            "id": "event_001",
            "category": "account.created",
            "associated_object_id": null,
            "amounts": [100, 250, 400],
            "source": {
                "type": "ach_transfer",
                "amount": 1500
            }
        }
        """;

  private static final String OVERSIZED_JSON = "x".repeat(JsonUtils.MAX_JSON_LENGTH + 1);

  @Nested
  @DisplayName("toJson")
  class ToJson {

    @Test
    @DisplayName("should write plain request params")
    void shouldWritePlainParams() throws JsonProcessingException {
      Map<String, Object> params = new LinkedHashMap<>();
      params.put("url", "https://example.com/hooks");
      params.put("limit", 10);
      params.put("selected_event_category", List.of("account.created"));

      String json = JsonUtils.toJson(params);

      JsonNode tree = JsonUtils.fromJson(json);
      assertThat(tree.get("url").asText()).isEqualTo("https://example.com/hooks");
      assertThat(tree.get("limit").asInt()).isEqualTo(10);
      assertThat(tree.get("selected_event_category").get(0).asText()).isEqualTo("account.created");
    }

    @Test
    @DisplayName("should write dates as ISO-8601 strings")
    void shouldWriteDatesAsIsoStrings() throws JsonProcessingException {
      Map<String, Object> params = Map.of("created_at", Map.of("after", Instant.parse("2024-01-31T15:30:00Z")));

      String json = JsonUtils.toJson(params);

      assertThat(json).contains("\"2024-01-31T15:30:00Z\"");
    }

    @Test
    @DisplayName("should write null as the JSON literal")
    void shouldWriteNull() throws JsonProcessingException {
      assertThat(JsonUtils.toJson(null)).isEqualTo("null");
    }

    @Test
    @DisplayName("should write a tree unchanged")
    void shouldWriteTree() throws JsonProcessingException {
      JsonNode tree = JsonUtils.fromJson("{\"a\":{\"b\":[1,2]}}");

      assertThat(JsonUtils.toJson(tree)).isEqualTo("{\"a\":{\"b\":[1,2]}}");
    }
  }

  @Nested
  @DisplayName("fromJson")
  class FromJson {

    @Test
    @DisplayName("should parse a response body")
    void shouldParseBody() throws JsonProcessingException {
      JsonNode tree = JsonUtils.fromJson(EVENT_JSON);

      assertThat(tree.get("id").asText()).isEqualTo("event_001");
      assertThat(tree.get("associated_object_id").isNull()).isTrue();
      assertThat(tree.path("source").path("amount").asLong()).isEqualTo(1500L);
    }

    @Test
    @DisplayName("should throw JsonProcessingException for malformed JSON")
    void shouldRejectMalformedJson() {
      assertThatThrownBy(() -> JsonUtils.fromJson("{\"id\": "))
          .isInstanceOf(JsonProcessingException.class);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("should reject null or blank input")
    void shouldRejectBlankInput(String json) {
      assertThatThrownBy(() -> JsonUtils.fromJson(json))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("json must not be null or blank");
    }

    @Test
    @DisplayName("should reject oversized input")
    void shouldRejectOversizedInput() {
      assertThatThrownBy(() -> JsonUtils.fromJson(OVERSIZED_JSON))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("JSON exceeds maximum allowed length");
    }
  }

  @Nested
  @DisplayName("extractValue")
  class ExtractValue {

    @Test
    @DisplayName("should extract nested and indexed values")
    void shouldExtractValues() {
      Optional<Object> type = JsonUtils.extractValue(EVENT_JSON, "$.source.type");
      Optional<Object> amount = JsonUtils.extractValue(EVENT_JSON, "$.amounts[1]");

      assertThat(type).contains("ach_transfer");
      assertThat(amount).contains(250);
    }

    @Test
    @DisplayName("should be empty for missing paths and null values")
    void shouldBeEmptyForMissingOrNull() {
      assertThat(JsonUtils.extractValue(EVENT_JSON, "$.nonexistent")).isEmpty();
      assertThat(JsonUtils.extractValue(EVENT_JSON, "$.associated_object_id")).isEmpty();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" "})
    @DisplayName("should reject null or blank paths")
    void shouldRejectBlankPath(String path) {
      assertThatThrownBy(() -> JsonUtils.extractValue(EVENT_JSON, path))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("JSONPath expression must not be null");
    }

    @Test
    @DisplayName("should throw InvalidPathException for malformed paths")
    void shouldRejectMalformedPath() {
      assertThatThrownBy(() -> JsonUtils.extractValue(EVENT_JSON, "$["))
          .isInstanceOf(InvalidPathException.class);
    }
  }

  @Test
  @DisplayName("convert should turn a tree into a map")
  void shouldConvertTreeToMap() throws JsonProcessingException {
    Map<String, Object> map = JsonUtils.convert(
        JsonUtils.fromJson(EVENT_JSON), new TypeReference<Map<String, Object>>() {});

    assertThat(map)
        .containsEntry("id", "event_001")
        .containsEntry("amounts", List.of(100, 250, 400))
        .containsEntry("source", Map.of("type", "ach_transfer", "amount", 1500));
    assertThatThrownBy(() -> JsonUtils.convert(null, new TypeReference<Map<String, Object>>() {}))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("notBlank should return valid input and reject blank input")
  void shouldValidateNotBlank() {
    assertThat(JsonUtils.notBlank("value", "must not be blank")).isEqualTo("value");
    assertThatThrownBy(() -> JsonUtils.notBlank(" ", "apiKey must not be blank"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("apiKey must not be blank");
    assertThatThrownBy(() -> JsonUtils.notBlank("value", ""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Message must not be null or blank");
  }
}
