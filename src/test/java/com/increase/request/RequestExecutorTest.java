package com.increase.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.increase.exception.IncreaseResponseException;
import com.increase.exception.IncreaseServerException;
import com.increase.exception.IncreaseTransportException;
import com.increase.response.ResponseHash;
import com.increase.support.ResponseTestDataProvider;
import com.increase.transport.Transport;
import com.increase.transport.TransportResponse;
import com.increase.util.JsonUtils;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;

@ExtendWith(MockitoExtension.class)
class RequestExecutorTest {

  @Mock
  private Transport transport;

  @Captor
  private ArgumentCaptor<Map<String, String>> headersCaptor;

  private RequestExecutor executor;

  @BeforeEach
  void setUp() {
    executor = new RequestExecutor(transport);
  }

  @Test
  @DisplayName("Should add a JSON content type to POST requests")
  void shouldInjectJsonContentTypeOnPost() {
    when(transport.send(eq(HttpMethod.POST), eq("/event_subscriptions"), anyMap(), anyMap()))
        .thenReturn(ResponseTestDataProvider.object("event_subscription_1", "event_subscription"));

    executor.execute(HttpMethod.POST, "/event_subscriptions", Map.of("url", "https://example.com"),
        Map.of("Idempotency-Key", "key-1"));

    verify(transport).send(eq(HttpMethod.POST), eq("/event_subscriptions"), anyMap(), headersCaptor.capture());
    assertThat(headersCaptor.getValue())
        .containsEntry("Content-Type", "application/json")
        .containsEntry("Idempotency-Key", "key-1");
  }

  @Test
  @DisplayName("Should keep an explicit content type whatever its case")
  void shouldNotOverwriteExplicitContentType() {
    when(transport.send(eq(HttpMethod.POST), eq("/event_subscriptions"), anyMap(), anyMap()))
        .thenReturn(ResponseTestDataProvider.object("event_subscription_1", "event_subscription"));

    executor.execute(HttpMethod.POST, "/event_subscriptions", null, Map.of("content-type", "text/plain"));

    verify(transport).send(eq(HttpMethod.POST), eq("/event_subscriptions"), anyMap(), headersCaptor.capture());
    assertThat(headersCaptor.getValue()).containsExactly(Map.entry("content-type", "text/plain"));
  }

  @Test
  @DisplayName("Should not add a content type to GET or PATCH requests")
  void shouldNotInjectContentTypeOnOtherMethods() {
    when(transport.send(eq(HttpMethod.GET), eq("/events/event_1"), anyMap(), anyMap()))
        .thenReturn(ResponseTestDataProvider.object("event_1", "event"));
    when(transport.send(eq(HttpMethod.PATCH), eq("/event_subscriptions/sub_1"), anyMap(), anyMap()))
        .thenReturn(ResponseTestDataProvider.object("sub_1", "event_subscription"));

    executor.execute(HttpMethod.GET, "/events/event_1", null, null);
    executor.execute(HttpMethod.PATCH, "/event_subscriptions/sub_1", Map.of("status", "disabled"), null);

    verify(transport).send(eq(HttpMethod.GET), eq("/events/event_1"), anyMap(), headersCaptor.capture());
    verify(transport).send(eq(HttpMethod.PATCH), eq("/event_subscriptions/sub_1"), anyMap(), headersCaptor.capture());
    assertThat(headersCaptor.getAllValues()).allSatisfy(headers -> assertThat(headers).isEmpty());
  }

  @Test
  @DisplayName("Should not modify the caller's headers")
  void shouldNotMutateCallerHeaders() {
    when(transport.send(eq(HttpMethod.POST), eq("/event_subscriptions"), anyMap(), anyMap()))
        .thenReturn(ResponseTestDataProvider.object("event_subscription_1", "event_subscription"));
    Map<String, String> headers = new HashMap<>(Map.of("Idempotency-Key", "key-1"));

    executor.execute(HttpMethod.POST, "/event_subscriptions", null, headers);

    assertThat(headers).containsExactly(Map.entry("Idempotency-Key", "key-1"));
  }

  @Test
  @DisplayName("Should decode the body into a navigable response")
  void shouldDecodeBody() {
    TransportResponse raw = ResponseTestDataProvider.object("event_1", "event");
    when(transport.send(eq(HttpMethod.GET), eq("/events/event_1"), anyMap(), anyMap())).thenReturn(raw);

    ResponseHash result = executor.execute(HttpMethod.GET, "/events/event_1", null, null);

    assertThat(result.id()).contains("event_1");
    assertThat(result.text("status")).contains("active");
    assertThat(result.response()).isSameAs(raw);
    assertThat(result.data()).isEmpty();
  }

  @Test
  @DisplayName("Should decode an empty body to an empty object")
  void shouldDecodeEmptyBody() {
    when(transport.send(eq(HttpMethod.PATCH), eq("/event_subscriptions/sub_1"), anyMap(), anyMap()))
        .thenReturn(new TransportResponse(204, Map.of(), ""));

    ResponseHash result = executor.execute(HttpMethod.PATCH, "/event_subscriptions/sub_1", null, null);

    assertThat(result.node().isObject()).isTrue();
    assertThat(result.node().size()).isZero();
  }

  @Test
  @DisplayName("Should throw IncreaseResponseException when the body is not JSON")
  void shouldRejectNonJsonBody() {
    when(transport.send(eq(HttpMethod.GET), eq("/events"), anyMap(), anyMap()))
        .thenReturn(new TransportResponse(200, Map.of("Content-Type", List.of("text/html")), "<html>{oops"));

    assertThatThrownBy(() -> executor.execute(HttpMethod.GET, "/events", null, null))
        .isInstanceOf(IncreaseResponseException.class)
        .hasMessageContaining("not valid JSON")
        .satisfies(e -> assertThat(((IncreaseResponseException) e).getResponseBody()).isEqualTo("<html>{oops"));
  }

  @Test
  @DisplayName("Should let transport and server errors through unchanged")
  void shouldPropagateTransportErrors() {
    IncreaseTransportException ioFailure = new IncreaseTransportException("GET /events could not reach the API");
    IncreaseServerException notFound =
        new IncreaseServerException("GET /events/x failed with status 404", 404, "{}", "object_not_found_error", null, null, null);
    when(transport.send(eq(HttpMethod.GET), eq("/events"), anyMap(), anyMap())).thenThrow(ioFailure);
    when(transport.send(eq(HttpMethod.GET), eq("/events/x"), anyMap(), anyMap())).thenThrow(notFound);

    assertThatThrownBy(() -> executor.execute(HttpMethod.GET, "/events", null, null)).isSameAs(ioFailure);
    assertThatThrownBy(() -> executor.execute(HttpMethod.GET, "/events/x", null, null)).isSameAs(notFound);
  }

  @Test
  @DisplayName("Should throw IncreaseResponseException when the body exceeds the size limit")
  void shouldRejectOversizedBody() {
    String oversized = "x".repeat(JsonUtils.MAX_JSON_LENGTH + 1);
    when(transport.send(eq(HttpMethod.GET), eq("/events"), anyMap(), anyMap()))
        .thenReturn(new TransportResponse(200, Map.of(), oversized));

    assertThatThrownBy(() -> executor.execute(HttpMethod.GET, "/events", null, null))
        .isInstanceOfSatisfying(IncreaseResponseException.class, e -> {
          assertThat(e.getStatusCode()).isEqualTo(200);
          assertThat(e.getMessage()).contains("cannot be decoded");
          assertThat(e.getCause()).isInstanceOf(IllegalArgumentException.class);
        });
  }
}
