package com.increase.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.increase.exception.IncreaseException;
import com.increase.exception.IncreaseServerException;
import com.increase.exception.IncreaseTransportException;
import com.increase.util.JsonUtils;
import com.jayway.jsonpath.InvalidJsonException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * {@link Transport} backed by Spring's {@link RestClient}.
 *
 * <p>GET and DELETE params travel in the query string, nested maps flattened with dots
 * ({@code created_at.after=...}) and every name and value fully percent-encoded; POST, PUT and
 * PATCH params are sent as a JSON body.
 * Authentication and default headers are configured on the {@code RestClient} itself.
 */
@Slf4j
public class RestClientTransport implements Transport {

  private static final Set<HttpMethod> BODY_METHODS =
      Set.of(HttpMethod.POST, HttpMethod.PUT, HttpMethod.PATCH);

  private final RestClient restClient;
  private final String baseUrl;

  public RestClientTransport(RestClient restClient, String baseUrl) {
    if (restClient == null) {
      throw new IllegalArgumentException("restClient must not be null");
    }
    this.restClient = restClient;
    this.baseUrl = StringUtils.removeEnd(JsonUtils.notBlank(baseUrl, "baseUrl must not be blank"), "/");
  }

  @Override
  public TransportResponse send(
      HttpMethod method, String path, Map<String, Object> params, Map<String, String> headers) {
    boolean hasBody = BODY_METHODS.contains(method);
    URI uri = buildUri(path, hasBody ? Map.of() : params);
    String body = hasBody ? serialize(params) : null;
    log.debug("Sending {} {}", method, uri);

    try {
      RestClient.RequestBodySpec request =
          restClient
              .method(method)
              .uri(uri)
              .headers(
                  h -> {
                    headers.forEach(h::set);
                    if (hasBody && !h.containsKey(HttpHeaders.CONTENT_TYPE)) {
                      h.setContentType(MediaType.APPLICATION_JSON);
                    }
                  });
      if (body != null) {
        request.body(body);
      }
      ResponseEntity<String> entity = request.retrieve().toEntity(String.class);
      log.debug("{} {} answered {}", method, uri, entity.getStatusCode().value());
      return new TransportResponse(
          entity.getStatusCode().value(), entity.getHeaders(), entity.getBody());
    } catch (Exception e) {
      return translateAndThrow(e, method + " " + path);
    }
  }

  URI buildUri(String path, Map<String, Object> params) {
    UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl)
        .path(UriUtils.encodePath(path, StandardCharsets.UTF_8));
    appendQueryParams(builder, "", params);
    // components are encoded one by one, '+' in cursors and offsets must not reach the server raw
    return builder.build(true).toUri();
  }

  private void appendQueryParams(UriComponentsBuilder builder, String prefix, Map<?, ?> params) {
    params.forEach(
        (key, value) -> {
          String name = prefix.isEmpty() ? String.valueOf(key) : prefix + "." + key;
          if (value == null) {
            return;
          }
          if (value instanceof Map<?, ?> nested) {
            appendQueryParams(builder, name, nested);
          } else if (value instanceof Collection<?> values) {
            builder.queryParam(
                encode(name), values.stream().map(v -> encode(String.valueOf(v))).toArray());
          } else {
            builder.queryParam(encode(name), encode(String.valueOf(value)));
          }
        });
  }

  private static String encode(String component) {
    return UriUtils.encode(component, StandardCharsets.UTF_8);
  }

  private String serialize(Map<String, Object> params) {
    try {
      return JsonUtils.toJson(params);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Request params cannot be serialized to JSON", e);
    }
  }

  /**
   * Translates RestClient exceptions into the client's exception types.
   *
   * @return never returns, always throws
   * @throws IncreaseServerException for non-success statuses
   * @throws IncreaseTransportException for I/O failures and anything unexpected
   */
  private <T> T translateAndThrow(Exception e, String contextMessage) {
    if (e instanceof IncreaseException ex) {
      throw ex;
    }
    if (e instanceof RestClientResponseException ex) {
      int status = ex.getStatusCode().value();
      String responseBody = ex.getResponseBodyAsString();
      log.warn("{} failed with status {}", contextMessage, status);
      throw new IncreaseServerException(
          contextMessage + " failed with status " + status,
          status,
          responseBody,
          errorField(responseBody, "$.type"),
          errorField(responseBody, "$.title"),
          errorField(responseBody, "$.detail"),
          ex);
    }
    if (e instanceof ResourceAccessException ex) {
      log.error("I/O error on {}: {}", contextMessage, ex.getMessage());
      throw new IncreaseTransportException(contextMessage + " could not reach the API", ex);
    }
    if (e instanceof RestClientException ex) {
      log.error("Client error on {}: {}", contextMessage, ex.getMessage());
      throw new IncreaseTransportException(contextMessage + " failed", ex);
    }
    log.error("Unexpected error on {}", contextMessage, e);
    throw new IncreaseTransportException(contextMessage + " failed due to unexpected error", e);
  }

  private static String errorField(String body, String path) {
    if (StringUtils.isBlank(body)) {
      return null;
    }
    try {
      Optional<Object> value = JsonUtils.extractValue(body, path);
      return value.map(String::valueOf).orElse(null);
    } catch (InvalidJsonException | ClassCastException e) {
      log.debug("Error body is not an API error document: {}", e.getMessage());
      return null;
    }
  }
}
