package com.increase.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.increase.exception.IncreaseResponseException;
import com.increase.response.ResponseHash;
import com.increase.transport.Transport;
import com.increase.transport.TransportResponse;
import com.increase.util.JsonUtils;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

/**
 * Issues a single request through the {@link Transport} and decodes the body. Transport and
 * server failures are not caught here.
 */
@Slf4j
@RequiredArgsConstructor
public class RequestExecutor {

  private final Transport transport;

  /**
   * @param method  HTTP method
   * @param path    request path
   * @param params  request params, may be null
   * @param headers request headers, may be null
   * @return the decoded response
   * @throws IncreaseResponseException if the body is not JSON or is too large to decode
   */
  public ResponseHash execute(
      HttpMethod method, String path, Map<String, ?> params, Map<String, String> headers) {
    Map<String, Object> outgoingParams = params == null ? Map.of() : new LinkedHashMap<>(params);
    Map<String, String> outgoingHeaders = withDefaultHeaders(method, headers);

    log.debug("Executing {} {} with params {}", method, path, outgoingParams.keySet());
    TransportResponse response = transport.send(method, path, outgoingParams, outgoingHeaders);
    return new ResponseHash(decode(response, method, path), response);
  }

  private static Map<String, String> withDefaultHeaders(
      HttpMethod method, Map<String, String> headers) {
    Map<String, String> merged = new LinkedHashMap<>();
    if (HttpMethod.POST.equals(method) && !hasContentType(headers)) {
      merged.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
    }
    if (headers != null) {
      merged.putAll(headers);
    }
    return merged;
  }

  private static boolean hasContentType(Map<String, String> headers) {
    return headers != null
        && headers.keySet().stream().anyMatch(HttpHeaders.CONTENT_TYPE::equalsIgnoreCase);
  }

  private static JsonNode decode(TransportResponse response, HttpMethod method, String path) {
    String body = response.body();
    if (StringUtils.isBlank(body)) {
      return JsonUtils.emptyObject();
    }
    try {
      return JsonUtils.fromJson(body);
    } catch (JsonProcessingException e) {
      log.error("Response to {} {} is not valid JSON", method, path);
      throw new IncreaseResponseException(
          "Response to " + method + " " + path + " is not valid JSON",
          response.status(),
          body,
          e);
    } catch (IllegalArgumentException e) {
      log.error("Response to {} {} cannot be decoded: {}", method, path, e.getMessage());
      throw new IncreaseResponseException(
          "Response to " + method + " " + path + " cannot be decoded: " + e.getMessage(),
          response.status(),
          StringUtils.abbreviate(body, 1024),
          e);
    }
  }
}
