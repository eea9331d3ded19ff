package com.increase.transport;

import java.util.Map;
import org.springframework.http.HttpMethod;

/**
 * The connection that performs network I/O for the client. Implementations decide how params are
 * encoded (query string or body) and signal failures themselves:
 * {@link com.increase.exception.IncreaseTransportException} when the API cannot be reached,
 * {@link com.increase.exception.IncreaseServerException} for non-success statuses.
 */
public interface Transport {

  /**
   * @param method  HTTP method
   * @param path    path relative to the configured base URL, e.g. {@code /events/event_123}
   * @param params  request params, never null
   * @param headers request headers, never null
   * @return the raw response
   */
  TransportResponse send(
      HttpMethod method, String path, Map<String, Object> params, Map<String, String> headers);
}
