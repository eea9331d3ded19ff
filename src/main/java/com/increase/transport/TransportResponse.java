package com.increase.transport;

import java.util.List;
import java.util.Map;

public record TransportResponse(
    int status,
    Map<String, List<String>> headers,
    String body   // may be null or empty, e.g. on 204
) {

  public TransportResponse {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public static TransportResponse ok(String body) {
    return new TransportResponse(200, Map.of(), body);
  }
}
