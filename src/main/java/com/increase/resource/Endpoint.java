package com.increase.resource;

import com.increase.client.IncreaseClient;
import com.increase.endpoint.EndpointSpec;
import com.increase.endpoint.UrlBuilder;
import com.increase.request.PageHandler;
import com.increase.response.ResponseHash;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One operation of a resource type bound to a client, ready to call.
 *
 * <p>{@link #request} serves single-result operations and {@link #collect} paginated ones.
 * {@link #forEachPage} works for both; on an operation that does not paginate the handler gets the
 * whole response once, which is also returned.
 */
public final class Endpoint {

  private final EndpointSpec spec;
  private final String resourceRoot;
  private final IncreaseClient client;

  Endpoint(EndpointSpec spec, String resourceRoot, IncreaseClient client) {
    this.spec = spec;
    this.resourceRoot = resourceRoot;
    this.client = client;
  }

  public String path(String id) {
    return UrlBuilder.buildPath(resourceRoot, spec, id);
  }

  public ResponseHash request(Map<String, ?> params) {
    return request(null, params, null);
  }

  public ResponseHash request(String id, Map<String, ?> params) {
    return request(id, params, null);
  }

  /**
   * @throws IllegalStateException if the operation is paginated
   */
  public ResponseHash request(String id, Map<String, ?> params, Map<String, String> headers) {
    if (spec.paginated()) {
      throw new IllegalStateException(
          spec.operationName() + " is paginated, use collect or forEachPage");
    }
    return client.getExecutor().execute(spec.httpMethod(), path(id), params, headers);
  }

  public List<ResponseHash> collect(Map<String, ?> params) {
    return collect(null, params, null);
  }

  public List<ResponseHash> collect(String id, Map<String, ?> params) {
    return collect(id, params, null);
  }

  /**
   * @throws IllegalStateException if the operation is not paginated
   */
  public List<ResponseHash> collect(
      String id, Map<String, ?> params, Map<String, String> headers) {
    if (!spec.paginated()) {
      throw new IllegalStateException(
          spec.operationName() + " is not paginated, use request or forEachPage");
    }
    return client.getPaginator().collect(spec.httpMethod(), path(id), params, headers);
  }

  public Optional<ResponseHash> forEachPage(Map<String, ?> params, PageHandler handler) {
    return forEachPage(null, params, null, handler);
  }

  public Optional<ResponseHash> forEachPage(
      String id, Map<String, ?> params, Map<String, String> headers, PageHandler handler) {
    return client.getPaginator().forEachPage(spec.httpMethod(), path(id), params, headers, handler);
  }
}
