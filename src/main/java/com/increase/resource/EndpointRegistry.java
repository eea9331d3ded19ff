package com.increase.resource;

import com.increase.Increase;
import com.increase.client.IncreaseClient;
import com.increase.endpoint.EndpointSpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The frozen operations of one resource type, keyed by operation name.
 */
public final class EndpointRegistry {

  private final String resourceName;
  private final String resourceRoot;
  private final Map<String, EndpointSpec> specs;

  EndpointRegistry(String resourceName, String resourceRoot, Map<String, EndpointSpec> specs) {
    this.resourceName = resourceName;
    this.resourceRoot = resourceRoot;
    this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
  }

  public String resourceName() {
    return resourceName;
  }

  public String resourceRoot() {
    return resourceRoot;
  }

  public Set<String> operationNames() {
    return specs.keySet();
  }

  public Optional<EndpointSpec> find(String operationName) {
    return Optional.ofNullable(specs.get(operationName));
  }

  /**
   * @throws IllegalArgumentException if the resource has no such operation
   */
  public EndpointSpec spec(String operationName) {
    return find(operationName)
        .orElseThrow(() -> new IllegalArgumentException(
            resourceName + " has no operation named " + operationName));
  }

  /** The operation bound to {@code client}. */
  public Endpoint endpoint(String operationName, IncreaseClient client) {
    if (client == null) {
      throw new IllegalArgumentException("client must not be null");
    }
    return new Endpoint(spec(operationName), resourceRoot, client);
  }

  /** The operation bound to {@link Increase#defaultClient()}. */
  public Endpoint endpoint(String operationName) {
    return endpoint(operationName, Increase.defaultClient());
  }
}
