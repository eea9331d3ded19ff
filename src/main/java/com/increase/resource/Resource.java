package com.increase.resource;

import com.increase.Increase;
import com.increase.client.IncreaseClient;

/**
 * Base class of the API resources (Events, Event Subscriptions, ...). Each subclass declares its
 * operations once in an {@link EndpointRegistry} and exposes them as typed methods.
 */
public abstract class Resource {

  private final EndpointRegistry endpoints;
  private final IncreaseClient client;

  /**
   * @param client the client to use, or null for {@link Increase#defaultClient()}
   */
  protected Resource(EndpointRegistry endpoints, IncreaseClient client) {
    if (endpoints == null) {
      throw new IllegalArgumentException("endpoints must not be null");
    }
    this.endpoints = endpoints;
    this.client = client != null ? client : Increase.defaultClient();
  }

  public IncreaseClient client() {
    return client;
  }

  public String resourceName() {
    return endpoints.resourceName();
  }

  public String resourceUrl() {
    return endpoints.resourceRoot();
  }

  public Endpoint endpoint(String operationName) {
    return endpoints.endpoint(operationName, client);
  }
}
