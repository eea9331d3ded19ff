package com.increase.resource;

import com.increase.client.ClientConfig;
import com.increase.client.IncreaseClient;
import com.increase.request.PageHandler;
import com.increase.response.ResponseHash;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class EventSubscriptions extends Resource {

  public static final EndpointRegistry ENDPOINTS =
      EndpointRegistrar.forResource(EventSubscriptions.class)
          .create()
          .list()
          .update()
          .retrieve()
          .register();

  /** Uses the default client. */
  public EventSubscriptions() {
    this(null);
  }

  public EventSubscriptions(IncreaseClient client) {
    super(ENDPOINTS, client);
  }

  public static EventSubscriptions withConfig(ClientConfig config) {
    return new EventSubscriptions(IncreaseClient.create(config));
  }

  /** Create an Event Subscription */
  public ResponseHash create(Map<String, ?> params) {
    return endpoint(EndpointRegistrar.CREATE).request(params);
  }

  public ResponseHash create(Map<String, ?> params, Map<String, String> headers) {
    return endpoint(EndpointRegistrar.CREATE).request(null, params, headers);
  }

  /**
   * Create an Event Subscription, delivering the created object to {@code handler} once.
   *
   * @return the same response the handler received
   */
  public Optional<ResponseHash> create(Map<String, ?> params, PageHandler handler) {
    return endpoint(EndpointRegistrar.CREATE).forEachPage(params, handler);
  }

  /** List Event Subscriptions, one page unless params carry a {@code limit}. */
  public List<ResponseHash> list() {
    return list(null);
  }

  public List<ResponseHash> list(Map<String, ?> params) {
    return endpoint(EndpointRegistrar.LIST).collect(params);
  }

  /**
   * Hands each page to {@code handler} as it arrives.
   *
   * @return the raw response when the server answered without a page, otherwise empty
   */
  public Optional<ResponseHash> list(Map<String, ?> params, PageHandler handler) {
    return endpoint(EndpointRegistrar.LIST).forEachPage(params, handler);
  }

  /** Update an Event Subscription */
  public ResponseHash update(String id, Map<String, ?> params) {
    return endpoint(EndpointRegistrar.UPDATE).request(id, params);
  }

  /** Retrieve an Event Subscription */
  public ResponseHash retrieve(String id) {
    return endpoint(EndpointRegistrar.RETRIEVE).request(id, null);
  }
}
