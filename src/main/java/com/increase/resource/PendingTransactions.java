package com.increase.resource;

import com.increase.client.ClientConfig;
import com.increase.client.IncreaseClient;
import com.increase.request.PageHandler;
import com.increase.response.ResponseHash;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class PendingTransactions extends Resource {

  public static final EndpointRegistry ENDPOINTS =
      EndpointRegistrar.forResource(PendingTransactions.class)
          .list()
          .retrieve()
          .register();

  /** Uses the default client. */
  public PendingTransactions() {
    this(null);
  }

  public PendingTransactions(IncreaseClient client) {
    super(ENDPOINTS, client);
  }

  public static PendingTransactions withConfig(ClientConfig config) {
    return new PendingTransactions(IncreaseClient.create(config));
  }

  /** List Pending Transactions, one page unless params carry a {@code limit}. */
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

  /** Retrieve a Pending Transaction */
  public ResponseHash retrieve(String id) {
    return endpoint(EndpointRegistrar.RETRIEVE).request(id, null);
  }
}
