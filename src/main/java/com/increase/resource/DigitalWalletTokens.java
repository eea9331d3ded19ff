package com.increase.resource;

import com.increase.client.ClientConfig;
import com.increase.client.IncreaseClient;
import com.increase.request.PageHandler;
import com.increase.response.ResponseHash;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tokens provisioned into digital wallets such as Apple Pay and Google Pay. Read only.
 */
public class DigitalWalletTokens extends Resource {

  public static final EndpointRegistry ENDPOINTS =
      EndpointRegistrar.forResource(DigitalWalletTokens.class)
          .list()
          .retrieve()
          .register();

  /** Uses the default client. */
  public DigitalWalletTokens() {
    this(null);
  }

  public DigitalWalletTokens(IncreaseClient client) {
    super(ENDPOINTS, client);
  }

  public static DigitalWalletTokens withConfig(ClientConfig config) {
    return new DigitalWalletTokens(IncreaseClient.create(config));
  }

  /** List Digital Wallet Tokens, one page unless params carry a {@code limit}. */
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

  /** Retrieve a Digital Wallet Token */
  public ResponseHash retrieve(String id) {
    return endpoint(EndpointRegistrar.RETRIEVE).request(id, null);
  }
}
