package com.increase.config;

import com.increase.Increase;
import com.increase.client.ClientConfig;
import com.increase.client.IncreaseClient;
import com.increase.transport.RestClientTransport;
import com.increase.transport.Transport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Wires an {@link IncreaseClient} from {@code increase.*} properties:
 * <ul>
 *   <li>{@code increase.api-key} (required)</li>
 *   <li>{@code increase.base-url}, production by default</li>
 *   <li>{@code increase.connect-timeout} / {@code increase.read-timeout}</li>
 *   <li>{@code increase.register-default}: also install the client as {@link Increase#defaultClient()}</li>
 * </ul>
 */
@Slf4j
@Configuration
public class IncreaseClientConfig {

  @Value("${increase.api-key}")
  private String apiKey;

  @Value("${increase.base-url:https://api.increase.com}")
  private String baseUrl;

  @Value("${increase.connect-timeout:10s}")
  private String connectTimeout;

  @Value("${increase.read-timeout:60s}")
  private String readTimeout;

  @Value("${increase.register-default:false}")
  private boolean registerDefault;

  @Bean
  public ClientConfig increaseClientConfig() {
    return ClientConfig.builder()
        .apiKey(apiKey)
        .baseUrl(baseUrl)
        .connectTimeout(DurationStyle.detectAndParse(connectTimeout))
        .readTimeout(DurationStyle.detectAndParse(readTimeout))
        .build();
  }

  @Bean
  public RestClient increaseRestClient(ClientConfig increaseClientConfig) {
    return IncreaseClient.restClientBuilder(increaseClientConfig).build();
  }

  @Bean
  public Transport increaseTransport(
      RestClient increaseRestClient, ClientConfig increaseClientConfig) {
    return new RestClientTransport(increaseRestClient, increaseClientConfig.baseUrl());
  }

  @Bean
  public IncreaseClient increaseClient(
      ClientConfig increaseClientConfig, Transport increaseTransport) {
    IncreaseClient client = new IncreaseClient(increaseClientConfig, increaseTransport);
    if (registerDefault) {
      log.info("Registering {} as the default Increase client", increaseClientConfig);
      Increase.setDefaultClient(client);
    }
    return client;
  }
}
