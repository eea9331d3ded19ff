package com.increase.client;

import com.increase.request.Paginator;
import com.increase.request.RequestExecutor;
import com.increase.transport.RestClientTransport;
import com.increase.transport.Transport;
import java.net.http.HttpClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * A configured connection to the API, shared by every resource created with it.
 */
@Slf4j
@Getter
public class IncreaseClient {

  private final ClientConfig config;
  private final Transport connection;
  private final RequestExecutor executor;
  private final Paginator paginator;

  public IncreaseClient(ClientConfig config, Transport connection) {
    if (config == null || connection == null) {
      throw new IllegalArgumentException("config and connection must not be null");
    }
    this.config = config;
    this.connection = connection;
    this.executor = new RequestExecutor(connection);
    this.paginator = new Paginator(executor);
  }

  /** Client talking HTTP through a {@link RestClientTransport}. */
  public static IncreaseClient create(ClientConfig config) {
    log.info("Creating Increase client for {}", config.baseUrl());
    RestClient restClient = restClientBuilder(config).build();
    return new IncreaseClient(config, new RestClientTransport(restClient, config.baseUrl()));
  }

  /**
   * RestClient builder carrying the bearer token, JSON accept header and timeouts of
   * {@code config}.
   */
  public static RestClient.Builder restClientBuilder(ClientConfig config) {
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(config.connectTimeout())
        .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(config.readTimeout());

    return RestClient.builder()
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.apiKey())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
  }
}
