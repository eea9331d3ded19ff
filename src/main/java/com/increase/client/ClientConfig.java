package com.increase.client;

import com.increase.util.JsonUtils;
import java.time.Duration;
import java.util.Map;
import lombok.Builder;
import org.apache.commons.lang3.StringUtils;

/**
 * Connection settings of an {@link IncreaseClient}. Only the API key is mandatory; the base URL
 * defaults to production.
 */
@Builder(toBuilder = true)
public record ClientConfig(
    String apiKey,
    String baseUrl,
    Duration connectTimeout,
    Duration readTimeout
) {

  public static final String API_KEY_VARIABLE = "INCREASE_API_KEY";
  public static final String BASE_URL_VARIABLE = "INCREASE_BASE_URL";
  public static final String ENVIRONMENT_VARIABLE = "INCREASE_ENVIRONMENT";

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);

  public ClientConfig {
    JsonUtils.notBlank(apiKey, "apiKey must not be blank");
    baseUrl = StringUtils.isBlank(baseUrl) ? Environment.PRODUCTION.baseUrl() : baseUrl.trim();
    connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    readTimeout = readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout;
  }

  /**
   * Reads {@code INCREASE_API_KEY} and either {@code INCREASE_BASE_URL} or
   * {@code INCREASE_ENVIRONMENT} ({@code production} or {@code sandbox}).
   *
   * @throws IllegalArgumentException if the API key is missing
   */
  public static ClientConfig fromEnvironment(Map<String, String> env) {
    String baseUrl = env.get(BASE_URL_VARIABLE);
    if (StringUtils.isBlank(baseUrl) && StringUtils.isNotBlank(env.get(ENVIRONMENT_VARIABLE))) {
      baseUrl = Environment.fromName(env.get(ENVIRONMENT_VARIABLE)).baseUrl();
    }
    return ClientConfig.builder()
        .apiKey(env.get(API_KEY_VARIABLE))
        .baseUrl(baseUrl)
        .build();
  }

  // keep the key out of logs
  @Override
  public String toString() {
    return "ClientConfig[baseUrl=" + baseUrl
        + ", apiKey=" + StringUtils.abbreviate(apiKey, 7)
        + ", connectTimeout=" + connectTimeout
        + ", readTimeout=" + readTimeout + "]";
  }
}
