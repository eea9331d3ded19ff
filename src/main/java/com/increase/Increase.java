package com.increase;

import com.increase.client.ClientConfig;
import com.increase.client.IncreaseClient;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Holder of the process-wide default client, used by resources created without an explicit one.
 * Set it once at startup; when nothing was set the first lookup builds a client from the
 * {@code INCREASE_*} environment variables.
 */
@Slf4j
@UtilityClass
public class Increase {

  private static volatile IncreaseClient defaultClient;

  public static IncreaseClient defaultClient() {
    IncreaseClient client = defaultClient;
    if (client == null) {
      synchronized (Increase.class) {
        client = defaultClient;
        if (client == null) {
          log.info("No default client configured, reading settings from the environment");
          client = IncreaseClient.create(ClientConfig.fromEnvironment(System.getenv()));
          defaultClient = client;
        }
      }
    }
    return client;
  }

  public static void setDefaultClient(IncreaseClient client) {
    defaultClient = client;
  }

  public static IncreaseClient configure(ClientConfig config) {
    IncreaseClient client = IncreaseClient.create(config);
    setDefaultClient(client);
    return client;
  }
}
