package com.increase.endpoint;

import java.util.List;
import java.util.Locale;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/**
 * Path construction and the resource naming convention.
 */
@UtilityClass
public class UrlBuilder {

  /**
   * Builds the request path of an endpoint.
   *
   * @param resourceRoot root of the resource, e.g. {@code /events}
   * @param spec         the endpoint
   * @param id           resource id, required exactly when {@code spec.requiresId()}
   * @return the path, e.g. {@code /accounts/account_123/close}
   * @throws IllegalArgumentException if the id is missing, blank, or not expected
   */
  public static String buildPath(String resourceRoot, EndpointSpec spec, String id) {
    List<String> segments = spec.urlSegments();
    if (!spec.requiresId()) {
      if (id != null) {
        throw new IllegalArgumentException(
            "Endpoint " + spec.operationName() + " does not take an id");
      }
      return segments.isEmpty() ? resourceRoot : resourceRoot + "/" + segments.get(0);
    }

    if (StringUtils.isBlank(id)) {
      throw new IllegalArgumentException(
          "Endpoint " + spec.operationName() + " requires a non-blank id");
    }
    return switch (segments.size()) {
      case 2 -> resourceRoot + "/" + segments.get(0) + "/" + id + "/" + segments.get(1);
      case 1 -> resourceRoot + "/" + id + "/" + segments.get(0);
      default -> resourceRoot + "/" + id;
    };
  }

  /**
   * Human readable name of a resource type: the simple class name split into words,
   * {@code DigitalWalletTokens} becomes {@code Digital Wallet Tokens}.
   */
  public static String resourceName(Class<?> resourceType) {
    return resourceType.getSimpleName().replaceAll("([A-Z])", " $1").trim();
  }

  /** {@code Digital Wallet Tokens} becomes {@code /digital_wallet_tokens}. */
  public static String resourceRoot(String resourceName) {
    return "/" + resourceName.toLowerCase(Locale.ROOT).replace(' ', '_');
  }
}
