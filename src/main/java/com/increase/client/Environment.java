package com.increase.client;

import java.util.Arrays;
import java.util.Locale;

public enum Environment {
  PRODUCTION("https://api.increase.com"),
  SANDBOX("https://sandbox.increase.com");

  private final String baseUrl;

  Environment(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String baseUrl() {
    return baseUrl;
  }

  /**
   * @throws IllegalArgumentException for names other than production or sandbox
   */
  public static Environment fromName(String name) {
    return Arrays.stream(values())
        .filter(e -> e.name().equals(name.trim().toUpperCase(Locale.ROOT)))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException(
            "Unknown environment '" + name + "', expected production or sandbox"));
  }
}
