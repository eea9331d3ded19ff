package com.increase.exception;

import lombok.Getter;

/**
 * Thrown when a response arrived but its body could not be used: it is not JSON, or a
 * paginated call received a body without a {@code data} array.
 */
@Getter
public class IncreaseResponseException extends IncreaseException {

  private final int statusCode;
  private final String responseBody;

  public IncreaseResponseException(String message, int statusCode, String responseBody) {
    super(message);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public IncreaseResponseException(
      String message, int statusCode, String responseBody, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }
}
