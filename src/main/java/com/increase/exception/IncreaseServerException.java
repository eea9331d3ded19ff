package com.increase.exception;

import lombok.Getter;

/**
 * Thrown when the API answers with a non-success status. The error fields are the ones the API
 * puts in its problem body ({@code type}, {@code title}, {@code detail}); any of them may be null
 * when the body is not an API error document.
 */
@Getter
public class IncreaseServerException extends IncreaseException {

  private final int statusCode;
  private final String responseBody;
  private final String errorType;
  private final String title;
  private final String detail;

  public IncreaseServerException(
      String message,
      int statusCode,
      String responseBody,
      String errorType,
      String title,
      String detail,
      Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
    this.errorType = errorType;
    this.title = title;
    this.detail = detail;
  }

  public boolean isClientError() {
    return statusCode >= 400 && statusCode < 500;
  }

  public boolean isServerError() {
    return statusCode >= 500;
  }
}
