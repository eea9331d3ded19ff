package com.increase.exception;

/**
 * Custom exception thrown when the API could not be reached at all
 * (connection refused, timeout, broken stream).
 */
public class IncreaseTransportException extends IncreaseException {

  /**
   * @param message The error message.
   */
  public IncreaseTransportException(String message) {
    super(message);
  }

  /**
   * @param message The error message.
   * @param cause   The underlying cause of the exception.
   */
  public IncreaseTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
