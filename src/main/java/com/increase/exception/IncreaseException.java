package com.increase.exception;

/**
 * Base type for every exception raised by the Increase client.
 */
public class IncreaseException extends RuntimeException {

  /**
   * @param message The error message.
   */
  public IncreaseException(String message) {
    super(message);
  }

  /**
   * @param message The error message.
   * @param cause   The underlying cause of the exception.
   */
  public IncreaseException(String message, Throwable cause) {
    super(message, cause);
  }
}
