package com.increase.exception;

/**
 * Thrown while a resource type declares its endpoints and one of the declarations is invalid,
 * e.g. more than two URL segments, or two segments on an endpoint that does not take an id.
 * Raised from static initialisers, so it is fatal to loading the resource class.
 */
public class EndpointDefinitionException extends IncreaseException {

  /**
   * @param message The error message.
   */
  public EndpointDefinitionException(String message) {
    super(message);
  }

  /**
   * @param message The error message.
   * @param cause   The underlying cause of the exception.
   */
  public EndpointDefinitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
