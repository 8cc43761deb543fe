package com.codeheadsystems.secrets.exception;

/**
 * Thrown when a string cannot be parsed as either envelope shape.
 */
public class MalformedEnvelopeException extends SecretsException {

  /**
   * Instantiates a new Malformed envelope exception.
   *
   * @param message the message
   */
  public MalformedEnvelopeException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Malformed envelope exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MalformedEnvelopeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
