package com.codeheadsystems.secrets.exception;

/**
 * Base exception for failures in the secrets encryption core.
 */
public class SecretsException extends RuntimeException {

  /**
   * Instantiates a new Secrets exception.
   *
   * @param message the message
   */
  public SecretsException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Secrets exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SecretsException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
