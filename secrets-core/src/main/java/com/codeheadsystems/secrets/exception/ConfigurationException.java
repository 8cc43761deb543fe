package com.codeheadsystems.secrets.exception;

/**
 * Thrown when no usable master secret is configured, or a supplied secret is unusable.
 */
public class ConfigurationException extends SecretsException {

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   */
  public ConfigurationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
