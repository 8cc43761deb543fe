package com.codeheadsystems.secrets.exception;

/**
 * Thrown when an envelope does not authenticate.
 *
 * <p>Tampering, a wrong key and a key-derivation mode mismatch all end up here with the same
 * message, so callers cannot tell them apart.</p>
 */
public class AuthenticationException extends SecretsException {

  /**
   * The constant MESSAGE.
   */
  public static final String MESSAGE = "Unable to authenticate envelope";

  /**
   * Instantiates a new Authentication exception.
   */
  public AuthenticationException() {
    super(MESSAGE);
  }

  /**
   * Instantiates a new Authentication exception.
   *
   * @param cause the cause
   */
  public AuthenticationException(final Throwable cause) {
    super(MESSAGE, cause);
  }
}
