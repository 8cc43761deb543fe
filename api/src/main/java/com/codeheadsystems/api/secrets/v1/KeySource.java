package com.codeheadsystems.api.secrets.v1;

/**
 * Where the active master secret came from.
 */
public enum KeySource {
  /**
   * A named process environment value.
   */
  ENVIRONMENT,
  /**
   * The configured key file.
   */
  FILE,
  /**
   * Activated at runtime by a key rotation.
   */
  ROTATION,
  /**
   * Nothing configured.
   */
  NONE
}
