package com.codeheadsystems.secrets.model;

/**
 * Envelope format discriminator.
 */
public enum FormatVersion {

  /**
   * Pre-versioning format: three hex fields, no prefix.
   */
  LEGACY(""),
  /**
   * Current format, prefixed with {@code v2:}.
   */
  CURRENT("v2:");

  private final String prefix;

  FormatVersion(final String prefix) {
    this.prefix = prefix;
  }

  /**
   * Prefix string.
   *
   * @return the string
   */
  public String prefix() {
    return prefix;
  }
}
