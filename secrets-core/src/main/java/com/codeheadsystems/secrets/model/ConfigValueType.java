package com.codeheadsystems.secrets.model;

/**
 * Type of a stored configuration value. Only SECRET values are encrypted.
 */
public enum ConfigValueType {
  STRING,
  NUMBER,
  BOOLEAN,
  JSON,
  SECRET
}
