package com.codeheadsystems.secrets.model;

/**
 * Text encoding for generated key material.
 */
public enum KeyEncoding {
  HEX,
  BASE64
}
