package com.codeheadsystems.secrets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A configuration value in the form it is persisted.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableStoredConfigValue.class)
@JsonDeserialize(builder = ImmutableStoredConfigValue.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface StoredConfigValue {

  /**
   * Configuration key.
   *
   * @return the string
   */
  String key();

  /**
   * Value type.
   *
   * @return the config value type
   */
  ConfigValueType valueType();

  /**
   * Either the plain value or an envelope, see {@link #encrypted()}.
   *
   * @return the string
   */
  @Value.Redacted
  String value();

  /**
   * Encrypted boolean.
   *
   * @return the boolean
   */
  boolean encrypted();

}
