package com.codeheadsystems.secrets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Secrets configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(builder = ImmutableConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Configuration {

  /**
   * Secret names consulted when none are configured, highest priority first.
   */
  List<String> DEFAULT_SECRET_NAMES = List.of("ENCRYPTION_KEY", "PASSPHRASE", "JWT_SECRET");

  /**
   * The constant DEFAULT_PBKDF2_ITERATIONS.
   */
  int DEFAULT_PBKDF2_ITERATIONS = 100_000;

  /**
   * Names looked up in the secret source, in priority order.
   *
   * @return the list
   */
  @Value.Default
  default List<String> secretNames() {
    return DEFAULT_SECRET_NAMES;
  }

  /**
   * File holding the secret, consulted after every name.
   *
   * @return the optional
   */
  Optional<String> keyFilePath();

  /**
   * When true a missing secret fails the startup check, otherwise only encryption calls fail.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean requireSecret() {
    return true;
  }

  /**
   * PBKDF2 iteration count. Changing it makes existing salted envelopes unreadable.
   *
   * @return the int
   */
  @Value.Default
  default int pbkdf2Iterations() {
    return DEFAULT_PBKDF2_ITERATIONS;
  }

  /**
   * Validate.
   */
  @Value.Check
  default void validate() {
    if (pbkdf2Iterations() < 1) {
      throw new IllegalArgumentException("pbkdf2Iterations must be positive");
    }
  }

}
