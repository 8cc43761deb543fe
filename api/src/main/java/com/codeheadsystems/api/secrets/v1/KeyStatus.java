package com.codeheadsystems.api.secrets.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Health report of the configured master secret. Never carries the secret itself.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableKeyStatus.class)
@JsonDeserialize(builder = ImmutableKeyStatus.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface KeyStatus {

  /**
   * Configured boolean.
   *
   * @return the boolean
   */
  @JsonProperty("configured")
  boolean configured();

  /**
   * Source of the secret.
   *
   * @return the key source
   */
  @JsonProperty("source")
  KeySource source();

  /**
   * 16 character fingerprint of the secret, if configured.
   *
   * @return the optional
   */
  @JsonProperty("keyHash")
  Optional<String> keyHash();

  /**
   * Length of the secret in characters.
   *
   * @return the int
   */
  @JsonProperty("keyLength")
  int keyLength();

  /**
   * When the active secret was last rotated, if this process has seen it rotated.
   *
   * @return the optional
   */
  @JsonProperty("lastRotated")
  Optional<Instant> lastRotated();

  /**
   * True when the rotation interval has passed, or when no secret is configured.
   *
   * @return the boolean
   */
  @JsonProperty("rotationDue")
  boolean rotationDue();

  /**
   * Warnings list.
   *
   * @return the list
   */
  @JsonProperty("warnings")
  List<String> warnings();

  /**
   * Secure boolean.
   *
   * @return the boolean
   */
  @JsonProperty("secure")
  @Value.Derived
  default boolean secure() {
    return configured() && warnings().isEmpty();
  }

}
