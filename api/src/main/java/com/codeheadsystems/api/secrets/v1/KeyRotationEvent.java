package com.codeheadsystems.api.secrets.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import org.immutables.value.Value;

/**
 * A single key rotation, kept in memory for observability. Not a source of truth.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableKeyRotationEvent.class)
@JsonDeserialize(builder = ImmutableKeyRotationEvent.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface KeyRotationEvent {

  /**
   * Fingerprint of the secret in use before the rotation.
   *
   * @return the string
   */
  @JsonProperty("oldKeyHash")
  String oldKeyHash();

  /**
   * Fingerprint of the secret in use after the rotation.
   *
   * @return the string
   */
  @JsonProperty("newKeyHash")
  String newKeyHash();

  /**
   * Started at instant.
   *
   * @return the instant
   */
  @JsonProperty("startedAt")
  Instant startedAt();

  /**
   * Completed at instant.
   *
   * @return the instant
   */
  @JsonProperty("completedAt")
  Instant completedAt();

  /**
   * Items handed to the rotation.
   *
   * @return the int
   */
  @JsonProperty("itemCount")
  int itemCount();

  /**
   * Items re-encrypted under the new key.
   *
   * @return the int
   */
  @JsonProperty("itemsReencrypted")
  int itemsReencrypted();

  /**
   * Success boolean.
   *
   * @return the boolean
   */
  @JsonProperty("success")
  boolean success();

}
