package com.codeheadsystems.api.secrets.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A stored ciphertext identified by the caller's own id.
 * <p>
 * Used both as the input of a key rotation and as the re-encrypted output the caller
 * must persist afterwards.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRotationItem.class)
@JsonDeserialize(builder = ImmutableRotationItem.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface RotationItem {

  /**
   * Of rotation item.
   *
   * @param id            the id
   * @param encryptedData the encrypted data
   * @return the rotation item
   */
  static RotationItem of(final String id, final String encryptedData) {
    return ImmutableRotationItem.builder().id(id).encryptedData(encryptedData).build();
  }

  /**
   * Caller supplied identifier.
   *
   * @return the id
   */
  @JsonProperty("id")
  String id();

  /**
   * The envelope string.
   *
   * @return the encrypted data
   */
  @JsonProperty("encryptedData")
  String encryptedData();

}
