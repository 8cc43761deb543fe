package com.codeheadsystems.api.secrets.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The interface Rotation error.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRotationError.class)
@JsonDeserialize(builder = ImmutableRotationError.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface RotationError {

  /**
   * Of rotation error.
   *
   * @param id    the id
   * @param error the error
   * @return the rotation error
   */
  static RotationError of(final String id, final String error) {
    return ImmutableRotationError.builder().id(id).error(error).build();
  }

  /**
   * Id of the item that failed.
   *
   * @return the id
   */
  @JsonProperty("id")
  String id();

  /**
   * Error description.
   *
   * @return the string
   */
  @JsonProperty("error")
  String error();

}
