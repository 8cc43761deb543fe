package com.codeheadsystems.api.secrets.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Outcome of a key rotation batch.
 * <p>
 * The rotation only re-encrypts in memory. Nothing has been written anywhere when this is
 * returned: the caller owns persisting {@link #rotatedItems()}, and a batch with errors
 * leaves the failed items readable only under the previous key.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRotationResult.class)
@JsonDeserialize(builder = ImmutableRotationResult.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface RotationResult {

  /**
   * True when every item was rotated.
   *
   * @return the boolean
   */
  @JsonProperty("success")
  boolean success();

  /**
   * Number of items attempted, successful or not.
   *
   * @return the int
   */
  @JsonProperty("itemsProcessed")
  int itemsProcessed();

  /**
   * Per-item failures.
   *
   * @return the list
   */
  @JsonProperty("errors")
  List<RotationError> errors();

  /**
   * Items re-encrypted under the new key, to be persisted by the caller.
   *
   * @return the list
   */
  @JsonProperty("rotatedItems")
  List<RotationItem> rotatedItems();

}
