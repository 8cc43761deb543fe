package com.codeheadsystems.secrets.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Key for a single encrypt or decrypt call.
 */
@Value.Immutable
public interface OperationKey {

  /**
   * Of operation key.
   *
   * @param key  the key
   * @param salt the salt used to derive it, if any
   * @return the operation key
   */
  static OperationKey of(final byte[] key, final Optional<byte[]> salt) {
    return ImmutableOperationKey.builder().key(key).salt(salt).build();
  }

  /**
   * Key byte [ ].
   *
   * @return the byte [ ]
   */
  @Value.Redacted
  byte[] key();

  /**
   * Salt optional.
   *
   * @return the optional
   */
  Optional<byte[]> salt();

}
