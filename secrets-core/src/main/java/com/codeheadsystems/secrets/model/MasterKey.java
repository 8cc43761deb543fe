package com.codeheadsystems.secrets.model;

import com.codeheadsystems.api.secrets.v1.KeySource;
import com.codeheadsystems.secrets.utilities.HashUtilities;
import org.immutables.value.Value;

/**
 * The normalized master key together with the secret it came from.
 */
@Value.Immutable
public interface MasterKey {

  /**
   * Of master key.
   *
   * @param secret the secret
   * @param source the source
   * @param origin the environment name or file path it was read from
   * @param key    the 32 byte key
   * @return the master key
   */
  static MasterKey of(final String secret, final KeySource source, final String origin, final byte[] key) {
    return ImmutableMasterKey.builder().secret(secret).source(source).origin(origin).key(key).build();
  }

  /**
   * Operator supplied secret.
   *
   * @return the string
   */
  @Value.Redacted
  String secret();

  /**
   * Source key source.
   *
   * @return the key source
   */
  KeySource source();

  /**
   * Environment name, key file path, or {@code rotation}.
   *
   * @return the string
   */
  String origin();

  /**
   * SHA-256 of the secret.
   *
   * @return the byte [ ]
   */
  @Value.Redacted
  byte[] key();

  /**
   * Fingerprint of the secret.
   *
   * @return the string
   */
  @Value.Derived
  default String fingerprint() {
    return HashUtilities.hashKey(secret());
  }

}
