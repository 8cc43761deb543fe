package com.codeheadsystems.secrets.model;

/**
 * Everything needed to decrypt a value except the key.
 *
 * <p>Either a {@link LegacyEnvelope} or a {@link CurrentEnvelope}. The colon delimited
 * string form only exists inside the codec.</p>
 */
public interface Envelope {

  /**
   * Version format version.
   *
   * @return the format version
   */
  FormatVersion version();

  /**
   * Initialization vector.
   *
   * @return the byte [ ]
   */
  byte[] iv();

  /**
   * GCM authentication tag.
   *
   * @return the byte [ ]
   */
  byte[] authTag();

  /**
   * Ciphertext without the tag.
   *
   * @return the byte [ ]
   */
  byte[] ciphertext();

}
