package com.codeheadsystems.secrets.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * The {@code v2:} envelope. Carries a salt only when the key was password derived.
 */
@Value.Immutable
public interface CurrentEnvelope extends Envelope {

  /**
   * Of current envelope.
   *
   * @param salt       the salt, if PBKDF2 was used
   * @param iv         the iv
   * @param authTag    the auth tag
   * @param ciphertext the ciphertext
   * @return the current envelope
   */
  static CurrentEnvelope of(final Optional<byte[]> salt,
                            final byte[] iv,
                            final byte[] authTag,
                            final byte[] ciphertext) {
    return ImmutableCurrentEnvelope.builder()
        .salt(salt)
        .iv(iv)
        .authTag(authTag)
        .ciphertext(ciphertext)
        .build();
  }

  /**
   * PBKDF2 salt.
   *
   * @return the optional
   */
  Optional<byte[]> salt();

  @Override
  default FormatVersion version() {
    return FormatVersion.CURRENT;
  }

}
