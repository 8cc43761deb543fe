package com.codeheadsystems.secrets.model;

import org.immutables.value.Value;

/**
 * The unversioned envelope, always encrypted directly under the master key.
 */
@Value.Immutable
public interface LegacyEnvelope extends Envelope {

  /**
   * Of legacy envelope.
   *
   * @param iv         the iv
   * @param authTag    the auth tag
   * @param ciphertext the ciphertext
   * @return the legacy envelope
   */
  static LegacyEnvelope of(final byte[] iv, final byte[] authTag, final byte[] ciphertext) {
    return ImmutableLegacyEnvelope.builder().iv(iv).authTag(authTag).ciphertext(ciphertext).build();
  }

  @Override
  default FormatVersion version() {
    return FormatVersion.LEGACY;
  }

}
