package com.codeheadsystems.secrets.encryption;

import com.codeheadsystems.secrets.converter.EnvelopeCodec;
import com.codeheadsystems.secrets.exception.MalformedEnvelopeException;
import com.codeheadsystems.secrets.manager.KeyManager;
import com.codeheadsystems.secrets.model.Envelope;
import com.codeheadsystems.secrets.model.FormatVersion;
import com.codeheadsystems.secrets.model.LegacyEnvelope;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The unversioned {@code iv:authTag:ciphertext} format, encrypted directly under the master key.
 *
 * <p>Still written for non-secret configuration values. Secrets use
 * {@link EncryptionService} and legacy secrets are migrated away from this format.</p>
 */
@Singleton
public class LegacyConfigCipher {

  private static final Logger log = LoggerFactory.getLogger(LegacyConfigCipher.class);

  private final KeyManager keyManager;
  private final EnvelopeCodec envelopeCodec;
  private final AesGcmCipher cipher;

  /**
   * Instantiates a new Legacy config cipher.
   *
   * @param keyManager    the key manager
   * @param envelopeCodec the envelope codec
   * @param cipher        the cipher
   */
  @Inject
  public LegacyConfigCipher(final KeyManager keyManager,
                            final EnvelopeCodec envelopeCodec,
                            final AesGcmCipher cipher) {
    log.info("LegacyConfigCipher({},{},{})", keyManager, envelopeCodec, cipher);
    this.keyManager = keyManager;
    this.envelopeCodec = envelopeCodec;
    this.cipher = cipher;
  }

  /**
   * Encrypts into the legacy format.
   *
   * @param plaintext the plaintext
   * @return the legacy envelope string
   */
  public String encrypt(final String plaintext) {
    Objects.requireNonNull(plaintext, "plaintext");
    log.trace("encrypt(length={})", plaintext.length());
    final AesGcmCipher.Sealed sealed = cipher.encrypt(
        keyManager.deriveMasterKey().key(), plaintext.getBytes(StandardCharsets.UTF_8));
    return envelopeCodec.encode(LegacyEnvelope.of(sealed.iv(), sealed.authTag(), sealed.ciphertext()));
  }

  /**
   * Decrypts a legacy format string. A current format value is rejected, never reinterpreted.
   *
   * @param value the value
   * @return the plaintext
   */
  public String decrypt(final String value) {
    Objects.requireNonNull(value, "value");
    log.trace("decrypt(length={})", value.length());
    final Envelope envelope = envelopeCodec.decode(value);
    if (envelope.version() != FormatVersion.LEGACY) {
      throw new MalformedEnvelopeException("Expected a legacy envelope, found " + envelope.version());
    }
    return decrypt((LegacyEnvelope) envelope);
  }

  /**
   * Decrypts an already decoded legacy envelope.
   *
   * @param envelope the envelope
   * @return the plaintext
   */
  public String decrypt(final LegacyEnvelope envelope) {
    final byte[] plaintext = cipher.decrypt(keyManager.deriveMasterKey().key(), envelope);
    return new String(plaintext, StandardCharsets.UTF_8);
  }

}
