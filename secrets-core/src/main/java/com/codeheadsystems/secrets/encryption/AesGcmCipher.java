package com.codeheadsystems.secrets.encryption;

import com.codeheadsystems.secrets.exception.AuthenticationException;
import com.codeheadsystems.secrets.exception.SecretsException;
import com.codeheadsystems.secrets.model.Envelope;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-256-GCM with a fresh random IV per call and no additional authenticated data.
 *
 * <p>The JCA appends the tag to the ciphertext; this class splits it off so the envelope can
 * carry it as its own field.</p>
 */
@Singleton
public class AesGcmCipher {

  /**
   * The constant ALGORITHM.
   */
  public static final String ALGORITHM = "AES/GCM/NoPadding";
  /**
   * IV length in bytes.
   */
  public static final int IV_LENGTH = 16;
  /**
   * Tag length in bytes.
   */
  public static final int TAG_LENGTH = 16;

  private static final Logger log = LoggerFactory.getLogger(AesGcmCipher.class);

  private final SecureRandom secureRandom;

  /**
   * Instantiates a new Aes gcm cipher.
   *
   * @param secureRandom the secure random
   */
  @Inject
  public AesGcmCipher(final SecureRandom secureRandom) {
    log.info("AesGcmCipher({})", secureRandom);
    this.secureRandom = secureRandom;
  }

  /**
   * Encrypts under the key with a newly generated IV.
   *
   * @param key       the 32 byte key
   * @param plaintext the plaintext
   * @return the sealed parts
   */
  public Sealed encrypt(final byte[] key, final byte[] plaintext) {
    final byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      final Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH * 8, iv));
      final byte[] output = cipher.doFinal(plaintext);
      final int split = output.length - TAG_LENGTH;
      return new Sealed(iv, Arrays.copyOfRange(output, split, output.length), Arrays.copyOfRange(output, 0, split));
    } catch (GeneralSecurityException e) {
      log.error("Encryption failed", e);
      throw new SecretsException("Failed to encrypt value", e);
    }
  }

  /**
   * Decrypts and verifies an envelope's payload.
   *
   * @param key      the key
   * @param envelope the envelope
   * @return the plaintext bytes
   * @throws AuthenticationException if the tag does not verify
   */
  public byte[] decrypt(final byte[] key, final Envelope envelope) {
    if (envelope.authTag().length != TAG_LENGTH) {
      log.debug("Rejecting tag of {} bytes", envelope.authTag().length);
      throw new AuthenticationException();
    }
    final byte[] input = ByteBuffer.allocate(envelope.ciphertext().length + TAG_LENGTH)
        .put(envelope.ciphertext())
        .put(envelope.authTag())
        .array();
    try {
      final Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
          new GCMParameterSpec(TAG_LENGTH * 8, envelope.iv()));
      return cipher.doFinal(input);
    } catch (AEADBadTagException e) {
      log.debug("Tag verification failed");
      throw new AuthenticationException(e);
    } catch (GeneralSecurityException e) {
      log.error("Decryption failed", e);
      throw new SecretsException("Failed to decrypt value", e);
    }
  }

  /**
   * The parts produced by one encryption.
   *
   * @param iv         the iv
   * @param authTag    the auth tag
   * @param ciphertext the ciphertext
   */
  public record Sealed(byte[] iv, byte[] authTag, byte[] ciphertext) {
  }

}
