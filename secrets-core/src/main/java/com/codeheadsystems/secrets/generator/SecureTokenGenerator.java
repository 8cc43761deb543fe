package com.codeheadsystems.secrets.generator;

import com.codeheadsystems.secrets.model.KeyEncoding;
import com.codeheadsystems.secrets.utilities.HexUtilities;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cryptographically secure tokens, identifiers and key material.
 */
@Singleton
public class SecureTokenGenerator {

  /**
   * The constant DEFAULT_TOKEN_BYTES.
   */
  public static final int DEFAULT_TOKEN_BYTES = 32;
  /**
   * The constant DEFAULT_KEY_BYTES.
   */
  public static final int DEFAULT_KEY_BYTES = 32;

  private static final Logger log = LoggerFactory.getLogger(SecureTokenGenerator.class);

  private final SecureRandom secureRandom;

  /**
   * Instantiates a new Secure token generator.
   *
   * @param secureRandom the secure random
   */
  @Inject
  public SecureTokenGenerator(final SecureRandom secureRandom) {
    log.info("SecureTokenGenerator({})", secureRandom);
    this.secureRandom = secureRandom;
  }

  /**
   * Token of the default size.
   *
   * @return 64 hex characters
   */
  public String generateSecureToken() {
    return generateSecureToken(DEFAULT_TOKEN_BYTES);
  }

  /**
   * Random token.
   *
   * @param byteLength number of random bytes, zero gives an empty token
   * @return the hex string, twice as long as byteLength
   */
  public String generateSecureToken(final int byteLength) {
    log.trace("generateSecureToken({})", byteLength);
    if (byteLength == 0) {
      return "";
    }
    return HexUtilities.encode.apply(randomBytes(byteLength));
  }

  /**
   * Random version 4 UUID.
   *
   * @return the string
   */
  public String generateUuid() {
    return UUID.randomUUID().toString();
  }

  /**
   * 32 bytes of key material, base64 encoded.
   *
   * @return the string
   */
  public String generateKey() {
    return generateKey(DEFAULT_KEY_BYTES, KeyEncoding.BASE64);
  }

  /**
   * Key material.
   *
   * @param byteLength number of random bytes
   * @param encoding   the encoding
   * @return the string
   */
  public String generateKey(final int byteLength, final KeyEncoding encoding) {
    log.trace("generateKey({}, {})", byteLength, encoding);
    final byte[] bytes = randomBytes(byteLength);
    return switch (encoding) {
      case HEX -> HexUtilities.encode.apply(bytes);
      case BASE64 -> Base64.getEncoder().encodeToString(bytes);
    };
  }

  private byte[] randomBytes(final int byteLength) {
    if (byteLength < 1) {
      throw new IllegalArgumentException("byteLength must be positive");
    }
    final byte[] bytes = new byte[byteLength];
    secureRandom.nextBytes(bytes);
    return bytes;
  }

}
