package com.codeheadsystems.secrets.utilities;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Pure one-way hash helpers. None of these use key material.
 */
public class HashUtilities {

  /**
   * Length of the fingerprint returned by {@link #hashKey(String)}.
   */
  public static final int KEY_HASH_LENGTH = 16;

  private HashUtilities() {
  }

  /**
   * SHA-256 of the UTF-8 bytes, as 64 lowercase hex characters.
   *
   * @param data the data
   * @return the string
   */
  public static String sha256(final String data) {
    return DigestUtils.sha256Hex(data);
  }

  /**
   * SHA-512 of the UTF-8 bytes, as 128 lowercase hex characters.
   *
   * @param data the data
   * @return the string
   */
  public static String sha512(final String data) {
    return DigestUtils.sha512Hex(data);
  }

  /**
   * Short deterministic fingerprint, for logs and cache keys.
   *
   * @param value the value
   * @return the first 16 hex characters of the SHA-256
   */
  public static String hashKey(final String value) {
    return sha256(value).substring(0, KEY_HASH_LENGTH);
  }

  /**
   * Compares two strings in time that depends only on the length of {@code a}.
   * Different lengths compare false; null never matches.
   *
   * @param a the expected value
   * @param b the candidate
   * @return true if equal
   */
  public static boolean timingSafeEqual(final String a, final String b) {
    if (a == null || b == null) {
      return false;
    }
    return MessageDigest.isEqual(
        a.getBytes(StandardCharsets.UTF_8),
        b.getBytes(StandardCharsets.UTF_8));
  }

}
