package com.codeheadsystems.secrets.encryption;

import java.util.Map;

/**
 * Authenticated encryption of secrets into self-describing envelope strings.
 *
 * <p>The empty string is passed through unchanged by {@link #encrypt(String, boolean)} and
 * {@link #decrypt(String, boolean)}: callers store it to mean "not set", so an empty value
 * can not itself be encrypted.</p>
 */
public interface EncryptionService {

  /**
   * Encrypts with the master key.
   *
   * @param plaintext the plaintext
   * @return the envelope, or the empty string for empty input
   */
  default String encrypt(final String plaintext) {
    return encrypt(plaintext, false);
  }

  /**
   * Encrypts into a current format envelope.
   *
   * @param plaintext the plaintext
   * @param usePbkdf2 derive a salted key with PBKDF2
   * @return the envelope, or the empty string for empty input
   */
  String encrypt(String plaintext, boolean usePbkdf2);

  /**
   * Decrypts an envelope written without PBKDF2.
   *
   * @param envelope the envelope
   * @return the plaintext
   */
  default String decrypt(final String envelope) {
    return decrypt(envelope, false);
  }

  /**
   * Decrypts an envelope. The flag must match the one used to encrypt.
   *
   * @param envelope  the envelope
   * @param usePbkdf2 whether the envelope was written with PBKDF2
   * @return the plaintext
   */
  String decrypt(String envelope, boolean usePbkdf2);

  /**
   * Encrypts a credential record as JSON. An empty record still produces an envelope.
   *
   * @param credentials the credentials
   * @return the envelope
   */
  String encryptCredentials(Map<String, ?> credentials);

  /**
   * Decrypts a credential record. The empty string gives an empty record.
   *
   * @param envelope the envelope
   * @return the credentials
   */
  Map<String, Object> decryptCredentials(String envelope);

  /**
   * Encrypts a high value secret, always with PBKDF2.
   *
   * @param apiKey the api key
   * @return the envelope
   */
  default String encryptApiKey(final String apiKey) {
    return encrypt(apiKey, true);
  }

  /**
   * Decrypts a value written by {@link #encryptApiKey(String)}.
   *
   * @param envelope the envelope
   * @return the api key
   */
  default String decryptApiKey(final String envelope) {
    return decrypt(envelope, true);
  }

  /**
   * True if the value is in the current, versioned format.
   *
   * @param value the value
   * @return the boolean
   */
  boolean isCurrentFormat(String value);

  /**
   * True if the value is an envelope of either format.
   *
   * @param value the value
   * @return the boolean
   */
  boolean isEncrypted(String value);

}
