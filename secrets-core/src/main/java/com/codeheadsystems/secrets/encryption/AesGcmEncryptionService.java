package com.codeheadsystems.secrets.encryption;

import com.codeheadsystems.secrets.converter.EnvelopeCodec;
import com.codeheadsystems.secrets.exception.AuthenticationException;
import com.codeheadsystems.secrets.exception.SecretsException;
import com.codeheadsystems.secrets.manager.KeyManager;
import com.codeheadsystems.secrets.model.CurrentEnvelope;
import com.codeheadsystems.secrets.model.Envelope;
import com.codeheadsystems.secrets.model.LegacyEnvelope;
import com.codeheadsystems.secrets.model.OperationKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-256-GCM implementation of EncryptionService.
 *
 * <p>Encrypted format: {@code v2:[salt:]iv:authTag:ciphertext}, hex fields. The salt is present
 * exactly when the key was derived with PBKDF2, and decryption insists that the caller's flag
 * agrees with it.</p>
 */
@Singleton
public class AesGcmEncryptionService implements EncryptionService {

  private static final Logger log = LoggerFactory.getLogger(AesGcmEncryptionService.class);
  private static final TypeReference<Map<String, Object>> CREDENTIALS_TYPE = new TypeReference<>() {
  };

  private final KeyManager keyManager;
  private final EnvelopeCodec envelopeCodec;
  private final AesGcmCipher cipher;
  private final LegacyConfigCipher legacyConfigCipher;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new AES-GCM encryption service.
   *
   * @param keyManager         the key manager
   * @param envelopeCodec      the envelope codec
   * @param cipher             the cipher
   * @param legacyConfigCipher the legacy config cipher
   * @param objectMapper       the object mapper for credential records
   */
  @Inject
  public AesGcmEncryptionService(final KeyManager keyManager,
                                 final EnvelopeCodec envelopeCodec,
                                 final AesGcmCipher cipher,
                                 final LegacyConfigCipher legacyConfigCipher,
                                 final ObjectMapper objectMapper) {
    log.info("AesGcmEncryptionService({},{},{},{})", keyManager, envelopeCodec, cipher, legacyConfigCipher);
    this.keyManager = keyManager;
    this.envelopeCodec = envelopeCodec;
    this.cipher = cipher;
    this.legacyConfigCipher = legacyConfigCipher;
    this.objectMapper = objectMapper;
  }

  @Override
  public String encrypt(final String plaintext, final boolean usePbkdf2) {
    Objects.requireNonNull(plaintext, "plaintext");
    log.trace("encrypt(length={}, {})", plaintext.length(), usePbkdf2);
    if (plaintext.isEmpty()) {
      return "";
    }
    final OperationKey operationKey = keyManager.deriveOperationKey(usePbkdf2);
    final AesGcmCipher.Sealed sealed = cipher.encrypt(operationKey.key(), plaintext.getBytes(StandardCharsets.UTF_8));
    return envelopeCodec.encode(
        CurrentEnvelope.of(operationKey.salt(), sealed.iv(), sealed.authTag(), sealed.ciphertext()));
  }

  @Override
  public String decrypt(final String value, final boolean usePbkdf2) {
    Objects.requireNonNull(value, "value");
    log.trace("decrypt(length={}, {})", value.length(), usePbkdf2);
    if (value.isEmpty()) {
      return "";
    }
    final Envelope envelope = envelopeCodec.decode(value);
    if (envelope instanceof LegacyEnvelope legacy) {
      if (usePbkdf2) {
        log.debug("Legacy envelope can not be password derived");
        throw new AuthenticationException();
      }
      return legacyConfigCipher.decrypt(legacy);
    }
    final CurrentEnvelope current = (CurrentEnvelope) envelope;
    if (current.salt().isPresent() != usePbkdf2) {
      log.debug("Derivation mode mismatch: salted={}, usePbkdf2={}", current.salt().isPresent(), usePbkdf2);
      throw new AuthenticationException();
    }
    final byte[] key = current.salt()
        .map(salt -> keyManager.deriveOperationKey(salt).key())
        .orElseGet(() -> keyManager.deriveMasterKey().key());
    return new String(cipher.decrypt(key, current), StandardCharsets.UTF_8);
  }

  @Override
  public String encryptCredentials(final Map<String, ?> credentials) {
    Objects.requireNonNull(credentials, "credentials");
    log.trace("encryptCredentials({} fields)", credentials.size());
    try {
      return encrypt(objectMapper.writeValueAsString(credentials));
    } catch (JsonProcessingException e) {
      log.error("Unable to serialize credential record", e);
      throw new SecretsException("Failed to serialize credentials", e);
    }
  }

  @Override
  public Map<String, Object> decryptCredentials(final String value) {
    log.trace("decryptCredentials()");
    final String json = decrypt(value);
    if (json.isEmpty()) {
      return new LinkedHashMap<>();
    }
    try {
      final Map<String, Object> credentials = objectMapper.readValue(json, CREDENTIALS_TYPE);
      if (credentials == null) {
        throw new SecretsException("Decrypted value is not a credential record");
      }
      return credentials;
    } catch (JsonProcessingException e) {
      log.error("Decrypted value is not a JSON object");
      throw new SecretsException("Decrypted value is not a credential record", e);
    }
  }

  @Override
  public boolean isCurrentFormat(final String value) {
    return envelopeCodec.isCurrentFormat(value);
  }

  @Override
  public boolean isEncrypted(final String value) {
    return envelopeCodec.isEncrypted(value);
  }

}
