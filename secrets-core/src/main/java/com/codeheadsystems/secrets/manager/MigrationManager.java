package com.codeheadsystems.secrets.manager;

import com.codeheadsystems.secrets.converter.EnvelopeCodec;
import com.codeheadsystems.secrets.encryption.EncryptionService;
import com.codeheadsystems.secrets.encryption.LegacyConfigCipher;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves values from the legacy format to the current one.
 */
@Singleton
public class MigrationManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(MigrationManager.class);

  private final EnvelopeCodec envelopeCodec;
  private final LegacyConfigCipher legacyConfigCipher;
  private final EncryptionService encryptionService;

  /**
   * Instantiates a new Migration manager.
   *
   * @param envelopeCodec      the envelope codec
   * @param legacyConfigCipher the legacy config cipher
   * @param encryptionService  the encryption service
   */
  @Inject
  public MigrationManager(final EnvelopeCodec envelopeCodec,
                          final LegacyConfigCipher legacyConfigCipher,
                          final EncryptionService encryptionService) {
    LOGGER.info("MigrationManager({},{},{})", envelopeCodec, legacyConfigCipher, encryptionService);
    this.envelopeCodec = envelopeCodec;
    this.legacyConfigCipher = legacyConfigCipher;
    this.encryptionService = encryptionService;
  }

  /**
   * Migrate to the current format, encrypted with the master key.
   *
   * @param value the stored value
   * @return the current format value
   */
  public String migrateToV2(final String value) {
    return migrateToV2(value, false);
  }

  /**
   * Migrate to the current format. Empty and already current values come back unchanged.
   * A legacy value that does not decrypt fails the same way {@code decrypt} does.
   *
   * @param value     the stored value
   * @param usePbkdf2 re-encrypt with a password derived key
   * @return the current format value
   */
  public String migrateToV2(final String value, final boolean usePbkdf2) {
    Objects.requireNonNull(value, "value");
    LOGGER.trace("migrateToV2(length={}, {})", value.length(), usePbkdf2);
    if (value.isEmpty() || envelopeCodec.isCurrentFormat(value)) {
      return value;
    }
    final String plaintext = legacyConfigCipher.decrypt(value);
    final String migrated = encryptionService.encrypt(plaintext, usePbkdf2);
    LOGGER.debug("Migrated legacy value to current format");
    return migrated;
  }

  /**
   * True for a legacy envelope. Plaintext and current values need nothing.
   *
   * @param value the value
   * @return the boolean
   */
  public boolean needsMigration(final String value) {
    return !envelopeCodec.isCurrentFormat(value) && envelopeCodec.isEncrypted(value);
  }

}
