package com.codeheadsystems.secrets.helper;

import com.codeheadsystems.secrets.encryption.EncryptionService;
import com.codeheadsystems.secrets.encryption.LegacyConfigCipher;
import com.codeheadsystems.secrets.manager.MigrationManager;
import com.codeheadsystems.secrets.model.ConfigValueType;
import com.codeheadsystems.secrets.model.ImmutableStoredConfigValue;
import com.codeheadsystems.secrets.model.StoredConfigValue;
import com.codeheadsystems.secrets.utilities.MaskUtilities;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts and decrypts configuration values by type before they are persisted.
 * Only SECRET values are encrypted, always with a password derived key.
 */
@Singleton
public class SecretConfigHelper {

  private static final Logger log = LoggerFactory.getLogger(SecretConfigHelper.class);

  private final EncryptionService encryptionService;
  private final LegacyConfigCipher legacyConfigCipher;
  private final MigrationManager migrationManager;

  /**
   * Instantiates a new Secret config helper.
   *
   * @param encryptionService  the encryption service
   * @param legacyConfigCipher the legacy config cipher
   * @param migrationManager   the migration manager
   */
  @Inject
  public SecretConfigHelper(final EncryptionService encryptionService,
                            final LegacyConfigCipher legacyConfigCipher,
                            final MigrationManager migrationManager) {
    log.info("SecretConfigHelper({},{},{})", encryptionService, legacyConfigCipher, migrationManager);
    this.encryptionService = encryptionService;
    this.legacyConfigCipher = legacyConfigCipher;
    this.migrationManager = migrationManager;
  }

  /**
   * Prepares a value for storage. An empty SECRET stays empty and unencrypted.
   *
   * @param key       the key
   * @param valueType the value type
   * @param plaintext the plaintext
   * @return the stored config value
   */
  public StoredConfigValue store(final String key, final ConfigValueType valueType, final String plaintext) {
    Objects.requireNonNull(plaintext, "plaintext");
    log.trace("store({}, {})", key, valueType);
    final boolean encrypt = valueType == ConfigValueType.SECRET && !plaintext.isEmpty();
    return ImmutableStoredConfigValue.builder()
        .key(key)
        .valueType(valueType)
        .value(encrypt ? encryptionService.encryptApiKey(plaintext) : plaintext)
        .encrypted(encrypt)
        .build();
  }

  /**
   * The plaintext of a stored value. Legacy encrypted secrets are still readable.
   *
   * @param stored the stored value
   * @return the plaintext
   */
  public String reveal(final StoredConfigValue stored) {
    log.trace("reveal({})", stored.key());
    if (!stored.encrypted()) {
      return stored.value();
    }
    if (encryptionService.isCurrentFormat(stored.value())) {
      return encryptionService.decryptApiKey(stored.value());
    }
    return legacyConfigCipher.decrypt(stored.value());
  }

  /**
   * Re-encrypts a legacy encrypted SECRET in the current format. Anything else is
   * returned unchanged.
   *
   * @param stored the stored value
   * @return the stored config value
   */
  public StoredConfigValue migrate(final StoredConfigValue stored) {
    log.trace("migrate({})", stored.key());
    if (stored.valueType() != ConfigValueType.SECRET
        || !stored.encrypted()
        || !migrationManager.needsMigration(stored.value())) {
      return stored;
    }
    log.info("Migrating secret {} to the current format", stored.key());
    return ImmutableStoredConfigValue.copyOf(stored)
        .withValue(migrationManager.migrateToV2(stored.value(), true));
  }

  /**
   * Value for display. Secrets are masked.
   *
   * @param stored the stored value
   * @return the string
   */
  public String displayValue(final StoredConfigValue stored) {
    if (stored.valueType() != ConfigValueType.SECRET) {
      return stored.value();
    }
    return MaskUtilities.mask(reveal(stored));
  }

}
