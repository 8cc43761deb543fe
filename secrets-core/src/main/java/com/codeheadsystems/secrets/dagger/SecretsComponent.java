package com.codeheadsystems.secrets.dagger;

import com.codeheadsystems.secrets.encryption.EncryptionService;
import com.codeheadsystems.secrets.encryption.LegacyConfigCipher;
import com.codeheadsystems.secrets.encryption.MacService;
import com.codeheadsystems.secrets.generator.SecureTokenGenerator;
import com.codeheadsystems.secrets.helper.SecretConfigHelper;
import com.codeheadsystems.secrets.manager.KeyFileManager;
import com.codeheadsystems.secrets.manager.KeyHealthManager;
import com.codeheadsystems.secrets.manager.KeyManager;
import com.codeheadsystems.secrets.manager.KeyRotationManager;
import com.codeheadsystems.secrets.manager.MigrationManager;
import com.codeheadsystems.secrets.model.Configuration;
import com.codeheadsystems.secrets.source.SecretSource;
import dagger.Component;
import javax.inject.Singleton;

/**
 * The interface Secrets component.
 */
@Singleton
@Component(modules = {SecretsModule.class, ConfigurationModule.class, CommonModule.class})
public interface SecretsComponent {

  /**
   * Component reading secrets from the process environment.
   *
   * @param configuration the configuration
   * @return the secrets component
   */
  static SecretsComponent instance(final Configuration configuration) {
    return DaggerSecretsComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Component reading secrets from the given source.
   *
   * @param configuration the configuration
   * @param secretSource  the secret source
   * @return the secrets component
   */
  static SecretsComponent instance(final Configuration configuration, final SecretSource secretSource) {
    return DaggerSecretsComponent.builder()
        .configurationModule(new ConfigurationModule(configuration, secretSource))
        .build();
  }

  /**
   * Encryption service.
   *
   * @return the encryption service
   */
  EncryptionService encryptionService();

  /**
   * Legacy config cipher.
   *
   * @return the legacy config cipher
   */
  LegacyConfigCipher legacyConfigCipher();

  /**
   * Key manager.
   *
   * @return the key manager
   */
  KeyManager keyManager();

  /**
   * Migration manager.
   *
   * @return the migration manager
   */
  MigrationManager migrationManager();

  /**
   * Key rotation manager.
   *
   * @return the key rotation manager
   */
  KeyRotationManager keyRotationManager();

  /**
   * Key health manager.
   *
   * @return the key health manager
   */
  KeyHealthManager keyHealthManager();

  /**
   * Key file manager.
   *
   * @return the key file manager
   */
  KeyFileManager keyFileManager();

  /**
   * Mac service.
   *
   * @return the mac service
   */
  MacService macService();

  /**
   * Secure token generator.
   *
   * @return the secure token generator
   */
  SecureTokenGenerator secureTokenGenerator();

  /**
   * Secret config helper.
   *
   * @return the secret config helper
   */
  SecretConfigHelper secretConfigHelper();
}
