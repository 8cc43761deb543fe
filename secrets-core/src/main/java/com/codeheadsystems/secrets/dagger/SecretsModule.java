package com.codeheadsystems.secrets.dagger;

import com.codeheadsystems.secrets.encryption.AesGcmEncryptionService;
import com.codeheadsystems.secrets.encryption.EncryptionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * The type Secrets module.
 */
@Module(includes = SecretsModule.Binder.class)
public class SecretsModule {

  /**
   * Instantiates a new Secrets module.
   */
  public SecretsModule() {
    // Default constructor
  }

  /**
   * Object mapper for credential records and the api types.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper()
        .registerModule(new Jdk8Module())
        .registerModule(new JavaTimeModule());
  }

  /**
   * The interface Binder.
   */
  @Module
  interface Binder {

    /**
     * Encryption service.
     *
     * @param service the service
     * @return the encryption service
     */
    @Binds
    EncryptionService encryptionService(AesGcmEncryptionService service);

  }
}
