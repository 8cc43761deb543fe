package com.codeheadsystems.secrets.dagger;

import com.codeheadsystems.secrets.model.Configuration;
import com.codeheadsystems.secrets.source.EnvironmentSecretSource;
import com.codeheadsystems.secrets.source.SecretSource;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * The type Configuration module.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;
  private final SecretSource secretSource;

  /**
   * Reads secrets from the process environment.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this(configuration, new EnvironmentSecretSource());
  }

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   * @param secretSource  where named secrets are looked up
   */
  public ConfigurationModule(final Configuration configuration,
                             final SecretSource secretSource) {
    this.configuration = configuration;
    this.secretSource = secretSource;
  }

  /**
   * Configuration configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  /**
   * Secret source.
   *
   * @return the secret source
   */
  @Provides
  @Singleton
  public SecretSource secretSource() {
    return secretSource;
  }
}
