package com.codeheadsystems.secrets.source;

import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads secrets from the process environment.
 */
@Singleton
public class EnvironmentSecretSource implements SecretSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(EnvironmentSecretSource.class);

  /**
   * Instantiates a new Environment secret source.
   */
  @Inject
  public EnvironmentSecretSource() {
    LOGGER.info("EnvironmentSecretSource()");
  }

  @Override
  public Optional<String> lookup(final String name) {
    LOGGER.trace("lookup({})", name);
    return Optional.ofNullable(System.getenv(name));
  }

}
