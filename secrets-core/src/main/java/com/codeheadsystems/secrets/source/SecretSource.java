package com.codeheadsystems.secrets.source;

import java.util.Optional;

/**
 * Looks up named configuration values that may hold the master secret.
 */
@FunctionalInterface
public interface SecretSource {

  /**
   * Lookup the named value.
   *
   * @param name the name
   * @return the value, if set
   */
  Optional<String> lookup(String name);

}
