package com.codeheadsystems.secrets.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentSecretSourceTest {

  private final EnvironmentSecretSource source = new EnvironmentSecretSource();

  @Test
  void lookup_present() {
    assumeFalse(System.getenv().isEmpty());
    final Map.Entry<String, String> any = System.getenv().entrySet().iterator().next();
    assertThat(source.lookup(any.getKey())).hasValue(any.getValue());
  }

  @Test
  void lookup_missing() {
    assertThat(source.lookup("SECRETS_TEST_VARIABLE_THAT_IS_NEVER_SET")).isEmpty();
  }

}
