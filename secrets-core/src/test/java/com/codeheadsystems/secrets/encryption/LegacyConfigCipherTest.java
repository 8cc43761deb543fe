package com.codeheadsystems.secrets.encryption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.secrets.converter.EnvelopeCodec;
import com.codeheadsystems.secrets.exception.AuthenticationException;
import com.codeheadsystems.secrets.exception.MalformedEnvelopeException;
import com.codeheadsystems.secrets.manager.KeyManager;
import com.codeheadsystems.secrets.model.ImmutableConfiguration;
import java.security.SecureRandom;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LegacyConfigCipherTest {

  private KeyManager keyManager;
  private LegacyConfigCipher cipher;

  @BeforeEach
  void setup() {
    keyManager = new KeyManager(ImmutableConfiguration.builder().build(),
        name -> Optional.of("legacy-test-secret"), new SecureRandom());
    cipher = new LegacyConfigCipher(keyManager, new EnvelopeCodec(), new AesGcmCipher(new SecureRandom()));
  }

  @Test
  void encrypt() {
    final String encrypted = cipher.encrypt("database password");

    assertThat(encrypted).doesNotStartWith("v2:");
    assertThat(encrypted.split(":")).hasSize(3);
    assertThat(cipher.decrypt(encrypted)).isEqualTo("database password");
  }

  @Test
  void decrypt_currentFormatRejected() {
    assertThatExceptionOfType(MalformedEnvelopeException.class)
        .isThrownBy(() -> cipher.decrypt("v2:0a0b:1c1d:ff00"));
  }

  @Test
  void decrypt_afterRotation() {
    final String encrypted = cipher.encrypt("database password");
    keyManager.activate("some-other-secret");

    assertThatExceptionOfType(AuthenticationException.class).isThrownBy(() -> cipher.decrypt(encrypted));
  }

}
