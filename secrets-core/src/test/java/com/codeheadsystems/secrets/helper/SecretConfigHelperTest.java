package com.codeheadsystems.secrets.helper;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.secrets.dagger.SecretsComponent;
import com.codeheadsystems.secrets.encryption.EncryptionService;
import com.codeheadsystems.secrets.encryption.LegacyConfigCipher;
import com.codeheadsystems.secrets.model.ConfigValueType;
import com.codeheadsystems.secrets.model.ImmutableConfiguration;
import com.codeheadsystems.secrets.model.ImmutableStoredConfigValue;
import com.codeheadsystems.secrets.model.StoredConfigValue;
import com.codeheadsystems.secrets.utilities.MaskUtilities;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SecretConfigHelperTest {

  private static final String API_KEY = "sk-live-0123456789abcdef";

  private EncryptionService encryptionService;
  private LegacyConfigCipher legacyConfigCipher;
  private SecretConfigHelper helper;

  @BeforeEach
  void setup() {
    final SecretsComponent component = SecretsComponent.instance(
        ImmutableConfiguration.builder().pbkdf2Iterations(1000).build(),
        name -> Optional.of("config-helper-test-secret"));
    encryptionService = component.encryptionService();
    legacyConfigCipher = component.legacyConfigCipher();
    helper = component.secretConfigHelper();
  }

  @Test
  void store_secret() {
    final StoredConfigValue stored = helper.store("openai.apiKey", ConfigValueType.SECRET, API_KEY);

    assertThat(stored.encrypted()).isTrue();
    assertThat(stored.value()).startsWith("v2:").doesNotContain(API_KEY);
    assertThat(stored.value().split(":")).hasSize(5);
    assertThat(helper.reveal(stored)).isEqualTo(API_KEY);
  }

  @Test
  void store_emptySecret() {
    final StoredConfigValue stored = helper.store("openai.apiKey", ConfigValueType.SECRET, "");

    assertThat(stored.encrypted()).isFalse();
    assertThat(stored.value()).isEmpty();
  }

  @Test
  void store_plainTypes() {
    final StoredConfigValue stored = helper.store("pool.size", ConfigValueType.NUMBER, "10");

    assertThat(stored.encrypted()).isFalse();
    assertThat(stored.value()).isEqualTo("10");
    assertThat(helper.reveal(stored)).isEqualTo("10");
    assertThat(helper.displayValue(stored)).isEqualTo("10");
  }

  @Test
  void reveal_legacySecret() {
    final StoredConfigValue stored = legacySecret();
    assertThat(helper.reveal(stored)).isEqualTo(API_KEY);
  }

  @Test
  void migrate_legacySecret() {
    final StoredConfigValue migrated = helper.migrate(legacySecret());

    assertThat(encryptionService.isCurrentFormat(migrated.value())).isTrue();
    assertThat(migrated.value().split(":")).hasSize(5);
    assertThat(migrated.encrypted()).isTrue();
    assertThat(helper.reveal(migrated)).isEqualTo(API_KEY);
  }

  @Test
  void migrate_currentSecretUnchanged() {
    final StoredConfigValue stored = helper.store("openai.apiKey", ConfigValueType.SECRET, API_KEY);
    assertThat(helper.migrate(stored)).isSameAs(stored);
  }

  @Test
  void migrate_nonSecretUnchanged() {
    final StoredConfigValue stored = ImmutableStoredConfigValue.builder()
        .key("feature.flags")
        .valueType(ConfigValueType.JSON)
        .value(legacyConfigCipher.encrypt("{}"))
        .encrypted(true)
        .build();
    assertThat(helper.migrate(stored)).isSameAs(stored);
  }

  @Test
  void displayValue_secretMasked() {
    final StoredConfigValue stored = helper.store("openai.apiKey", ConfigValueType.SECRET, API_KEY);
    assertThat(helper.displayValue(stored)).isEqualTo(MaskUtilities.MASK + "cdef");
  }

  @Test
  void toString_redactsValue() {
    final StoredConfigValue stored = ImmutableStoredConfigValue.builder()
        .key("openai.apiKey")
        .valueType(ConfigValueType.SECRET)
        .value(API_KEY)
        .encrypted(false)
        .build();
    assertThat(stored.toString()).doesNotContain(API_KEY);
  }

  private StoredConfigValue legacySecret() {
    return ImmutableStoredConfigValue.builder()
        .key("openai.apiKey")
        .valueType(ConfigValueType.SECRET)
        .value(legacyConfigCipher.encrypt(API_KEY))
        .encrypted(true)
        .build();
  }

}
