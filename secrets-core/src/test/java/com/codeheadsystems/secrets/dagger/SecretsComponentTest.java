package com.codeheadsystems.secrets.dagger;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.api.secrets.v1.RotationItem;
import com.codeheadsystems.api.secrets.v1.RotationResult;
import com.codeheadsystems.secrets.encryption.AesGcmEncryptionService;
import com.codeheadsystems.secrets.encryption.EncryptionService;
import com.codeheadsystems.secrets.model.ImmutableConfiguration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SecretsComponentTest {

  private SecretsComponent component;

  @BeforeEach
  void setup() {
    component = SecretsComponent.instance(ImmutableConfiguration.builder().build(),
        name -> "PASSPHRASE".equals(name) ? Optional.of("component-test-passphrase") : Optional.empty());
  }

  @Test
  void encryptionService() {
    assertThat(component.encryptionService())
        .isInstanceOf(AesGcmEncryptionService.class)
        .isSameAs(component.encryptionService());
  }

  @Test
  void sharedKeyManager() {
    component.keyRotationManager().rotateKey(List.of(), "rotated-component-secret");

    assertThat(component.keyManager().deriveMasterKey().origin()).isEqualTo("rotation");
  }

  @Test
  void endToEnd() {
    final EncryptionService service = component.encryptionService();
    final String legacy = component.legacyConfigCipher().encrypt("stored before the upgrade");
    final String migrated = component.migrationManager().migrateToV2(legacy, true);

    final RotationResult result = component.keyRotationManager().rotateKey(
        List.of(RotationItem.of("setting", migrated)),
        component.keyRotationManager().prepareKeyRotation());

    assertThat(result.success()).isTrue();
    assertThat(service.decrypt(result.rotatedItems().get(0).encryptedData(), true))
        .isEqualTo("stored before the upgrade");
    assertThat(component.keyHealthManager().selfTest()).isTrue();
  }

}
