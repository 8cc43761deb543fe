package com.codeheadsystems.secrets.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.codeheadsystems.api.secrets.v1.KeySource;
import com.codeheadsystems.secrets.exception.ConfigurationException;
import com.codeheadsystems.secrets.generator.SecureTokenGenerator;
import com.codeheadsystems.secrets.model.Configuration;
import com.codeheadsystems.secrets.model.ImmutableConfiguration;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeyFileManagerTest {

  private static final String SECRET = "file-based-secret-for-local-setups";

  @TempDir Path tempDir;

  private Path keyFile;
  private KeyManager keyManager;
  private KeyFileManager keyFileManager;

  @BeforeEach
  void setup() {
    keyFile = tempDir.resolve("keys").resolve("encryption.key");
    final Configuration configuration = ImmutableConfiguration.builder()
        .keyFilePath(keyFile.toString())
        .build();
    keyManager = new KeyManager(configuration, name -> Optional.empty(), new SecureRandom());
    keyFileManager = new KeyFileManager(configuration, keyManager, new SecureTokenGenerator(new SecureRandom()));
  }

  @Test
  void createKeyFile() throws IOException {
    final Path path = keyFileManager.createKeyFile(SECRET);

    assertThat(path).isEqualTo(keyFile);
    assertThat(Files.readString(keyFile, StandardCharsets.UTF_8)).isEqualTo(SECRET);
    assertThat(keyManager.deriveMasterKey().source()).isEqualTo(KeySource.FILE);
    assertThat(keyManager.deriveMasterKey().secret()).isEqualTo(SECRET);
  }

  @Test
  void createKeyFile_ownerOnly() throws IOException {
    assumeTrue(tempDir.getFileSystem().supportedFileAttributeViews().contains("posix"));

    keyFileManager.createKeyFile(SECRET);

    assertThat(Files.getPosixFilePermissions(keyFile)).isEqualTo(KeyFileManager.OWNER_ONLY);
  }

  @Test
  void createKeyFile_replacesExisting() throws IOException {
    keyFileManager.createKeyFile(SECRET + "-and-a-much-longer-suffix");
    final String before = keyManager.currentKeyHash();

    keyFileManager.createKeyFile(SECRET);

    assertThat(Files.readString(keyFile, StandardCharsets.UTF_8)).isEqualTo(SECRET);
    assertThat(keyManager.currentKeyHash()).isNotEqualTo(before);
  }

  @Test
  void createKeyFile_generated() throws IOException {
    keyFileManager.createKeyFile();

    assertThat(Base64.getDecoder().decode(Files.readString(keyFile, StandardCharsets.UTF_8))).hasSize(32);
  }

  @Test
  void createKeyFile_blank() {
    assertThatExceptionOfType(ConfigurationException.class)
        .isThrownBy(() -> keyFileManager.createKeyFile(" "));
    assertThat(keyFile).doesNotExist();
  }

  @Test
  void createKeyFile_noPathConfigured() {
    final KeyFileManager manager = new KeyFileManager(ImmutableConfiguration.builder().build(), keyManager,
        new SecureTokenGenerator(new SecureRandom()));

    assertThatExceptionOfType(ConfigurationException.class)
        .isThrownBy(() -> manager.createKeyFile(SECRET))
        .withMessageContaining("No key file path");
  }

  @Test
  void deleteKeyFile() {
    keyFileManager.createKeyFile(SECRET);
    keyManager.deriveMasterKey();

    assertThat(keyFileManager.deleteKeyFile()).isTrue();
    assertThat(keyFile).doesNotExist();
    assertThat(keyManager.findMasterKey()).isEmpty();
    assertThatExceptionOfType(ConfigurationException.class).isThrownBy(() -> keyManager.deriveMasterKey());
  }

  @Test
  void deleteKeyFile_missing() {
    assertThat(keyFileManager.deleteKeyFile()).isFalse();
  }

}
