package com.codeheadsystems.secrets.manager;

import com.codeheadsystems.secrets.exception.ConfigurationException;
import com.codeheadsystems.secrets.generator.SecureTokenGenerator;
import com.codeheadsystems.secrets.model.Configuration;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes and removes the key file named by {@link Configuration#keyFilePath()}. Meant for local
 * setups where no secret is supplied through the environment.
 */
@Singleton
public class KeyFileManager {

  /**
   * Owner read and write only.
   */
  public static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyFileManager.class);

  private final Configuration configuration;
  private final KeyManager keyManager;
  private final SecureTokenGenerator secureTokenGenerator;

  /**
   * Instantiates a new Key file manager.
   *
   * @param configuration        the configuration
   * @param keyManager           the key manager
   * @param secureTokenGenerator the secure token generator
   */
  @Inject
  public KeyFileManager(final Configuration configuration,
                        final KeyManager keyManager,
                        final SecureTokenGenerator secureTokenGenerator) {
    LOGGER.info("KeyFileManager({},{})", keyManager, secureTokenGenerator);
    this.configuration = configuration;
    this.keyManager = keyManager;
    this.secureTokenGenerator = secureTokenGenerator;
  }

  /**
   * Writes a newly generated secret to the key file.
   *
   * @return the key file path
   */
  public Path createKeyFile() {
    return createKeyFile(secureTokenGenerator.generateKey());
  }

  /**
   * Writes the secret to the key file, replacing any existing one. On POSIX file systems only
   * the owner can read it. The key cache is invalidated afterwards.
   *
   * @param secret the secret
   * @return the key file path
   * @throws ConfigurationException if no key file path is configured or the file can not be written
   */
  public Path createKeyFile(final String secret) {
    Objects.requireNonNull(secret, "secret");
    if (secret.isBlank()) {
      throw new ConfigurationException("Key file secret must not be blank");
    }
    final Path path = keyFilePath();
    LOGGER.trace("createKeyFile({})", path);
    try {
      final Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      if (isPosix(path)) {
        if (Files.exists(path)) {
          Files.setPosixFilePermissions(path, OWNER_ONLY);
        } else {
          Files.createFile(path, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        }
      }
      Files.writeString(path, secret, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    } catch (IOException e) {
      LOGGER.error("Unable to write key file {}", path, e);
      throw new ConfigurationException("Unable to write key file: " + path, e);
    }
    keyManager.invalidateKeyCache();
    LOGGER.info("Wrote key file {}", path);
    return path;
  }

  /**
   * Removes the key file. The key cache is invalidated when a file was removed.
   *
   * @return true if a file was deleted
   * @throws ConfigurationException if no key file path is configured or the file can not be deleted
   */
  public boolean deleteKeyFile() {
    final Path path = keyFilePath();
    LOGGER.trace("deleteKeyFile({})", path);
    try {
      if (!Files.deleteIfExists(path)) {
        return false;
      }
    } catch (IOException e) {
      LOGGER.error("Unable to delete key file {}", path, e);
      throw new ConfigurationException("Unable to delete key file: " + path, e);
    }
    keyManager.invalidateKeyCache();
    LOGGER.info("Deleted key file {}", path);
    return true;
  }

  private Path keyFilePath() {
    return configuration.keyFilePath()
        .map(Path::of)
        .orElseThrow(() -> new ConfigurationException("No key file path configured"));
  }

  private boolean isPosix(final Path path) {
    return path.getFileSystem().supportedFileAttributeViews().contains("posix");
  }

}
