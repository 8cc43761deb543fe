package com.codeheadsystems.secrets.manager;

import com.codeheadsystems.api.secrets.v1.KeySource;
import com.codeheadsystems.secrets.exception.ConfigurationException;
import com.codeheadsystems.secrets.model.Configuration;
import com.codeheadsystems.secrets.model.MasterKey;
import com.codeheadsystems.secrets.model.OperationKey;
import com.codeheadsystems.secrets.source.SecretSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.codec.digest.DigestUtils;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the master key and derives the key for each operation.
 *
 * <p>The master key is SHA-256 of the operator secret, so its length never depends on the
 * secret. It is cached until {@link #invalidateKeyCache()} or {@link #activate(String)}. An
 * activated secret wins over configuration until the cache is invalidated.
 * Salted keys are derived fresh on every call.</p>
 */
@Singleton
public class KeyManager {

  /**
   * Key length in bytes (AES-256).
   */
  public static final int KEY_LENGTH = 32;
  /**
   * PBKDF2 salt length in bytes.
   */
  public static final int SALT_LENGTH = 32;
  /**
   * Origin recorded for secrets activated by a rotation.
   */
  public static final String ROTATION_ORIGIN = "rotation";

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyManager.class);

  private final Configuration configuration;
  private final SecretSource secretSource;
  private final SecureRandom secureRandom;
  private final AtomicReference<MasterKey> cachedKey;
  private final Object lock;
  private volatile String rotatedSecret;

  /**
   * Instantiates a new Key manager.
   *
   * @param configuration the configuration
   * @param secretSource  the secret source
   * @param secureRandom  the secure random
   */
  @Inject
  public KeyManager(final Configuration configuration,
                    final SecretSource secretSource,
                    final SecureRandom secureRandom) {
    LOGGER.info("KeyManager({},{})", configuration, secretSource);
    this.configuration = configuration;
    this.secretSource = secretSource;
    this.secureRandom = secureRandom;
    this.cachedKey = new AtomicReference<>();
    this.lock = new Object();
  }

  /**
   * Returns the master key, loading it from configuration on first use.
   *
   * @return the master key
   * @throws ConfigurationException if no secret is configured
   */
  public MasterKey deriveMasterKey() {
    final MasterKey cached = cachedKey.get();
    if (cached != null) {
      return cached;
    }
    synchronized (lock) {
      MasterKey masterKey = cachedKey.get();
      if (masterKey == null) {
        masterKey = findMasterKey().orElseThrow(() -> {
          LOGGER.error("No master secret found in {} or key file", configuration.secretNames());
          return new ConfigurationException("No encryption secret configured. Set one of "
              + configuration.secretNames());
        });
        LOGGER.debug("Loaded master key {} from {}", masterKey.fingerprint(), masterKey.source());
        cachedKey.set(masterKey);
      }
      return masterKey;
    }
  }

  /**
   * Looks the secret up without caching or failing. Rotation first, then each secret name,
   * then the key file.
   *
   * @return the master key, if any secret is configured
   */
  public Optional<MasterKey> findMasterKey() {
    LOGGER.trace("findMasterKey()");
    final String rotated = rotatedSecret;
    if (rotated != null) {
      return Optional.of(normalize(rotated, KeySource.ROTATION, ROTATION_ORIGIN));
    }
    for (String name : configuration.secretNames()) {
      final Optional<String> value = secretSource.lookup(name).filter(s -> !s.isBlank());
      if (value.isPresent()) {
        return Optional.of(normalize(value.get(), KeySource.ENVIRONMENT, name));
      }
    }
    return configuration.keyFilePath().flatMap(this::readKeyFile);
  }

  /**
   * Key for one operation. Without PBKDF2 this is the master key; with it a new salt is
   * generated and must be stored alongside the ciphertext.
   *
   * @param usePbkdf2 whether to derive with PBKDF2
   * @return the operation key
   */
  public OperationKey deriveOperationKey(final boolean usePbkdf2) {
    LOGGER.trace("deriveOperationKey({})", usePbkdf2);
    if (!usePbkdf2) {
      return OperationKey.of(deriveMasterKey().key(), Optional.empty());
    }
    final byte[] salt = new byte[SALT_LENGTH];
    secureRandom.nextBytes(salt);
    return deriveOperationKey(salt);
  }

  /**
   * Reproduces the PBKDF2-HMAC-SHA512 key for a stored salt.
   *
   * @param salt the salt
   * @return the operation key
   */
  public OperationKey deriveOperationKey(final byte[] salt) {
    LOGGER.trace("deriveOperationKey(salt[{}])", salt.length);
    final PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA512Digest());
    generator.init(deriveMasterKey().key(), salt, configuration.pbkdf2Iterations());
    final KeyParameter parameter = (KeyParameter) generator.generateDerivedParameters(KEY_LENGTH * 8);
    return OperationKey.of(parameter.getKey(), Optional.of(salt.clone()));
  }

  /**
   * Fingerprint of the active secret.
   *
   * @return the 16 character key hash
   */
  public String currentKeyHash() {
    return deriveMasterKey().fingerprint();
  }

  /**
   * Forgets the cached master key and any secret activated by a rotation. The next operation
   * reloads the secret from configuration, so a rotated secret has to be persisted there before
   * this is called.
   */
  public void invalidateKeyCache() {
    LOGGER.info("invalidateKeyCache()");
    synchronized (lock) {
      rotatedSecret = null;
      cachedKey.set(null);
    }
  }

  /**
   * Makes the given secret the active one until the next {@link #invalidateKeyCache()}. When this
   * returns every thread sees the new key.
   *
   * @param newSecret the new secret
   * @return the new master key
   */
  public MasterKey activate(final String newSecret) {
    if (newSecret == null || newSecret.isBlank()) {
      throw new ConfigurationException("New key secret must not be blank");
    }
    final MasterKey masterKey = normalize(newSecret, KeySource.ROTATION, ROTATION_ORIGIN);
    synchronized (lock) {
      rotatedSecret = newSecret;
      cachedKey.set(masterKey);
    }
    LOGGER.info("Activated master key {}", masterKey.fingerprint());
    return masterKey;
  }

  private Optional<MasterKey> readKeyFile(final String keyFilePath) {
    final Path path = Path.of(keyFilePath);
    if (!Files.isRegularFile(path)) {
      LOGGER.debug("Key file {} not present", path);
      return Optional.empty();
    }
    try {
      final String secret = Files.readString(path, StandardCharsets.UTF_8).trim();
      if (secret.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(normalize(secret, KeySource.FILE, keyFilePath));
    } catch (IOException e) {
      LOGGER.error("Unable to read key file {}", path, e);
      throw new ConfigurationException("Unable to read key file: " + keyFilePath, e);
    }
  }

  private MasterKey normalize(final String secret, final KeySource source, final String origin) {
    return MasterKey.of(secret, source, origin, DigestUtils.sha256(secret));
  }

}
