package com.codeheadsystems.secrets.manager;

import com.codeheadsystems.api.secrets.v1.ImmutableKeyStatus;
import com.codeheadsystems.api.secrets.v1.KeyRotationEvent;
import com.codeheadsystems.api.secrets.v1.KeySource;
import com.codeheadsystems.api.secrets.v1.KeyStatus;
import com.codeheadsystems.secrets.encryption.EncryptionService;
import com.codeheadsystems.secrets.exception.ConfigurationException;
import com.codeheadsystems.secrets.exception.SecretsException;
import com.codeheadsystems.secrets.model.Configuration;
import com.codeheadsystems.secrets.model.MasterKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup checks and health reporting for the master secret.
 */
@Singleton
public class KeyHealthManager {

  /**
   * Secrets shorter than this get a warning.
   */
  public static final int MIN_KEY_LENGTH = 32;
  /**
   * The constant JWT_SECRET.
   */
  public static final String JWT_SECRET = "JWT_SECRET";
  /**
   * Recommended days between rotations.
   */
  public static final int KEY_ROTATION_INTERVAL_DAYS = 90;

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyHealthManager.class);
  private static final Pattern REPEATED = Pattern.compile("(.)\\1{4,}");
  private static final Pattern SEQUENCE = Pattern.compile("(?i)123456|abcdef|qwerty");
  private static final Pattern ALPHANUMERIC = Pattern.compile("^[a-zA-Z0-9]+$");
  private static final int ALPHANUMERIC_MIN_LENGTH = 48;
  private static final String SELF_TEST_VALUE = "secrets self test";

  private final Configuration configuration;
  private final KeyManager keyManager;
  private final EncryptionService encryptionService;
  private final KeyRotationManager keyRotationManager;
  private final Clock clock;
  private final ConcurrentMap<String, Instant> firstSeen;
  private final ConcurrentMap<String, Instant> markedRotated;

  /**
   * Instantiates a new Key health manager.
   *
   * @param configuration      the configuration
   * @param keyManager         the key manager
   * @param encryptionService  the encryption service
   * @param keyRotationManager the key rotation manager, for rotation times
   * @param clock              the clock
   */
  @Inject
  public KeyHealthManager(final Configuration configuration,
                          final KeyManager keyManager,
                          final EncryptionService encryptionService,
                          final KeyRotationManager keyRotationManager,
                          final Clock clock) {
    LOGGER.info("KeyHealthManager({},{},{})", keyManager, encryptionService, keyRotationManager);
    this.configuration = configuration;
    this.keyManager = keyManager;
    this.encryptionService = encryptionService;
    this.keyRotationManager = keyRotationManager;
    this.clock = clock;
    this.firstSeen = new ConcurrentHashMap<>();
    this.markedRotated = new ConcurrentHashMap<>();
  }

  /**
   * Key status.
   *
   * @return the key status
   */
  public KeyStatus keyStatus() {
    LOGGER.trace("keyStatus()");
    final Optional<MasterKey> masterKey = keyManager.findMasterKey();
    if (masterKey.isEmpty()) {
      return ImmutableKeyStatus.builder()
          .configured(false)
          .source(KeySource.NONE)
          .keyLength(0)
          .rotationDue(true)
          .addWarnings("No encryption secret configured")
          .build();
    }
    final MasterKey key = masterKey.get();
    final Instant now = clock.instant();
    final Instant seen = firstSeen.computeIfAbsent(key.fingerprint(), fingerprint -> now);
    final Optional<Instant> lastRotated = lastRotated(key.fingerprint());
    final boolean rotationDue = Duration.between(lastRotated.orElse(seen), now).toDays()
        >= KEY_ROTATION_INTERVAL_DAYS;
    final List<String> warnings = new ArrayList<>();
    if (key.secret().length() < MIN_KEY_LENGTH) {
      warnings.add("Secret is shorter than " + MIN_KEY_LENGTH + " characters");
    }
    if (JWT_SECRET.equals(key.origin())) {
      warnings.add("JWT_SECRET is used as the encryption secret, set a dedicated one");
    }
    if (isWeak(key.secret())) {
      warnings.add("Secret contains weak patterns");
    }
    if (rotationDue) {
      warnings.add("Key rotation recommended every " + KEY_ROTATION_INTERVAL_DAYS + " days");
    }
    return ImmutableKeyStatus.builder()
        .configured(true)
        .source(key.source())
        .keyHash(key.fingerprint())
        .keyLength(key.secret().length())
        .lastRotated(lastRotated)
        .rotationDue(rotationDue)
        .warnings(warnings)
        .build();
  }

  /**
   * Records that the active secret was rotated now, for secrets rotated outside this process
   * (a new value deployed to the environment). Does nothing without a configured secret.
   */
  public void markKeyAsRotated() {
    final Optional<MasterKey> masterKey = keyManager.findMasterKey();
    if (masterKey.isEmpty()) {
      LOGGER.warn("markKeyAsRotated() without a configured secret");
      return;
    }
    final String fingerprint = masterKey.get().fingerprint();
    markedRotated.put(fingerprint, clock.instant());
    LOGGER.info("Marked key {} as rotated", fingerprint);
  }

  private Optional<Instant> lastRotated(final String fingerprint) {
    final Stream<Instant> rotatedHere = keyRotationManager.getKeyRotationHistory().stream()
        .filter(event -> event.newKeyHash().equals(fingerprint))
        .map(KeyRotationEvent::completedAt);
    return Stream.concat(rotatedHere, Optional.ofNullable(markedRotated.get(fingerprint)).stream())
        .max(Instant::compareTo);
  }

  /**
   * Problems with a candidate secret. Empty means it is acceptable.
   *
   * @param candidate the candidate
   * @return the list of problems
   */
  public List<String> validateKey(final String candidate) {
    final List<String> errors = new ArrayList<>();
    if (candidate == null || candidate.isEmpty()) {
      errors.add("Secret must not be empty");
      return errors;
    }
    if (candidate.length() < MIN_KEY_LENGTH) {
      errors.add("Secret must be at least " + MIN_KEY_LENGTH + " characters");
    }
    if (isWeak(candidate)) {
      errors.add("Secret contains weak patterns");
    }
    return errors;
  }

  /**
   * Encrypts and decrypts a sample value with the active key.
   *
   * @return true if the round trip worked
   */
  public boolean selfTest() {
    LOGGER.trace("selfTest()");
    try {
      return SELF_TEST_VALUE.equals(encryptionService.decrypt(encryptionService.encrypt(SELF_TEST_VALUE)));
    } catch (SecretsException e) {
      LOGGER.error("Encryption self test failed", e);
      return false;
    }
  }

  /**
   * Startup check. A missing secret fails when the configuration requires one, otherwise
   * it is logged and encryption calls fail later.
   *
   * @throws ConfigurationException if the secret is missing and required, or unusable
   */
  public void ensureEncryptionKey() {
    final KeyStatus status = keyStatus();
    if (!status.configured()) {
      if (configuration.requireSecret()) {
        LOGGER.error("No encryption secret configured in {}", configuration.secretNames());
        throw new ConfigurationException("No encryption secret configured. Set one of "
            + configuration.secretNames());
      }
      LOGGER.warn("No encryption secret configured, encryption is unavailable");
      return;
    }
    status.warnings().forEach(warning -> LOGGER.warn("Encryption secret: {}", warning));
    if (!selfTest()) {
      throw new ConfigurationException("Encryption self test failed");
    }
    LOGGER.info("Encryption secret {} configured from {}", status.keyHash().orElse(""), status.source());
  }

  private boolean isWeak(final String secret) {
    return REPEATED.matcher(secret).find()
        || SEQUENCE.matcher(secret).find()
        || (ALPHANUMERIC.matcher(secret).matches() && secret.length() < ALPHANUMERIC_MIN_LENGTH);
  }

}
