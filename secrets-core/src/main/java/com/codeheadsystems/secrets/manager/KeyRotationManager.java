package com.codeheadsystems.secrets.manager;

import com.codeheadsystems.api.secrets.v1.ImmutableKeyRotationEvent;
import com.codeheadsystems.api.secrets.v1.ImmutableRotationResult;
import com.codeheadsystems.api.secrets.v1.KeyRotationEvent;
import com.codeheadsystems.api.secrets.v1.RotationError;
import com.codeheadsystems.api.secrets.v1.RotationItem;
import com.codeheadsystems.api.secrets.v1.RotationResult;
import com.codeheadsystems.secrets.converter.EnvelopeCodec;
import com.codeheadsystems.secrets.encryption.EncryptionService;
import com.codeheadsystems.secrets.exception.ConfigurationException;
import com.codeheadsystems.secrets.exception.SecretsException;
import com.codeheadsystems.secrets.generator.SecureTokenGenerator;
import com.codeheadsystems.secrets.model.CurrentEnvelope;
import com.codeheadsystems.secrets.model.MasterKey;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-encrypts stored values under a new master secret.
 *
 * <p>Rotation happens in memory only. The caller persists
 * {@link RotationResult#rotatedItems()}; nothing here is transactional.</p>
 */
@Singleton
public class KeyRotationManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyRotationManager.class);

  private final KeyManager keyManager;
  private final EnvelopeCodec envelopeCodec;
  private final EncryptionService encryptionService;
  private final SecureTokenGenerator secureTokenGenerator;
  private final Clock clock;
  private final List<KeyRotationEvent> history;
  private final Object rotationLock;

  /**
   * Instantiates a new Key rotation manager.
   *
   * @param keyManager           the key manager
   * @param envelopeCodec        the envelope codec
   * @param encryptionService    the encryption service
   * @param secureTokenGenerator the secure token generator
   * @param clock                the clock
   */
  @Inject
  public KeyRotationManager(final KeyManager keyManager,
                            final EnvelopeCodec envelopeCodec,
                            final EncryptionService encryptionService,
                            final SecureTokenGenerator secureTokenGenerator,
                            final Clock clock) {
    LOGGER.info("KeyRotationManager({},{},{})", keyManager, encryptionService, clock);
    this.keyManager = keyManager;
    this.envelopeCodec = envelopeCodec;
    this.encryptionService = encryptionService;
    this.secureTokenGenerator = secureTokenGenerator;
    this.clock = clock;
    this.history = new CopyOnWriteArrayList<>();
    this.rotationLock = new Object();
  }

  /**
   * Decrypts every item under the current key, activates the new secret, then re-encrypts
   * what was recovered. Each item keeps its key-derivation mode; legacy items come out in
   * the current format. A failing item is reported in the errors and the batch carries on.
   *
   * @param items        the stored values
   * @param newKeySecret the new master secret
   * @return the rotation result
   * @throws ConfigurationException if the new secret is blank or no current secret exists
   */
  public RotationResult rotateKey(final List<RotationItem> items, final String newKeySecret) {
    Objects.requireNonNull(items, "items");
    LOGGER.trace("rotateKey({} items)", items.size());
    if (newKeySecret == null || newKeySecret.isBlank()) {
      throw new ConfigurationException("New key secret must not be blank");
    }
    synchronized (rotationLock) {
      final Instant startedAt = clock.instant();
      final String oldKeyHash = keyManager.currentKeyHash();
      final List<RotationError> errors = new ArrayList<>();

      final List<Recovered> recovered = new ArrayList<>(items.size());
      for (RotationItem item : items) {
        try {
          final boolean usePbkdf2 = usesPbkdf2(item.encryptedData());
          final String plaintext = encryptionService.decrypt(item.encryptedData(), usePbkdf2);
          recovered.add(new Recovered(item.id(), plaintext, usePbkdf2));
        } catch (SecretsException e) {
          LOGGER.warn("Unable to decrypt item {} under the current key: {}", item.id(), e.getMessage());
          errors.add(RotationError.of(item.id(), "Decryption failed: " + e.getMessage()));
        }
      }

      final MasterKey newKey = keyManager.activate(newKeySecret);

      final List<RotationItem> rotated = new ArrayList<>(recovered.size());
      for (Recovered item : recovered) {
        try {
          rotated.add(RotationItem.of(item.id(), encryptionService.encrypt(item.plaintext(), item.usePbkdf2())));
        } catch (SecretsException e) {
          LOGGER.warn("Unable to re-encrypt item {} under the new key: {}", item.id(), e.getMessage());
          errors.add(RotationError.of(item.id(), "Re-encryption failed: " + e.getMessage()));
        }
      }

      final boolean success = errors.isEmpty();
      final KeyRotationEvent event = ImmutableKeyRotationEvent.builder()
          .oldKeyHash(oldKeyHash)
          .newKeyHash(newKey.fingerprint())
          .startedAt(startedAt)
          .completedAt(clock.instant())
          .itemCount(items.size())
          .itemsReencrypted(rotated.size())
          .success(success)
          .build();
      history.add(event);
      LOGGER.info("Rotated key {} -> {}: {} of {} items re-encrypted, {} errors",
          oldKeyHash, newKey.fingerprint(), rotated.size(), items.size(), errors.size());

      return ImmutableRotationResult.builder()
          .success(success)
          .itemsProcessed(items.size())
          .errors(errors)
          .rotatedItems(rotated)
          .build();
    }
  }

  /**
   * Reloads the master secret from configuration, dropping the secret activated by the last
   * rotation. Call it once the rotated secret has been persisted to configuration.
   */
  public void invalidateKeyCache() {
    keyManager.invalidateKeyCache();
  }

  /**
   * Rotations performed by this process, oldest first.
   *
   * @return the key rotation history
   */
  public List<KeyRotationEvent> getKeyRotationHistory() {
    return List.copyOf(history);
  }

  /**
   * A fresh secret suitable for {@link #rotateKey(List, String)}.
   *
   * @return the string
   */
  public String prepareKeyRotation() {
    return secureTokenGenerator.generateKey();
  }

  private boolean usesPbkdf2(final String value) {
    if (!envelopeCodec.isCurrentFormat(value)) {
      return false;
    }
    return ((CurrentEnvelope) envelopeCodec.decode(value)).salt().isPresent();
  }

  private record Recovered(String id, String plaintext, boolean usePbkdf2) {
  }

}
