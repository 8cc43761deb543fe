package com.codeheadsystems.secrets.converter;

import com.codeheadsystems.secrets.exception.MalformedEnvelopeException;
import com.codeheadsystems.secrets.model.CurrentEnvelope;
import com.codeheadsystems.secrets.model.Envelope;
import com.codeheadsystems.secrets.model.FormatVersion;
import com.codeheadsystems.secrets.model.LegacyEnvelope;
import com.codeheadsystems.secrets.utilities.HexUtilities;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec between {@link Envelope} values and their string form.
 *
 * <p>Current: {@code v2:[salt:]iv:authTag:ciphertext}. Legacy: {@code iv:authTag:ciphertext}.
 * Every field is lowercase hex.</p>
 */
@Singleton
public class EnvelopeCodec {

  /**
   * The constant DELIMITER.
   */
  public static final String DELIMITER = ":";

  private static final Logger log = LoggerFactory.getLogger(EnvelopeCodec.class);

  /**
   * Instantiates a new Envelope codec.
   */
  @Inject
  public EnvelopeCodec() {
    log.info("EnvelopeCodec()");
  }

  /**
   * Encodes an envelope.
   *
   * @param envelope the envelope
   * @return the string
   */
  public String encode(final Envelope envelope) {
    log.trace("encode({})", envelope.version());
    final List<String> fields = new ArrayList<>(4);
    if (envelope instanceof CurrentEnvelope) {
      ((CurrentEnvelope) envelope).salt().ifPresent(salt -> fields.add(HexUtilities.encode.apply(salt)));
    }
    fields.add(HexUtilities.encode.apply(envelope.iv()));
    fields.add(HexUtilities.encode.apply(envelope.authTag()));
    fields.add(HexUtilities.encode.apply(envelope.ciphertext()));
    return envelope.version().prefix() + String.join(DELIMITER, fields);
  }

  /**
   * Decodes an envelope string. A {@code v2:} value is never read as legacy.
   *
   * @param value the value
   * @return the envelope
   * @throws MalformedEnvelopeException if the value matches neither shape
   */
  public Envelope decode(final String value) {
    log.trace("decode(length={})", value == null ? -1 : value.length());
    if (value == null || value.isEmpty()) {
      throw new MalformedEnvelopeException("Envelope is empty");
    }
    if (isCurrentFormat(value)) {
      final List<byte[]> fields = fields(value.substring(FormatVersion.CURRENT.prefix().length()));
      if (fields.size() == 3) {
        return CurrentEnvelope.of(Optional.empty(), fields.get(0), fields.get(1), fields.get(2));
      } else if (fields.size() == 4) {
        return CurrentEnvelope.of(Optional.of(fields.get(0)), fields.get(1), fields.get(2), fields.get(3));
      }
      throw new MalformedEnvelopeException("Current envelope must have 3 or 4 fields, found " + fields.size());
    }
    final List<byte[]> fields = fields(value);
    if (fields.size() != 3) {
      throw new MalformedEnvelopeException("Legacy envelope must have 3 fields, found " + fields.size());
    }
    return LegacyEnvelope.of(fields.get(0), fields.get(1), fields.get(2));
  }

  /**
   * True if the value carries the current format prefix.
   *
   * @param value the value
   * @return the boolean
   */
  public boolean isCurrentFormat(final String value) {
    return value != null && value.startsWith(FormatVersion.CURRENT.prefix());
  }

  /**
   * True if the value parses as either envelope shape. Lets callers tell stored ciphertext
   * apart from plaintext defaults.
   *
   * @param value the value
   * @return the boolean
   */
  public boolean isEncrypted(final String value) {
    if (value == null || value.isEmpty()) {
      return false;
    }
    try {
      decode(value);
      return true;
    } catch (MalformedEnvelopeException e) {
      log.trace("Not an envelope: {}", e.getMessage());
      return false;
    }
  }

  private List<byte[]> fields(final String body) {
    final String[] parts = body.split(DELIMITER, -1);
    final List<byte[]> result = new ArrayList<>(parts.length);
    for (String part : parts) {
      if (part.isEmpty()) {
        throw new MalformedEnvelopeException("Envelope has an empty field");
      }
      result.add(HexUtilities.decode.apply(part)
          .orElseThrow(() -> new MalformedEnvelopeException("Envelope field is not valid hex")));
    }
    return result;
  }

}
