package com.codeheadsystems.secrets.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.secrets.exception.MalformedEnvelopeException;
import com.codeheadsystems.secrets.model.CurrentEnvelope;
import com.codeheadsystems.secrets.model.Envelope;
import com.codeheadsystems.secrets.model.FormatVersion;
import com.codeheadsystems.secrets.model.LegacyEnvelope;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EnvelopeCodecTest {

  private static final byte[] SALT = {0x01, 0x02};
  private static final byte[] IV = {0x0a, 0x0b};
  private static final byte[] TAG = {0x1c, 0x1d};
  private static final byte[] CIPHERTEXT = {(byte) 0xff, 0x00};

  private EnvelopeCodec codec;

  @BeforeEach
  void setup() {
    codec = new EnvelopeCodec();
  }

  @Test
  void encode_current() {
    assertThat(codec.encode(CurrentEnvelope.of(Optional.empty(), IV, TAG, CIPHERTEXT)))
        .isEqualTo("v2:0a0b:1c1d:ff00");
  }

  @Test
  void encode_currentWithSalt() {
    assertThat(codec.encode(CurrentEnvelope.of(Optional.of(SALT), IV, TAG, CIPHERTEXT)))
        .isEqualTo("v2:0102:0a0b:1c1d:ff00");
  }

  @Test
  void encode_legacy() {
    assertThat(codec.encode(LegacyEnvelope.of(IV, TAG, CIPHERTEXT))).isEqualTo("0a0b:1c1d:ff00");
  }

  @Test
  void decode_current() {
    final Envelope envelope = codec.decode("v2:0a0b:1c1d:ff00");
    assertThat(envelope).isInstanceOf(CurrentEnvelope.class);
    assertThat(((CurrentEnvelope) envelope).salt()).isEmpty();
    assertThat(envelope.iv()).isEqualTo(IV);
    assertThat(envelope.authTag()).isEqualTo(TAG);
    assertThat(envelope.ciphertext()).isEqualTo(CIPHERTEXT);
  }

  @Test
  void decode_currentWithSalt() {
    final CurrentEnvelope envelope = (CurrentEnvelope) codec.decode("v2:0102:0a0b:1c1d:ff00");
    assertThat(envelope.salt()).hasValueSatisfying(salt -> assertThat(salt).isEqualTo(SALT));
    assertThat(envelope.iv()).isEqualTo(IV);
  }

  @Test
  void decode_upperCaseHex() {
    assertThat(codec.decode("v2:0A0B:1C1D:FF00").ciphertext()).isEqualTo(CIPHERTEXT);
  }

  @Test
  void decode_legacy() {
    final Envelope envelope = codec.decode("0a0b:1c1d:ff00");
    assertThat(envelope.version()).isEqualTo(FormatVersion.LEGACY);
    assertThat(envelope.authTag()).isEqualTo(TAG);
  }

  @Test
  void decode_currentTooFewFields() {
    assertThatExceptionOfType(MalformedEnvelopeException.class)
        .isThrownBy(() -> codec.decode("v2:0a0b:1c1d"));
  }

  @Test
  void decode_currentTooManyFields() {
    assertThatExceptionOfType(MalformedEnvelopeException.class)
        .isThrownBy(() -> codec.decode("v2:00:0102:0a0b:1c1d:ff00"));
  }

  @Test
  void decode_legacyWithFourFields() {
    assertThatExceptionOfType(MalformedEnvelopeException.class)
        .isThrownBy(() -> codec.decode("0102:0a0b:1c1d:ff00"));
  }

  @Test
  void decode_emptyField() {
    assertThatExceptionOfType(MalformedEnvelopeException.class)
        .isThrownBy(() -> codec.decode("v2:0a0b::ff00"));
  }

  @Test
  void decode_trailingDelimiter() {
    assertThatExceptionOfType(MalformedEnvelopeException.class)
        .isThrownBy(() -> codec.decode("0a0b:1c1d:ff00:"));
  }

  @Test
  void decode_notHex() {
    assertThatExceptionOfType(MalformedEnvelopeException.class)
        .isThrownBy(() -> codec.decode("v2:0a0b:1c1d:zz00"));
  }

  @Test
  void decode_oddLengthHex() {
    assertThatExceptionOfType(MalformedEnvelopeException.class)
        .isThrownBy(() -> codec.decode("v2:0a0b:1c1d:ff0"));
  }

  @Test
  void decode_empty() {
    assertThatExceptionOfType(MalformedEnvelopeException.class)
        .isThrownBy(() -> codec.decode(""));
  }

  @Test
  void isCurrentFormat() {
    assertThat(codec.isCurrentFormat("v2:0a0b:1c1d:ff00")).isTrue();
    assertThat(codec.isCurrentFormat("v2:")).isTrue();
    assertThat(codec.isCurrentFormat("0a0b:1c1d:ff00")).isFalse();
    assertThat(codec.isCurrentFormat("")).isFalse();
    assertThat(codec.isCurrentFormat(null)).isFalse();
  }

  @Test
  void isEncrypted() {
    assertThat(codec.isEncrypted("v2:0a0b:1c1d:ff00")).isTrue();
    assertThat(codec.isEncrypted("0a0b:1c1d:ff00")).isTrue();
    assertThat(codec.isEncrypted("plain text value")).isFalse();
    assertThat(codec.isEncrypted("U2FsdGVkX1+abc123==")).isFalse();
    assertThat(codec.isEncrypted("")).isFalse();
    assertThat(codec.isEncrypted(null)).isFalse();
  }

}
