package com.codeheadsystems.secrets.utilities;

import java.util.Optional;
import java.util.function.Function;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowercase hex conversions used by the envelope format.
 */
public class HexUtilities {

  /**
   * The constant encode.
   */
  public static final Function<byte[], String> encode = Hex::encodeHexString;
  private static final Logger LOGGER = LoggerFactory.getLogger(HexUtilities.class);
  /**
   * The constant decode. Empty if the input is not an even length hex string.
   */
  public static final Function<String, Optional<byte[]>> decode = s -> {
    try {
      return Optional.of(Hex.decodeHex(s));
    } catch (DecoderException e) {
      LOGGER.debug("Failed to decode hex string of length {}: {}", s.length(), e.getMessage());
      return Optional.empty();
    }
  };

  private HexUtilities() {
  }

}
