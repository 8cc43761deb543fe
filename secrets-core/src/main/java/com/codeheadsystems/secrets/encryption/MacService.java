package com.codeheadsystems.secrets.encryption;

import com.codeheadsystems.secrets.manager.KeyManager;
import com.codeheadsystems.secrets.utilities.HexUtilities;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyed message authentication with HMAC-SHA256.
 */
@Singleton
public class MacService {

  private static final Logger log = LoggerFactory.getLogger(MacService.class);

  private final KeyManager keyManager;

  /**
   * Instantiates a new Mac service.
   *
   * @param keyManager the key manager
   */
  @Inject
  public MacService(final KeyManager keyManager) {
    log.info("MacService({})", keyManager);
    this.keyManager = keyManager;
  }

  /**
   * HMAC keyed with the master key. The key is the hex text of the master key, so values
   * match those written by earlier releases.
   *
   * @param data the data
   * @return 64 lowercase hex characters
   */
  public String hmac(final String data) {
    return hmac(data, HexUtilities.encode.apply(keyManager.deriveMasterKey().key()));
  }

  /**
   * HMAC with an explicit key.
   *
   * @param data the data
   * @param key  the key
   * @return 64 lowercase hex characters
   */
  public String hmac(final String data, final String key) {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(key, "key");
    log.trace("hmac(length={})", data.length());
    return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, key).hmacHex(data);
  }

}
