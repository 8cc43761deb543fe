package com.codeheadsystems.secrets.encryption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codeheadsystems.api.secrets.v1.KeySource;
import com.codeheadsystems.secrets.manager.KeyManager;
import com.codeheadsystems.secrets.model.MasterKey;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MacServiceTest {

  @Mock private KeyManager keyManager;

  @InjectMocks private MacService macService;

  @Test
  void hmac_withKey() {
    // RFC 4231 test case 2
    assertThat(macService.hmac("what do ya want for nothing?", "Jefe"))
        .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
  }

  @Test
  void hmac_masterKey() {
    final MasterKey masterKey = MasterKey.of("secret", KeySource.ENVIRONMENT, "ENCRYPTION_KEY",
        DigestUtils.sha256("secret"));
    when(keyManager.deriveMasterKey()).thenReturn(masterKey);

    assertThat(macService.hmac("payload"))
        .hasSize(64)
        .isEqualTo(macService.hmac("payload", DigestUtils.sha256Hex("secret")));
  }

  @Test
  void hmac_deterministic() {
    assertThat(macService.hmac("payload", "key")).isEqualTo(macService.hmac("payload", "key"));
    assertThat(macService.hmac("payload", "key")).isNotEqualTo(macService.hmac("payload", "key2"));
  }

}
