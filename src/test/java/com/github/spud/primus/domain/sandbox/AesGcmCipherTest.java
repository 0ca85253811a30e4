package com.github.spud.primus.domain.sandbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.primus.application.config.SandboxProperties;
import com.github.spud.primus.support.PolicyFixture;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class AesGcmCipherTest {

  private final AesGcmCipher cipher = new AesGcmCipher(new SecretKeySpec(PolicyFixture.KEY, "AES"));

  @Test
  void ciphertextCarriesTwelveByteNonce() {
    byte[] plain = "entry".getBytes(StandardCharsets.UTF_8);

    byte[] sealed = cipher.encrypt(plain);

    // nonce + plaintext + 16-byte tag
    assertThat(sealed).hasSize(AesGcmCipher.NONCE_LENGTH + plain.length + 16);
    assertThat(cipher.decrypt(sealed)).isEqualTo(plain);
  }

  @Test
  void sameTextEncryptsDifferently() {
    byte[] plain = "same".getBytes(StandardCharsets.UTF_8);

    assertThat(cipher.encrypt(plain)).isNotEqualTo(cipher.encrypt(plain));
  }

  @Test
  void tamperedCiphertextIsRejected() {
    byte[] sealed = cipher.encrypt("do not touch".getBytes(StandardCharsets.UTF_8));
    sealed[sealed.length - 1] ^= 0x01;

    assertThatThrownBy(() -> cipher.decrypt(sealed)).isInstanceOf(CipherException.class);
  }

  @Test
  void truncatedCiphertextIsRejected() {
    assertThatThrownBy(() -> cipher.decrypt(new byte[5])).isInstanceOf(CipherException.class);
  }

  @Test
  void otherKeyCannotDecrypt() {
    byte[] otherKey = PolicyFixture.KEY.clone();
    otherKey[0] ^= 0x7f;
    AesGcmCipher other = new AesGcmCipher(new SecretKeySpec(otherKey, "AES"));
    byte[] sealed = cipher.encrypt("private".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> other.decrypt(sealed)).isInstanceOf(CipherException.class);
  }

  @Test
  void configuredKeyIsUsed() {
    SandboxProperties properties = new SandboxProperties();
    properties.setKey(Base64.getEncoder().encodeToString(PolicyFixture.KEY));
    AesGcmCipher configured = new AesGcmCipher(new SandboxKeyProvider(properties));
    byte[] sealed = cipher.encrypt("shared".getBytes(StandardCharsets.UTF_8));

    assertThat(new String(configured.decrypt(sealed), StandardCharsets.UTF_8)).isEqualTo("shared");
  }

  @Test
  void keyOfWrongLengthIsRejected() {
    SandboxProperties properties = new SandboxProperties();
    properties.setKey(Base64.getEncoder().encodeToString(new byte[10]));

    assertThatThrownBy(() -> new SandboxKeyProvider(properties))
      .isInstanceOf(IllegalStateException.class);
  }
}
