package com.github.spud.primus.domain.sandbox;

import com.github.spud.primus.application.config.SandboxProperties;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the sandbox key. A configured key is used as-is; otherwise a random 256-bit key lives
 * only as long as the process, so nothing encrypted with it survives a restart.
 */
@Slf4j
@Component
public class SandboxKeyProvider {

  private final SecretKey key;

  public SandboxKeyProvider(SandboxProperties properties) {
    this.key = StringUtils.hasText(properties.getKey())
      ? decode(properties.getKey())
      : generate();
  }

  public SecretKey key() {
    return key;
  }

  private static SecretKey decode(String base64) {
    byte[] raw;
    try {
      raw = Base64.getDecoder().decode(base64.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("primus.sandbox.key is not valid base64", e);
    }
    if (raw.length != 16 && raw.length != 24 && raw.length != 32) {
      throw new IllegalStateException(
        "primus.sandbox.key must decode to 16, 24 or 32 bytes, got " + raw.length);
    }
    return new SecretKeySpec(raw, "AES");
  }

  private static SecretKey generate() {
    log.warn("No sandbox key configured, generating an ephemeral key for this process");
    try {
      KeyGenerator generator = KeyGenerator.getInstance("AES");
      generator.init(256);
      return generator.generateKey();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("AES is not available on this JVM", e);
    }
  }
}
