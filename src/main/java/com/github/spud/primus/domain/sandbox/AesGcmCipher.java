package com.github.spud.primus.domain.sandbox;

import com.github.spud.primus.domain.memory.PartitionCipher;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * AES-GCM with a random 12-byte nonce. Output layout: {@code nonce || ciphertext+tag}.
 */
@Component
public class AesGcmCipher implements PartitionCipher {

  static final int NONCE_LENGTH = 12;

  private static final int TAG_BITS = 128;

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";

  private final SecretKey key;

  private final SecureRandom random = new SecureRandom();

  @Autowired
  public AesGcmCipher(SandboxKeyProvider keyProvider) {
    this(keyProvider.key());
  }

  public AesGcmCipher(SecretKey key) {
    this.key = key;
  }

  @Override
  public byte[] encrypt(byte[] plaintext) {
    byte[] nonce = newNonce();
    byte[] sealed = seal(nonce, plaintext);
    return ByteBuffer.allocate(nonce.length + sealed.length).put(nonce).put(sealed).array();
  }

  @Override
  public byte[] decrypt(byte[] ciphertext) {
    if (ciphertext == null || ciphertext.length <= NONCE_LENGTH) {
      throw new CipherException("Ciphertext is truncated", null);
    }
    ByteBuffer buffer = ByteBuffer.wrap(ciphertext);
    byte[] nonce = new byte[NONCE_LENGTH];
    buffer.get(nonce);
    byte[] sealed = new byte[buffer.remaining()];
    buffer.get(sealed);
    return open(nonce, sealed);
  }

  /**
   * Encrypts with a caller-supplied nonce, for formats that store the nonce separately.
   */
  public byte[] seal(byte[] nonce, byte[] plaintext) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
      return cipher.doFinal(plaintext);
    } catch (GeneralSecurityException e) {
      throw new CipherException("Encryption failed", e);
    }
  }

  public byte[] open(byte[] nonce, byte[] sealed) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
      return cipher.doFinal(sealed);
    } catch (GeneralSecurityException e) {
      throw new CipherException("Decryption failed", e);
    }
  }

  public byte[] newNonce() {
    byte[] nonce = new byte[NONCE_LENGTH];
    random.nextBytes(nonce);
    return nonce;
  }
}
