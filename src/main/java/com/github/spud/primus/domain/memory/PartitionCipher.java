package com.github.spud.primus.domain.memory;

/**
 * Black-box cipher used for partition bytes at rest. Implementations must make the plaintext
 * unrecoverable without their key.
 */
public interface PartitionCipher {

  byte[] encrypt(byte[] plaintext);

  byte[] decrypt(byte[] ciphertext);
}
