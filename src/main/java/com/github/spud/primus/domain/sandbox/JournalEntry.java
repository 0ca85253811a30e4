package com.github.spud.primus.domain.sandbox;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Journal entry as stored. Nonce and ciphertext are base64; the plaintext never leaves memory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalEntry {

  private String id;

  private Instant createdAt;

  private String nonce;

  private String ciphertext;
}
