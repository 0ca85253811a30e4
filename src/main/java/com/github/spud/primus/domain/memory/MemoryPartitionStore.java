package com.github.spud.primus.domain.memory;

import com.github.spud.primus.application.config.PolicyProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Key-scoped partition storage. Holds no policy: every operation redeems a single-use token issued
 * by the {@link TokenAuthority}, and trusts the token rather than the caller.
 * <p>
 * Writes to one partition are serialized; writes to different partitions run in parallel. Bytes of
 * sandbox-private partitions are kept encrypted with the sandbox cipher.
 */
@Component
public class MemoryPartitionStore {

  private final Map<PartitionId, Partition> partitions = new ConcurrentHashMap<>();

  private final PartitionCipher sandboxCipher;

  private final Duration tokenTtl;

  private final Clock clock;

  private volatile TokenAuthority authority;

  @Autowired
  public MemoryPartitionStore(PartitionCipher sandboxCipher, PolicyProperties properties) {
    this(sandboxCipher, properties.getTokenTtl(), Clock.systemUTC());
  }

  public MemoryPartitionStore(PartitionCipher sandboxCipher, Duration tokenTtl, Clock clock) {
    this.sandboxCipher = sandboxCipher;
    this.tokenTtl = tokenTtl;
    this.clock = clock;
  }

  /**
   * Hands out the token authority. Can be claimed once only.
   *
   * @throws IllegalStateException on a second claim
   */
  public synchronized TokenAuthority claimTokenAuthority() {
    if (authority != null) {
      throw new IllegalStateException("Token authority already claimed");
    }
    authority = new TokenAuthority(tokenTtl, clock);
    return authority;
  }

  public byte[] read(PartitionId partitionId, AccessToken token) {
    AccessToken redeemed = authority().redeem(token, partitionId, keyOf(token),
      AccessOperation.READ);
    Partition partition = partitions.get(partitionId);
    if (partition == null) {
      throw new PartitionNotFoundException("Partition " + partitionId + " does not exist");
    }
    byte[] stored = partition.entries.get(redeemed.getKey());
    if (stored == null) {
      throw new PartitionNotFoundException(
        "Partition " + partitionId + " has no entry '" + redeemed.getKey() + "'");
    }
    return partitionId.isSandboxPrivate() ? sandboxCipher.decrypt(stored) : stored.clone();
  }

  public void write(PartitionId partitionId, AccessToken token, byte[] bytes) {
    AccessToken redeemed = authority().redeem(token, partitionId, keyOf(token),
      AccessOperation.WRITE);
    Partition partition = partitions.computeIfAbsent(partitionId, id -> new Partition());
    partition.writeLock.lock();
    try {
      partition.entries.put(redeemed.getKey(), seal(partitionId, bytes));
    } finally {
      partition.writeLock.unlock();
    }
  }

  /**
   * Appends to an entry, creating it when absent. Used for conversation history, where concurrent
   * appends must not lose updates.
   */
  public void append(PartitionId partitionId, AccessToken token, byte[] bytes) {
    AccessToken redeemed = authority().redeem(token, partitionId, keyOf(token),
      AccessOperation.APPEND);
    Partition partition = partitions.computeIfAbsent(partitionId, id -> new Partition());
    partition.writeLock.lock();
    try {
      byte[] current = partition.entries.get(redeemed.getKey());
      byte[] plain = current == null ? new byte[0]
        : partitionId.isSandboxPrivate() ? sandboxCipher.decrypt(current) : current;
      byte[] merged = new byte[plain.length + bytes.length];
      System.arraycopy(plain, 0, merged, 0, plain.length);
      System.arraycopy(bytes, 0, merged, plain.length, bytes.length);
      partition.entries.put(redeemed.getKey(), seal(partitionId, merged));
    } finally {
      partition.writeLock.unlock();
    }
  }

  public boolean exists(PartitionId partitionId) {
    return partitions.containsKey(partitionId);
  }

  /**
   * Raw bytes as held at rest, for diagnostics. Sandbox-private entries stay encrypted.
   */
  byte[] rawEntry(PartitionId partitionId, String key) {
    Partition partition = partitions.get(partitionId);
    return partition == null ? null : partition.entries.get(key);
  }

  private byte[] seal(PartitionId partitionId, byte[] bytes) {
    return partitionId.isSandboxPrivate() ? sandboxCipher.encrypt(bytes) : bytes.clone();
  }

  private TokenAuthority authority() {
    TokenAuthority current = authority;
    if (current == null) {
      throw new TokenInvalidException("No token authority has been claimed for this store");
    }
    return current;
  }

  private static String keyOf(AccessToken token) {
    if (token == null) {
      throw new TokenInvalidException("Missing access token");
    }
    return token.getKey();
  }

  private static final class Partition {

    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

    private final ReentrantLock writeLock = new ReentrantLock();
  }
}
