package com.github.spud.primus.domain.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues and redeems access tokens for one {@link MemoryPartitionStore}. The store hands out its
 * authority exactly once, to the guard that owns the authorization path.
 */
public final class TokenAuthority {

  private final Map<String, AccessToken> outstanding = new ConcurrentHashMap<>();

  private final Duration ttl;

  private final Clock clock;

  TokenAuthority(Duration ttl, Clock clock) {
    this.ttl = ttl;
    this.clock = clock;
  }

  public AccessToken issue(String actorId, PartitionId partition, String key,
    AccessOperation operation) {
    purgeExpired();
    AccessToken token = new AccessToken(UUID.randomUUID().toString(), actorId, partition, key,
      operation, clock.instant());
    outstanding.put(token.getTokenId(), token);
    return token;
  }

  /**
   * Number of tokens issued and not yet redeemed or expired.
   */
  public int outstandingCount() {
    purgeExpired();
    return outstanding.size();
  }

  /**
   * Atomically removes the token and validates it against the requested operation. A token is
   * burned even when validation fails.
   */
  AccessToken redeem(AccessToken presented, PartitionId partition, String key,
    AccessOperation operation) {
    if (presented == null) {
      throw new TokenInvalidException("Missing access token");
    }
    if (!outstanding.remove(presented.getTokenId(), presented)) {
      throw new TokenInvalidException("Token " + presented.getTokenId() + " is unknown or already used");
    }
    if (isExpired(presented, clock.instant())) {
      throw new TokenInvalidException("Token " + presented.getTokenId() + " has expired");
    }
    if (!presented.getPartition().equals(partition)) {
      throw new TokenInvalidException("Token is bound to partition " + presented.getPartition());
    }
    if (!presented.getKey().equals(key)) {
      throw new TokenInvalidException("Token is bound to key " + presented.getKey());
    }
    if (presented.getOperation() != operation) {
      throw new TokenInvalidException("Token is bound to operation " + presented.getOperation());
    }
    return presented;
  }

  private void purgeExpired() {
    Instant now = clock.instant();
    outstanding.values().removeIf(token -> isExpired(token, now));
  }

  private boolean isExpired(AccessToken token, Instant now) {
    return token.getIssuedAt().plus(ttl).isBefore(now);
  }
}
