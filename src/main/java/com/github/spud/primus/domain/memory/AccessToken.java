package com.github.spud.primus.domain.memory;

import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Single-use capability for one store operation. Only a {@link TokenAuthority} creates tokens, and
 * the store accepts a token only while it is registered as outstanding.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class AccessToken {

  String tokenId;

  String actorId;

  PartitionId partition;

  String key;

  AccessOperation operation;

  Instant issuedAt;
}
