package com.github.spud.primus.domain.actor;

import com.github.spud.primus.domain.memory.PartitionId;
import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Anything that can request actions. Immutable once registered.
 */
@Value
@Builder
public class Actor {

  @NonNull
  String id;

  @NonNull
  ActorKind kind;

  String name;

  /**
   * Creator of an agent or subchat; {@code null} for Primus and the sandbox.
   */
  String parentId;

  @NonNull
  PersonalityRef personality;

  @NonNull
  Instant createdAt;

  public PartitionId ownPartition() {
    return PartitionId.of(id, kind.ownPartitionClass());
  }

  public boolean is(ActorKind other) {
    return kind == other;
  }
}
