package com.github.spud.primus.domain.memory;

import lombok.NonNull;
import lombok.Value;

/**
 * Identifies a memory partition by its owning actor and class.
 */
@Value(staticConstructor = "of")
public class PartitionId {

  @NonNull
  String ownerId;

  @NonNull
  PartitionClass partitionClass;

  public boolean isSandboxPrivate() {
    return partitionClass == PartitionClass.SANDBOX_PRIVATE;
  }

  @Override
  public String toString() {
    return ownerId + "/" + partitionClass.name().toLowerCase();
  }
}
