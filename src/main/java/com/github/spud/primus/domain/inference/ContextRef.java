package com.github.spud.primus.domain.inference;

import com.github.spud.primus.domain.memory.PartitionId;
import lombok.Value;

/**
 * Memory entry a chat turn asks to include as context.
 */
@Value(staticConstructor = "of")
public class ContextRef {

  PartitionId partition;

  String key;
}
