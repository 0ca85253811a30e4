package com.github.spud.primus.domain.inference;

import com.github.spud.primus.domain.policy.Decision;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChatTurnResult {

  Decision decision;

  String completion;

  List<ContextRef> included;

  /**
   * Requested context the actor could not read. Only references, never content.
   */
  List<ContextRef> excluded;
}
