package com.github.spud.primus.interfaces.rest;

import com.github.spud.primus.domain.memory.PartitionClass;
import com.github.spud.primus.domain.memory.PartitionId;
import com.github.spud.primus.domain.policy.Action;
import com.github.spud.primus.domain.policy.ActionKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import lombok.Data;

/**
 * Action as submitted by a front end. There is no confirmation flag: confirmation happens only
 * through the approval endpoints.
 */
@Data
public class ActionRequestDto {

  @NotBlank
  private String actorId;

  @NotNull
  private ActionKind kind;

  private String targetOwner;

  private PartitionClass targetClass;

  private String key;

  private String payload;

  private String counterpartId;

  private Set<String> sharedKeys;

  Action toAction() {
    Action.ActionBuilder builder = Action.builder()
      .actorId(actorId)
      .kind(kind)
      .key(key)
      .counterpartId(counterpartId);
    if (targetOwner != null && targetClass != null) {
      builder.target(PartitionId.of(targetOwner, targetClass));
    }
    if (payload != null) {
      builder.payload(payload.getBytes(StandardCharsets.UTF_8));
    }
    if (sharedKeys != null) {
      builder.sharedKeys(Set.copyOf(sharedKeys));
    }
    return builder.build();
  }
}
