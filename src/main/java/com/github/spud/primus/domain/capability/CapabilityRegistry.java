package com.github.spud.primus.domain.capability;

import com.github.spud.primus.domain.actor.ActorKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Static capability templates, one per actor kind. The table is closed over {@link ActorKind} and
 * checked once at construction: agent and subchat templates must stay within Primus's template.
 */
@Component
public class CapabilityRegistry {

  private static final Map<ActorKind, CapabilityGrant> TEMPLATES;

  static {
    Map<ActorKind, CapabilityGrant> templates = new EnumMap<>(ActorKind.class);
    templates.put(ActorKind.PRIMUS, CapabilityGrant.builder()
      .internetAccess(InternetAccess.TEMPORARY_SESSION)
      .agentToAgent(true)
      .subchatCrossAccess(true)
      .personalityWrite(true)
      .ragWriteScope(RagWriteScope.OWN_PARTITION_ONLY)
      .build());
    templates.put(ActorKind.AGENT, CapabilityGrant.builder()
      .internetAccess(InternetAccess.PER_CALL)
      .agentToAgent(true)
      .subchatCrossAccess(false)
      .personalityWrite(false)
      .ragWriteScope(RagWriteScope.OWN_PARTITION_ONLY)
      .build());
    templates.put(ActorKind.SUBCHAT, CapabilityGrant.builder()
      .internetAccess(InternetAccess.OFF)
      .agentToAgent(false)
      .subchatCrossAccess(false)
      .personalityWrite(false)
      .ragWriteScope(RagWriteScope.OWN_PARTITION_ONLY)
      .build());
    // 沙箱离线，但可在用户确认后修改系统设置
    templates.put(ActorKind.SANDBOX, CapabilityGrant.builder()
      .internetAccess(InternetAccess.OFF)
      .agentToAgent(false)
      .subchatCrossAccess(false)
      .personalityWrite(true)
      .ragWriteScope(RagWriteScope.OWN_PARTITION_ONLY)
      .build());
    TEMPLATES = Collections.unmodifiableMap(templates);
  }

  public CapabilityRegistry() {
    CapabilityGrant primus = TEMPLATES.get(ActorKind.PRIMUS);
    for (ActorKind kind : ActorKind.values()) {
      if (!TEMPLATES.containsKey(kind)) {
        throw new IllegalStateException("No capability template for actor kind " + kind);
      }
    }
    for (ActorKind kind : new ActorKind[]{ActorKind.AGENT, ActorKind.SUBCHAT}) {
      if (!TEMPLATES.get(kind).isSubsetOf(primus)) {
        throw new IllegalStateException(kind + " template exceeds the PRIMUS template");
      }
    }
  }

  /**
   * Capability template for an actor kind.
   *
   * @throws IllegalArgumentException when {@code kind} is null
   */
  public CapabilityGrant capabilitiesFor(ActorKind kind) {
    if (kind == null) {
      throw new IllegalArgumentException("Actor kind must not be null");
    }
    CapabilityGrant template = TEMPLATES.get(kind);
    if (template == null) {
      throw new IllegalArgumentException("Unknown actor kind: " + kind);
    }
    return template;
  }
}
