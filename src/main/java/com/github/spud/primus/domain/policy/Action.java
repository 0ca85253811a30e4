package com.github.spud.primus.domain.policy;

import com.github.spud.primus.domain.actor.PersonalityRef;
import com.github.spud.primus.domain.memory.PartitionId;
import java.util.Set;
import java.util.UUID;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.springframework.util.StringUtils;

/**
 * A single request from an actor. Every externally observable operation is expressed as an action
 * and passed through the interaction guard before it is executed.
 */
@Value
@Builder(toBuilder = true)
public class Action {

  public static final String DEFAULT_KEY = "default";

  public static final String SETTINGS_PREFIX = "settings/";

  @Builder.Default
  String requestId = UUID.randomUUID().toString();

  @NonNull
  String actorId;

  @NonNull
  ActionKind kind;

  PartitionId target;

  String key;

  byte[] payload;

  /**
   * Partner agent for collaboration actions, grantee for read grants.
   */
  String counterpartId;

  @Builder.Default
  Set<String> sharedKeys = Set.of();

  /**
   * Set only when an approved action is replayed by the guard.
   */
  boolean confirmed;

  /**
   * Entry key the action touches inside its target partition.
   */
  public String effectiveKey() {
    if (kind == ActionKind.PERSONALITY_WRITE) {
      return PersonalityRef.PERSONALITY_KEY;
    }
    String base = StringUtils.hasText(key) ? key : DEFAULT_KEY;
    if (kind == ActionKind.SETTING_WRITE && !base.startsWith(SETTINGS_PREFIX)) {
      return SETTINGS_PREFIX + base;
    }
    return base;
  }

  public Action confirmedReplay() {
    return toBuilder().confirmed(true).build();
  }

  public Action unconfirmed() {
    return confirmed ? toBuilder().confirmed(false).build() : this;
  }
}
