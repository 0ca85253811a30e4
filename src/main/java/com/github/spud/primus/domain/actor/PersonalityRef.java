package com.github.spud.primus.domain.actor;

import com.github.spud.primus.domain.memory.PartitionId;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Points at the personality document of an actor. A read-only alias shares the document of
 * another actor and can never be rebound. The target of an existing reference never changes.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PersonalityRef {

  public static final String PERSONALITY_KEY = "personality";

  PartitionId partition;

  boolean readOnlyAlias;

  public static PersonalityRef owned(PartitionId partition) {
    return new PersonalityRef(partition, false);
  }

  public PersonalityRef readOnlyAlias() {
    return new PersonalityRef(partition, true);
  }

  public String getKey() {
    return PERSONALITY_KEY;
  }
}
