package com.github.spud.primus.domain.capability;

import lombok.Builder;
import lombok.Value;

/**
 * Set of permissions attached to an actor. Grants are immutable; narrowing always produces a new
 * grant that is the intersection of both sides, so a grant can never be widened by combination.
 */
@Value
@Builder(toBuilder = true)
public class CapabilityGrant {

  @Builder.Default
  InternetAccess internetAccess = InternetAccess.OFF;

  boolean agentToAgent;

  boolean subchatCrossAccess;

  boolean personalityWrite;

  @Builder.Default
  RagWriteScope ragWriteScope = RagWriteScope.NONE;

  public static CapabilityGrant none() {
    return CapabilityGrant.builder().build();
  }

  /**
   * Field-wise intersection. A {@code null} argument narrows nothing.
   */
  public CapabilityGrant intersect(CapabilityGrant other) {
    if (other == null) {
      return this;
    }
    return CapabilityGrant.builder()
      .internetAccess(internetAccess.narrowest(other.internetAccess))
      .agentToAgent(agentToAgent && other.agentToAgent)
      .subchatCrossAccess(subchatCrossAccess && other.subchatCrossAccess)
      .personalityWrite(personalityWrite && other.personalityWrite)
      .ragWriteScope(ragWriteScope.narrowest(other.ragWriteScope))
      .build();
  }

  /**
   * Whether every capability of this grant is also held by {@code other}. The RAG write scope is
   * not compared: it is always bound to the holder's own partition.
   */
  public boolean isSubsetOf(CapabilityGrant other) {
    return other.internetAccess.permits(internetAccess)
      && (!agentToAgent || other.agentToAgent)
      && (!subchatCrossAccess || other.subchatCrossAccess)
      && (!personalityWrite || other.personalityWrite);
  }

  public CapabilityGrant offline() {
    return toBuilder().internetAccess(InternetAccess.OFF).build();
  }
}
