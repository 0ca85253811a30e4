package com.github.spud.primus.domain.capability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.primus.domain.actor.ActorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class CapabilityRegistryTest {

  private final CapabilityRegistry registry = new CapabilityRegistry();

  @ParameterizedTest
  @EnumSource(ActorKind.class)
  void everyActorKindHasATemplate(ActorKind kind) {
    assertThat(registry.capabilitiesFor(kind)).isNotNull();
  }

  @Test
  void agentAndSubChatStayWithinPrimus() {
    CapabilityGrant primus = registry.capabilitiesFor(ActorKind.PRIMUS);
    assertThat(registry.capabilitiesFor(ActorKind.AGENT).isSubsetOf(primus)).isTrue();
    assertThat(registry.capabilitiesFor(ActorKind.SUBCHAT).isSubsetOf(primus)).isTrue();
  }

  @Test
  void nullKindIsRejected() {
    assertThatThrownBy(() -> registry.capabilitiesFor(null))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void subChatNeverGainsPersonalityWriteThroughNarrowing() {
    CapabilityGrant everything = CapabilityGrant.builder()
      .internetAccess(InternetAccess.TEMPORARY_SESSION)
      .agentToAgent(true)
      .subchatCrossAccess(true)
      .personalityWrite(true)
      .ragWriteScope(RagWriteScope.OWN_PARTITION_ONLY)
      .build();

    CapabilityGrant subChat = registry.capabilitiesFor(ActorKind.SUBCHAT);
    assertThat(subChat.intersect(everything).isPersonalityWrite()).isFalse();
    assertThat(everything.intersect(subChat).isPersonalityWrite()).isFalse();
    assertThat(subChat.intersect(CapabilityGrant.none()).isPersonalityWrite()).isFalse();
  }

  @Test
  void intersectionIsFieldWiseNarrowest() {
    CapabilityGrant agent = registry.capabilitiesFor(ActorKind.AGENT);
    CapabilityGrant narrowed = agent.intersect(CapabilityGrant.builder()
      .internetAccess(InternetAccess.TEMPORARY_SESSION)
      .agentToAgent(false)
      .ragWriteScope(RagWriteScope.OWN_PARTITION_ONLY)
      .build());

    assertThat(narrowed.getInternetAccess()).isEqualTo(InternetAccess.PER_CALL);
    assertThat(narrowed.isAgentToAgent()).isFalse();
    assertThat(narrowed.getRagWriteScope()).isEqualTo(RagWriteScope.OWN_PARTITION_ONLY);
    assertThat(narrowed.isSubsetOf(agent)).isTrue();
  }

  @Test
  void offlineOnlyRemovesInternet() {
    CapabilityGrant primus = registry.capabilitiesFor(ActorKind.PRIMUS);
    CapabilityGrant offline = primus.offline();

    assertThat(offline.getInternetAccess()).isEqualTo(InternetAccess.OFF);
    assertThat(offline.isPersonalityWrite()).isTrue();
    assertThat(offline.isAgentToAgent()).isTrue();
  }
}
