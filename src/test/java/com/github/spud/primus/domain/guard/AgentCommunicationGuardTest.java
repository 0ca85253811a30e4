package com.github.spud.primus.domain.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.primus.domain.memory.PartitionClass;
import com.github.spud.primus.domain.memory.PartitionId;
import com.github.spud.primus.domain.policy.Action;
import com.github.spud.primus.domain.policy.ActionKind;
import com.github.spud.primus.domain.policy.Decision;
import com.github.spud.primus.domain.policy.DecisionReason;
import java.time.Clock;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AgentCommunicationGuardTest {

  private AgentCommunicationGuard guard;

  @BeforeEach
  void setUp() {
    guard = new AgentCommunicationGuard(2, Clock.systemUTC());
    guard.authorizePair("a", "b");
    guard.authorizePair("a", "c");
    guard.authorizePair("b", "c");
  }

  @Test
  void authorizedPairOpensACollaboration() {
    Decision decision = guard.apply(join("a", "b"));

    assertThat(decision.isAllowed()).isTrue();
    assertThat(guard.activeGroups()).hasSize(1);
    assertThat(guard.activeGroups().get(0).getMembers()).containsExactlyInAnyOrder("a", "b");
  }

  @Test
  void thirdAgentCannotJoinAFullGroup() {
    guard.apply(join("a", "b"));

    Decision third = guard.apply(join("c", "a"));

    assertThat(third.isDenied()).isTrue();
    assertThat(third.getReason()).isEqualTo(DecisionReason.COLLABORATION_FULL);
    assertThat(guard.activeGroups().get(0).getMembers()).hasSize(2);
  }

  @Test
  void unauthorizedPairIsDenied() {
    Decision decision = guard.check(join("a", "z"));

    assertThat(decision.getReason()).isEqualTo(DecisionReason.PARTNER_NOT_AUTHORIZED);
  }

  @Test
  void activeCollaborationsAreCapped() {
    AgentCommunicationGuard single = new AgentCommunicationGuard(1, Clock.systemUTC());
    single.authorizePair("a", "b");
    single.authorizePair("c", "d");
    single.apply(join("a", "b"));

    assertThat(single.check(join("c", "d")).getReason())
      .isEqualTo(DecisionReason.COLLABORATION_LIMIT_REACHED);
  }

  @Test
  void messagesInsideTheGroupAreAllowed() {
    guard.apply(join("a", "b"));

    assertThat(guard.check(message("b", "a")).isAllowed()).isTrue();
  }

  @Test
  void sharedKeysAreVisibleOnlyToTheGroup() {
    guard.apply(join("a", "b"));
    PartitionId partitionOfA = PartitionId.of("a", PartitionClass.AGENT_PRIVATE);

    guard.apply(share("a", "b", Set.of("findings")));

    assertThat(guard.isShared(partitionOfA, "findings", "b")).isTrue();
    assertThat(guard.isShared(partitionOfA, "secrets", "b")).isFalse();
    assertThat(guard.isShared(partitionOfA, "findings", "c")).isFalse();
  }

  @Test
  void leavingDissolvesTheGroupAndItsShares() {
    guard.apply(join("a", "b"));
    guard.apply(share("a", "b", Set.of("findings")));

    guard.apply(Action.builder().actorId("b").kind(ActionKind.LEAVE_COLLABORATION).build());

    assertThat(guard.activeGroups()).isEmpty();
    assertThat(guard.isShared(PartitionId.of("a", PartitionClass.AGENT_PRIVATE), "findings", "b"))
      .isFalse();
  }

  @Test
  void revokingAPairDissolvesItsGroup() {
    guard.apply(join("a", "b"));

    assertThat(guard.revokePair("b", "a")).isTrue();

    assertThat(guard.activeGroups()).isEmpty();
    assertThat(guard.check(join("a", "b")).getReason())
      .isEqualTo(DecisionReason.PARTNER_NOT_AUTHORIZED);
  }

  @Test
  void dissolveForRemovesPairsAndGroups() {
    guard.apply(join("a", "b"));

    guard.dissolveFor("a");

    assertThat(guard.activeGroups()).isEmpty();
    assertThat(guard.isPairAuthorized("a", "c")).isFalse();
    assertThat(guard.isPairAuthorized("b", "c")).isTrue();
  }

  @Test
  void agentCannotPairWithItself() {
    assertThatThrownBy(() -> guard.authorizePair("a", "a"))
      .isInstanceOf(IllegalArgumentException.class);
  }

  private static Action join(String actor, String partner) {
    return Action.builder()
      .actorId(actor)
      .kind(ActionKind.JOIN_COLLABORATION)
      .counterpartId(partner)
      .build();
  }

  private static Action message(String actor, String partner) {
    return Action.builder()
      .actorId(actor)
      .kind(ActionKind.AGENT_MESSAGE)
      .counterpartId(partner)
      .build();
  }

  private static Action share(String actor, String partner, Set<String> keys) {
    return Action.builder()
      .actorId(actor)
      .kind(ActionKind.SHARE_MEMORY)
      .target(PartitionId.of(actor, PartitionClass.AGENT_PRIVATE))
      .counterpartId(partner)
      .sharedKeys(keys)
      .build();
  }
}
