package com.github.spud.primus.domain.policy;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.primus.domain.actor.Actor;
import com.github.spud.primus.domain.capability.CapabilityGrant;
import com.github.spud.primus.domain.capability.InternetAccess;
import com.github.spud.primus.domain.capability.RagWriteScope;
import com.github.spud.primus.domain.memory.PartitionClass;
import com.github.spud.primus.domain.memory.PartitionId;
import com.github.spud.primus.domain.state.Mode;
import com.github.spud.primus.support.PolicyFixture;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PermissionEnforcerTest {

  private PolicyFixture fixture;

  private Actor primus;

  private Actor agent;

  private Actor partner;

  @BeforeEach
  void setUp() {
    fixture = new PolicyFixture();
    primus = fixture.primus();
    agent = fixture.directory.createAgent("researcher");
    partner = fixture.directory.createAgent("writer");
  }

  @Test
  void unknownActorIsDenied() {
    Decision decision = evaluate(null, Action.builder()
      .actorId("ghost")
      .kind(ActionKind.CHAT_TURN)
      .build());

    assertThat(decision.getType()).isEqualTo(DecisionType.DENY);
    assertThat(decision.getReason()).isEqualTo(DecisionReason.UNKNOWN_ACTOR);
  }

  @Test
  void partitionActionWithoutTargetIsInvalid() {
    Decision decision = evaluate(agent, Action.builder()
      .actorId(agent.getId())
      .kind(ActionKind.MEMORY_READ)
      .build());

    assertThat(decision.getReason()).isEqualTo(DecisionReason.INVALID_ACTION);
  }

  @Test
  void sandboxPartitionIsSealedEvenForPrimus() {
    PartitionId sandboxPrivate = fixture.sandbox().ownPartition();

    Decision decision = evaluate(primus, read(primus, sandboxPrivate, "draft"));

    assertThat(decision.isDenied()).isTrue();
    assertThat(decision.getReason()).isEqualTo(DecisionReason.SANDBOX_PARTITION_SEALED);
  }

  @Test
  void sandboxActorIsInactiveOutsideSandbox() {
    Actor sandbox = fixture.sandbox();

    Decision decision = evaluate(sandbox, read(sandbox, sandbox.ownPartition(), "draft"));

    assertThat(decision.getReason()).isEqualTo(DecisionReason.SANDBOX_INACTIVE);
  }

  @Test
  void sandboxActorReadsItsPartitionInsideSandbox() {
    fixture.modeController.enterSandbox();
    Actor sandbox = fixture.sandbox();

    Decision decision = evaluate(sandbox, read(sandbox, sandbox.ownPartition(), "draft"));

    assertThat(decision.isAllowed()).isTrue();
  }

  @Test
  void globalPartitionIsReadableByAgents() {
    assertThat(evaluate(agent, read(agent, primus.ownPartition(), "facts")).isAllowed()).isTrue();
  }

  @Test
  void otherAgentsPrivatePartitionIsNotShared() {
    Decision decision = evaluate(agent, read(agent, partner.ownPartition(), "notes"));

    assertThat(decision.getReason()).isEqualTo(DecisionReason.PRIVATE_PARTITION_NOT_SHARED);
  }

  @Test
  void primusNeedsAGrantToReadAgentMemory() {
    Action action = read(primus, agent.ownPartition(), "notes");
    assertThat(evaluate(primus, action).getReason())
      .isEqualTo(DecisionReason.CROSS_READ_NOT_GRANTED);

    fixture.readGrants.grant(agent.ownPartition(), primus.getId());

    assertThat(evaluate(primus, action).isAllowed()).isTrue();
  }

  @Test
  void subChatReadsParentPersonalityThroughAlias() {
    Actor subChat = fixture.directory.createSubChat(agent.getId(), "side");

    Decision personality = evaluate(subChat, read(subChat, agent.ownPartition(), "personality"));
    Decision notes = evaluate(subChat, read(subChat, agent.ownPartition(), "notes"));

    assertThat(personality.isAllowed()).isTrue();
    assertThat(notes.isDenied()).isTrue();
  }

  @Test
  void crossSubChatReadNeedsCapabilityAndGrant() {
    Actor subChat = fixture.directory.createSubChat(primus.getId(), "thread");
    Action byAgent = read(agent, subChat.ownPartition(), "history");
    Action byPrimus = read(primus, subChat.ownPartition(), "history");

    assertThat(evaluate(agent, byAgent).getReason()).isEqualTo(DecisionReason.CAPABILITY_MISSING);
    assertThat(evaluate(primus, byPrimus).getReason())
      .isEqualTo(DecisionReason.CROSS_READ_NOT_GRANTED);

    fixture.readGrants.grant(subChat.ownPartition(), primus.getId());
    assertThat(evaluate(primus, byPrimus).isAllowed()).isTrue();
  }

  @Test
  void writesStayInOwnPartition() {
    Action foreign = write(agent, partner.ownPartition(), "notes");
    Action own = write(agent, agent.ownPartition(), "notes");

    assertThat(evaluate(agent, foreign).getReason()).isEqualTo(DecisionReason.NOT_PARTITION_OWNER);
    assertThat(evaluate(agent, own).isAllowed()).isTrue();
  }

  @Test
  void personalityKeyCannotBeWrittenAsMemory() {
    Decision decision = evaluate(agent, write(agent, agent.ownPartition(), "personality"));

    assertThat(decision.getReason()).isEqualTo(DecisionReason.PERSONALITY_WRITE_FORBIDDEN);
  }

  @Test
  void narrowedRagScopeForbidsWrites() {
    fixture.directory.narrow(agent.getId(), CapabilityGrant.builder()
      .internetAccess(InternetAccess.PER_CALL)
      .agentToAgent(true)
      .ragWriteScope(RagWriteScope.NONE)
      .build());

    Decision decision = evaluate(agent, write(agent, agent.ownPartition(), "notes"));

    assertThat(decision.getReason()).isEqualTo(DecisionReason.RAG_WRITE_FORBIDDEN);
  }

  @Test
  void agentCannotWriteAnyPersonality() {
    Decision decision = evaluate(agent, personalityWrite(agent, agent.ownPartition()));

    assertThat(decision.getReason()).isEqualTo(DecisionReason.PERSONALITY_WRITE_FORBIDDEN);
  }

  @Test
  void subChatCannotWritePersonality() {
    Actor subChat = fixture.directory.createSubChat(primus.getId(), "thread");

    Decision decision = evaluate(subChat, personalityWrite(subChat, primus.ownPartition()));

    assertThat(decision.getReason()).isEqualTo(DecisionReason.PERSONALITY_WRITE_FORBIDDEN);
  }

  @Test
  void unconfirmedPrimusPersonalityWriteNeedsApproval() {
    Decision decision = evaluate(primus, personalityWrite(primus, primus.ownPartition()));

    assertThat(decision.getType()).isEqualTo(DecisionType.REQUIRE_APPROVAL);
    assertThat(decision.getReason()).isEqualTo(DecisionReason.CONFIRMATION_REQUIRED);
  }

  @Test
  void confirmedPrimusPersonalityWriteIsAllowed() {
    Decision decision = evaluate(primus,
      personalityWrite(primus, primus.ownPartition()).confirmedReplay());

    assertThat(decision.isAllowed()).isTrue();
  }

  @Test
  void primusMayEditAnAgentPersonality() {
    Decision decision = evaluate(primus, personalityWrite(primus, agent.ownPartition()));

    assertThat(decision.requiresApproval()).isTrue();
  }

  @Test
  void sandboxEditIsHeldInsideSandbox() {
    fixture.modeController.enterSandbox();
    Actor sandbox = fixture.sandbox();

    Decision decision = evaluate(sandbox, personalityWrite(sandbox, primus.ownPartition()));

    assertThat(decision.getType()).isEqualTo(DecisionType.REQUIRE_APPROVAL);
    assertThat(decision.getReason()).isEqualTo(DecisionReason.HELD_UNTIL_SANDBOX_EXIT);
  }

  @Test
  void confirmedSandboxEditIsAllowedAfterExit() {
    Actor sandbox = fixture.sandbox();

    Decision decision = evaluate(sandbox,
      personalityWrite(sandbox, primus.ownPartition()).confirmedReplay());

    assertThat(decision.isAllowed()).isTrue();
  }

  @Test
  void internetIsOffInSandbox() {
    fixture.modeController.enterSandbox();

    Decision decision = evaluate(primus, internet(primus));

    assertThat(decision.getReason()).isEqualTo(DecisionReason.SANDBOX_OFFLINE);
  }

  @Test
  void subChatHasNoInternet() {
    Actor subChat = fixture.directory.createSubChat(primus.getId(), "thread");

    assertThat(evaluate(subChat, internet(subChat)).getReason())
      .isEqualTo(DecisionReason.INTERNET_DISABLED);
  }

  @Test
  void agentInternetNeedsConfirmationPerCall() {
    assertThat(evaluate(agent, internet(agent)).requiresApproval()).isTrue();
    assertThat(evaluate(agent, internet(agent).confirmedReplay()).isAllowed()).isTrue();
  }

  @Test
  void confirmedSessionCoversLaterPrimusCalls() {
    fixture.modeController.confirmSession(primus.getId(), ActionKind.INTERNET_CALL);

    assertThat(evaluate(primus, internet(primus)).isAllowed()).isTrue();
  }

  @Test
  void narrowingPrimusAlsoNarrowsItsAgentsAndSubChats() {
    Actor subChat = fixture.directory.createSubChat(agent.getId(), "side");
    fixture.communicationGuard.authorizePair(agent.getId(), partner.getId());

    fixture.directory.narrow(primus.getId(), CapabilityGrant.none());

    CapabilityGrant primusGrant = fixture.enforcer.effectiveGrant(primus, Mode.NORMAL);
    CapabilityGrant agentGrant = fixture.enforcer.effectiveGrant(agent, Mode.NORMAL);
    CapabilityGrant subChatGrant = fixture.enforcer.effectiveGrant(subChat, Mode.NORMAL);
    assertThat(agentGrant.isSubsetOf(primusGrant)).isTrue();
    assertThat(subChatGrant.isSubsetOf(primusGrant)).isTrue();
    assertThat(agentGrant.getInternetAccess()).isEqualTo(InternetAccess.OFF);
    assertThat(agentGrant.isAgentToAgent()).isFalse();
    assertThat(agentGrant.getRagWriteScope()).isEqualTo(RagWriteScope.OWN_PARTITION_ONLY);

    assertThat(evaluate(agent, internet(agent)).getReason())
      .isEqualTo(DecisionReason.INTERNET_DISABLED);
    assertThat(evaluate(agent, join(agent, partner)).getReason())
      .isEqualTo(DecisionReason.AGENT_COMMUNICATION_DISABLED);
    assertThat(evaluate(agent, write(agent, agent.ownPartition(), "notes")).isAllowed()).isTrue();
  }

  @Test
  void agentCommunicationNeedsAuthorizedPair() {
    Decision decision = evaluate(agent, join(agent, partner));

    assertThat(decision.getReason()).isEqualTo(DecisionReason.PARTNER_NOT_AUTHORIZED);
  }

  @Test
  void agentCommunicationIsDeniedInSandbox() {
    fixture.communicationGuard.authorizePair(agent.getId(), partner.getId());
    fixture.modeController.enterSandbox();

    assertThat(evaluate(agent, join(agent, partner)).getReason())
      .isEqualTo(DecisionReason.SANDBOX_OFFLINE);
  }

  @Test
  void primusCannotJoinAgentCollaboration() {
    assertThat(evaluate(primus, join(primus, agent)).getReason())
      .isEqualTo(DecisionReason.AGENT_COMMUNICATION_DISABLED);
  }

  @Test
  void sharedKeysRequireOpenCollaboration() {
    Action share = Action.builder()
      .actorId(agent.getId())
      .kind(ActionKind.SHARE_MEMORY)
      .target(agent.ownPartition())
      .counterpartId(partner.getId())
      .sharedKeys(Set.of("notes"))
      .build();

    assertThat(evaluate(agent, share).getReason()).isEqualTo(DecisionReason.NOT_IN_COLLABORATION);
  }

  @Test
  void agentPrivatePartitionCanOnlyBeGrantedToPrimus() {
    Action toPartner = grant(agent, agent.ownPartition(), partner.getId());
    Action toPrimus = grant(agent, agent.ownPartition(), primus.getId());

    assertThat(evaluate(agent, toPartner).getReason())
      .isEqualTo(DecisionReason.PRIVATE_PARTITION_NOT_SHARED);
    assertThat(evaluate(agent, toPrimus).isAllowed()).isTrue();
  }

  @Test
  void onlyOwnerGrantsReads() {
    Decision decision = evaluate(primus, grant(primus, agent.ownPartition(), primus.getId()));

    assertThat(decision.getReason()).isEqualTo(DecisionReason.NOT_PARTITION_OWNER);
  }

  @Test
  void pendingApprovalBlocksSameKind() {
    Action first = personalityWrite(primus, primus.ownPartition());
    long epoch = fixture.modeController.withReadLock(s -> s.getEpoch());
    fixture.modeController.suspend(first, DecisionReason.CONFIRMATION_REQUIRED, epoch);

    Decision second = evaluate(primus, personalityWrite(primus, primus.ownPartition()));
    Decision other = evaluate(primus, internet(primus));

    assertThat(second.getReason()).isEqualTo(DecisionReason.APPROVAL_PENDING);
    assertThat(other.requiresApproval()).isTrue();
  }

  private Decision evaluate(Actor actor, Action action) {
    return fixture.modeController.withReadLock(
      snapshot -> fixture.enforcer.evaluate(actor, action, snapshot));
  }

  private static Action read(Actor actor, PartitionId target, String key) {
    return Action.builder()
      .actorId(actor.getId())
      .kind(ActionKind.MEMORY_READ)
      .target(target)
      .key(key)
      .build();
  }

  private static Action write(Actor actor, PartitionId target, String key) {
    return Action.builder()
      .actorId(actor.getId())
      .kind(ActionKind.MEMORY_WRITE)
      .target(target)
      .key(key)
      .payload(new byte[]{1})
      .build();
  }

  private static Action personalityWrite(Actor actor, PartitionId target) {
    return Action.builder()
      .actorId(actor.getId())
      .kind(ActionKind.PERSONALITY_WRITE)
      .target(target)
      .payload(new byte[]{1})
      .build();
  }

  private static Action internet(Actor actor) {
    return Action.builder()
      .actorId(actor.getId())
      .kind(ActionKind.INTERNET_CALL)
      .build();
  }

  private static Action join(Actor actor, Actor partner) {
    return Action.builder()
      .actorId(actor.getId())
      .kind(ActionKind.JOIN_COLLABORATION)
      .counterpartId(partner.getId())
      .build();
  }

  private static Action grant(Actor owner, PartitionId target, String granteeId) {
    return Action.builder()
      .actorId(owner.getId())
      .kind(ActionKind.GRANT_READ)
      .target(target)
      .counterpartId(granteeId)
      .build();
  }
}
