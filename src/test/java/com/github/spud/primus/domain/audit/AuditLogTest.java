package com.github.spud.primus.domain.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.primus.application.config.AuditProperties;
import com.github.spud.primus.domain.policy.Action;
import com.github.spud.primus.domain.policy.ActionKind;
import com.github.spud.primus.domain.policy.Decision;
import com.github.spud.primus.domain.policy.DecisionReason;
import com.github.spud.primus.domain.policy.DecisionType;
import com.github.spud.primus.domain.state.Mode;
import com.github.spud.primus.domain.state.ModeController;
import com.github.spud.primus.domain.state.ModeSnapshot;
import com.github.spud.primus.support.ModeMachines;
import com.github.spud.primus.util.JsonUtils;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuditLogTest {

  @TempDir
  Path tempDir;

  private ModeController modeController;

  private AuditProperties properties;

  @BeforeEach
  void setUp() {
    modeController = ModeMachines.controller();
    properties = new AuditProperties();
    properties.setMaxTail(3);
  }

  @Test
  void recordsAreSequencedAndTailIsCapped() {
    AuditLog log = new AuditLog(modeController, properties);
    for (int i = 0; i < 5; i++) {
      log.record("agent-" + i, ActionKind.MEMORY_READ, Decision.allow());
    }

    List<AuditRecord> tail = log.tail(10);

    assertThat(tail).hasSize(3);
    assertThat(tail).extracting(AuditRecord::getSequence).containsExactly(3L, 4L, 5L);
    assertThat(log.tail(1)).extracting(AuditRecord::getActorId).containsExactly("agent-4");
  }

  @Test
  void nothingIsRecordedWhileSuppressed() {
    AuditLog log = new AuditLog(modeController, properties);
    modeController.enterSandbox();

    assertThat(log.record("primus", ActionKind.CHAT_TURN, Decision.allow())).isEmpty();
    assertThat(log.size()).isZero();

    modeController.exitSandbox();
    assertThat(log.record("primus", ActionKind.CHAT_TURN, Decision.allow())).isPresent();
  }

  @Test
  void recordsAreMirroredAsJsonLines() throws Exception {
    Path file = tempDir.resolve("audit.jsonl");
    properties.setFile(file.toString());
    AuditLog log = new AuditLog(modeController, properties);

    log.record("agent-1", ActionKind.INTERNET_CALL,
      Decision.deny(DecisionReason.INTERNET_DISABLED, "offline"));
    log.record("primus", ActionKind.CHAT_TURN, Decision.allow());

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertThat(lines).hasSize(2);
    Map<String, Object> first = new JsonUtils().parseMap(lines.get(0));
    assertThat(first).containsEntry("actorId", "agent-1")
      .containsEntry("decision", "DENY")
      .containsEntry("reason", "INTERNET_DISABLED");
    assertThat((String) first.get("timestamp")).contains("T");
    assertThat(first).containsEntry("mode", "NORMAL");
    assertThat(JsonUtils.fromJson(lines.get(1), AuditRecord.class)).isEqualTo(log.tail(1).get(0));
  }

  @Test
  void recordsCarryTheModeOfTheDecision() {
    AuditLog log = new AuditLog(modeController, properties);
    log.record("primus", ActionKind.CHAT_TURN, Decision.allow());
    modeController.suspend(Action.builder()
        .actorId("primus")
        .kind(ActionKind.INTERNET_CALL)
        .build(), DecisionReason.CONFIRMATION_REQUIRED,
      modeController.withReadLock(ModeSnapshot::getEpoch));

    log.record("primus", ActionKind.CHAT_TURN, Decision.allow());

    assertThat(log.tail(2)).extracting(AuditRecord::getMode)
      .containsExactly(Mode.NORMAL, Mode.APPROVAL_PENDING);
  }

  @Test
  void recordsCannotBeRewrittenByReaders() {
    AuditLog log = new AuditLog(modeController, properties);
    log.record("agent-1", ActionKind.INTERNET_CALL,
      Decision.deny(DecisionReason.INTERNET_DISABLED, "offline"));

    List<AuditRecord> tail = log.tail(1);

    assertThat(AuditRecord.class.getMethods())
      .noneMatch(method -> method.getName().startsWith("set"));
    assertThatThrownBy(() -> tail.add(tail.get(0)))
      .isInstanceOf(UnsupportedOperationException.class);
    assertThat(log.tail(1).get(0).getDecision()).isEqualTo(DecisionType.DENY);
    assertThat(log.tail(1).get(0).getActorId()).isEqualTo("agent-1");
  }

  @Test
  void mirrorIsNotWrittenDuringSandbox() throws Exception {
    Path file = tempDir.resolve("audit.jsonl");
    properties.setFile(file.toString());
    AuditLog log = new AuditLog(modeController, properties);
    modeController.enterSandbox();

    log.record("sandbox", ActionKind.MEMORY_WRITE, Decision.allow());

    assertThat(Files.exists(file)).isFalse();
  }
}
