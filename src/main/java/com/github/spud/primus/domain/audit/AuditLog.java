package com.github.spud.primus.domain.audit;

import com.github.spud.primus.application.config.AuditProperties;
import com.github.spud.primus.domain.policy.ActionKind;
import com.github.spud.primus.domain.policy.Decision;
import com.github.spud.primus.domain.state.Mode;
import com.github.spud.primus.domain.state.ModeController;
import com.github.spud.primus.util.JsonUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Append-only trail of enforcement decisions. Nothing is recorded while the audit is suppressed,
 * which is exactly while the mode is SANDBOX.
 * <p>
 * Records are optionally mirrored to a JSONL file, one record per line.
 */
@Slf4j
@Component
public class AuditLog {

  private final List<AuditRecord> records = new ArrayList<>();

  private final ModeController modeController;

  private final Path mirror;

  private final int maxTail;

  private final Clock clock;

  private long sequence;

  @Autowired
  public AuditLog(ModeController modeController, AuditProperties properties) {
    this(modeController, properties, Clock.systemUTC());
  }

  public AuditLog(ModeController modeController, AuditProperties properties, Clock clock) {
    this.modeController = modeController;
    this.mirror = StringUtils.hasText(properties.getFile()) ? Path.of(properties.getFile()) : null;
    this.maxTail = properties.getMaxTail();
    this.clock = clock;
  }

  /**
   * Appends a record against a mode the caller already holds the read lock for. Nothing is
   * recorded for decisions made in SANDBOX mode.
   *
   * @param mode mode the decision was made in
   * @return the record, or empty when the audit is suppressed
   */
  public Optional<AuditRecord> append(String actorId, ActionKind kind, Decision decision,
    Mode mode) {
    if (mode == Mode.SANDBOX) {
      return Optional.empty();
    }
    AuditRecord record;
    synchronized (records) {
      record = AuditRecord.builder()
        .sequence(++sequence)
        .timestamp(clock.instant())
        .actorId(actorId)
        .kind(kind)
        .decision(decision.getType())
        .reason(decision.getReason())
        .detail(decision.getDetail())
        .approvalId(decision.getApprovalId())
        .mode(mode)
        .build();
      records.add(record);
      writeMirror(record);
    }
    return Optional.of(record);
  }

  /**
   * Appends a record, taking the mode from a snapshot read under the mode read lock.
   */
  public Optional<AuditRecord> record(String actorId, ActionKind kind, Decision decision) {
    return modeController.withReadLock(
      snapshot -> append(actorId, kind, decision, snapshot.getMode()));
  }

  /**
   * Most recent records, oldest first. {@code n} is capped by the configured maximum.
   */
  public List<AuditRecord> tail(int n) {
    int limit = Math.max(0, Math.min(n, maxTail));
    synchronized (records) {
      return List.copyOf(records.subList(Math.max(0, records.size() - limit), records.size()));
    }
  }

  public int size() {
    synchronized (records) {
      return records.size();
    }
  }

  private void writeMirror(AuditRecord record) {
    if (mirror == null) {
      return;
    }
    try {
      Files.writeString(mirror, JsonUtils.toJson(record) + System.lineSeparator(),
        StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    } catch (IOException e) {
      log.error("Failed to mirror audit record {} to {}", record.getSequence(), mirror, e);
    }
  }
}
