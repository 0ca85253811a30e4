package com.github.spud.primus.interfaces.rest;

import com.github.spud.primus.application.config.AuditProperties;
import com.github.spud.primus.domain.audit.AuditLog;
import com.github.spud.primus.domain.audit.AuditRecord;
import com.github.spud.primus.domain.guard.InteractionGuard;
import com.github.spud.primus.domain.state.Mode;
import com.github.spud.primus.domain.state.ModeController;
import com.github.spud.primus.domain.state.ModeTransition;
import com.github.spud.primus.domain.state.PendingApproval;
import jakarta.validation.Valid;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 策略核心 Api：动作判定、模式切换、待确认队列与审计
 */
@Slf4j
@RestController
@RequestMapping("/policy")
@RequiredArgsConstructor
public class PolicyController {

  private final InteractionGuard guard;

  private final ModeController modeController;

  private final AuditLog auditLog;

  private final AuditProperties auditProperties;

  /**
   * 判定并执行一个动作
   */
  @PostMapping("/actions")
  public Mono<ResponseEntity<ActionResponse>> execute(
    @Valid @RequestBody ActionRequestDto request
  ) {
    return Mono.fromCallable(() -> ResponseEntity.ok(
        ActionResponse.of(guard.execute(request.toAction()))))
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 只判定，不执行
   */
  @PostMapping("/actions/authorize")
  public Mono<ResponseEntity<ActionResponse>> authorize(
    @Valid @RequestBody ActionRequestDto request
  ) {
    return Mono.fromCallable(() -> ResponseEntity.ok(
        ActionResponse.of(guard.authorize(request.toAction()))))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/mode")
  public Mono<ResponseEntity<ModeStatus>> mode() {
    return Mono.fromCallable(() -> ResponseEntity.ok(currentStatus()));
  }

  @PostMapping("/mode/sandbox/enter")
  public Mono<ResponseEntity<ModeStatus>> enterSandbox() {
    return Mono.fromCallable(() -> {
        guard.enterSandbox();
        return ResponseEntity.ok(currentStatus());
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 退出沙箱，沙箱内的修改转为待确认请求
   */
  @PostMapping("/mode/sandbox/exit")
  public Mono<ResponseEntity<List<PendingApproval>>> exitSandbox() {
    return Mono.fromCallable(() -> ResponseEntity.ok(guard.exitSandbox()))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/approvals")
  public Mono<ResponseEntity<List<PendingApproval>>> approvals() {
    return Mono.fromCallable(() -> ResponseEntity.ok(modeController.pendingApprovals()));
  }

  @PostMapping("/approvals/{approvalId}/approve")
  public Mono<ResponseEntity<ActionResponse>> approve(@PathVariable String approvalId) {
    return resolve(approvalId, true);
  }

  @PostMapping("/approvals/{approvalId}/reject")
  public Mono<ResponseEntity<ActionResponse>> reject(@PathVariable String approvalId) {
    return resolve(approvalId, false);
  }

  @GetMapping("/audit")
  public Mono<ResponseEntity<List<AuditRecord>>> audit(
    @RequestParam(name = "n", required = false) Integer n
  ) {
    int limit = n != null ? n : auditProperties.getMaxTail();
    return Mono.fromCallable(() -> ResponseEntity.ok(auditLog.tail(limit)));
  }

  private Mono<ResponseEntity<ActionResponse>> resolve(String approvalId, boolean approve) {
    return Mono.fromCallable(() -> {
        log.info("Resolving approval: approvalId={}, approve={}", approvalId, approve);
        return ResponseEntity.ok(ActionResponse.of(guard.resolveApproval(approvalId, approve)));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  private ModeStatus currentStatus() {
    return new ModeStatus(modeController.currentMode(),
      modeController.pendingApprovals().size(),
      modeController.heldEditCount(),
      modeController.history());
  }

  // ===== DTOs =====

  @Data
  @AllArgsConstructor
  public static class ModeStatus {

    private Mode mode;
    private int pendingApprovals;
    private int heldSandboxEdits;
    private List<ModeTransition> history;
  }
}
