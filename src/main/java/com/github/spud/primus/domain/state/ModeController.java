package com.github.spud.primus.domain.state;

import com.github.spud.primus.domain.policy.Action;
import com.github.spud.primus.domain.policy.ActionKind;
import com.github.spud.primus.domain.policy.DecisionReason;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.statemachine.StateMachine;
import org.springframework.stereotype.Service;

/**
 * Owns the global mode and everything that changes with it: pending approvals, edits held during
 * sandbox mode and internet sessions confirmed by the user.
 * <p>
 * Evaluations run under the read lock and may overlap. Transitions take the write lock, so no
 * evaluation ever observes a half-applied mode change. Every change bumps the epoch.
 */
@Slf4j
@Service
public class ModeController {

  private static final int HISTORY_LIMIT = 100;

  private final ModeStateMachineDriver driver;

  private final Clock clock;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private final Map<String, PendingApproval> pending = new LinkedHashMap<>();

  private final List<PendingApproval> heldSandboxEdits = new ArrayList<>();

  private final Set<ApprovalKey> confirmedSessions = ConcurrentHashMap.newKeySet();

  private final Deque<ModeTransition> history = new ArrayDeque<>();

  private long epoch;

  @Autowired
  public ModeController(StateMachine<Mode, ModeEvent> modeStateMachine) {
    this(new ModeStateMachineDriver(modeStateMachine), Clock.systemUTC());
  }

  public ModeController(ModeStateMachineDriver driver, Clock clock) {
    this.driver = driver;
    this.clock = clock;
  }

  public Mode currentMode() {
    lock.readLock().lock();
    try {
      return driver.currentMode();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Runs {@code work} against a consistent view of the mode. No transition can start until
   * {@code work} returns.
   */
  public <T> T withReadLock(Function<ModeSnapshot, T> work) {
    lock.readLock().lock();
    try {
      return work.apply(snapshot());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Suspends an action that needs user confirmation.
   * <p>
   * In sandbox mode the action is held and turns into a pending approval at exit. Otherwise it
   * becomes pending right away and the mode moves to APPROVAL_PENDING.
   *
   * @param observedEpoch epoch of the snapshot the decision was made on
   * @return empty when the mode changed since that snapshot; the caller must re-evaluate
   */
  public Optional<PendingApproval> suspend(Action action, DecisionReason reason,
    long observedEpoch) {
    lock.writeLock().lock();
    try {
      if (epoch != observedEpoch) {
        return Optional.empty();
      }
      Mode mode = driver.currentMode();
      PendingApproval approval = PendingApproval.builder()
        .id(UUID.randomUUID().toString())
        .action(action)
        .reason(reason)
        .origin(mode == Mode.SANDBOX ? ApprovalOrigin.SANDBOX_EDIT : ApprovalOrigin.DIRECT)
        .createdAt(clock.instant())
        .build();
      if (mode == Mode.SANDBOX) {
        heldSandboxEdits.add(approval);
      } else {
        pending.put(approval.getId(), approval);
        if (mode == Mode.NORMAL) {
          fire(ModeEvent.REQUIRE_APPROVAL);
        }
        log.info("Action suspended for approval: approvalId={}, actorId={}, kind={}",
          approval.getId(), action.getActorId(), action.getKind());
      }
      epoch++;
      return Optional.of(approval);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Removes a pending approval. Returns to NORMAL once nothing is pending.
   *
   * @throws ApprovalNotFoundException when no approval with that id is pending
   */
  public PendingApproval resolve(String approvalId) {
    return resolve(approvalId, Function.identity());
  }

  /**
   * Removes a pending approval and runs {@code work} on it while still holding the write lock.
   * {@code work} may take the read lock again; no other transition can start before it returns,
   * so an approved replay is decided in the mode the approval was resolved into.
   *
   * @throws ApprovalNotFoundException when no approval with that id is pending
   */
  public <T> T resolve(String approvalId, Function<PendingApproval, T> work) {
    lock.writeLock().lock();
    try {
      PendingApproval approval = pending.remove(approvalId);
      if (approval == null) {
        throw new ApprovalNotFoundException(approvalId);
      }
      settlePending();
      epoch++;
      return work.apply(approval);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Drops pending approvals and held edits of an actor that is going away.
   *
   * @return number of discarded entries
   */
  public int cancelFor(String actorId) {
    lock.writeLock().lock();
    try {
      int discarded = 0;
      Iterator<PendingApproval> it = pending.values().iterator();
      while (it.hasNext()) {
        if (it.next().getActorId().equals(actorId)) {
          it.remove();
          discarded++;
        }
      }
      int held = heldSandboxEdits.size();
      heldSandboxEdits.removeIf(a -> a.getActorId().equals(actorId));
      discarded += held - heldSandboxEdits.size();
      confirmedSessions.removeIf(k -> k.getActorId().equals(actorId));
      if (discarded > 0) {
        settlePending();
        epoch++;
      }
      return discarded;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Enters sandbox mode. Refused while any approval is pending, so a pending decision never
   * straddles the sandbox boundary. Confirmed internet sessions end here.
   *
   * @throws TransitionRejectedException when the mode is not NORMAL
   */
  public void enterSandbox() {
    lock.writeLock().lock();
    try {
      Mode mode = driver.currentMode();
      if (mode != Mode.NORMAL || !pending.isEmpty()) {
        throw new TransitionRejectedException(mode, ModeEvent.ENTER_SANDBOX,
          "Cannot enter sandbox mode from " + mode
            + (pending.isEmpty() ? "" : " with " + pending.size() + " pending approval(s)"));
      }
      fire(ModeEvent.ENTER_SANDBOX);
      confirmedSessions.clear();
      epoch++;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Leaves sandbox mode. Edits held during the session become pending approvals, moving the mode
   * on to APPROVAL_PENDING.
   *
   * @return approvals created from held edits
   * @throws TransitionRejectedException when the mode is not SANDBOX
   */
  public List<PendingApproval> exitSandbox() {
    lock.writeLock().lock();
    try {
      Mode mode = driver.currentMode();
      if (mode != Mode.SANDBOX) {
        throw new TransitionRejectedException(mode, ModeEvent.EXIT_SANDBOX,
          "Cannot exit sandbox mode from " + mode);
      }
      fire(ModeEvent.EXIT_SANDBOX);
      List<PendingApproval> released = List.copyOf(heldSandboxEdits);
      heldSandboxEdits.clear();
      if (!released.isEmpty()) {
        released.forEach(a -> pending.put(a.getId(), a));
        fire(ModeEvent.REQUIRE_APPROVAL);
        log.info("Held sandbox edits submitted for approval: count={}", released.size());
      }
      epoch++;
      return released;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Records that the user confirmed a session-scoped capability. Called under the read lock.
   */
  public void confirmSession(String actorId, ActionKind kind) {
    confirmedSessions.add(ApprovalKey.of(actorId, kind));
  }

  public List<PendingApproval> pendingApprovals() {
    lock.readLock().lock();
    try {
      return List.copyOf(pending.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<PendingApproval> findPending(String approvalId) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(pending.get(approvalId));
    } finally {
      lock.readLock().unlock();
    }
  }

  public int heldEditCount() {
    lock.readLock().lock();
    try {
      return heldSandboxEdits.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<ModeTransition> history() {
    lock.readLock().lock();
    try {
      return List.copyOf(history);
    } finally {
      lock.readLock().unlock();
    }
  }

  private ModeSnapshot snapshot() {
    Set<ApprovalKey> pendingKeys = pending.values().stream()
      .map(PendingApproval::key)
      .collect(Collectors.toUnmodifiableSet());
    return new ModeSnapshot(driver.currentMode(), epoch, pendingKeys,
      Set.copyOf(confirmedSessions));
  }

  private void settlePending() {
    if (pending.isEmpty() && driver.currentMode() == Mode.APPROVAL_PENDING) {
      fire(ModeEvent.APPROVALS_RESOLVED);
    }
  }

  private void fire(ModeEvent event) {
    Mode from = driver.currentMode();
    if (!driver.sendEvent(event)) {
      throw new TransitionRejectedException(from, event,
        "Transition " + event + " is not allowed from " + from);
    }
    Mode to = driver.currentMode();
    history.addLast(new ModeTransition(from, to, event, clock.instant()));
    while (history.size() > HISTORY_LIMIT) {
      history.removeFirst();
    }
    // 沙箱内部不记录任何可识别信息，模式名本身不涉密
    log.info("Mode changed: {} -> {}", from, to);
  }
}
