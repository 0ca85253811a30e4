package com.github.spud.primus.domain.state;

import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import reactor.core.publisher.Mono;

/**
 * 状态机驱动器 - ModeController 与 StateMachine 的适配层
 */
@Slf4j
public class ModeStateMachineDriver {

  private final StateMachine<Mode, ModeEvent> stateMachine;

  public ModeStateMachineDriver(StateMachine<Mode, ModeEvent> stateMachine) {
    this.stateMachine = stateMachine;
    stateMachine.startReactively().block();
  }

  /**
   * 获取当前模式
   */
  public Mode currentMode() {
    return stateMachine.getState().getId();
  }

  /**
   * 发送事件并等待状态转换完成
   *
   * @return 事件被状态机接受时返回 true
   */
  public boolean sendEvent(ModeEvent event) {
    Mode before = currentMode();
    log.debug("Sending event {} to mode machine, current mode: {}", event, before);

    StateMachineEventResult<Mode, ModeEvent> result = stateMachine
      .sendEvent(Mono.just(MessageBuilder
        .withPayload(event)
        .build()))
      .blockFirst();

    boolean accepted = result != null
      && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;

    if (accepted) {
      log.debug("Event {} accepted, new mode: {}", event, currentMode());
    } else {
      log.warn("Event {} rejected in mode {}", event, before);
    }
    return accepted;
  }

  /**
   * 停止状态机
   */
  public void stop() {
    stateMachine.stopReactively().block();
  }
}
