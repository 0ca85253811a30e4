package com.github.spud.primus.domain.state;

import java.util.EnumSet;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.statemachine.config.builders.StateMachineConfigurationConfigurer;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

/**
 * 模式状态机配置
 * <pre>
 * 状态流转:
 *   NORMAL --(REQUIRE_APPROVAL)--> APPROVAL_PENDING
 *   APPROVAL_PENDING --(APPROVALS_RESOLVED)--> NORMAL
 *   NORMAL --(ENTER_SANDBOX)--> SANDBOX
 *   SANDBOX --(EXIT_SANDBOX)--> NORMAL
 * </pre>
 * 其他组合一律拒绝，例如 APPROVAL_PENDING 下无法进入沙箱。
 */
@Configuration
@EnableStateMachineFactory
public class ModeStateMachineConfig extends EnumStateMachineConfigurerAdapter<Mode, ModeEvent> {

  public static final String MACHINE_ID = "primus-mode";

  @Override
  public void configure(StateMachineConfigurationConfigurer<Mode, ModeEvent> config)
    throws Exception {
    config
      .withConfiguration()
      .autoStartup(false);
  }

  @Override
  public void configure(StateMachineStateConfigurer<Mode, ModeEvent> states)
    throws Exception {
    states
      .withStates()
      .initial(Mode.NORMAL)
      .states(EnumSet.allOf(Mode.class));
  }

  @Override
  public void configure(StateMachineTransitionConfigurer<Mode, ModeEvent> transitions)
    throws Exception {
    transitions
      // NORMAL -> APPROVAL_PENDING
      .withExternal()
      .source(Mode.NORMAL).target(Mode.APPROVAL_PENDING)
      .event(ModeEvent.REQUIRE_APPROVAL)
      .and()

      // APPROVAL_PENDING -> NORMAL (全部处理完毕)
      .withExternal()
      .source(Mode.APPROVAL_PENDING).target(Mode.NORMAL)
      .event(ModeEvent.APPROVALS_RESOLVED)
      .and()

      // NORMAL -> SANDBOX
      .withExternal()
      .source(Mode.NORMAL).target(Mode.SANDBOX)
      .event(ModeEvent.ENTER_SANDBOX)
      .and()

      // SANDBOX -> NORMAL
      .withExternal()
      .source(Mode.SANDBOX).target(Mode.NORMAL)
      .event(ModeEvent.EXIT_SANDBOX);
  }

  /**
   * 进程内唯一的模式状态机
   */
  @Bean
  public StateMachine<Mode, ModeEvent> modeStateMachine(
    StateMachineFactory<Mode, ModeEvent> stateMachineFactory) {
    return stateMachineFactory.getStateMachine(MACHINE_ID);
  }
}
