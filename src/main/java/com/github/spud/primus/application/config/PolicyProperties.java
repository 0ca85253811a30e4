package com.github.spud.primus.application.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 策略核心配置
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "primus.policy")
public class PolicyProperties {

  /**
   * 主助手的 actor id
   */
  private String primusId = "primus";

  /**
   * 沙箱 actor id
   */
  private String sandboxId = "sandbox";

  /**
   * 同时存在的 Agent 协作组上限
   */
  private int maxActiveCollaborations = 2;

  /**
   * 模式并发变化时，同一请求重新判定的最大次数
   */
  private int decisionRetryLimit = 3;

  /**
   * 访问令牌有效期
   */
  private Duration tokenTtl = Duration.ofSeconds(60);
}
