package com.github.spud.primus.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Captain's Log 沙箱配置
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "primus.sandbox")
public class SandboxProperties {

  /**
   * Base64 编码的 AES 密钥（16/24/32 字节）。为空时每次启动生成临时密钥
   */
  private String key;

  /**
   * 加密日志的持久化文件（JSONL），为空时只保存在内存中
   */
  private String journalFile;
}
