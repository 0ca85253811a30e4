package com.github.spud.primus.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Audit trail configuration
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "primus.audit")
public class AuditProperties {

  /**
   * Optional JSONL file mirroring every audit record. Empty disables the mirror.
   */
  private String file;

  /**
   * Upper bound for a single audit tail query
   */
  private int maxTail = 500;
}
