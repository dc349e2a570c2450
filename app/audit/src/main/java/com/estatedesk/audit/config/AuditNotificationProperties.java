package com.estatedesk.audit.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "audit.notification")
public record AuditNotificationProperties(Duration defaultTtl, boolean notifyAdminActions) {

  public AuditNotificationProperties {
    defaultTtl = defaultTtl == null ? Duration.ofDays(30) : defaultTtl;
  }
}
