/*
 * Where: audit application configuration binding
 * What: retention window for audit records/backups and the cleanup schedule
 * Why: the undo window is policy, not a per-record constant
 */
package com.estatedesk.audit.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "audit.retention")
public record AuditRetentionProperties(
    boolean enabled,
    Duration window,
    Duration cleanupInterval,
    boolean purgeRecords,
    Duration staleExecutingAfter) {

  public AuditRetentionProperties {
    window = window == null ? Duration.ofDays(7) : window;
    cleanupInterval = cleanupInterval == null ? Duration.ofHours(1) : cleanupInterval;
    staleExecutingAfter =
        staleExecutingAfter == null ? Duration.ofMinutes(15) : staleExecutingAfter;
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("audit.retention.window must be positive");
    }
  }
}
