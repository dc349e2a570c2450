/*
 * Where: audit cleanup worker
 * What: triggers the retention sweep on a fixed delay
 */
package com.estatedesk.audit.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "audit.retention.enabled", havingValue = "true")
public class AuditRetentionWorker {

  private final AuditRetentionService retentionService;

  @Scheduled(
      fixedDelayString = "${audit.retention.cleanup-interval}",
      initialDelayString = "${audit.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
