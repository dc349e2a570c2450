/*
 * Where: audit service layer
 * What: Micrometer meters for record writes, backup failures and undo outcomes
 * Why: degraded recordings and failed undos must be visible without reading logs
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.UndoStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class AuditMetrics {

  static final String METRIC_RECORD_TOTAL = "audit.record.total";
  static final String METRIC_BACKUP_FAILURE_TOTAL = "audit.backup.failure.total";
  static final String METRIC_UNDO_TOTAL = "audit.undo.total";
  static final String METRIC_UNDO_DURATION = "audit.undo.duration";
  static final String METRIC_UNDO_EXECUTING_STALE = "audit.undo.executing.stale";

  public static final String RESULT_RECORDED = "recorded";
  public static final String RESULT_DEGRADED = "degraded";
  public static final String RESULT_FAILED = "failed";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> recordCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<UndoStatus, Counter> undoCounters = new ConcurrentHashMap<>();
  private final AtomicInteger staleExecuting = new AtomicInteger(0);
  private final Counter backupFailureCounter;
  private final Timer undoDurationTimer;

  public AuditMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.backupFailureCounter =
        Counter.builder(METRIC_BACKUP_FAILURE_TOTAL)
            .description("Backups that could not be written while recording an action")
            .register(meterRegistry);
    this.undoDurationTimer =
        Timer.builder(METRIC_UNDO_DURATION)
            .description("Time from undo start to its terminal state")
            .register(meterRegistry);
    Gauge.builder(METRIC_UNDO_EXECUTING_STALE, staleExecuting, AtomicInteger::get)
        .description("Undo actions stuck in EXECUTING at the last retention sweep")
        .register(meterRegistry);
  }

  public void recordAuditWrite(ActionKind actionKind, String result) {
    final String action = actionKind == null ? "unknown" : actionKind.name().toLowerCase(Locale.ROOT);
    recordCounters
        .computeIfAbsent(
            action + ":" + result,
            ignored ->
                Counter.builder(METRIC_RECORD_TOTAL)
                    .description("Audit record write outcomes")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordBackupFailure() {
    backupFailureCounter.increment();
  }

  public void recordUndoOutcome(UndoStatus status, Duration elapsed) {
    undoCounters
        .computeIfAbsent(
            status,
            ignored ->
                Counter.builder(METRIC_UNDO_TOTAL)
                    .description("Undo action outcomes")
                    .tags(Tags.of("result", status.name().toLowerCase(Locale.ROOT)))
                    .register(meterRegistry))
        .increment();
    if (elapsed != null && !elapsed.isNegative()) {
      undoDurationTimer.record(elapsed);
    }
  }

  public void updateStaleExecuting(int count) {
    staleExecuting.set(Math.max(count, 0));
  }
}
