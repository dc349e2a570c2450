/*
 * Where: audit service layer
 * What: entry point business services call after each action they want on the audit trail
 * Why: recording must never break the business operation that triggered it
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.config.RequestMdcInterceptor;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.RequestMetadata;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditRecorder {

  private static final Logger logger = LoggerFactory.getLogger(AuditRecorder.class);

  private final AuditRecordWriter writer;
  private final AuditMetrics metrics;

  /**
   * Appends one audit record, joining the caller's transaction when there is one.
   *
   * @return the stored record, or empty when anything after validation failed; the failure is
   *     logged and counted and the caller's transaction is left usable
   * @throws IllegalArgumentException when kind, entity type or description is missing
   */
  public Optional<AuditRecord> record(AuditEntry entry) {
    if (entry == null) {
      throw new IllegalArgumentException("audit entry is required");
    }
    entry.validate();
    final RequestMetadata metadata = withRequestContext(entry.requestMetadata());
    try {
      final AuditRecord record = writer.write(entry, metadata);
      final boolean degraded =
          entry.actionKind().isMutating() && entry.undoable() && !record.undoable();
      metrics.recordAuditWrite(
          entry.actionKind(), degraded ? AuditMetrics.RESULT_DEGRADED : AuditMetrics.RESULT_RECORDED);
      logger.debug(
          "audit recorded id={} action={} entityType={} entityId={} groupId={} undoable={} tier={}",
          record.id(),
          record.actionKind(),
          record.entityType(),
          record.entityId(),
          record.groupId(),
          record.undoable(),
          record.tier());
      return Optional.of(record);
    } catch (RuntimeException ex) {
      // The savepoint is already rolled back; the caller's transaction carries on.
      metrics.recordAuditWrite(entry.actionKind(), AuditMetrics.RESULT_FAILED);
      logger.error(
          "audit record write failed action={} entityType={} entityId={}",
          entry.actionKind(),
          entry.entityType(),
          entry.entityId(),
          ex);
      return Optional.empty();
    }
  }

  // Blank fields fall back to what RequestMdcInterceptor put on the current thread.
  static RequestMetadata withRequestContext(RequestMetadata supplied) {
    final RequestMetadata base = supplied == null ? RequestMetadata.empty() : supplied;
    return new RequestMetadata(
        firstNonBlank(base.ipAddress(), MDC.get(RequestMdcInterceptor.CLIENT_IP)),
        firstNonBlank(base.userAgent(), MDC.get(RequestMdcInterceptor.USER_AGENT)),
        firstNonBlank(base.endpoint(), MDC.get(RequestMdcInterceptor.HTTP_PATH)),
        firstNonBlank(base.method(), MDC.get(RequestMdcInterceptor.HTTP_METHOD)),
        base.statusCode(),
        firstNonBlank(base.requestId(), MDC.get(RequestMdcInterceptor.REQUEST_ID)));
  }

  private static String firstNonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
