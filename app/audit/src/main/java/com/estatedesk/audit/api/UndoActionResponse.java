package com.estatedesk.audit.api;

import com.estatedesk.audit.model.UndoAction;
import com.estatedesk.audit.model.UndoFailureKind;
import com.estatedesk.audit.model.UndoStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UndoActionResponse(
    UUID undoActionId,
    UUID auditRecordId,
    UndoStatus status,
    String performedByAdminId,
    String reason,
    UndoFailureKind failureKind,
    String errorMessage,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String cancelledBy,
    Instant cancelledAt) {

  static UndoActionResponse from(UndoAction action) {
    return new UndoActionResponse(
        action.id(),
        action.auditRecordId(),
        action.status(),
        action.performedByAdminId(),
        action.reason(),
        action.failureKind(),
        action.errorMessage(),
        action.createdAt(),
        action.startedAt(),
        action.completedAt(),
        action.cancelledBy(),
        action.cancelledAt());
  }
}
