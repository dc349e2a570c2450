package com.estatedesk.audit.service;

import com.estatedesk.audit.model.UndoAction;
import com.estatedesk.audit.model.UndoFailureKind;
import com.estatedesk.audit.model.UndoStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UndoActionSummary(
    UUID id,
    UndoStatus status,
    String performedByAdminId,
    String reason,
    UndoFailureKind failureKind,
    String errorMessage,
    Instant createdAt,
    Instant completedAt) {

  public static UndoActionSummary of(UndoAction action) {
    return new UndoActionSummary(
        action.id(),
        action.status(),
        action.performedByAdminId(),
        action.reason(),
        action.failureKind(),
        action.errorMessage(),
        action.createdAt(),
        action.completedAt());
  }
}
