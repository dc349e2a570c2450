package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ActionKind;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UndoHistoryEntry(
    UndoActionSummary undoAction,
    UUID auditRecordId,
    ActionKind originalAction,
    String entityType,
    String entityId,
    String description) {}
