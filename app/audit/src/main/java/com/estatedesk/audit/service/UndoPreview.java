package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.ReversibilityTier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UndoPreview(
    UUID auditRecordId,
    ActionKind originalAction,
    String entityType,
    String entityId,
    String operation,
    JsonNode affectedData,
    ReversibilityTier complexity,
    List<String> warnings,
    String estimatedDuration) {

  public UndoPreview {
    warnings = List.copyOf(warnings);
  }
}
