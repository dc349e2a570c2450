package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.ReversibilityTier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** A timeline member annotated for the caller viewing it. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditRecordView(
    UUID id,
    String groupId,
    String actorUserId,
    String adminUserId,
    ActionKind actionKind,
    String entityType,
    String entityId,
    String description,
    String context,
    JsonNode beforeSnapshot,
    JsonNode afterSnapshot,
    boolean undoable,
    ReversibilityTier tier,
    Instant createdAt,
    Instant expiresAt,
    boolean canUndoByRole,
    boolean stillUndoable,
    ImpactPreview impact,
    List<UndoActionSummary> undoActions) {

  public AuditRecordView {
    undoActions = List.copyOf(undoActions);
  }
}
