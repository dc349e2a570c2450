package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ReversibilityTier;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransactionGroupView(
    String groupId,
    String name,
    String description,
    String primaryUserId,
    int totalActions,
    int undoableActions,
    ReversibilityTier aggregateTier,
    boolean allUndoable,
    boolean undone,
    Instant latestActionAt,
    List<AuditRecordView> actions) {

  public TransactionGroupView {
    actions = List.copyOf(actions);
  }
}
