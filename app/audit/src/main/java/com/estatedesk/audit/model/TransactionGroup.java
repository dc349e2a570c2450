package com.estatedesk.audit.model;

import java.time.Instant;

public record TransactionGroup(
    String groupId,
    String name,
    String description,
    String primaryUserId,
    int totalActions,
    int undoableActions,
    ReversibilityTier aggregateTier,
    boolean allUndoable,
    boolean undone,
    Instant createdAt,
    Instant updatedAt) {

  public boolean canBeFullyUndone() {
    return allUndoable && !undone;
  }
}
