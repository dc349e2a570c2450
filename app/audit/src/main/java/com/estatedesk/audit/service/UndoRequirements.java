package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ReversibilityTier;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Optional;

/** Outcome of an undo feasibility check. {@code canUndo} holds exactly when there are no blockers. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UndoRequirements(
    boolean canUndo,
    ReversibilityTier complexity,
    List<String> requirements,
    List<String> warnings,
    List<UndoBlocker> blockers) {

  public UndoRequirements {
    requirements = List.copyOf(requirements);
    warnings = List.copyOf(warnings);
    blockers = List.copyOf(blockers);
    if (canUndo != blockers.isEmpty()) {
      throw new IllegalArgumentException("canUndo must be true exactly when there are no blockers");
    }
  }

  public Optional<UndoBlocker> firstBlocker() {
    return blockers.stream().findFirst();
  }
}
