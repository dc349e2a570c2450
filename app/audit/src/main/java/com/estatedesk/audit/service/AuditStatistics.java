package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ActionKind;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditStatistics(
    int periodDays,
    int totalActions,
    int undoableActions,
    double undoableRatio,
    int undoAttempts,
    int undoCompleted,
    int undoFailed,
    double undoSuccessRate,
    Map<ActionKind, Integer> actionsByKind) {

  public AuditStatistics {
    actionsByKind = Map.copyOf(actionsByKind);
  }
}
