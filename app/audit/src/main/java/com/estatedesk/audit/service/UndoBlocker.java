package com.estatedesk.audit.service;

import com.estatedesk.audit.model.UndoFailureKind;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UndoBlocker(UndoFailureKind kind, String message) {}
