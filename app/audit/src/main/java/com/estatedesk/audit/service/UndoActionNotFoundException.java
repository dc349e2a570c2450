package com.estatedesk.audit.service;

import java.util.UUID;

public class UndoActionNotFoundException extends RuntimeException {

  public UndoActionNotFoundException(UUID undoActionId) {
    super("undo action not found: " + undoActionId);
  }
}
