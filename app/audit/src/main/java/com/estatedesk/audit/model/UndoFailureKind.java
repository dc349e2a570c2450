/*
 * Where: audit domain model
 * What: typed reasons an undo is blocked or fails
 * Why: lets callers tell "already reversed" apart from "window closed" and restore errors
 */
package com.estatedesk.audit.model;

public enum UndoFailureKind {
  NOT_UNDOABLE(false),
  EXPIRED(false),
  RACE_LOST(false),
  ALREADY_UNDONE(false),
  CANCELLED(false),
  ENTITY_CONFLICT(true),
  ENTITY_MISSING(true),
  BACKUP_MISSING(false),
  BACKUP_CORRUPT(false),
  RESTORE_FAILED(true);

  private final boolean retryable;

  UndoFailureKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
