/*
 * Where: audit domain model
 * What: lifecycle of an undo attempt
 * Why: PENDING -> EXECUTING -> COMPLETED|FAILED, CANCELLED only from PENDING
 */
package com.estatedesk.audit.model;

public enum UndoStatus {
  PENDING,
  EXECUTING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}
