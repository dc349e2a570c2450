package com.estatedesk.audit.service;

import com.estatedesk.audit.model.UndoFailureKind;

/** A write-back step of an undo could not be applied; rolls back the undo's unit of work. */
public class UndoStepException extends RuntimeException {

  private final UndoFailureKind failureKind;

  public UndoStepException(UndoFailureKind failureKind, String message) {
    super(message);
    this.failureKind = failureKind;
  }

  public UndoFailureKind failureKind() {
    return failureKind;
  }
}
