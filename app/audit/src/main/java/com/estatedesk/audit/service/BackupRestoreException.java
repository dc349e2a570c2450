package com.estatedesk.audit.service;

import com.estatedesk.audit.model.UndoFailureKind;

/** A backup is missing, expired or unreadable; carries the failure kind an undo reports. */
public class BackupRestoreException extends RuntimeException {

  private final UndoFailureKind failureKind;

  public BackupRestoreException(UndoFailureKind failureKind, String message) {
    super(message);
    this.failureKind = failureKind;
  }

  public BackupRestoreException(UndoFailureKind failureKind, String message, Throwable cause) {
    super(message, cause);
    this.failureKind = failureKind;
  }

  public UndoFailureKind failureKind() {
    return failureKind;
  }
}
