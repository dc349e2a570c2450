package com.estatedesk.audit.service;

/** A backup could not be written while recording an action. */
public class BackupSnapshotException extends RuntimeException {

  public BackupSnapshotException(String message, Throwable cause) {
    super(message, cause);
  }
}
