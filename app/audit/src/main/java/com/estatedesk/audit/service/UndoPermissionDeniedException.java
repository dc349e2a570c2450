package com.estatedesk.audit.service;

public class UndoPermissionDeniedException extends RuntimeException {

  public UndoPermissionDeniedException(String message) {
    super(message);
  }
}
