/*
 * Where: audit undo service
 * What: an undo action was asked to move to a state its current state does not allow
 * Why: surfaced as 409 so clients can refresh instead of retrying blindly
 */
package com.estatedesk.audit.service;

public class InvalidUndoTransitionException extends RuntimeException {

  public InvalidUndoTransitionException(String message) {
    super(message);
  }
}
