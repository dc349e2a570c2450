/*
 * Where: audit domain model
 * What: kinds of actions the audit trail records
 * Why: only mutating kinds can ever be reversed
 */
package com.estatedesk.audit.model;

public enum ActionKind {
  CREATE,
  READ,
  UPDATE,
  DELETE,
  LOGIN,
  LOGOUT,
  REFRESH_TOKEN,
  ACCESS_DENIED,
  ERROR;

  public boolean isMutating() {
    return this == CREATE || this == UPDATE || this == DELETE;
  }
}
