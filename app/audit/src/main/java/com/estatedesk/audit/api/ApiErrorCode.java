package com.estatedesk.audit.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  UNDO_FORBIDDEN,
  UNDO_STATE_CONFLICT
}
