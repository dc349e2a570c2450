package com.estatedesk.audit.model;

public enum NotificationType {
  ADMIN_ACTION,
  UNDO_PERFORMED,
  SYSTEM_ALERT,
  ACCOUNT_UPDATE
}
