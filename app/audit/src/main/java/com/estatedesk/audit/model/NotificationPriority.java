package com.estatedesk.audit.model;

public enum NotificationPriority {
  LOW,
  NORMAL,
  HIGH,
  URGENT;

  public boolean isUrgent() {
    return this == HIGH || this == URGENT;
  }
}
