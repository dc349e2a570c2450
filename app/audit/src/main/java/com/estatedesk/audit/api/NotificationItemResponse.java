package com.estatedesk.audit.api;

import com.estatedesk.audit.model.NotificationPriority;
import com.estatedesk.audit.model.NotificationType;
import com.estatedesk.audit.model.UserNotification;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationItemResponse(
    UUID id,
    NotificationType type,
    String title,
    String message,
    NotificationPriority priority,
    String category,
    String actionUrl,
    UUID undoActionId,
    boolean read,
    Instant readAt,
    Instant expiresAt,
    Instant createdAt) {

  static NotificationItemResponse from(UserNotification notification) {
    return new NotificationItemResponse(
        notification.id(),
        notification.type(),
        notification.title(),
        notification.message(),
        notification.priority(),
        notification.category(),
        notification.actionUrl(),
        notification.undoActionId(),
        notification.read(),
        notification.readAt(),
        notification.expiresAt(),
        notification.createdAt());
  }
}
