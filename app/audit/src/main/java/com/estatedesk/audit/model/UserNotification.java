/*
 * Where: audit domain model
 * What: a message surfaced in a user's notification bell, as stored in user_notifications
 * Why: users learn about admin interventions and undos performed on their data
 */
package com.estatedesk.audit.model;

import java.time.Instant;
import java.util.UUID;

public record UserNotification(
    UUID id,
    String userId,
    NotificationType type,
    String title,
    String message,
    UUID undoActionId,
    NotificationPriority priority,
    String category,
    String actionUrl,
    boolean read,
    Instant readAt,
    boolean archived,
    Instant archivedAt,
    Instant expiresAt,
    String metadataJson,
    Instant createdAt) {

  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && now.isAfter(expiresAt);
  }
}
