package com.estatedesk.audit.service;

import com.estatedesk.audit.model.NotificationType;
import com.estatedesk.audit.model.UserNotification;
import java.util.List;
import java.util.Map;

/** Bell badge data: unread counts and the few most recent unread notifications. */
public record NotificationSummary(
    int totalUnread,
    int urgentCount,
    Map<NotificationType, Integer> countsByType,
    List<UserNotification> mostRecent) {

  public NotificationSummary {
    countsByType = Map.copyOf(countsByType);
    mostRecent = List.copyOf(mostRecent);
  }
}
