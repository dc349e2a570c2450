package com.estatedesk.audit.service;

import com.estatedesk.audit.model.UserNotification;
import java.util.List;

public record NotificationPage(
    List<UserNotification> items, int totalCount, int unreadCount, boolean hasMore) {

  public NotificationPage {
    items = List.copyOf(items);
  }
}
