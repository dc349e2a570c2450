package com.estatedesk.audit.api;

import com.estatedesk.audit.service.NotificationPage;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationListResponse(
    List<NotificationItemResponse> notifications,
    int totalCount,
    int unreadCount,
    boolean hasMore) {

  public NotificationListResponse {
    notifications = List.copyOf(notifications);
  }

  static NotificationListResponse from(NotificationPage page) {
    return new NotificationListResponse(
        page.items().stream().map(NotificationItemResponse::from).toList(),
        page.totalCount(),
        page.unreadCount(),
        page.hasMore());
  }
}
