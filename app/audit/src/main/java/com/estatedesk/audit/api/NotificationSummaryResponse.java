package com.estatedesk.audit.api;

import com.estatedesk.audit.model.NotificationType;
import com.estatedesk.audit.service.NotificationSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummaryResponse(
    int totalUnread,
    int urgentCount,
    Map<NotificationType, Integer> countsByType,
    List<NotificationItemResponse> mostRecent) {

  public NotificationSummaryResponse {
    countsByType = Map.copyOf(countsByType);
    mostRecent = List.copyOf(mostRecent);
  }

  static NotificationSummaryResponse from(NotificationSummary summary) {
    return new NotificationSummaryResponse(
        summary.totalUnread(),
        summary.urgentCount(),
        summary.countsByType(),
        summary.mostRecent().stream().map(NotificationItemResponse::from).toList());
  }
}
