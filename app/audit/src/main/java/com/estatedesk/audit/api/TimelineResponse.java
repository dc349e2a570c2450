package com.estatedesk.audit.api;

import com.estatedesk.audit.service.TransactionGroupView;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TimelineResponse(String userId, int days, List<TransactionGroupView> groups) {

  public TimelineResponse {
    groups = List.copyOf(groups);
  }
}
