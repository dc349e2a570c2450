package com.estatedesk.audit.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UndoHistoryPage(List<UndoHistoryEntry> items, int totalCount, boolean hasMore) {

  public UndoHistoryPage {
    items = List.copyOf(items);
  }
}
