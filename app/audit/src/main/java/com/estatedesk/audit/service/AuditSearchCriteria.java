package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ActionKind;

/** Filters for {@link TimelineQueryService#search}. Null fields do not filter. */
public record AuditSearchCriteria(
    String query, Integer days, String entityType, ActionKind actionKind, String userId, Integer limit) {

  static final int DEFAULT_DAYS = 30;
  static final int DEFAULT_LIMIT = 50;
  static final int MAX_LIMIT = 200;

  public AuditSearchCriteria {
    days = days == null ? DEFAULT_DAYS : days;
    limit = limit == null ? DEFAULT_LIMIT : limit;
    if (days <= 0) {
      throw new IllegalArgumentException("days must be positive");
    }
    if (limit <= 0 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
  }
}
