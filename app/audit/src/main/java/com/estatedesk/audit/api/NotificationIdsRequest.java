package com.estatedesk.audit.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.AssertTrue;
import java.util.List;
import java.util.UUID;

/** Either explicit ids or {@code all=true}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationIdsRequest(List<UUID> ids, Boolean all) {

  boolean markAll() {
    return Boolean.TRUE.equals(all);
  }

  @AssertTrue(message = "ids or all=true is required")
  @JsonIgnore
  public boolean isTargetPresent() {
    return markAll() || (ids != null && !ids.isEmpty());
  }
}
