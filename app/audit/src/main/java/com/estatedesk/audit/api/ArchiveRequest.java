package com.estatedesk.audit.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.UUID;

/** Archives the listed ids, or everything older than {@code older_than_days}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArchiveRequest(
    List<UUID> ids,
    @Positive(message = "older_than_days must be positive") Integer olderThanDays) {

  @AssertTrue(message = "ids or older_than_days is required")
  @JsonIgnore
  public boolean isTargetPresent() {
    return olderThanDays != null || (ids != null && !ids.isEmpty());
  }
}
