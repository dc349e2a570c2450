/*
 * Where: audit domain model
 * What: reference to an entity touched by the same action as the primary entity
 * Why: captured at write time so undo feasibility never depends on later schema changes
 */
package com.estatedesk.audit.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RelatedEntity(String entityType, String entityId, JsonNode state) {

  public static RelatedEntity of(String entityType, String entityId) {
    return new RelatedEntity(entityType, entityId, null);
  }
}
