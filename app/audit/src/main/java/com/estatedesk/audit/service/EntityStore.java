package com.estatedesk.audit.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Write-back boundary used by undo. Business services that own real entity tables provide their
 * own bean; the module ships {@link com.estatedesk.audit.repository.JdbcEntityStore}.
 */
public interface EntityStore {

  boolean exists(String entityType, String entityId);

  /** Creates the entity or replaces its current state. */
  void restore(String entityType, String entityId, JsonNode state);

  /** Returns false when there was nothing to remove. */
  boolean remove(String entityType, String entityId);
}
