package com.estatedesk.audit.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.UUID;

/** Decoded contents of a backup, ready to be written back through {@link EntityStore}. */
public record RestoredBackup(
    UUID backupId, String entityType, String entityId, JsonNode payload, JsonNode relatedPayload, String filesPath) {

  public boolean hasFiles() {
    return filesPath != null && !filesPath.isBlank();
  }
}
