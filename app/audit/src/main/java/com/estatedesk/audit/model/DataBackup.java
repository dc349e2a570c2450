/*
 * Where: audit domain model
 * What: point-in-time snapshot of an entity attached 1:1 to an audit record
 * Why: undo of a delete or update restores from here
 */
package com.estatedesk.audit.model;

import java.time.Instant;
import java.util.UUID;

public record DataBackup(
    UUID id,
    UUID auditRecordId,
    String entityType,
    String entityId,
    byte[] payloadBytes,
    String relatedPayloadJson,
    String filesPath,
    long payloadSizeBytes,
    boolean compressed,
    Instant createdAt,
    Instant expiresAt,
    Instant consumedAt) {

  public DataBackup {
    payloadBytes = payloadBytes == null ? null : payloadBytes.clone();
  }

  @Override
  public byte[] payloadBytes() {
    return payloadBytes == null ? null : payloadBytes.clone();
  }

  public boolean hasFiles() {
    return filesPath != null && !filesPath.isBlank();
  }

  public boolean isExpiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }
}
