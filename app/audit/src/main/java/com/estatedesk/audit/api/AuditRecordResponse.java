package com.estatedesk.audit.api;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.ReversibilityTier;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

/** Search hit. Snapshots are left out; the timeline carries them. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditRecordResponse(
    UUID id,
    String groupId,
    String actorUserId,
    String adminUserId,
    ActionKind actionKind,
    String entityType,
    String entityId,
    String description,
    boolean undoable,
    ReversibilityTier tier,
    String endpoint,
    String ipAddress,
    Instant createdAt,
    Instant expiresAt) {

  static AuditRecordResponse from(AuditRecord record) {
    return new AuditRecordResponse(
        record.id(),
        record.groupId(),
        record.actorUserId(),
        record.adminUserId(),
        record.actionKind(),
        record.entityType(),
        record.entityId(),
        record.description(),
        record.undoable(),
        record.tier(),
        record.requestMetadata().endpoint(),
        record.requestMetadata().ipAddress(),
        record.createdAt(),
        record.expiresAt());
  }
}
