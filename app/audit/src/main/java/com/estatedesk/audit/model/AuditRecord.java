/*
 * Where: audit domain model
 * What: one recorded mutating (or security relevant) action, as stored in audit_records
 * Why: carries enough before/after state to reverse the action later
 */
package com.estatedesk.audit.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

public record AuditRecord(
    UUID id,
    String groupId,
    String actorUserId,
    String adminUserId,
    ActionKind actionKind,
    String entityType,
    String entityId,
    String description,
    String context,
    JsonNode beforeSnapshot,
    JsonNode afterSnapshot,
    List<RelatedEntity> relatedEntities,
    boolean undoable,
    ReversibilityTier tier,
    RequestMetadata requestMetadata,
    Instant createdAt,
    Instant expiresAt) {

  public AuditRecord {
    relatedEntities =
        relatedEntities == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(relatedEntities));
    requestMetadata = requestMetadata == null ? RequestMetadata.empty() : requestMetadata;
  }

  public boolean isExpiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }

  public AuditRecord withUndoable(boolean value) {
    return new AuditRecord(
        id,
        groupId,
        actorUserId,
        adminUserId,
        actionKind,
        entityType,
        entityId,
        description,
        context,
        beforeSnapshot,
        afterSnapshot,
        relatedEntities,
        value,
        tier,
        requestMetadata,
        createdAt,
        expiresAt);
  }
}
