package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.RelatedEntity;
import com.estatedesk.audit.model.RequestMetadata;
import com.estatedesk.audit.model.ReversibilityTier;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import lombok.Builder;

/**
 * What a business service reports to {@link AuditRecorder#record(AuditEntry)}.
 *
 * <p>{@code undoable} and {@code notifyAffectedUser} default to true when left unset. A
 * {@code tierOverride} replaces the classifier's answer for mutating kinds only.
 */
@Builder
public record AuditEntry(
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
    String groupId,
    RequestMetadata requestMetadata,
    Boolean undoable,
    ReversibilityTier tierOverride,
    Boolean notifyAffectedUser) {

  public AuditEntry {
    relatedEntities = relatedEntities == null ? List.of() : List.copyOf(relatedEntities);
    undoable = undoable == null ? Boolean.TRUE : undoable;
    notifyAffectedUser = notifyAffectedUser == null ? Boolean.TRUE : notifyAffectedUser;
  }

  void validate() {
    if (actionKind == null) {
      throw new IllegalArgumentException("actionKind is required");
    }
    if (entityType == null || entityType.isBlank()) {
      throw new IllegalArgumentException("entityType is required");
    }
    if (description == null || description.isBlank()) {
      throw new IllegalArgumentException("description is required");
    }
  }

  boolean isAdminActionOnOtherUser() {
    return hasText(adminUserId) && hasText(actorUserId) && !adminUserId.equals(actorUserId);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
