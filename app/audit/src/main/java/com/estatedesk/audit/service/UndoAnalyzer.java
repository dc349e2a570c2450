/*
 * Where: audit undo service
 * What: decides whether an audit record can be undone right now, and by whom
 * Why: admins see blockers and warnings before anything is written back
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.AdminRole;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.DataBackup;
import com.estatedesk.audit.model.ReversibilityTier;
import com.estatedesk.audit.model.UndoFailureKind;
import com.estatedesk.audit.repository.AuditRecordRepository;
import com.estatedesk.audit.repository.UndoActionRepository;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class UndoAnalyzer {

  static final String OPERATION_REMOVE = "remove";
  static final String OPERATION_RESTORE = "restore previous values";
  static final String OPERATION_RECREATE = "recreate from backup";

  private final AuditRecordRepository auditRecordRepository;
  private final UndoActionRepository undoActionRepository;
  private final BackupStore backupStore;
  private final EntityStore entityStore;
  private final UndoRolePolicy rolePolicy;
  private final Clock clock;

  @Transactional(readOnly = true)
  public UndoRequirements analyzeRequirements(UUID auditRecordId) {
    return analyzeRequirements(load(auditRecordId));
  }

  @Transactional(readOnly = true)
  public UndoRequirements analyzeRequirements(AuditRecord record) {
    final List<String> requirements = new ArrayList<>();
    final List<String> warnings = new ArrayList<>();
    final List<UndoBlocker> blockers = new ArrayList<>();

    if (!record.undoable()) {
      blockers.add(new UndoBlocker(UndoFailureKind.NOT_UNDOABLE, "this action cannot be undone"));
      return new UndoRequirements(false, record.tier(), requirements, warnings, blockers);
    }
    if (record.isExpiredAt(Instant.now(clock))) {
      blockers.add(
          new UndoBlocker(
              UndoFailureKind.EXPIRED, "undo window closed at " + record.expiresAt()));
    }
    if (undoActionRepository.existsCompleted(record.id())) {
      blockers.add(
          new UndoBlocker(UndoFailureKind.ALREADY_UNDONE, "this action has already been undone"));
    }

    switch (record.actionKind()) {
      case DELETE -> analyzeDelete(record, requirements, blockers);
      case CREATE -> analyzeCreate(record, warnings, blockers);
      case UPDATE -> analyzeUpdate(record, requirements, warnings, blockers);
      default ->
          blockers.add(
              new UndoBlocker(
                  UndoFailureKind.NOT_UNDOABLE, record.actionKind() + " actions cannot be undone"));
    }
    if (record.tier() == ReversibilityTier.COMPLEX) {
      warnings.add("complex action: review related entities after the undo");
    }
    return new UndoRequirements(blockers.isEmpty(), record.tier(), requirements, warnings, blockers);
  }

  @Transactional(readOnly = true)
  public boolean canUndoByRole(UUID auditRecordId, AdminRole role) {
    return canUndoByRole(load(auditRecordId), role);
  }

  public boolean canUndoByRole(AuditRecord record, AdminRole role) {
    return record.undoable() && rolePolicy.allows(role, record.tier());
  }

  /** Rejects roles that may not undo this record's tier, regardless of its current state. */
  @Transactional(readOnly = true)
  public void checkRoleMayUndo(UUID auditRecordId, AdminRole role) {
    final AuditRecord record = load(auditRecordId);
    if (record.undoable() && !rolePolicy.allows(role, record.tier())) {
      throw new UndoPermissionDeniedException(
          "role " + (role == null ? "none" : role.value()) + " may not undo " + record.tier() + " actions");
    }
  }

  @Transactional(readOnly = true)
  public boolean isStillUndoable(UUID auditRecordId) {
    return isStillUndoable(load(auditRecordId), undoActionRepository.existsCompleted(auditRecordId));
  }

  public boolean isStillUndoable(AuditRecord record, boolean hasCompletedUndo) {
    return record.undoable() && !record.isExpiredAt(Instant.now(clock)) && !hasCompletedUndo;
  }

  @Transactional(readOnly = true)
  public UndoPreview preview(UUID auditRecordId) {
    final AuditRecord record = load(auditRecordId);
    final UndoRequirements requirements = analyzeRequirements(record);
    final List<String> warnings = new ArrayList<>(requirements.warnings());
    requirements.blockers().forEach(blocker -> warnings.add(blocker.message()));

    final String operation;
    JsonNode affectedData = null;
    switch (record.actionKind()) {
      case CREATE -> {
        operation = OPERATION_REMOVE;
        affectedData = record.afterSnapshot();
        warnings.add("the created " + record.entityType() + " will be deleted");
      }
      case UPDATE -> {
        operation = OPERATION_RESTORE;
        affectedData = record.beforeSnapshot();
      }
      case DELETE -> {
        operation = OPERATION_RECREATE;
        final Optional<DataBackup> backup = backupStore.findByAuditRecordId(record.id());
        if (backup.isPresent()) {
          try {
            affectedData = backupStore.decode(backup.get()).payload();
          } catch (BackupRestoreException ex) {
            warnings.add(ex.getMessage());
          }
          if (backup.get().hasFiles()) {
            warnings.add("files will be restored from the backup");
          }
        }
      }
      default -> operation = "none";
    }
    return new UndoPreview(
        record.id(),
        record.actionKind(),
        record.entityType(),
        record.entityId(),
        operation,
        affectedData,
        record.tier(),
        warnings,
        estimatedDuration(record.tier()));
  }

  static String estimatedDuration(ReversibilityTier tier) {
    return switch (tier) {
      case MODERATE -> "30 seconds - 2 minutes";
      case COMPLEX -> "2-5 minutes";
      default -> "< 1 minute";
    };
  }

  private void analyzeDelete(AuditRecord record, List<String> requirements, List<UndoBlocker> blockers) {
    if (entityStore.exists(record.entityType(), record.entityId())) {
      blockers.add(
          new UndoBlocker(
              UndoFailureKind.ENTITY_CONFLICT,
              record.entityType() + " " + record.entityId() + " already exists"));
    }
    final Optional<DataBackup> backup = backupStore.findByAuditRecordId(record.id());
    if (backup.isEmpty()) {
      blockers.add(new UndoBlocker(UndoFailureKind.BACKUP_MISSING, "no backup available"));
      return;
    }
    requirements.add("backup available");
    if (backup.get().hasFiles()) {
      requirements.add("file backup available");
    }
  }

  private void analyzeCreate(AuditRecord record, List<String> warnings, List<UndoBlocker> blockers) {
    if (!entityStore.exists(record.entityType(), record.entityId())) {
      blockers.add(
          new UndoBlocker(
              UndoFailureKind.ENTITY_MISSING,
              record.entityType() + " " + record.entityId() + " no longer exists"));
    }
    final int later =
        auditRecordRepository.countLaterOnEntity(
            record.entityType(),
            record.entityId(),
            record.createdAt(),
            List.of(ActionKind.CREATE, ActionKind.UPDATE));
    if (later > 0) {
      warnings.add(later + " later change(s) to this entity will be lost");
    }
    if (!record.relatedEntities().isEmpty()) {
      warnings.add(record.relatedEntities().size() + " related entit(ies) are not removed");
    }
  }

  private void analyzeUpdate(
      AuditRecord record,
      List<String> requirements,
      List<String> warnings,
      List<UndoBlocker> blockers) {
    final int later =
        auditRecordRepository.countLaterOnEntity(
            record.entityType(), record.entityId(), record.createdAt(), List.of(ActionKind.UPDATE));
    if (later > 0) {
      warnings.add(later + " later update(s) to this entity will be overwritten");
    }
    if (record.beforeSnapshot() != null && !record.beforeSnapshot().isNull()) {
      requirements.add("previous values available");
    } else if (backupStore.findByAuditRecordId(record.id()).isPresent()) {
      requirements.add("backup available");
    } else {
      blockers.add(new UndoBlocker(UndoFailureKind.BACKUP_MISSING, "no previous values to restore"));
    }
  }

  private AuditRecord load(UUID auditRecordId) {
    return auditRecordRepository
        .findById(auditRecordId)
        .orElseThrow(() -> new AuditRecordNotFoundException(auditRecordId));
  }
}
