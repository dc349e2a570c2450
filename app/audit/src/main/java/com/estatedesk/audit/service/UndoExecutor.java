/*
 * Where: audit undo service
 * What: runs an undo in three units of work (claim, write back, record failure)
 * Why: the claim commits before any write-back so concurrent undos of one record cannot both succeed
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.config.UndoProperties;
import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.DataBackup;
import com.estatedesk.audit.model.NotificationPriority;
import com.estatedesk.audit.model.NotificationType;
import com.estatedesk.audit.model.UndoAction;
import com.estatedesk.audit.model.UndoFailureKind;
import com.estatedesk.audit.model.UndoStatus;
import com.estatedesk.audit.repository.AuditRecordRepository;
import com.estatedesk.audit.repository.UndoActionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class UndoExecutor {

  private static final Logger logger = LoggerFactory.getLogger(UndoExecutor.class);

  private static final List<UndoStatus> CLAIMING_STATUSES =
      List.of(UndoStatus.EXECUTING, UndoStatus.COMPLETED);
  private static final Set<UndoFailureKind> DOWNGRADING_FAILURES =
      EnumSet.of(UndoFailureKind.BACKUP_MISSING, UndoFailureKind.BACKUP_CORRUPT);

  private final AuditRecordRepository auditRecordRepository;
  private final UndoActionRepository undoActionRepository;
  private final UndoAnalyzer undoAnalyzer;
  private final BackupStore backupStore;
  private final EntityStore entityStore;
  private final TransactionGroupTracker groupTracker;
  private final NotificationCenter notificationCenter;
  private final AuditRecorder auditRecorder;
  private final UndoProperties properties;
  private final AuditMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * Prepares and immediately confirms an undo. Execution failures do not throw; they come back as
   * a FAILED action carrying the failure kind.
   */
  public UndoAction execute(UUID auditRecordId, String performingAdminId, String reason) {
    final UndoAction pending = prepare(auditRecordId, performingAdminId, reason);
    return confirm(pending.id());
  }

  /** Stores a PENDING undo action holding the preview the admin is about to confirm. */
  public UndoAction prepare(UUID auditRecordId, String performingAdminId, String reason) {
    if (performingAdminId == null || performingAdminId.isBlank()) {
      throw new IllegalArgumentException("performingAdminId is required");
    }
    final UndoPreview preview = undoAnalyzer.preview(auditRecordId);
    final UndoAction action =
        new UndoAction(
            UUID.randomUUID(),
            auditRecordId,
            performingAdminId,
            UndoStatus.PENDING,
            reason,
            writePreview(preview),
            null,
            null,
            null,
            Instant.now(clock),
            null,
            null,
            null,
            null);
    newTransaction().executeWithoutResult(status -> undoActionRepository.insert(action));
    logger.info(
        "undo prepared id={} auditRecordId={} adminId={}", action.id(), auditRecordId, performingAdminId);
    return action;
  }

  /**
   * Runs a PENDING undo action to a terminal state.
   *
   * @throws InvalidUndoTransitionException when the action is no longer PENDING
   */
  public UndoAction confirm(UUID undoActionId) {
    final UndoAction action = load(undoActionId);
    if (action.status() != UndoStatus.PENDING) {
      throw new InvalidUndoTransitionException(
          "undo action " + undoActionId + " is " + action.status() + ", expected PENDING");
    }
    final Instant startedAt = Instant.now(clock);
    final ExecutionLog log = new ExecutionLog();

    final AuditRecord record = newTransaction().execute(status -> claim(action, log, startedAt));
    if (record == null) {
      return finish(action.id(), startedAt);
    }

    final List<Path> restoredFiles = new ArrayList<>();
    try {
      newTransaction().executeWithoutResult(status -> writeBack(action, record, log, restoredFiles));
      logger.info(
          "undo completed id={} auditRecordId={} action={} entityType={} entityId={}",
          action.id(),
          record.id(),
          record.actionKind(),
          record.entityType(),
          record.entityId());
    } catch (RuntimeException ex) {
      // The write-back rolled back; files it restored must not outlive it.
      backupStore.discardRestoredFiles(restoredFiles);
      recordFailure(action, record, failureKindOf(ex), ex, log);
    }
    return finish(action.id(), startedAt);
  }

  /**
   * Cancels a PENDING undo action.
   *
   * @throws InvalidUndoTransitionException when the action already left PENDING
   */
  public UndoAction cancel(UUID undoActionId, String adminId) {
    final UndoAction action = load(undoActionId);
    final Integer updated =
        newTransaction()
            .execute(
                status -> undoActionRepository.markCancelled(undoActionId, adminId, Instant.now(clock)));
    if (updated == null || updated == 0) {
      throw new InvalidUndoTransitionException(
          "undo action " + undoActionId + " cannot be cancelled from " + load(undoActionId).status());
    }
    logger.info("undo cancelled id={} auditRecordId={} by={}", undoActionId, action.auditRecordId(), adminId);
    metrics.recordUndoOutcome(UndoStatus.CANCELLED, null);
    return load(undoActionId);
  }

  // Returns the locked record when the action moved to EXECUTING, null when it was failed instead.
  private AuditRecord claim(UndoAction action, ExecutionLog log, Instant now) {
    final AuditRecord record =
        auditRecordRepository
            .lockById(action.auditRecordId())
            .orElseThrow(() -> new AuditRecordNotFoundException(action.auditRecordId()));
    final UndoFailureKind failure;
    final String message;
    if (!record.undoable()) {
      failure = UndoFailureKind.NOT_UNDOABLE;
      message = "audit record is not undoable";
    } else if (record.isExpiredAt(now)) {
      failure = UndoFailureKind.EXPIRED;
      message = "undo window closed at " + record.expiresAt();
    } else if (undoActionRepository.countInStatus(record.id(), CLAIMING_STATUSES, action.id()) > 0) {
      failure = UndoFailureKind.RACE_LOST;
      message = "another undo of this record is running or has completed";
    } else {
      failure = null;
      message = null;
    }
    if (failure != null) {
      log.add("rejected: " + message);
      undoActionRepository.markFailed(action.id(), failure, message, log.text(), now);
      logger.warn(
          "undo rejected id={} auditRecordId={} failureKind={}", action.id(), record.id(), failure);
      return null;
    }
    log.add("started " + record.actionKind() + " undo of " + record.entityType() + " " + record.entityId());
    if (undoActionRepository.markExecuting(action.id(), now, log.text()) == 0) {
      throw new InvalidUndoTransitionException(
          "undo action " + action.id() + " left PENDING before it could start");
    }
    return record;
  }

  private void writeBack(
      UndoAction action, AuditRecord record, ExecutionLog log, List<Path> restoredFiles) {
    DataBackup usedBackup = null;
    switch (record.actionKind()) {
      case CREATE -> {
        if (!entityStore.remove(record.entityType(), record.entityId())) {
          throw new UndoStepException(
              UndoFailureKind.ENTITY_MISSING,
              record.entityType() + " " + record.entityId() + " no longer exists");
        }
        log.add("removed " + record.entityType() + " " + record.entityId());
      }
      case UPDATE -> {
        JsonNode previous = record.beforeSnapshot();
        if (previous == null || previous.isNull()) {
          usedBackup = requireBackup(record);
          previous = backupStore.decode(usedBackup).payload();
        }
        entityStore.restore(record.entityType(), record.entityId(), previous);
        log.add("restored previous values of " + record.entityType() + " " + record.entityId());
      }
      case DELETE -> {
        if (entityStore.exists(record.entityType(), record.entityId())) {
          throw new UndoStepException(
              UndoFailureKind.ENTITY_CONFLICT,
              record.entityType() + " " + record.entityId() + " already exists");
        }
        usedBackup = requireBackup(record);
        final RestoredBackup restored = backupStore.decode(usedBackup);
        entityStore.restore(record.entityType(), record.entityId(), restored.payload());
        log.add("recreated " + record.entityType() + " " + record.entityId() + " from backup");
        if (restored.hasFiles()) {
          restoredFiles.addAll(backupStore.restoreFiles(restored));
          log.add("restored " + restoredFiles.size() + " file(s)");
        }
      }
      default ->
          throw new UndoStepException(
              UndoFailureKind.NOT_UNDOABLE, record.actionKind() + " actions cannot be undone");
    }

    final Instant now = Instant.now(clock);
    if (usedBackup != null) {
      backupStore.markConsumed(usedBackup.id());
    }
    log.add("completed");
    if (undoActionRepository.markCompleted(action.id(), now, log.text()) == 0) {
      throw new IllegalStateException("undo action " + action.id() + " is no longer EXECUTING");
    }
    groupTracker.markUndoneIfAllReversed(record.groupId());
    notifyAffectedUser(action, record);
    recordUndo(action, record);
  }

  private DataBackup requireBackup(AuditRecord record) {
    return backupStore
        .findByAuditRecordId(record.id())
        .orElseThrow(
            () ->
                new BackupRestoreException(
                    UndoFailureKind.BACKUP_MISSING, "no backup for audit record " + record.id()));
  }

  private void notifyAffectedUser(UndoAction action, AuditRecord record) {
    if (record.actorUserId() == null) {
      return;
    }
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("original_action", record.actionKind().name());
    metadata.put("entity_type", record.entityType());
    metadata.put("entity_id", record.entityId());
    metadata.put("admin_user_id", action.performedByAdminId());
    metadata.put("complexity", record.tier().name());
    final StringBuilder message =
        new StringBuilder(undoMessage(record.actionKind()))
            .append(" (")
            .append(record.description())
            .append(").");
    if (action.reason() != null && !action.reason().isBlank()) {
      message.append(" Reason: ").append(action.reason());
    }
    notificationCenter.create(
        record.actorUserId(),
        NotificationType.UNDO_PERFORMED,
        undoTitle(record.actionKind()),
        message.toString(),
        NotificationPriority.HIGH,
        action.id(),
        metadata,
        null);
  }

  private void recordUndo(UndoAction action, AuditRecord record) {
    auditRecorder.record(
        AuditEntry.builder()
            .actorUserId(record.actorUserId())
            .adminUserId(action.performedByAdminId())
            .actionKind(inverseOf(record.actionKind()))
            .entityType(record.entityType())
            .entityId(record.entityId())
            .description("Undo of " + record.actionKind() + ": " + record.description())
            .context("undo_action_id=" + action.id() + " audit_record_id=" + record.id())
            .undoable(false)
            .notifyAffectedUser(false)
            .build());
  }

  private void recordFailure(
      UndoAction action,
      AuditRecord record,
      UndoFailureKind failureKind,
      RuntimeException cause,
      ExecutionLog log) {
    log.add("failed: " + failureKind + " " + cause.getMessage());
    newTransaction()
        .executeWithoutResult(
            status -> {
              undoActionRepository.markFailed(
                  action.id(),
                  failureKind,
                  truncateError(cause.getMessage()),
                  log.text(),
                  Instant.now(clock));
              if (DOWNGRADING_FAILURES.contains(failureKind)
                  && auditRecordRepository.markNotUndoable(record.id()) == 1) {
                groupTracker.memberNoLongerUndoable(record.groupId());
              }
            });
    logger.warn(
        "undo failed id={} auditRecordId={} failureKind={} retryable={}",
        action.id(),
        record.id(),
        failureKind,
        failureKind.isRetryable(),
        cause);
  }

  private static UndoFailureKind failureKindOf(RuntimeException ex) {
    if (ex instanceof BackupRestoreException restoreFailure) {
      return restoreFailure.failureKind();
    }
    if (ex instanceof UndoStepException stepFailure) {
      return stepFailure.failureKind();
    }
    if (ex instanceof DuplicateKeyException) {
      // Another action reached COMPLETED first; the partial unique index rejected this one.
      return UndoFailureKind.RACE_LOST;
    }
    return UndoFailureKind.RESTORE_FAILED;
  }

  private UndoAction finish(UUID undoActionId, Instant startedAt) {
    final UndoAction result = load(undoActionId);
    metrics.recordUndoOutcome(result.status(), Duration.between(startedAt, Instant.now(clock)));
    return result;
  }

  public UndoAction find(UUID undoActionId) {
    return load(undoActionId);
  }

  private UndoAction load(UUID undoActionId) {
    return undoActionRepository
        .findById(undoActionId)
        .orElseThrow(() -> new UndoActionNotFoundException(undoActionId));
  }

  private TransactionTemplate newTransaction() {
    // Each step commits on its own even when the caller already holds a transaction.
    final TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    return template;
  }

  private String writePreview(UndoPreview preview) {
    try {
      return objectMapper.writeValueAsString(preview);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize undo preview", ex);
    }
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  static ActionKind inverseOf(ActionKind kind) {
    return switch (kind) {
      case CREATE -> ActionKind.DELETE;
      case DELETE -> ActionKind.CREATE;
      default -> ActionKind.UPDATE;
    };
  }

  private static String undoTitle(ActionKind kind) {
    return switch (kind) {
      case CREATE -> "Creation undone by an administrator";
      case UPDATE -> "Changes undone by an administrator";
      case DELETE -> "Deletion undone by an administrator";
      default -> "Action undone by an administrator";
    };
  }

  private static String undoMessage(ActionKind kind) {
    return switch (kind) {
      case CREATE -> "Something you created was removed by an administrator";
      case UPDATE -> "Your changes were reverted to their previous values";
      case DELETE -> "Something you deleted was restored by an administrator";
      default -> "One of your actions was undone by an administrator";
    };
  }

  private static final class ExecutionLog {
    private final List<String> lines = new ArrayList<>();

    void add(String line) {
      lines.add(line);
    }

    String text() {
      return String.join("\n", lines);
    }
  }
}
