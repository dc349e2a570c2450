/*
 * Where: audit service layer
 * What: the write half of AuditRecorder (record row, backup, group rollup, admin notification)
 * Why: runs in a savepoint of the caller's transaction so a failure here can be rolled back alone
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.config.AuditNotificationProperties;
import com.estatedesk.audit.config.AuditRetentionProperties;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.RequestMetadata;
import com.estatedesk.audit.model.ReversibilityTier;
import com.estatedesk.audit.repository.AuditRecordRepository;
import com.estatedesk.common.CorrelationIds;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AuditRecordWriter {

  private static final Logger logger = LoggerFactory.getLogger(AuditRecordWriter.class);

  private final AuditRecordRepository auditRecordRepository;
  private final ComplexityClassifier complexityClassifier;
  private final BackupStore backupStore;
  private final TransactionGroupTracker groupTracker;
  private final NotificationCenter notificationCenter;
  private final AuditRetentionProperties retentionProperties;
  private final AuditNotificationProperties notificationProperties;
  private final AuditMetrics metrics;
  private final Clock clock;

  @Transactional(propagation = Propagation.NESTED)
  public AuditRecord write(AuditEntry entry, RequestMetadata metadata) {
    final Instant now = Instant.now(clock);
    final boolean mutating = entry.actionKind().isMutating();
    final ReversibilityTier tier;
    if (!mutating) {
      tier = ReversibilityTier.IMPOSSIBLE;
    } else if (entry.tierOverride() != null) {
      tier = entry.tierOverride();
    } else {
      tier =
          complexityClassifier.classify(
              entry.actionKind(), entry.entityType(), entry.relatedEntities());
    }
    final String groupId =
        entry.groupId() == null || entry.groupId().isBlank()
            ? CorrelationIds.newCorrelationId()
            : entry.groupId();
    AuditRecord record =
        new AuditRecord(
            UUID.randomUUID(),
            groupId,
            entry.actorUserId(),
            entry.adminUserId(),
            entry.actionKind(),
            entry.entityType(),
            entry.entityId(),
            entry.description(),
            entry.context(),
            entry.beforeSnapshot(),
            entry.afterSnapshot(),
            entry.relatedEntities(),
            mutating && entry.undoable(),
            tier,
            metadata,
            now,
            now.plus(retentionProperties.window()));
    auditRecordRepository.insert(record);

    if (record.undoable() && entry.beforeSnapshot() != null && !entry.beforeSnapshot().isNull()) {
      record = snapshotOrDowngrade(record);
    }
    groupTracker.touch(groupId, record);
    if (entry.isAdminActionOnOtherUser()
        && entry.notifyAffectedUser()
        && notificationProperties.notifyAdminActions()) {
      notificationCenter.notifyAdminAction(record);
    }
    return record;
  }

  private AuditRecord snapshotOrDowngrade(AuditRecord record) {
    try {
      backupStore.snapshot(
          record.id(),
          record.entityType(),
          record.entityId(),
          record.beforeSnapshot(),
          record.relatedEntities(),
          record.expiresAt());
      return record;
    } catch (BackupSnapshotException ex) {
      // The record survives; it just can no longer be undone.
      logger.warn(
          "audit backup failed, record kept as not undoable id={} entityType={} entityId={}",
          record.id(),
          record.entityType(),
          record.entityId(),
          ex);
      metrics.recordBackupFailure();
      auditRecordRepository.markNotUndoable(record.id());
      return record.withUndoable(false);
    }
  }
}
