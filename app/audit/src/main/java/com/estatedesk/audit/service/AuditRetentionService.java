/*
 * Where: audit service layer
 * What: sweeps expired notifications, backups (rows then files), stuck undos and, optionally, audit records
 * Why: read paths already hide expired rows; this keeps storage bounded
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.config.AuditRetentionProperties;
import com.estatedesk.audit.repository.AuditRecordRepository;
import com.estatedesk.audit.repository.DataBackupRepository;
import com.estatedesk.audit.repository.TransactionGroupRepository;
import com.estatedesk.audit.repository.UndoActionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class AuditRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(AuditRetentionService.class);

  private final NotificationCenter notificationCenter;
  private final DataBackupRepository backupRepository;
  private final AuditRecordRepository auditRecordRepository;
  private final TransactionGroupRepository groupRepository;
  private final UndoActionRepository undoActionRepository;
  private final BackupStore backupStore;
  private final AuditRetentionProperties properties;
  private final AuditMetrics metrics;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;

  public RetentionSweepResult cleanup() {
    final Instant now = Instant.now(clock);
    final Integer failedStale =
        new TransactionTemplate(transactionManager)
            .execute(
                status ->
                    undoActionRepository.failExecutingStartedBefore(
                        now.minus(properties.staleExecutingAfter()),
                        "undo did not finish within " + properties.staleExecutingAfter(),
                        now));
    final int staleExecuting = failedStale == null ? 0 : failedStale;
    metrics.updateStaleExecuting(staleExecuting);
    if (staleExecuting > 0) {
      logger.error(
          "audit retention failed undo actions stuck in EXECUTING count={} olderThan={}",
          staleExecuting,
          properties.staleExecutingAfter());
    }

    final int deletedNotifications = notificationCenter.deleteExpired(now);
    // Rows go first so a crash never leaves a row pointing at deleted files.
    final List<String> filesPaths =
        new TransactionTemplate(transactionManager)
            .execute(status -> backupRepository.deleteExpiredReturningFilesPaths(now));
    final List<String> expiredFiles = filesPaths == null ? List.of() : filesPaths;
    final long purgedDirectories =
        expiredFiles.stream().filter(Objects::nonNull).filter(backupStore::purgeFiles).count();

    int deletedRecords = 0;
    int deletedGroups = 0;
    if (properties.purgeRecords()) {
      deletedRecords = auditRecordRepository.deleteExpired(now);
      deletedGroups = groupRepository.deleteEmptyCreatedBefore(now.minus(properties.window()));
    }
    logger.info(
        "audit retention cleanup notifications={} backups={} backupDirectories={} records={} groups={}",
        deletedNotifications,
        expiredFiles.size(),
        purgedDirectories,
        deletedRecords,
        deletedGroups);
    return new RetentionSweepResult(
        deletedNotifications, expiredFiles.size(), deletedRecords, deletedGroups, staleExecuting);
  }

  public record RetentionSweepResult(
      int notifications, int backups, int records, int groups, int staleExecuting) {}
}
