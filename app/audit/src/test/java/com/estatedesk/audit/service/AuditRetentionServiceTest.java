/*
 * Where: audit retention tests
 * What: verifies the sweep removes only expired rows and their backup directories
 * Why: undo eligibility of live records must survive every cleanup run
 */
package com.estatedesk.audit.service;

import static com.estatedesk.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;

import com.estatedesk.audit.AbstractPostgresContainerTest;
import com.estatedesk.audit.config.AuditBackupProperties;
import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.DataBackup;
import com.estatedesk.audit.model.NotificationType;
import com.estatedesk.audit.model.RequestMetadata;
import com.estatedesk.audit.model.ReversibilityTier;
import com.estatedesk.audit.model.UndoAction;
import com.estatedesk.audit.model.UndoFailureKind;
import com.estatedesk.audit.model.UndoStatus;
import com.estatedesk.audit.repository.AuditRecordRepository;
import com.estatedesk.audit.repository.DataBackupRepository;
import com.estatedesk.audit.repository.TransactionGroupRepository;
import com.estatedesk.audit.repository.UndoActionRepository;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(properties = "audit.retention.purge-records=true")
@ActiveProfiles("test")
class AuditRetentionServiceTest extends AbstractPostgresContainerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-02T09:00:00Z");

  @TestConfiguration
  static class FixedClockConfig {
    @Bean(name = "testClock")
    @Primary
    Clock clock() {
      return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    }
  }

  @Autowired private AuditRetentionService retentionService;
  @Autowired private AuditRecordRepository auditRecordRepository;
  @Autowired private DataBackupRepository backupRepository;
  @Autowired private TransactionGroupRepository groupRepository;
  @Autowired private UndoActionRepository undoActionRepository;
  @Autowired private NotificationCenter notificationCenter;
  @Autowired private AuditBackupProperties backupProperties;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM user_notifications", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM audit_records", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM transaction_groups", new MapSqlParameterSource());
  }

  @Test
  void cleanupRemovesExpiredRowsAndBackupDirectories() throws IOException {
    final AuditRecord expired = insertRecord("u-old", FIXED_NOW.minus(Duration.ofDays(8)));
    final AuditRecord live = insertRecord("u-new", FIXED_NOW.minus(Duration.ofDays(1)));
    final Path expiredFiles = backupProperties.rootDirectory().resolve("photo").resolve("u-old");
    Files.createDirectories(expiredFiles);
    Files.writeString(expiredFiles.resolve("a.jpg"), "x", StandardCharsets.UTF_8);
    backupRepository.insert(backup(expired, expiredFiles.toString()));
    backupRepository.insert(backup(live, null));

    notificationCenter.create(
        "owner-1", NotificationType.SYSTEM_ALERT, "old", "old", null, null, null, Duration.ZERO);
    notificationCenter.create(
        "owner-1", NotificationType.SYSTEM_ALERT, "kept", "kept", null, null, null, Duration.ZERO);
    // The center never hands out an already expired notification, so age one by hand.
    jdbcTemplate.update(
        "UPDATE user_notifications SET expires_at = :expiresAt WHERE title = 'old'",
        new MapSqlParameterSource().addValue("expiresAt", toTimestamp(FIXED_NOW.minusSeconds(1))));

    final AuditRetentionService.RetentionSweepResult result = retentionService.cleanup();

    assertThat(result.backups()).isEqualTo(1);
    assertThat(result.notifications()).isEqualTo(1);
    assertThat(result.records()).isEqualTo(1);
    assertThat(expiredFiles).doesNotExist();
    assertThat(auditRecordRepository.findById(expired.id())).isEmpty();
    assertThat(auditRecordRepository.findById(live.id())).isPresent();
    assertThat(backupRepository.findByAuditRecordId(live.id())).isPresent();
  }

  @Test
  void cleanupDropsEmptyGroupsOlderThanTheWindow() {
    groupRepository.insertIfAbsent("stale-group", "Stale", null, "owner-1", FIXED_NOW.minus(Duration.ofDays(8)));
    groupRepository.insertIfAbsent("fresh-group", "Fresh", null, "owner-1", FIXED_NOW.minus(Duration.ofDays(1)));

    final AuditRetentionService.RetentionSweepResult result = retentionService.cleanup();

    assertThat(result.groups()).isEqualTo(1);
    assertThat(groupRepository.findById("stale-group")).isEmpty();
    assertThat(groupRepository.findById("fresh-group")).isPresent();
  }

  @Test
  void cleanupFailsUndoActionsStuckInExecuting() {
    final AuditRecord record = insertRecord("u-stuck", FIXED_NOW.minus(Duration.ofHours(2)));
    final UUID stuckId = UUID.randomUUID();
    undoActionRepository.insert(
        new UndoAction(
            stuckId,
            record.id(),
            "admin-1",
            UndoStatus.EXECUTING,
            "stuck",
            null,
            "started",
            null,
            null,
            FIXED_NOW.minus(Duration.ofHours(1)),
            FIXED_NOW.minus(Duration.ofHours(1)),
            null,
            null,
            null));

    final AuditRetentionService.RetentionSweepResult result = retentionService.cleanup();

    assertThat(result.staleExecuting()).isEqualTo(1);
    assertThat(auditRecordRepository.findById(record.id())).isPresent();
    final UndoAction stuck = undoActionRepository.findById(stuckId).orElseThrow();
    assertThat(stuck.status()).isEqualTo(UndoStatus.FAILED);
    assertThat(stuck.failureKind()).isEqualTo(UndoFailureKind.RESTORE_FAILED);
    assertThat(stuck.completedAt()).isEqualTo(FIXED_NOW);
    assertThat(stuck.executionLog()).startsWith("started").contains("did not finish");

    assertThat(retentionService.cleanup().staleExecuting()).isZero();
  }

  private AuditRecord insertRecord(String entityId, Instant createdAt) {
    final AuditRecord record =
        new AuditRecord(
            UUID.randomUUID(),
            "group-" + entityId,
            "owner-1",
            null,
            ActionKind.DELETE,
            "photo",
            entityId,
            "Deleted photo " + entityId,
            null,
            null,
            null,
            List.of(),
            true,
            ReversibilityTier.SIMPLE,
            RequestMetadata.empty(),
            createdAt,
            createdAt.plus(Duration.ofDays(7)));
    auditRecordRepository.insert(record);
    return record;
  }

  private static DataBackup backup(AuditRecord record, String filesPath) {
    final byte[] payload = "{}".getBytes(StandardCharsets.UTF_8);
    return new DataBackup(
        UUID.randomUUID(),
        record.id(),
        record.entityType(),
        record.entityId(),
        payload,
        null,
        filesPath,
        payload.length,
        false,
        record.createdAt(),
        record.expiresAt(),
        null);
  }
}
