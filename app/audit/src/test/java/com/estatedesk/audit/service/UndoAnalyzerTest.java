package com.estatedesk.audit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.estatedesk.audit.AbstractPostgresContainerTest;
import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.AdminRole;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.RelatedEntity;
import com.estatedesk.audit.model.RequestMetadata;
import com.estatedesk.audit.model.ReversibilityTier;
import com.estatedesk.audit.model.UndoFailureKind;
import com.estatedesk.audit.repository.AuditRecordRepository;
import com.estatedesk.audit.repository.JdbcEntityStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;
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

@SpringBootTest
@ActiveProfiles("test")
class UndoAnalyzerTest extends AbstractPostgresContainerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-02T09:00:00Z");

  @TestConfiguration
  static class FixedClockConfig {
    @Bean(name = "testClock")
    @Primary
    Clock clock() {
      return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    }
  }

  @Autowired private UndoAnalyzer undoAnalyzer;
  @Autowired private AuditRecorder auditRecorder;
  @Autowired private AuditRecordRepository auditRecordRepository;
  @Autowired private JdbcEntityStore entityStore;
  @Autowired private ObjectMapper objectMapper;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM user_notifications", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM audit_records", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM transaction_groups", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM entity_documents", new MapSqlParameterSource());
  }

  @Test
  void buildingDeleteWithManyRelatedEntitiesNeedsSuperAdmin() {
    final List<RelatedEntity> units =
        IntStream.range(0, 8).mapToObj(i -> RelatedEntity.of("unit", "unit-" + i)).toList();
    final AuditRecord record =
        auditRecorder
            .record(
                AuditEntry.builder()
                    .actorUserId("owner-1")
                    .actionKind(ActionKind.DELETE)
                    .entityType("building")
                    .entityId("b-1")
                    .description("Deleted building with units")
                    .beforeSnapshot(state("name", "Tower"))
                    .relatedEntities(units)
                    .build())
            .orElseThrow();

    assertThat(record.tier()).isEqualTo(ReversibilityTier.COMPLEX);
    assertThat(undoAnalyzer.canUndoByRole(record.id(), AdminRole.SUPPORT)).isFalse();
    assertThat(undoAnalyzer.canUndoByRole(record.id(), AdminRole.SUPER_ADMIN)).isTrue();
    assertThatThrownBy(() -> undoAnalyzer.checkRoleMayUndo(record.id(), AdminRole.SUPPORT))
        .isInstanceOf(UndoPermissionDeniedException.class);

    final UndoRequirements requirements = undoAnalyzer.analyzeRequirements(record.id());
    assertThat(requirements.canUndo()).isTrue();
    assertThat(requirements.requirements()).contains("backup available");
    assertThat(requirements.warnings()).anyMatch(warning -> warning.startsWith("complex action"));
  }

  @Test
  void recordPastItsRetentionWindowIsBlockedAsExpired() {
    final Instant createdAt = FIXED_NOW.minus(Duration.ofDays(8));
    final AuditRecord record =
        new AuditRecord(
            UUID.randomUUID(),
            "group-old",
            "owner-1",
            null,
            ActionKind.UPDATE,
            "user",
            "u-1",
            "Changed name",
            null,
            state("name", "Old"),
            state("name", "New"),
            List.of(),
            true,
            ReversibilityTier.SIMPLE,
            RequestMetadata.empty(),
            createdAt,
            createdAt.plus(Duration.ofDays(7)));
    auditRecordRepository.insert(record);

    final UndoRequirements requirements = undoAnalyzer.analyzeRequirements(record.id());

    assertThat(requirements.canUndo()).isFalse();
    assertThat(requirements.blockers())
        .extracting(UndoBlocker::kind)
        .containsExactly(UndoFailureKind.EXPIRED);
    assertThat(undoAnalyzer.isStillUndoable(record.id())).isFalse();
  }

  @Test
  void notUndoableRecordReportsOnlyThatBlocker() {
    final AuditRecord record =
        auditRecorder
            .record(
                AuditEntry.builder()
                    .actorUserId("owner-1")
                    .actionKind(ActionKind.UPDATE)
                    .entityType("user")
                    .entityId("u-1")
                    .description("Password changed")
                    .undoable(false)
                    .build())
            .orElseThrow();

    final UndoRequirements requirements = undoAnalyzer.analyzeRequirements(record.id());

    assertThat(requirements.canUndo()).isFalse();
    assertThat(requirements.blockers())
        .extracting(UndoBlocker::kind)
        .containsExactly(UndoFailureKind.NOT_UNDOABLE);
  }

  @Test
  void deleteIsBlockedWhileEntityExistsAgain() {
    final AuditRecord record = recordDelete("user", "u-5");
    entityStore.restore("user", "u-5", state("name", "Recreated"));

    final UndoRequirements requirements = undoAnalyzer.analyzeRequirements(record.id());

    assertThat(requirements.canUndo()).isFalse();
    assertThat(requirements.firstBlocker())
        .hasValueSatisfying(blocker -> assertThat(blocker.kind()).isEqualTo(UndoFailureKind.ENTITY_CONFLICT));
  }

  @Test
  void createIsBlockedOnceEntityIsGone() {
    final AuditRecord record =
        auditRecorder
            .record(
                AuditEntry.builder()
                    .actorUserId("owner-1")
                    .actionKind(ActionKind.CREATE)
                    .entityType("unit")
                    .entityId("unit-1")
                    .description("Created unit")
                    .afterSnapshot(state("name", "1A"))
                    .build())
            .orElseThrow();

    final UndoRequirements missing = undoAnalyzer.analyzeRequirements(record.id());
    entityStore.restore("unit", "unit-1", state("name", "1A"));
    final UndoRequirements present = undoAnalyzer.analyzeRequirements(record.id());

    assertThat(missing.blockers())
        .extracting(UndoBlocker::kind)
        .containsExactly(UndoFailureKind.ENTITY_MISSING);
    assertThat(present.canUndo()).isTrue();
  }

  @Test
  void previewDescribesTheInverseOperation() {
    final AuditRecord deleted = recordDelete("user", "u-7");
    final AuditRecord updated =
        auditRecorder
            .record(
                AuditEntry.builder()
                    .actorUserId("owner-1")
                    .actionKind(ActionKind.UPDATE)
                    .entityType("user")
                    .entityId("u-8")
                    .description("Changed phone")
                    .beforeSnapshot(state("phone", "111"))
                    .afterSnapshot(state("phone", "222"))
                    .build())
            .orElseThrow();

    final UndoPreview deletePreview = undoAnalyzer.preview(deleted.id());
    final UndoPreview updatePreview = undoAnalyzer.preview(updated.id());

    assertThat(deletePreview.operation()).isEqualTo(UndoAnalyzer.OPERATION_RECREATE);
    assertThat(deletePreview.affectedData().get("name").asText()).isEqualTo("Gone");
    assertThat(deletePreview.estimatedDuration()).isEqualTo("< 1 minute");
    assertThat(updatePreview.operation()).isEqualTo(UndoAnalyzer.OPERATION_RESTORE);
    assertThat(updatePreview.affectedData().get("phone").asText()).isEqualTo("111");
  }

  @Test
  void unknownRecordIsReportedNotFound() {
    assertThatThrownBy(() -> undoAnalyzer.analyzeRequirements(UUID.randomUUID()))
        .isInstanceOf(AuditRecordNotFoundException.class);
  }

  private AuditRecord recordDelete(String entityType, String entityId) {
    return auditRecorder
        .record(
            AuditEntry.builder()
                .actorUserId("owner-1")
                .actionKind(ActionKind.DELETE)
                .entityType(entityType)
                .entityId(entityId)
                .description("Deleted " + entityType + " " + entityId)
                .beforeSnapshot(state("name", "Gone"))
                .build())
        .orElseThrow();
  }

  private ObjectNode state(String field, String value) {
    return objectMapper.createObjectNode().put(field, value);
  }
}
