package com.estatedesk.audit.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.estatedesk.audit.AbstractPostgresContainerTest;
import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.RequestMetadata;
import com.estatedesk.audit.model.ReversibilityTier;
import com.estatedesk.audit.model.TransactionGroup;
import com.estatedesk.audit.repository.AuditRecordRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class TransactionGroupTrackerTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-02T09:00:00Z");

  @Autowired private TransactionGroupTracker groupTracker;
  @Autowired private AuditRecordRepository auditRecordRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM audit_records", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM transaction_groups", new MapSqlParameterSource());
  }

  @Test
  void touchingTheSameRecordTwiceCountsItOnce() {
    final AuditRecord record = insert("group-1", true, ReversibilityTier.MODERATE);

    assertThat(groupTracker.touch("group-1", record)).isTrue();
    assertThat(groupTracker.touch("group-1", record)).isFalse();

    final TransactionGroup group = groupTracker.find("group-1").orElseThrow();
    assertThat(group.totalActions()).isEqualTo(1);
    assertThat(group.undoableActions()).isEqualTo(1);
    assertThat(group.name()).isEqualTo("Transaction group-1");
  }

  @Test
  void tierOnlyRisesAndUndoabilityOnlyFalls() {
    groupTracker.touch("group-2", insert("group-2", true, ReversibilityTier.COMPLEX));
    groupTracker.touch("group-2", insert("group-2", false, ReversibilityTier.SIMPLE));
    groupTracker.touch("group-2", insert("group-2", true, ReversibilityTier.SIMPLE));

    final TransactionGroup group = groupTracker.find("group-2").orElseThrow();
    assertThat(group.totalActions()).isEqualTo(3);
    assertThat(group.undoableActions()).isEqualTo(2);
    assertThat(group.aggregateTier()).isEqualTo(ReversibilityTier.COMPLEX);
    assertThat(group.allUndoable()).isFalse();
    assertThat(group.canBeFullyUndone()).isFalse();
  }

  @Test
  void openedGroupKeepsItsNameWhenMembersArrive() {
    final String groupId = groupTracker.open("Bulk import", "units from csv", "owner-1");
    groupTracker.touch(groupId, insert(groupId, true, ReversibilityTier.SIMPLE));

    final TransactionGroup group = groupTracker.find(groupId).orElseThrow();
    assertThat(group.name()).isEqualTo("Bulk import");
    assertThat(group.description()).isEqualTo("units from csv");
    assertThat(group.allUndoable()).isTrue();
    assertThat(groupTracker.findAll(List.of(groupId, "missing"))).hasSize(1);
  }

  @Test
  void groupIsNotUndoneWhileMembersRemainUnreversed() {
    groupTracker.touch("group-3", insert("group-3", true, ReversibilityTier.SIMPLE));

    assertThat(groupTracker.markUndoneIfAllReversed("group-3")).isFalse();
    assertThat(groupTracker.find("group-3").orElseThrow().undone()).isFalse();
  }

  @Test
  void memberLosingUndoabilityLowersTheRollup() {
    groupTracker.touch("group-4", insert("group-4", true, ReversibilityTier.SIMPLE));
    groupTracker.touch("group-4", insert("group-4", true, ReversibilityTier.SIMPLE));

    groupTracker.memberNoLongerUndoable("group-4");

    final TransactionGroup group = groupTracker.find("group-4").orElseThrow();
    assertThat(group.totalActions()).isEqualTo(2);
    assertThat(group.undoableActions()).isEqualTo(1);
    assertThat(group.allUndoable()).isFalse();
  }

  private AuditRecord insert(String groupId, boolean undoable, ReversibilityTier tier) {
    final AuditRecord record =
        new AuditRecord(
            UUID.randomUUID(),
            groupId,
            "owner-1",
            null,
            undoable ? ActionKind.UPDATE : ActionKind.READ,
            "unit",
            "unit-1",
            "step",
            null,
            null,
            null,
            List.of(),
            undoable,
            tier,
            RequestMetadata.empty(),
            BASE_TIME,
            BASE_TIME.plus(Duration.ofDays(7)));
    auditRecordRepository.insert(record);
    return record;
  }
}
