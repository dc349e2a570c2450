/*
 * Where: audit read side
 * What: per-user timeline grouped by transaction, undo history, search and statistics
 * Why: admins decide what to undo from here, so every member carries its undo eligibility
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.AdminRole;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.TransactionGroup;
import com.estatedesk.audit.model.UndoAction;
import com.estatedesk.audit.model.UndoStatus;
import com.estatedesk.audit.repository.AuditRecordRepository;
import com.estatedesk.audit.repository.UndoActionRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class TimelineQueryService {

  static final int MAX_DAYS = 365;
  static final int MAX_PAGE_SIZE = 100;

  private final AuditRecordRepository auditRecordRepository;
  private final UndoActionRepository undoActionRepository;
  private final TransactionGroupTracker groupTracker;
  private final UndoAnalyzer undoAnalyzer;
  private final Clock clock;

  /**
   * Groups the user's records by transaction. Groups are ordered by their most recent member,
   * newest first; members are newest first too. Without a caller role nothing is undoable by role.
   */
  @Transactional(readOnly = true)
  public List<TransactionGroupView> getTimeline(
      String userId, int sinceDays, boolean includeNonUndoable, AdminRole callerRole) {
    requireText(userId, "userId");
    requireDays(sinceDays);
    final Instant since = Instant.now(clock).minus(Duration.ofDays(sinceDays));
    final List<AuditRecord> records =
        auditRecordRepository.findByActorSince(userId, since, !includeNonUndoable);
    if (records.isEmpty()) {
      return List.of();
    }

    final Map<UUID, List<UndoAction>> undoByRecord =
        undoActionRepository
            .findByAuditRecordIds(records.stream().map(AuditRecord::id).toList())
            .stream()
            .collect(Collectors.groupingBy(UndoAction::auditRecordId));
    // Records arrive newest first, so insertion order is already the group order.
    final Map<String, List<AuditRecordView>> members = new LinkedHashMap<>();
    for (AuditRecord record : records) {
      final List<UndoAction> undoActions = undoByRecord.getOrDefault(record.id(), List.of());
      members
          .computeIfAbsent(record.groupId(), ignored -> new ArrayList<>())
          .add(toView(record, undoActions, callerRole));
    }
    final Map<String, TransactionGroup> groups =
        groupTracker.findAll(members.keySet()).stream()
            .collect(Collectors.toMap(TransactionGroup::groupId, Function.identity()));

    final List<TransactionGroupView> views = new ArrayList<>(members.size());
    members.forEach(
        (groupId, actions) -> views.add(toGroupView(groupId, groups.get(groupId), actions)));
    return views;
  }

  @Transactional(readOnly = true)
  public UndoHistoryPage undoHistory(String userId, int limit, int offset) {
    requireText(userId, "userId");
    requirePage(limit, offset);
    final List<UndoAction> actions = undoActionRepository.findByActorUserId(userId, limit, offset);
    final Map<UUID, AuditRecord> records =
        auditRecordRepository
            .findAllByIds(actions.stream().map(UndoAction::auditRecordId).distinct().toList())
            .stream()
            .collect(Collectors.toMap(AuditRecord::id, Function.identity()));
    final List<UndoHistoryEntry> items =
        actions.stream()
            .map(action -> toHistoryEntry(action, records.get(action.auditRecordId())))
            .filter(Objects::nonNull)
            .toList();
    final int total = undoActionRepository.countByActorUserId(userId);
    return new UndoHistoryPage(items, total, offset + actions.size() < total);
  }

  @Transactional(readOnly = true)
  public List<AuditRecord> search(AuditSearchCriteria criteria) {
    requireDays(criteria.days());
    final Instant since = Instant.now(clock).minus(Duration.ofDays(criteria.days()));
    return auditRecordRepository.search(
        criteria.query(),
        criteria.entityType(),
        criteria.actionKind(),
        criteria.userId(),
        since,
        criteria.limit());
  }

  @Transactional(readOnly = true)
  public AuditStatistics statistics(int days) {
    requireDays(days);
    final Instant since = Instant.now(clock).minus(Duration.ofDays(days));
    final int total = auditRecordRepository.countSince(since, false);
    final int undoable = auditRecordRepository.countSince(since, true);
    final Map<ActionKind, Integer> byKind = auditRecordRepository.countByKindSince(since);
    final Map<UndoStatus, Integer> undoByStatus = undoActionRepository.countByStatusSince(since);
    final int completed = undoByStatus.getOrDefault(UndoStatus.COMPLETED, 0);
    final int failed = undoByStatus.getOrDefault(UndoStatus.FAILED, 0);
    final int attempts = undoByStatus.values().stream().mapToInt(Integer::intValue).sum();
    return new AuditStatistics(
        days,
        total,
        undoable,
        ratio(undoable, total),
        attempts,
        completed,
        failed,
        ratio(completed, completed + failed),
        byKind);
  }

  private AuditRecordView toView(AuditRecord record, List<UndoAction> undoActions, AdminRole callerRole) {
    final boolean completed =
        undoActions.stream().anyMatch(action -> action.status() == UndoStatus.COMPLETED);
    return new AuditRecordView(
        record.id(),
        record.groupId(),
        record.actorUserId(),
        record.adminUserId(),
        record.actionKind(),
        record.entityType(),
        record.entityId(),
        record.description(),
        record.context(),
        record.beforeSnapshot(),
        record.afterSnapshot(),
        record.undoable(),
        record.tier(),
        record.createdAt(),
        record.expiresAt(),
        callerRole != null && undoAnalyzer.canUndoByRole(record, callerRole),
        undoAnalyzer.isStillUndoable(record, completed),
        impactOf(record),
        undoActions.stream().map(UndoActionSummary::of).toList());
  }

  static ImpactPreview impactOf(AuditRecord record) {
    final String primary =
        record.entityId() == null ? record.entityType() : record.entityType() + " " + record.entityId();
    final int related = record.relatedEntities().size();
    final RiskLevel risk = RiskLevel.fromTier(record.tier());
    final String summary =
        related == 0
            ? record.actionKind() + " " + primary
            : record.actionKind() + " " + primary + " affecting " + related + " related entit(ies)";
    return new ImpactPreview(primary, related, risk, summary);
  }

  private TransactionGroupView toGroupView(
      String groupId, TransactionGroup group, List<AuditRecordView> actions) {
    final Instant latest = actions.get(0).createdAt();
    if (group == null) {
      return new TransactionGroupView(
          groupId,
          TransactionGroupTracker.defaultName(groupId),
          null,
          null,
          actions.size(),
          (int) actions.stream().filter(AuditRecordView::undoable).count(),
          actions.stream()
              .map(AuditRecordView::tier)
              .reduce((left, right) -> left.max(right))
              .orElseThrow(),
          actions.stream().allMatch(AuditRecordView::undoable),
          false,
          latest,
          actions);
    }
    return new TransactionGroupView(
        group.groupId(),
        group.name(),
        group.description(),
        group.primaryUserId(),
        group.totalActions(),
        group.undoableActions(),
        group.aggregateTier(),
        group.allUndoable(),
        group.undone(),
        latest,
        actions);
  }

  private static UndoHistoryEntry toHistoryEntry(UndoAction action, AuditRecord record) {
    if (record == null) {
      return null;
    }
    return new UndoHistoryEntry(
        UndoActionSummary.of(action),
        record.id(),
        record.actionKind(),
        record.entityType(),
        record.entityId(),
        record.description());
  }

  private static double ratio(int part, int whole) {
    return whole == 0 ? 0.0 : (double) part / whole;
  }

  private static void requireDays(int days) {
    if (days <= 0 || days > MAX_DAYS) {
      throw new IllegalArgumentException("days must be between 1 and " + MAX_DAYS);
    }
  }

  private static void requirePage(int limit, int offset) {
    if (limit <= 0 || limit > MAX_PAGE_SIZE) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
