/*
 * Where: audit service layer
 * What: rolls audit records sharing a correlation id up into a transaction group
 * Why: admins review and undo multi-step business operations as one unit
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.TransactionGroup;
import com.estatedesk.audit.repository.TransactionGroupRepository;
import com.estatedesk.common.CorrelationIds;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class TransactionGroupTracker {

  private static final Logger logger = LoggerFactory.getLogger(TransactionGroupTracker.class);

  private final TransactionGroupRepository groupRepository;
  private final Clock clock;

  /**
   * Adds the record to its group, creating the group on first sight. Touching the same record
   * twice is a no-op and returns false.
   */
  @Transactional
  public boolean touch(String groupId, AuditRecord record) {
    final Instant now = Instant.now(clock);
    if (groupRepository.insertIfAbsent(groupId, defaultName(groupId), null, record.actorUserId(), now)) {
      logger.debug("transaction group created groupId={}", groupId);
    }
    if (!groupRepository.insertMember(groupId, record.id(), now)) {
      return false;
    }
    groupRepository.applyMember(groupId, record.undoable(), record.tier(), record.actorUserId(), now);
    return true;
  }

  /** Opens a named group ahead of a multi-step operation and returns its id. */
  @Transactional
  public String open(String name, String description, String primaryUserId) {
    final String groupId = CorrelationIds.newCorrelationId();
    final String resolvedName = name == null || name.isBlank() ? defaultName(groupId) : name;
    groupRepository.insertIfAbsent(groupId, resolvedName, description, primaryUserId, Instant.now(clock));
    return groupId;
  }

  /** Call once per member whose record was downgraded to not undoable after it was touched. */
  @Transactional
  public void memberNoLongerUndoable(String groupId) {
    groupRepository.removeUndoableMember(groupId, Instant.now(clock));
    logger.debug("transaction group member downgraded groupId={}", groupId);
  }

  /** Returns true when this call flipped the group to undone. */
  @Transactional
  public boolean markUndoneIfAllReversed(String groupId) {
    return groupRepository.markUndoneIfAllReversed(groupId, Instant.now(clock)) == 1;
  }

  @Transactional(readOnly = true)
  public Optional<TransactionGroup> find(String groupId) {
    return groupRepository.findById(groupId);
  }

  @Transactional(readOnly = true)
  public List<TransactionGroup> findAll(Collection<String> groupIds) {
    return groupRepository.findAllByIds(groupIds);
  }

  static String defaultName(String groupId) {
    return "Transaction " + CorrelationIds.shortForm(groupId);
  }
}
