/*
 * Where: audit service layer
 * What: creates and serves per-user notifications (bell list, read/archive, summary)
 * Why: users must learn when an administrator changed or restored their data
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.config.AuditNotificationProperties;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.NotificationPriority;
import com.estatedesk.audit.model.NotificationType;
import com.estatedesk.audit.model.UserNotification;
import com.estatedesk.audit.repository.UserNotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationCenter {

  private static final Logger logger = LoggerFactory.getLogger(NotificationCenter.class);

  static final int SUMMARY_RECENT_LIMIT = 3;
  static final int MAX_PAGE_SIZE = 100;
  static final String CATEGORY_ADMIN_ACTION = "admin_action";
  static final String CATEGORY_SYSTEM = "system";

  private final UserNotificationRepository notificationRepository;
  private final AuditNotificationProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Stores a notification. A null {@code ttl} uses the configured default; a zero or negative one
   * means the notification never expires.
   */
  @Transactional
  public UserNotification create(
      String userId,
      NotificationType type,
      String title,
      String message,
      NotificationPriority priority,
      UUID linkedUndoActionId,
      Map<String, Object> metadata,
      Duration ttl) {
    requireText(userId, "userId");
    requireText(title, "title");
    requireText(message, "message");
    if (type == null) {
      throw new IllegalArgumentException("notification type is required");
    }
    final Instant now = Instant.now(clock);
    final Duration effectiveTtl = ttl == null ? properties.defaultTtl() : ttl;
    final UserNotification notification =
        new UserNotification(
            UUID.randomUUID(),
            userId,
            type,
            title,
            message,
            linkedUndoActionId,
            priority == null ? NotificationPriority.NORMAL : priority,
            categoryOf(type),
            null,
            false,
            null,
            false,
            null,
            effectiveTtl.isNegative() || effectiveTtl.isZero() ? null : now.plus(effectiveTtl),
            writeMetadata(metadata),
            now);
    notificationRepository.insert(notification);
    logger.debug(
        "notification created id={} userId={} type={} priority={}",
        notification.id(),
        userId,
        type,
        notification.priority());
    return notification;
  }

  /** Tells the affected user that an administrator acted on their data. */
  @Transactional
  public UserNotification notifyAdminAction(AuditRecord record) {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("audit_record_id", record.id().toString());
    metadata.put("action_kind", record.actionKind().name());
    metadata.put("entity_type", record.entityType());
    metadata.put("entity_id", record.entityId());
    metadata.put("admin_user_id", record.adminUserId());
    return create(
        record.actorUserId(),
        NotificationType.ADMIN_ACTION,
        "An administrator changed your data",
        "An administrator performed an action on your account: " + record.description(),
        NotificationPriority.HIGH,
        null,
        metadata,
        null);
  }

  @Transactional(readOnly = true)
  public NotificationPage listUnread(String userId, int limit, int offset) {
    return list(userId, true, limit, offset);
  }

  @Transactional(readOnly = true)
  public NotificationPage list(String userId, boolean unreadOnly, int limit, int offset) {
    requireText(userId, "userId");
    if (limit <= 0 || limit > MAX_PAGE_SIZE) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    final Instant now = Instant.now(clock);
    final List<UserNotification> items =
        notificationRepository.findActive(userId, unreadOnly, now, limit, offset);
    final int totalCount = notificationRepository.countActive(userId, unreadOnly, now);
    final int unreadCount =
        unreadOnly ? totalCount : notificationRepository.countActive(userId, true, now);
    return new NotificationPage(items, totalCount, unreadCount, offset + items.size() < totalCount);
  }

  @Transactional
  public int markRead(String userId, Collection<UUID> ids) {
    requireText(userId, "userId");
    return notificationRepository.markRead(userId, ids, Instant.now(clock));
  }

  @Transactional
  public int markAllRead(String userId) {
    requireText(userId, "userId");
    return notificationRepository.markAllRead(userId, Instant.now(clock));
  }

  @Transactional
  public int archive(String userId, Collection<UUID> ids) {
    requireText(userId, "userId");
    return notificationRepository.archive(userId, ids, Instant.now(clock));
  }

  @Transactional
  public int archiveOlderThan(String userId, int days) {
    requireText(userId, "userId");
    if (days < 0) {
      throw new IllegalArgumentException("days must not be negative");
    }
    final Instant now = Instant.now(clock);
    return notificationRepository.archiveCreatedBefore(userId, now.minus(Duration.ofDays(days)), now);
  }

  @Transactional(readOnly = true)
  public NotificationSummary summary(String userId) {
    requireText(userId, "userId");
    final Instant now = Instant.now(clock);
    final Map<NotificationType, Integer> countsByType =
        notificationRepository.countUnreadByType(userId, now);
    final int totalUnread = countsByType.values().stream().mapToInt(Integer::intValue).sum();
    final int urgentCount =
        notificationRepository.countUnreadWithPriority(userId, urgentPriorities(), now);
    final List<UserNotification> mostRecent =
        notificationRepository.findActive(userId, true, now, SUMMARY_RECENT_LIMIT, 0);
    return new NotificationSummary(totalUnread, urgentCount, countsByType, mostRecent);
  }

  @Transactional
  public int deleteExpired(Instant now) {
    return notificationRepository.deleteExpired(now);
  }

  private static Collection<NotificationPriority> urgentPriorities() {
    final EnumSet<NotificationPriority> urgent = EnumSet.noneOf(NotificationPriority.class);
    Arrays.stream(NotificationPriority.values())
        .filter(NotificationPriority::isUrgent)
        .forEach(urgent::add);
    return urgent;
  }

  private static String categoryOf(NotificationType type) {
    return switch (type) {
      case ADMIN_ACTION, UNDO_PERFORMED -> CATEGORY_ADMIN_ACTION;
      case SYSTEM_ALERT, ACCOUNT_UPDATE -> CATEGORY_SYSTEM;
    };
  }

  private String writeMetadata(Map<String, Object> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize notification metadata", ex);
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
