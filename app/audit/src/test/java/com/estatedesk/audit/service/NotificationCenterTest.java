package com.estatedesk.audit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.estatedesk.audit.AbstractPostgresContainerTest;
import com.estatedesk.audit.model.NotificationPriority;
import com.estatedesk.audit.model.NotificationType;
import com.estatedesk.audit.model.UserNotification;
import com.estatedesk.audit.repository.UserNotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
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

@SpringBootTest
@ActiveProfiles("test")
class NotificationCenterTest extends AbstractPostgresContainerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-02T09:00:00Z");
  private static final String USER = "owner-1";

  @TestConfiguration
  static class FixedClockConfig {
    @Bean(name = "testClock")
    @Primary
    Clock clock() {
      return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    }
  }

  @Autowired private NotificationCenter notificationCenter;
  @Autowired private UserNotificationRepository notificationRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM user_notifications", new MapSqlParameterSource());
  }

  @Test
  void createAppliesDefaultTtlAndCategory() {
    final UserNotification notification =
        notificationCenter.create(
            USER,
            NotificationType.UNDO_PERFORMED,
            "Deletion undone",
            "Your unit was restored",
            null,
            null,
            Map.of("entity_type", "unit"),
            null);
    final UserNotification permanent =
        notificationCenter.create(
            USER,
            NotificationType.SYSTEM_ALERT,
            "Maintenance",
            "Planned downtime",
            NotificationPriority.LOW,
            null,
            null,
            Duration.ZERO);

    assertThat(notification.priority()).isEqualTo(NotificationPriority.NORMAL);
    assertThat(notification.category()).isEqualTo("admin_action");
    assertThat(notification.expiresAt()).isEqualTo(FIXED_NOW.plus(Duration.ofDays(30)));
    assertThat(notification.metadataJson()).contains("\"entity_type\":\"unit\"");
    assertThat(permanent.category()).isEqualTo("system");
    assertThat(permanent.expiresAt()).isNull();
  }

  @Test
  void listPagesNewestFirstAndCountsUnread() {
    insert("first", FIXED_NOW.minusSeconds(30), NotificationPriority.NORMAL, null);
    insert("second", FIXED_NOW.minusSeconds(20), NotificationPriority.NORMAL, null);
    insert("third", FIXED_NOW.minusSeconds(10), NotificationPriority.NORMAL, null);

    final NotificationPage page = notificationCenter.list(USER, false, 2, 0);

    assertThat(page.items()).extracting(UserNotification::title).containsExactly("third", "second");
    assertThat(page.totalCount()).isEqualTo(3);
    assertThat(page.unreadCount()).isEqualTo(3);
    assertThat(page.hasMore()).isTrue();
    assertThat(notificationCenter.list(USER, false, 2, 2).hasMore()).isFalse();
  }

  @Test
  void markReadAndArchiveNarrowTheUnreadList() {
    final UUID read = insert("read me", FIXED_NOW.minusSeconds(30), NotificationPriority.HIGH, null);
    final UUID archived = insert("archive me", FIXED_NOW.minusSeconds(20), NotificationPriority.NORMAL, null);
    insert("keep", FIXED_NOW.minusSeconds(10), NotificationPriority.NORMAL, null);

    assertThat(notificationCenter.markRead(USER, List.of(read))).isEqualTo(1);
    assertThat(notificationCenter.archive(USER, List.of(archived))).isEqualTo(1);

    final NotificationPage unread = notificationCenter.listUnread(USER, 10, 0);
    assertThat(unread.items()).extracting(UserNotification::title).containsExactly("keep");
    final NotificationPage all = notificationCenter.list(USER, false, 10, 0);
    assertThat(all.items()).extracting(UserNotification::title).containsExactly("keep", "read me");
    assertThat(all.unreadCount()).isEqualTo(1);

    assertThat(notificationCenter.markAllRead(USER)).isEqualTo(1);
    assertThat(notificationCenter.listUnread(USER, 10, 0).items()).isEmpty();
  }

  @Test
  void markReadIgnoresOtherUsersNotifications() {
    final UUID foreign = insertFor("someone-else", "theirs", FIXED_NOW, NotificationPriority.NORMAL, null);

    assertThat(notificationCenter.markRead(USER, List.of(foreign))).isZero();
  }

  @Test
  void expiredNotificationsAreHiddenThenDeleted() {
    insert("expired", FIXED_NOW.minus(Duration.ofDays(31)), NotificationPriority.NORMAL, FIXED_NOW.minusSeconds(1));
    insert("live", FIXED_NOW.minusSeconds(5), NotificationPriority.NORMAL, FIXED_NOW.plusSeconds(60));

    assertThat(notificationCenter.list(USER, false, 10, 0).items())
        .extracting(UserNotification::title)
        .containsExactly("live");
    assertThat(notificationCenter.deleteExpired(FIXED_NOW)).isEqualTo(1);
  }

  @Test
  void archiveOlderThanOnlyTouchesOldNotifications() {
    insert("old", FIXED_NOW.minus(Duration.ofDays(10)), NotificationPriority.NORMAL, null);
    insert("recent", FIXED_NOW.minus(Duration.ofDays(1)), NotificationPriority.NORMAL, null);

    assertThat(notificationCenter.archiveOlderThan(USER, 7)).isEqualTo(1);
    assertThat(notificationCenter.list(USER, false, 10, 0).items())
        .extracting(UserNotification::title)
        .containsExactly("recent");
  }

  @Test
  void summaryCountsByTypeAndUrgency() {
    insert("a", FIXED_NOW.minusSeconds(40), NotificationPriority.URGENT, null);
    insert("b", FIXED_NOW.minusSeconds(30), NotificationPriority.HIGH, null);
    insert("c", FIXED_NOW.minusSeconds(20), NotificationPriority.NORMAL, null);
    insert("d", FIXED_NOW.minusSeconds(10), NotificationPriority.LOW, null);

    final NotificationSummary summary = notificationCenter.summary(USER);

    assertThat(summary.totalUnread()).isEqualTo(4);
    assertThat(summary.urgentCount()).isEqualTo(2);
    assertThat(summary.countsByType()).containsEntry(NotificationType.ADMIN_ACTION, 4);
    assertThat(summary.mostRecent()).extracting(UserNotification::title).containsExactly("d", "c", "b");
  }

  @Test
  void listRejectsOutOfRangePaging() {
    assertThatThrownBy(() -> notificationCenter.list(USER, false, 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> notificationCenter.list(USER, false, 10, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private UUID insert(String title, Instant createdAt, NotificationPriority priority, Instant expiresAt) {
    return insertFor(USER, title, createdAt, priority, expiresAt);
  }

  private UUID insertFor(
      String userId, String title, Instant createdAt, NotificationPriority priority, Instant expiresAt) {
    final UserNotification notification =
        new UserNotification(
            UUID.randomUUID(),
            userId,
            NotificationType.ADMIN_ACTION,
            title,
            "message for " + title,
            null,
            priority,
            "admin_action",
            null,
            false,
            null,
            false,
            null,
            expiresAt,
            null,
            createdAt);
    notificationRepository.insert(notification);
    return notification.id();
  }
}
