/*
 * Where: audit data access
 * What: user_notifications rows for the notification bell
 * Why: every read filters out archived and expired rows; the sweep deletes the expired ones later
 */
package com.estatedesk.audit.repository;

import static com.estatedesk.common.JdbcTimestampUtils.toInstant;
import static com.estatedesk.common.JdbcTimestampUtils.toTimestamp;

import com.estatedesk.audit.model.NotificationPriority;
import com.estatedesk.audit.model.NotificationType;
import com.estatedesk.audit.model.UserNotification;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserNotificationRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT id, user_id, type, title, message, undo_action_id, priority, category, action_url,
             is_read, read_at, archived, archived_at, expires_at,
             metadata_json::text AS metadata_json_text, created_at
      FROM user_notifications
      """;

  private static final String ACTIVE_FOR_USER =
      """
      WHERE user_id = :userId
        AND NOT archived
        AND (expires_at IS NULL OR expires_at > :now)
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(UserNotification notification) {
    final String sql =
        """
        INSERT INTO user_notifications (
          id,
          user_id,
          type,
          title,
          message,
          undo_action_id,
          priority,
          category,
          action_url,
          is_read,
          read_at,
          archived,
          archived_at,
          expires_at,
          metadata_json,
          created_at
        ) VALUES (
          :id,
          :userId,
          :type,
          :title,
          :message,
          :undoActionId,
          :priority,
          :category,
          :actionUrl,
          :read,
          :readAt,
          :archived,
          :archivedAt,
          :expiresAt,
          CAST(:metadataJson AS jsonb),
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", notification.id())
            .addValue("userId", notification.userId())
            .addValue("type", notification.type().name())
            .addValue("title", notification.title())
            .addValue("message", notification.message())
            .addValue("undoActionId", notification.undoActionId())
            .addValue("priority", notification.priority().name())
            .addValue("category", notification.category())
            .addValue("actionUrl", notification.actionUrl())
            .addValue("read", notification.read())
            .addValue("readAt", toTimestamp(notification.readAt()))
            .addValue("archived", notification.archived())
            .addValue("archivedAt", toTimestamp(notification.archivedAt()))
            .addValue("expiresAt", toTimestamp(notification.expiresAt()))
            .addValue("metadataJson", notification.metadataJson())
            .addValue("createdAt", toTimestamp(notification.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<UserNotification> findActive(
      String userId, boolean unreadOnly, Instant now, int limit, int offset) {
    final String sql =
        SELECT_COLUMNS
            + ACTIVE_FOR_USER
            + (unreadOnly ? "  AND NOT is_read\n" : "")
            + """
            ORDER BY created_at DESC, id
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        activeParams(userId, now).addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countActive(String userId, boolean unreadOnly, Instant now) {
    final String sql =
        "SELECT COUNT(*) FROM user_notifications\n"
            + ACTIVE_FOR_USER
            + (unreadOnly ? "  AND NOT is_read\n" : "");
    final Integer count = jdbcTemplate.queryForObject(sql, activeParams(userId, now), Integer.class);
    return count == null ? 0 : count;
  }

  public Map<NotificationType, Integer> countUnreadByType(String userId, Instant now) {
    final String sql =
        "SELECT type, COUNT(*) AS total FROM user_notifications\n"
            + ACTIVE_FOR_USER
            + "  AND NOT is_read\nGROUP BY type";
    final Map<NotificationType, Integer> counts = new EnumMap<>(NotificationType.class);
    jdbcTemplate.query(
        sql,
        activeParams(userId, now),
        rs -> {
          counts.put(NotificationType.valueOf(rs.getString("type")), rs.getInt("total"));
        });
    return counts;
  }

  public int countUnreadWithPriority(
      String userId, Collection<NotificationPriority> priorities, Instant now) {
    final String sql =
        "SELECT COUNT(*) FROM user_notifications\n"
            + ACTIVE_FOR_USER
            + "  AND NOT is_read\n  AND priority IN (:priorities)";
    final MapSqlParameterSource params =
        activeParams(userId, now)
            .addValue("priorities", priorities.stream().map(Enum::name).toList());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int markRead(String userId, Collection<UUID> ids, Instant now) {
    if (ids.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE user_notifications
        SET is_read = TRUE,
            read_at = :now
        WHERE user_id = :userId
          AND id IN (:ids)
          AND NOT is_read
        """;
    return jdbcTemplate.update(sql, activeParams(userId, now).addValue("ids", ids));
  }

  public int markAllRead(String userId, Instant now) {
    final String sql =
        """
        UPDATE user_notifications
        SET is_read = TRUE,
            read_at = :now
        WHERE user_id = :userId
          AND NOT is_read
          AND NOT archived
        """;
    return jdbcTemplate.update(sql, activeParams(userId, now));
  }

  public int archive(String userId, Collection<UUID> ids, Instant now) {
    if (ids.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE user_notifications
        SET archived = TRUE,
            archived_at = :now
        WHERE user_id = :userId
          AND id IN (:ids)
          AND NOT archived
        """;
    return jdbcTemplate.update(sql, activeParams(userId, now).addValue("ids", ids));
  }

  public int archiveCreatedBefore(String userId, Instant threshold, Instant now) {
    final String sql =
        """
        UPDATE user_notifications
        SET archived = TRUE,
            archived_at = :now
        WHERE user_id = :userId
          AND created_at < :threshold
          AND NOT archived
        """;
    return jdbcTemplate.update(
        sql, activeParams(userId, now).addValue("threshold", toTimestamp(threshold)));
  }

  public List<UserNotification> findByUndoActionId(UUID undoActionId) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + "WHERE undo_action_id = :undoActionId ORDER BY created_at",
        new MapSqlParameterSource().addValue("undoActionId", undoActionId),
        this::mapRow);
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM user_notifications
        WHERE expires_at IS NOT NULL
          AND expires_at < :now
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)));
  }

  private MapSqlParameterSource activeParams(String userId, Instant now) {
    return new MapSqlParameterSource().addValue("userId", userId).addValue("now", toTimestamp(now));
  }

  private UserNotification mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String undoActionId = rs.getString("undo_action_id");
    return new UserNotification(
        UUID.fromString(rs.getString("id")),
        rs.getString("user_id"),
        NotificationType.valueOf(rs.getString("type")),
        rs.getString("title"),
        rs.getString("message"),
        undoActionId == null ? null : UUID.fromString(undoActionId),
        NotificationPriority.valueOf(rs.getString("priority")),
        rs.getString("category"),
        rs.getString("action_url"),
        rs.getBoolean("is_read"),
        toInstant(rs.getTimestamp("read_at")),
        rs.getBoolean("archived"),
        toInstant(rs.getTimestamp("archived_at")),
        toInstant(rs.getTimestamp("expires_at")),
        rs.getString("metadata_json_text"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
