/*
 * Where: audit data access
 * What: transaction_groups rollups and their transaction_group_members rows
 * Why: the membership insert decides whether a record has already been counted
 */
package com.estatedesk.audit.repository;

import static com.estatedesk.common.JdbcTimestampUtils.toInstant;
import static com.estatedesk.common.JdbcTimestampUtils.toTimestamp;

import com.estatedesk.audit.model.ReversibilityTier;
import com.estatedesk.audit.model.TransactionGroup;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TransactionGroupRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT group_id, name, description, primary_user_id, total_actions, undoable_actions,
             aggregate_tier_rank, all_undoable, undone, created_at, updated_at
      FROM transaction_groups
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean insertIfAbsent(
      String groupId, String name, String description, String primaryUserId, Instant now) {
    final String sql =
        """
        INSERT INTO transaction_groups (
          group_id,
          name,
          description,
          primary_user_id,
          created_at,
          updated_at
        ) VALUES (
          :groupId,
          :name,
          :description,
          :primaryUserId,
          :now,
          :now
        )
        ON CONFLICT (group_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("groupId", groupId)
            .addValue("name", name)
            .addValue("description", description)
            .addValue("primaryUserId", primaryUserId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  /** Returns false when the record was already a member of the group. */
  public boolean insertMember(String groupId, UUID auditRecordId, Instant now) {
    final String sql =
        """
        INSERT INTO transaction_group_members (group_id, audit_record_id, created_at)
        VALUES (:groupId, :auditRecordId, :now)
        ON CONFLICT (group_id, audit_record_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("groupId", groupId)
            .addValue("auditRecordId", auditRecordId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public void applyMember(
      String groupId, boolean undoable, ReversibilityTier tier, String primaryUserId, Instant now) {
    // Rollups are monotonic; all_undoable never returns to true once cleared.
    final String sql =
        """
        UPDATE transaction_groups
        SET total_actions = total_actions + 1,
            undoable_actions = undoable_actions + CASE WHEN :undoable THEN 1 ELSE 0 END,
            aggregate_tier_rank = GREATEST(aggregate_tier_rank, :tierRank),
            all_undoable = all_undoable AND :undoable,
            primary_user_id = COALESCE(primary_user_id, :primaryUserId),
            updated_at = :now
        WHERE group_id = :groupId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("groupId", groupId)
            .addValue("undoable", undoable)
            .addValue("tierRank", tier.rank())
            .addValue("primaryUserId", primaryUserId)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  /** A member lost undoability after it was counted: one fewer undoable, all_undoable cleared. */
  public int removeUndoableMember(String groupId, Instant now) {
    final String sql =
        """
        UPDATE transaction_groups
        SET undoable_actions = GREATEST(undoable_actions - 1, 0),
            all_undoable = FALSE,
            updated_at = :now
        WHERE group_id = :groupId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("groupId", groupId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** Flags the group undone once every undoable member has a completed undo. */
  public int markUndoneIfAllReversed(String groupId, Instant now) {
    final String sql =
        """
        UPDATE transaction_groups g
        SET undone = TRUE,
            updated_at = :now
        WHERE g.group_id = :groupId
          AND NOT g.undone
          AND g.undoable_actions > 0
          AND NOT EXISTS (
            SELECT 1
            FROM transaction_group_members m
            JOIN audit_records r ON r.id = m.audit_record_id
            WHERE m.group_id = g.group_id
              AND r.undoable
              AND NOT EXISTS (
                SELECT 1 FROM undo_actions u
                WHERE u.audit_record_id = r.id AND u.status = 'COMPLETED'
              )
          )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("groupId", groupId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<TransactionGroup> findById(String groupId) {
    return jdbcTemplate
        .query(
            SELECT_COLUMNS + "WHERE group_id = :groupId",
            new MapSqlParameterSource().addValue("groupId", groupId),
            this::mapRow)
        .stream()
        .findFirst();
  }

  public List<TransactionGroup> findAllByIds(Collection<String> groupIds) {
    if (groupIds.isEmpty()) {
      return List.of();
    }
    return jdbcTemplate.query(
        SELECT_COLUMNS + "WHERE group_id IN (:groupIds)",
        new MapSqlParameterSource().addValue("groupIds", groupIds),
        this::mapRow);
  }

  public int deleteEmptyCreatedBefore(Instant threshold) {
    final String sql =
        """
        DELETE FROM transaction_groups g
        WHERE g.created_at < :threshold
          AND NOT EXISTS (
            SELECT 1 FROM transaction_group_members m WHERE m.group_id = g.group_id
          )
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  private TransactionGroup mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TransactionGroup(
        rs.getString("group_id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("primary_user_id"),
        rs.getInt("total_actions"),
        rs.getInt("undoable_actions"),
        ReversibilityTier.fromRank(rs.getInt("aggregate_tier_rank")),
        rs.getBoolean("all_undoable"),
        rs.getBoolean("undone"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
