/*
 * Where: audit data access
 * What: undo_actions rows and their guarded status transitions
 * Why: every transition is a conditional UPDATE so concurrent callers cannot both win
 */
package com.estatedesk.audit.repository;

import static com.estatedesk.common.JdbcTimestampUtils.toInstant;
import static com.estatedesk.common.JdbcTimestampUtils.toTimestamp;

import com.estatedesk.audit.model.UndoAction;
import com.estatedesk.audit.model.UndoFailureKind;
import com.estatedesk.audit.model.UndoStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UndoActionRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT u.id, u.audit_record_id, u.performed_by_admin_id, u.status, u.reason,
             u.preview_json::text AS preview_json_text, u.execution_log, u.failure_kind,
             u.error_message, u.created_at, u.started_at, u.completed_at, u.cancelled_by,
             u.cancelled_at
      FROM undo_actions u
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(UndoAction action) {
    final String sql =
        """
        INSERT INTO undo_actions (
          id,
          audit_record_id,
          performed_by_admin_id,
          status,
          reason,
          preview_json,
          execution_log,
          failure_kind,
          error_message,
          created_at,
          started_at,
          completed_at,
          cancelled_by,
          cancelled_at
        ) VALUES (
          :id,
          :auditRecordId,
          :performedByAdminId,
          :status,
          :reason,
          CAST(:previewJson AS jsonb),
          :executionLog,
          :failureKind,
          :errorMessage,
          :createdAt,
          :startedAt,
          :completedAt,
          :cancelledBy,
          :cancelledAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", action.id())
            .addValue("auditRecordId", action.auditRecordId())
            .addValue("performedByAdminId", action.performedByAdminId())
            .addValue("status", action.status().name())
            .addValue("reason", action.reason())
            .addValue("previewJson", action.previewJson())
            .addValue("executionLog", action.executionLog())
            .addValue("failureKind", action.failureKind() == null ? null : action.failureKind().name())
            .addValue("errorMessage", action.errorMessage())
            .addValue("createdAt", toTimestamp(action.createdAt()))
            .addValue("startedAt", toTimestamp(action.startedAt()))
            .addValue("completedAt", toTimestamp(action.completedAt()))
            .addValue("cancelledBy", action.cancelledBy())
            .addValue("cancelledAt", toTimestamp(action.cancelledAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<UndoAction> findById(UUID id) {
    return jdbcTemplate
        .query(
            SELECT_COLUMNS + "WHERE u.id = :id",
            new MapSqlParameterSource().addValue("id", id),
            this::mapRow)
        .stream()
        .findFirst();
  }

  public List<UndoAction> findByAuditRecordId(UUID auditRecordId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE u.audit_record_id = :auditRecordId
            ORDER BY u.created_at DESC, u.id
            """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("auditRecordId", auditRecordId), this::mapRow);
  }

  public List<UndoAction> findByAuditRecordIds(List<UUID> auditRecordIds) {
    if (auditRecordIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE u.audit_record_id IN (:auditRecordIds)
            ORDER BY u.created_at DESC, u.id
            """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("auditRecordIds", auditRecordIds), this::mapRow);
  }

  public boolean existsCompleted(UUID auditRecordId) {
    return countInStatus(auditRecordId, List.of(UndoStatus.COMPLETED), null) > 0;
  }

  /** Counts actions on the record in the given states, optionally ignoring one action. */
  public int countInStatus(UUID auditRecordId, List<UndoStatus> statuses, UUID excludeId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM undo_actions
        WHERE audit_record_id = :auditRecordId
          AND status IN (:statuses)
        """
            + (excludeId == null ? "" : "  AND id <> :excludeId\n");
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditRecordId", auditRecordId)
            .addValue("statuses", statuses.stream().map(Enum::name).toList());
    if (excludeId != null) {
      params.addValue("excludeId", excludeId);
    }
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int markExecuting(UUID id, Instant startedAt, String executionLog) {
    final String sql =
        """
        UPDATE undo_actions
        SET status = 'EXECUTING',
            started_at = :startedAt,
            execution_log = :executionLog
        WHERE id = :id
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("executionLog", executionLog);
    return jdbcTemplate.update(sql, params);
  }

  public int markCompleted(UUID id, Instant completedAt, String executionLog) {
    final String sql =
        """
        UPDATE undo_actions
        SET status = 'COMPLETED',
            completed_at = :completedAt,
            execution_log = :executionLog
        WHERE id = :id
          AND status = 'EXECUTING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("executionLog", executionLog);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(
      UUID id,
      UndoFailureKind failureKind,
      String errorMessage,
      String executionLog,
      Instant completedAt) {
    final String sql =
        """
        UPDATE undo_actions
        SET status = 'FAILED',
            failure_kind = :failureKind,
            error_message = :errorMessage,
            execution_log = :executionLog,
            completed_at = :completedAt
        WHERE id = :id
          AND status IN ('PENDING', 'EXECUTING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("failureKind", failureKind.name())
            .addValue("errorMessage", errorMessage)
            .addValue("executionLog", executionLog)
            .addValue("completedAt", toTimestamp(completedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markCancelled(UUID id, String cancelledBy, Instant cancelledAt) {
    final String sql =
        """
        UPDATE undo_actions
        SET status = 'CANCELLED',
            cancelled_by = :cancelledBy,
            cancelled_at = :cancelledAt
        WHERE id = :id
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("cancelledBy", cancelledBy)
            .addValue("cancelledAt", toTimestamp(cancelledAt));
    return jdbcTemplate.update(sql, params);
  }

  /** Undo actions performed on records where the user was the actor, newest first. */
  public List<UndoAction> findByActorUserId(String actorUserId, int limit, int offset) {
    final String sql =
        SELECT_COLUMNS
            + """
            JOIN audit_records r ON r.id = u.audit_record_id
            WHERE r.actor_user_id = :actorUserId
            ORDER BY u.created_at DESC, u.id
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("actorUserId", actorUserId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countByActorUserId(String actorUserId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM undo_actions u
        JOIN audit_records r ON r.id = u.audit_record_id
        WHERE r.actor_user_id = :actorUserId
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("actorUserId", actorUserId), Integer.class);
    return count == null ? 0 : count;
  }

  public Map<UndoStatus, Integer> countByStatusSince(Instant since) {
    final String sql =
        """
        SELECT status, COUNT(*) AS total
        FROM undo_actions
        WHERE created_at >= :since
        GROUP BY status
        """;
    final Map<UndoStatus, Integer> counts = new EnumMap<>(UndoStatus.class);
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("since", toTimestamp(since)),
        rs -> {
          counts.put(UndoStatus.valueOf(rs.getString("status")), rs.getInt("total"));
        });
    return counts;
  }

  /** Fails actions left in EXECUTING since before the threshold so the record can be retried. */
  public int failExecutingStartedBefore(Instant threshold, String errorMessage, Instant now) {
    final String sql =
        """
        UPDATE undo_actions
        SET status = 'FAILED',
            failure_kind = 'RESTORE_FAILED',
            error_message = :errorMessage,
            execution_log = CONCAT_WS(E'\\n', execution_log, :logLine),
            completed_at = :now
        WHERE status = 'EXECUTING'
          AND started_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("errorMessage", errorMessage)
            .addValue("logLine", "failed: RESTORE_FAILED " + errorMessage)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private UndoAction mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String failureKind = rs.getString("failure_kind");
    return new UndoAction(
        UUID.fromString(rs.getString("id")),
        UUID.fromString(rs.getString("audit_record_id")),
        rs.getString("performed_by_admin_id"),
        UndoStatus.valueOf(rs.getString("status")),
        rs.getString("reason"),
        rs.getString("preview_json_text"),
        rs.getString("execution_log"),
        failureKind == null ? null : UndoFailureKind.valueOf(failureKind),
        rs.getString("error_message"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("completed_at")),
        rs.getString("cancelled_by"),
        toInstant(rs.getTimestamp("cancelled_at")));
  }
}
