/*
 * Where: audit data access
 * What: insert/lookup/search of audit_records, plus the row lock taken before an undo starts
 * Why: audit rows are append-only; the only update is the undoable downgrade
 */
package com.estatedesk.audit.repository;

import static com.estatedesk.common.JdbcTimestampUtils.toInstant;
import static com.estatedesk.common.JdbcTimestampUtils.toTimestamp;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.AuditRecord;
import com.estatedesk.audit.model.RequestMetadata;
import com.estatedesk.audit.model.ReversibilityTier;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
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
public class AuditRecordRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT id, group_id, actor_user_id, admin_user_id, action_kind, entity_type, entity_id,
             description, context,
             before_snapshot::text AS before_snapshot_text,
             after_snapshot::text AS after_snapshot_text,
             related_entities::text AS related_entities_text,
             undoable, tier, ip_address, user_agent, endpoint, http_method, status_code,
             request_id, created_at, expires_at
      FROM audit_records
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final SnapshotJsonCodec jsonCodec;

  public void insert(AuditRecord record) {
    final String sql =
        """
        INSERT INTO audit_records (
          id,
          group_id,
          actor_user_id,
          admin_user_id,
          action_kind,
          entity_type,
          entity_id,
          description,
          context,
          before_snapshot,
          after_snapshot,
          related_entities,
          undoable,
          tier,
          ip_address,
          user_agent,
          endpoint,
          http_method,
          status_code,
          request_id,
          created_at,
          expires_at
        ) VALUES (
          :id,
          :groupId,
          :actorUserId,
          :adminUserId,
          :actionKind,
          :entityType,
          :entityId,
          :description,
          :context,
          CAST(:beforeSnapshot AS jsonb),
          CAST(:afterSnapshot AS jsonb),
          CAST(:relatedEntities AS jsonb),
          :undoable,
          :tier,
          :ipAddress,
          :userAgent,
          :endpoint,
          :httpMethod,
          :statusCode,
          :requestId,
          :createdAt,
          :expiresAt
        )
        """;
    final RequestMetadata metadata = record.requestMetadata();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("groupId", record.groupId())
            .addValue("actorUserId", record.actorUserId())
            .addValue("adminUserId", record.adminUserId())
            .addValue("actionKind", record.actionKind().name())
            .addValue("entityType", record.entityType())
            .addValue("entityId", record.entityId())
            .addValue("description", record.description())
            .addValue("context", record.context())
            .addValue("beforeSnapshot", jsonCodec.write(record.beforeSnapshot()))
            .addValue("afterSnapshot", jsonCodec.write(record.afterSnapshot()))
            .addValue("relatedEntities", jsonCodec.writeRelated(record.relatedEntities()))
            .addValue("undoable", record.undoable())
            .addValue("tier", record.tier().name())
            .addValue("ipAddress", metadata.ipAddress())
            .addValue("userAgent", metadata.userAgent())
            .addValue("endpoint", metadata.endpoint())
            .addValue("httpMethod", metadata.method())
            .addValue("statusCode", metadata.statusCode())
            .addValue("requestId", metadata.requestId())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("expiresAt", toTimestamp(record.expiresAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<AuditRecord> findById(UUID id) {
    final String sql = SELECT_COLUMNS + "WHERE id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  /** Row lock held until the surrounding transaction ends; serializes concurrent undos. */
  public Optional<AuditRecord> lockById(UUID id) {
    final String sql = SELECT_COLUMNS + "WHERE id = :id FOR UPDATE";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<AuditRecord> findAllByIds(Collection<UUID> ids) {
    if (ids.isEmpty()) {
      return List.of();
    }
    final String sql = SELECT_COLUMNS + "WHERE id IN (:ids)";
    return jdbcTemplate.query(sql, new MapSqlParameterSource().addValue("ids", ids), this::mapRow);
  }

  public int markNotUndoable(UUID id) {
    final String sql =
        """
        UPDATE audit_records
        SET undoable = FALSE
        WHERE id = :id
          AND undoable
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  public List<AuditRecord> findByActorSince(String actorUserId, Instant since, boolean undoableOnly) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE actor_user_id = :actorUserId
              AND created_at >= :since
            """
            + (undoableOnly ? "  AND undoable\n" : "")
            + "ORDER BY created_at DESC, id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("actorUserId", actorUserId)
            .addValue("since", toTimestamp(since));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countLaterOnEntity(
      String entityType, String entityId, Instant after, Collection<ActionKind> kinds) {
    if (entityId == null || kinds.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        SELECT COUNT(*)
        FROM audit_records
        WHERE entity_type = :entityType
          AND entity_id = :entityId
          AND created_at > :after
          AND action_kind IN (:kinds)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("entityType", entityType)
            .addValue("entityId", entityId)
            .addValue("after", toTimestamp(after))
            .addValue("kinds", kinds.stream().map(Enum::name).toList());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public List<AuditRecord> search(
      String text,
      String entityType,
      ActionKind actionKind,
      String userId,
      Instant since,
      int limit) {
    // Only the filters that were supplied become predicates.
    final StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE created_at >= :since\n");
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since)).addValue("limit", limit);
    if (text != null && !text.isBlank()) {
      sql.append("  AND (description ILIKE :pattern OR context ILIKE :pattern)\n");
      params.addValue("pattern", "%" + escapeLike(text.trim()) + "%");
    }
    if (entityType != null && !entityType.isBlank()) {
      sql.append("  AND entity_type = :entityType\n");
      params.addValue("entityType", entityType);
    }
    if (actionKind != null) {
      sql.append("  AND action_kind = :actionKind\n");
      params.addValue("actionKind", actionKind.name());
    }
    if (userId != null && !userId.isBlank()) {
      sql.append("  AND (actor_user_id = :userId OR admin_user_id = :userId)\n");
      params.addValue("userId", userId);
    }
    sql.append("ORDER BY created_at DESC, id\nLIMIT :limit");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public int countSince(Instant since, boolean undoableOnly) {
    final String sql =
        "SELECT COUNT(*) FROM audit_records WHERE created_at >= :since"
            + (undoableOnly ? " AND undoable" : "");
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("since", toTimestamp(since)), Integer.class);
    return count == null ? 0 : count;
  }

  public Map<ActionKind, Integer> countByKindSince(Instant since) {
    final String sql =
        """
        SELECT action_kind, COUNT(*) AS total
        FROM audit_records
        WHERE created_at >= :since
        GROUP BY action_kind
        """;
    final Map<ActionKind, Integer> counts = new EnumMap<>(ActionKind.class);
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("since", toTimestamp(since)),
        rs -> {
          counts.put(ActionKind.valueOf(rs.getString("action_kind")), rs.getInt("total"));
        });
    return counts;
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM audit_records
        WHERE expires_at < :now
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)));
  }

  private static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private AuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final int rawStatusCode = rs.getInt("status_code");
    final Integer statusCode = rs.wasNull() ? null : rawStatusCode;
    final RequestMetadata metadata =
        new RequestMetadata(
            rs.getString("ip_address"),
            rs.getString("user_agent"),
            rs.getString("endpoint"),
            rs.getString("http_method"),
            statusCode,
            rs.getString("request_id"));
    return new AuditRecord(
        UUID.fromString(rs.getString("id")),
        rs.getString("group_id"),
        rs.getString("actor_user_id"),
        rs.getString("admin_user_id"),
        ActionKind.valueOf(rs.getString("action_kind")),
        rs.getString("entity_type"),
        rs.getString("entity_id"),
        rs.getString("description"),
        rs.getString("context"),
        jsonCodec.read(rs.getString("before_snapshot_text")),
        jsonCodec.read(rs.getString("after_snapshot_text")),
        jsonCodec.readRelated(rs.getString("related_entities_text")),
        rs.getBoolean("undoable"),
        ReversibilityTier.valueOf(rs.getString("tier")),
        metadata,
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("expires_at")));
  }
}
