/*
 * Where: audit data access
 * What: data_backups rows (payload bytes, related payload, files path)
 * Why: backups are read by undo and swept by retention; payload bytes may be gzip
 */
package com.estatedesk.audit.repository;

import static com.estatedesk.common.JdbcTimestampUtils.toInstant;
import static com.estatedesk.common.JdbcTimestampUtils.toTimestamp;

import com.estatedesk.audit.model.DataBackup;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DataBackupRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT id, audit_record_id, entity_type, entity_id, payload,
             related_payload::text AS related_payload_text, files_path, payload_size_bytes,
             compressed, created_at, expires_at, consumed_at
      FROM data_backups
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(DataBackup backup) {
    final String sql =
        """
        INSERT INTO data_backups (
          id,
          audit_record_id,
          entity_type,
          entity_id,
          payload,
          related_payload,
          files_path,
          payload_size_bytes,
          compressed,
          created_at,
          expires_at,
          consumed_at
        ) VALUES (
          :id,
          :auditRecordId,
          :entityType,
          :entityId,
          :payload,
          CAST(:relatedPayload AS jsonb),
          :filesPath,
          :payloadSizeBytes,
          :compressed,
          :createdAt,
          :expiresAt,
          :consumedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", backup.id())
            .addValue("auditRecordId", backup.auditRecordId())
            .addValue("entityType", backup.entityType())
            .addValue("entityId", backup.entityId())
            .addValue("payload", backup.payloadBytes())
            .addValue("relatedPayload", backup.relatedPayloadJson())
            .addValue("filesPath", backup.filesPath())
            .addValue("payloadSizeBytes", backup.payloadSizeBytes())
            .addValue("compressed", backup.compressed())
            .addValue("createdAt", toTimestamp(backup.createdAt()))
            .addValue("expiresAt", toTimestamp(backup.expiresAt()))
            .addValue("consumedAt", toTimestamp(backup.consumedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<DataBackup> findById(UUID id) {
    return jdbcTemplate
        .query(
            SELECT_COLUMNS + "WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            this::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<DataBackup> findByAuditRecordId(UUID auditRecordId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE audit_record_id = :auditRecordId
            ORDER BY created_at DESC
            LIMIT 1
            """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("auditRecordId", auditRecordId), this::mapRow)
        .stream()
        .findFirst();
  }

  public int markConsumed(UUID id, Instant consumedAt) {
    final String sql =
        """
        UPDATE data_backups
        SET consumed_at = :consumedAt
        WHERE id = :id
          AND consumed_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("consumedAt", toTimestamp(consumedAt));
    return jdbcTemplate.update(sql, params);
  }

  /** Deletes expired rows and returns the file directories they referenced. */
  public List<String> deleteExpiredReturningFilesPaths(Instant now) {
    final String sql =
        """
        DELETE FROM data_backups
        WHERE expires_at < :now
        RETURNING files_path
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("now", toTimestamp(now)),
        (rs, rowNum) -> rs.getString("files_path"));
  }

  private DataBackup mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DataBackup(
        UUID.fromString(rs.getString("id")),
        UUID.fromString(rs.getString("audit_record_id")),
        rs.getString("entity_type"),
        rs.getString("entity_id"),
        rs.getBytes("payload"),
        rs.getString("related_payload_text"),
        rs.getString("files_path"),
        rs.getLong("payload_size_bytes"),
        rs.getBoolean("compressed"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("expires_at")),
        toInstant(rs.getTimestamp("consumed_at")));
  }
}
