/*
 * Where: audit data access
 * What: JSON document store in entity_documents backing EntityStore
 * Why: lets the engine run standalone; deployments with real entity tables register their own store
 */
package com.estatedesk.audit.repository;

import static com.estatedesk.common.JdbcTimestampUtils.toTimestamp;

import com.estatedesk.audit.service.EntityStore;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcEntityStore implements EntityStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final SnapshotJsonCodec jsonCodec;
  private final Clock clock;

  @Override
  public boolean exists(String entityType, String entityId) {
    if (entityId == null) {
      return false;
    }
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM entity_documents
          WHERE entity_type = :entityType AND entity_id = :entityId
        )
        """;
    return Boolean.TRUE.equals(
        jdbcTemplate.queryForObject(sql, keyParams(entityType, entityId), Boolean.class));
  }

  @Override
  public void restore(String entityType, String entityId, JsonNode state) {
    if (entityId == null) {
      throw new IllegalArgumentException("entityId is required to restore " + entityType);
    }
    final String sql =
        """
        INSERT INTO entity_documents (entity_type, entity_id, state, updated_at)
        VALUES (:entityType, :entityId, CAST(:state AS jsonb), :updatedAt)
        ON CONFLICT (entity_type, entity_id)
        DO UPDATE SET
          state = EXCLUDED.state,
          updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        keyParams(entityType, entityId)
            .addValue("state", jsonCodec.write(state))
            .addValue("updatedAt", toTimestamp(Instant.now(clock)));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public boolean remove(String entityType, String entityId) {
    if (entityId == null) {
      return false;
    }
    final String sql =
        """
        DELETE FROM entity_documents
        WHERE entity_type = :entityType AND entity_id = :entityId
        """;
    return jdbcTemplate.update(sql, keyParams(entityType, entityId)) > 0;
  }

  public Optional<JsonNode> find(String entityType, String entityId) {
    final String sql =
        """
        SELECT state::text AS state_text
        FROM entity_documents
        WHERE entity_type = :entityType AND entity_id = :entityId
        """;
    return jdbcTemplate
        .query(
            sql, keyParams(entityType, entityId), (rs, rowNum) -> jsonCodec.read(rs.getString("state_text")))
        .stream()
        .findFirst();
  }

  private MapSqlParameterSource keyParams(String entityType, String entityId) {
    return new MapSqlParameterSource()
        .addValue("entityType", entityType)
        .addValue("entityId", entityId);
  }
}
