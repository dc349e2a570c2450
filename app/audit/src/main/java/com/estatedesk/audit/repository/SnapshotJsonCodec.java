/*
 * Where: audit data access
 * What: converts JsonNode snapshots and related-entity lists to and from jsonb text
 * Why: repositories bind jsonb as text; parse failures are storage corruption, not caller error
 */
package com.estatedesk.audit.repository;

import com.estatedesk.audit.model.RelatedEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SnapshotJsonCodec {

  private static final TypeReference<List<RelatedEntity>> RELATED_LIST = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public String write(JsonNode node) {
    return node == null || node.isNull() ? null : node.toString();
  }

  public String writeRelated(List<RelatedEntity> relatedEntities) {
    try {
      return objectMapper.writeValueAsString(relatedEntities == null ? List.of() : relatedEntities);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize related entities", ex);
    }
  }

  public JsonNode read(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored snapshot is not valid json", ex);
    }
  }

  public List<RelatedEntity> readRelated(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, RELATED_LIST);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored related entities are not valid json", ex);
    }
  }
}
