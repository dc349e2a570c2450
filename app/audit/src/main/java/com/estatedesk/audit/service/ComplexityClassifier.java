/*
 * Where: audit service layer
 * What: derives the reversibility tier of an action from its kind, entity type and related entities
 * Why: the tier decides which admin roles may undo the action
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.RelatedEntity;
import com.estatedesk.audit.model.ReversibilityTier;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class ComplexityClassifier {

  static final int CASCADE_DELETE_THRESHOLD = 5;
  private static final Set<String> CONTAINER_ENTITY_TYPES = Set.of("building", "condominium");

  /** Rules apply in order; the first match wins. */
  public ReversibilityTier classify(
      ActionKind actionKind, String entityType, List<RelatedEntity> relatedEntities) {
    if (!actionKind.isMutating()) {
      return ReversibilityTier.IMPOSSIBLE;
    }
    final String type = entityType == null ? "" : entityType.toLowerCase(Locale.ROOT);
    final int relatedCount = relatedEntities == null ? 0 : relatedEntities.size();
    if (actionKind == ActionKind.UPDATE && type.equals("user")) {
      return ReversibilityTier.SIMPLE;
    }
    if (actionKind == ActionKind.DELETE && relatedCount > CASCADE_DELETE_THRESHOLD) {
      return ReversibilityTier.COMPLEX;
    }
    if (actionKind == ActionKind.DELETE && CONTAINER_ENTITY_TYPES.contains(type)) {
      return ReversibilityTier.COMPLEX;
    }
    if (actionKind == ActionKind.CREATE && relatedCount > 0) {
      return ReversibilityTier.MODERATE;
    }
    return ReversibilityTier.SIMPLE;
  }
}
