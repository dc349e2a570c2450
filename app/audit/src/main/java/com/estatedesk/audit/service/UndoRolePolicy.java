package com.estatedesk.audit.service;

import com.estatedesk.audit.model.AdminRole;
import com.estatedesk.audit.model.ReversibilityTier;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Which reversibility tiers each admin role may undo. IMPOSSIBLE is never allowed. */
@Component
public class UndoRolePolicy {

  private final Map<AdminRole, Set<ReversibilityTier>> allowedTiers =
      new EnumMap<>(AdminRole.class);

  public UndoRolePolicy() {
    allowedTiers.put(
        AdminRole.SUPER_ADMIN,
        EnumSet.of(ReversibilityTier.SIMPLE, ReversibilityTier.MODERATE, ReversibilityTier.COMPLEX));
    allowedTiers.put(
        AdminRole.SUPPORT, EnumSet.of(ReversibilityTier.SIMPLE, ReversibilityTier.MODERATE));
    allowedTiers.put(AdminRole.USER_MANAGER, EnumSet.of(ReversibilityTier.SIMPLE));
    allowedTiers.put(AdminRole.MODERATOR, EnumSet.of(ReversibilityTier.SIMPLE));
    allowedTiers.put(AdminRole.VIEWER, EnumSet.noneOf(ReversibilityTier.class));
  }

  public boolean allows(AdminRole role, ReversibilityTier tier) {
    if (role == null || tier == null) {
      return false;
    }
    return allowedTiers.getOrDefault(role, Set.of()).contains(tier);
  }

  public Set<ReversibilityTier> allowedTiers(AdminRole role) {
    return Set.copyOf(allowedTiers.getOrDefault(role, Set.of()));
  }
}
