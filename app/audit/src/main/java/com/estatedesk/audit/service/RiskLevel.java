package com.estatedesk.audit.service;

import com.estatedesk.audit.model.ReversibilityTier;

public enum RiskLevel {
  NONE,
  LOW,
  MEDIUM,
  HIGH;

  public static RiskLevel fromTier(ReversibilityTier tier) {
    return switch (tier) {
      case SIMPLE -> LOW;
      case MODERATE -> MEDIUM;
      case COMPLEX -> HIGH;
      case IMPOSSIBLE -> NONE;
    };
  }
}
