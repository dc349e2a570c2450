/*
 * Where: audit domain model
 * What: ordered classification of how safely an action can be reversed
 * Why: higher tiers require a higher admin role to undo
 */
package com.estatedesk.audit.model;

public enum ReversibilityTier {
  SIMPLE,
  MODERATE,
  COMPLEX,
  IMPOSSIBLE;

  public int rank() {
    return ordinal();
  }

  public ReversibilityTier max(ReversibilityTier other) {
    if (other == null) {
      return this;
    }
    return other.ordinal() > ordinal() ? other : this;
  }

  public static ReversibilityTier fromRank(int rank) {
    final ReversibilityTier[] values = values();
    if (rank < 0 || rank >= values.length) {
      throw new IllegalArgumentException("unknown reversibility tier rank: " + rank);
    }
    return values[rank];
  }
}
