/*
 * Where: audit domain model
 * What: administrator roles known to the undo permission table
 * Why: callers send the lower-case role value; this resolves it type-safely
 */
package com.estatedesk.audit.model;

import java.util.Locale;

public enum AdminRole {
  SUPER_ADMIN,
  USER_MANAGER,
  SUPPORT,
  MODERATOR,
  VIEWER;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AdminRole fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("admin role is required");
    }
    final String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (AdminRole role : values()) {
      if (role.name().equals(normalized)) {
        return role;
      }
    }
    throw new IllegalArgumentException("unknown admin role: " + value);
  }
}
