/*
 * Where: shared JDBC utilities
 * What: explicit Instant <-> Timestamp conversion for NamedParameterJdbcTemplate binds
 * Why: the PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.estatedesk.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps them UTC regardless of the server time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
