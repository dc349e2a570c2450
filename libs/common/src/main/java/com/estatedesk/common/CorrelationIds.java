package com.estatedesk.common;

import java.util.UUID;

public final class CorrelationIds {
  private static final int SHORT_LENGTH = 8;

  private CorrelationIds() {}

  public static String newCorrelationId() {
    return UUID.randomUUID().toString();
  }

  public static String shortForm(String correlationId) {
    if (correlationId == null || correlationId.length() <= SHORT_LENGTH) {
      return correlationId;
    }
    return correlationId.substring(0, SHORT_LENGTH);
  }
}
