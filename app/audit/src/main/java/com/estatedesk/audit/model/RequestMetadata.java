package com.estatedesk.audit.model;

public record RequestMetadata(
    String ipAddress,
    String userAgent,
    String endpoint,
    String method,
    Integer statusCode,
    String requestId) {

  public static RequestMetadata empty() {
    return new RequestMetadata(null, null, null, null, null, null);
  }
}
