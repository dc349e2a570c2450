/*
 * Where: audit application configuration binding
 * What: undo execution tunables
 * Why: error messages are persisted and must stay bounded
 */
package com.estatedesk.audit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "audit.undo")
public record UndoProperties(int errorMessageMaxLength) {

  public UndoProperties {
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
  }
}
