package com.estatedesk.audit.service;

import java.util.UUID;

public class AuditRecordNotFoundException extends RuntimeException {

  public AuditRecordNotFoundException(UUID auditRecordId) {
    super("audit record not found: " + auditRecordId);
  }
}
