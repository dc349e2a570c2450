/*
 * Where: audit domain model
 * What: one attempt (successful or not) to reverse an audit record, as stored in undo_actions
 * Why: keeps the preview, execution log and outcome of every undo for the audit trail
 */
package com.estatedesk.audit.model;

import java.time.Instant;
import java.util.UUID;

public record UndoAction(
    UUID id,
    UUID auditRecordId,
    String performedByAdminId,
    UndoStatus status,
    String reason,
    String previewJson,
    String executionLog,
    UndoFailureKind failureKind,
    String errorMessage,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String cancelledBy,
    Instant cancelledAt) {}
