/*
 * Where: audit HTTP layer
 * What: admin endpoints for the timeline, undo analysis, undo execution, search and statistics
 * Why: the admin console drives every undo through these routes
 */
package com.estatedesk.audit.api;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.AdminRole;
import com.estatedesk.audit.model.UndoAction;
import com.estatedesk.audit.service.AuditSearchCriteria;
import com.estatedesk.audit.service.AuditStatistics;
import com.estatedesk.audit.service.TimelineQueryService;
import com.estatedesk.audit.service.UndoAnalyzer;
import com.estatedesk.audit.service.UndoExecutor;
import com.estatedesk.audit.service.UndoHistoryPage;
import com.estatedesk.audit.service.UndoPreview;
import com.estatedesk.audit.service.UndoRequirements;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/audit")
@RequiredArgsConstructor
@Validated
public class AuditAdminController {

  static final String HEADER_ADMIN_ID = "X-Admin-Id";
  static final String HEADER_ADMIN_ROLE = "X-Admin-Role";

  private final TimelineQueryService timelineQueryService;
  private final UndoAnalyzer undoAnalyzer;
  private final UndoExecutor undoExecutor;

  @GetMapping("/users/{user_id}/timeline")
  public TimelineResponse timeline(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId,
      @RequestParam(value = "days", defaultValue = "30") int days,
      @RequestParam(value = "include_non_undoable", defaultValue = "false")
          boolean includeNonUndoable,
      @RequestHeader(value = HEADER_ADMIN_ROLE, required = false) String adminRole) {
    final AdminRole role = adminRole == null ? null : AdminRole.fromValue(adminRole);
    return new TimelineResponse(
        userId, days, timelineQueryService.getTimeline(userId, days, includeNonUndoable, role));
  }

  @GetMapping("/records/{id}/requirements")
  public UndoRequirements requirements(@PathVariable("id") UUID auditRecordId) {
    return undoAnalyzer.analyzeRequirements(auditRecordId);
  }

  @GetMapping("/records/{id}/preview")
  public UndoPreview preview(@PathVariable("id") UUID auditRecordId) {
    return undoAnalyzer.preview(auditRecordId);
  }

  @PostMapping("/records/{id}/undo")
  public UndoActionResponse undo(
      @PathVariable("id") UUID auditRecordId,
      @RequestHeader(HEADER_ADMIN_ID) @NotBlank(message = "X-Admin-Id is required") String adminId,
      @RequestHeader(HEADER_ADMIN_ROLE) String adminRole,
      @Valid @RequestBody UndoRequest request) {
    undoAnalyzer.checkRoleMayUndo(auditRecordId, AdminRole.fromValue(adminRole));
    return UndoActionResponse.from(undoExecutor.execute(auditRecordId, adminId, request.reason()));
  }

  @PostMapping("/records/{id}/undo-actions")
  public ResponseEntity<UndoActionResponse> prepare(
      @PathVariable("id") UUID auditRecordId,
      @RequestHeader(HEADER_ADMIN_ID) @NotBlank(message = "X-Admin-Id is required") String adminId,
      @RequestHeader(HEADER_ADMIN_ROLE) String adminRole,
      @Valid @RequestBody UndoRequest request) {
    undoAnalyzer.checkRoleMayUndo(auditRecordId, AdminRole.fromValue(adminRole));
    final UndoAction pending = undoExecutor.prepare(auditRecordId, adminId, request.reason());
    return ResponseEntity.status(HttpStatus.CREATED).body(UndoActionResponse.from(pending));
  }

  @PostMapping("/undo-actions/{id}/confirm")
  public UndoActionResponse confirm(
      @PathVariable("id") UUID undoActionId,
      @RequestHeader(HEADER_ADMIN_ROLE) String adminRole) {
    // The role may differ from the one that prepared the action.
    final UndoAction pending = undoExecutor.find(undoActionId);
    undoAnalyzer.checkRoleMayUndo(pending.auditRecordId(), AdminRole.fromValue(adminRole));
    return UndoActionResponse.from(undoExecutor.confirm(undoActionId));
  }

  @PostMapping("/undo-actions/{id}/cancel")
  public UndoActionResponse cancel(
      @PathVariable("id") UUID undoActionId,
      @RequestHeader(HEADER_ADMIN_ID) @NotBlank(message = "X-Admin-Id is required") String adminId) {
    return UndoActionResponse.from(undoExecutor.cancel(undoActionId, adminId));
  }

  @GetMapping("/users/{user_id}/undo-history")
  public UndoHistoryPage undoHistory(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId,
      @RequestParam(value = "limit", defaultValue = "20") int limit,
      @RequestParam(value = "offset", defaultValue = "0") int offset) {
    return timelineQueryService.undoHistory(userId, limit, offset);
  }

  @GetMapping("/search")
  public List<AuditRecordResponse> search(
      @RequestParam(value = "query", required = false) String query,
      @RequestParam(value = "days", required = false) Integer days,
      @RequestParam(value = "entity_type", required = false) String entityType,
      @RequestParam(value = "action", required = false) ActionKind action,
      @RequestParam(value = "user_id", required = false) String userId,
      @RequestParam(value = "limit", required = false) Integer limit) {
    final AuditSearchCriteria criteria =
        new AuditSearchCriteria(query, days, entityType, action, userId, limit);
    return timelineQueryService.search(criteria).stream().map(AuditRecordResponse::from).toList();
  }

  @GetMapping("/stats")
  public AuditStatistics stats(@RequestParam(value = "days", defaultValue = "30") int days) {
    return timelineQueryService.statistics(days);
  }
}
