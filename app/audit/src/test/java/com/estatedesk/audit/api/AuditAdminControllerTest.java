/*
 * Where: audit admin API web-layer tests
 * What: verifies routing, header handling and the error mapping of every admin endpoint
 * Why: the console relies on stable status codes to tell forbidden, missing and stale undos apart
 */
package com.estatedesk.audit.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.estatedesk.audit.model.ActionKind;
import com.estatedesk.audit.model.AdminRole;
import com.estatedesk.audit.model.ReversibilityTier;
import com.estatedesk.audit.model.UndoAction;
import com.estatedesk.audit.model.UndoFailureKind;
import com.estatedesk.audit.model.UndoStatus;
import com.estatedesk.audit.service.AuditRecordNotFoundException;
import com.estatedesk.audit.service.AuditSearchCriteria;
import com.estatedesk.audit.service.InvalidUndoTransitionException;
import com.estatedesk.audit.service.TimelineQueryService;
import com.estatedesk.audit.service.TransactionGroupView;
import com.estatedesk.audit.service.UndoAnalyzer;
import com.estatedesk.audit.service.UndoBlocker;
import com.estatedesk.audit.service.UndoExecutor;
import com.estatedesk.audit.service.UndoPermissionDeniedException;
import com.estatedesk.audit.service.UndoRequirements;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AuditAdminController.class)
@Import(ApiExceptionHandler.class)
class AuditAdminControllerTest {

  private static final UUID RECORD_ID = UUID.fromString("6f1c2d3e-0000-4000-8000-000000000001");
  private static final UUID UNDO_ID = UUID.fromString("6f1c2d3e-0000-4000-8000-000000000002");
  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
  private static final String REASON_BODY =
      """
      {"reason":"deleted by mistake"}
      """;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TimelineQueryService timelineQueryService;
  @MockitoBean private UndoAnalyzer undoAnalyzer;
  @MockitoBean private UndoExecutor undoExecutor;

  @Test
  void undoReturnsTerminalAction() throws Exception {
    when(undoExecutor.execute(RECORD_ID, "admin-1", "deleted by mistake"))
        .thenReturn(action(UndoStatus.COMPLETED, null));

    mockMvc
        .perform(
            post("/admin/audit/records/{id}/undo", RECORD_ID)
                .header("X-Admin-Id", "admin-1")
                .header("X-Admin-Role", "support")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REASON_BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.undo_action_id").value(UNDO_ID.toString()))
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.performed_by_admin_id").value("admin-1"));

    verify(undoAnalyzer).checkRoleMayUndo(RECORD_ID, AdminRole.SUPPORT);
  }

  @Test
  void failedUndoIsStillOkWithFailureKind() throws Exception {
    when(undoExecutor.execute(RECORD_ID, "admin-1", "deleted by mistake"))
        .thenReturn(action(UndoStatus.FAILED, UndoFailureKind.RACE_LOST));

    mockMvc
        .perform(
            post("/admin/audit/records/{id}/undo", RECORD_ID)
                .header("X-Admin-Id", "admin-1")
                .header("X-Admin-Role", "super_admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REASON_BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(jsonPath("$.failure_kind").value("RACE_LOST"));
  }

  @Test
  void undoReturnsForbiddenWhenRoleMayNotUndoTier() throws Exception {
    doThrow(new UndoPermissionDeniedException("role support may not undo COMPLEX actions"))
        .when(undoAnalyzer)
        .checkRoleMayUndo(RECORD_ID, AdminRole.SUPPORT);

    mockMvc
        .perform(
            post("/admin/audit/records/{id}/undo", RECORD_ID)
                .header("X-Admin-Id", "admin-1")
                .header("X-Admin-Role", "support")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REASON_BODY))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("UNDO_FORBIDDEN"));

    verifyNoInteractions(undoExecutor);
  }

  @Test
  void undoRejectsMissingAdminHeader() throws Exception {
    mockMvc
        .perform(
            post("/admin/audit/records/{id}/undo", RECORD_ID)
                .header("X-Admin-Role", "support")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REASON_BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("X-Admin-Id is required"));
  }

  @Test
  void undoRejectsUnknownRole() throws Exception {
    mockMvc
        .perform(
            post("/admin/audit/records/{id}/undo", RECORD_ID)
                .header("X-Admin-Id", "admin-1")
                .header("X-Admin-Role", "janitor")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REASON_BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("unknown admin role: janitor"));
  }

  @Test
  void undoRejectsBlankReason() throws Exception {
    mockMvc
        .perform(
            post("/admin/audit/records/{id}/undo", RECORD_ID)
                .header("X-Admin-Id", "admin-1")
                .header("X-Admin-Role", "support")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"  \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("reason is required"));
  }

  @Test
  void prepareCreatesPendingAction() throws Exception {
    when(undoExecutor.prepare(RECORD_ID, "admin-1", "deleted by mistake"))
        .thenReturn(action(UndoStatus.PENDING, null));

    mockMvc
        .perform(
            post("/admin/audit/records/{id}/undo-actions", RECORD_ID)
                .header("X-Admin-Id", "admin-1")
                .header("X-Admin-Role", "user_manager")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REASON_BODY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.status").value("PENDING"));
  }

  @Test
  void confirmOfNonPendingActionIsConflict() throws Exception {
    when(undoExecutor.find(UNDO_ID)).thenReturn(action(UndoStatus.PENDING, null));
    when(undoExecutor.confirm(UNDO_ID))
        .thenThrow(new InvalidUndoTransitionException("undo action is CANCELLED, expected PENDING"));

    mockMvc
        .perform(post("/admin/audit/undo-actions/{id}/confirm", UNDO_ID).header("X-Admin-Role", "support"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("UNDO_STATE_CONFLICT"));
  }

  @Test
  void cancelPassesAdminThrough() throws Exception {
    when(undoExecutor.cancel(UNDO_ID, "admin-2")).thenReturn(action(UndoStatus.CANCELLED, null));

    mockMvc
        .perform(post("/admin/audit/undo-actions/{id}/cancel", UNDO_ID).header("X-Admin-Id", "admin-2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CANCELLED"));
  }

  @Test
  void requirementsOfUnknownRecordIsNotFound() throws Exception {
    when(undoAnalyzer.analyzeRequirements(RECORD_ID))
        .thenThrow(new AuditRecordNotFoundException(RECORD_ID));

    mockMvc
        .perform(get("/admin/audit/records/{id}/requirements", RECORD_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void requirementsExposeBlockers() throws Exception {
    when(undoAnalyzer.analyzeRequirements(RECORD_ID))
        .thenReturn(
            new UndoRequirements(
                false,
                ReversibilityTier.SIMPLE,
                List.of(),
                List.of(),
                List.of(new UndoBlocker(UndoFailureKind.EXPIRED, "undo window closed"))));

    mockMvc
        .perform(get("/admin/audit/records/{id}/requirements", RECORD_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.can_undo").value(false))
        .andExpect(jsonPath("$.blockers[0].kind").value("EXPIRED"));
  }

  @Test
  void malformedRecordIdIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/admin/audit/records/{id}/preview", "not-a-uuid"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("id is invalid"));
  }

  @Test
  void timelineResolvesOptionalRole() throws Exception {
    when(timelineQueryService.getTimeline("owner-1", 14, true, AdminRole.MODERATOR))
        .thenReturn(
            List.of(
                new TransactionGroupView(
                    "group-1",
                    "Transaction group-1",
                    null,
                    "owner-1",
                    1,
                    1,
                    ReversibilityTier.SIMPLE,
                    true,
                    false,
                    NOW,
                    List.of())));

    mockMvc
        .perform(
            get("/admin/audit/users/{userId}/timeline", "owner-1")
                .param("days", "14")
                .param("include_non_undoable", "true")
                .header("X-Admin-Role", "moderator"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("owner-1"))
        .andExpect(jsonPath("$.groups[0].group_id").value("group-1"))
        .andExpect(jsonPath("$.groups[0].aggregate_tier").value("SIMPLE"));
  }

  @Test
  void searchBuildsCriteriaFromQueryParameters() throws Exception {
    when(timelineQueryService.search(any())).thenReturn(List.of());

    mockMvc
        .perform(
            get("/admin/audit/search")
                .param("query", "rent")
                .param("action", "DELETE")
                .param("entity_type", "unit")
                .param("limit", "25"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").isArray());

    final ArgumentCaptor<AuditSearchCriteria> criteria =
        ArgumentCaptor.forClass(AuditSearchCriteria.class);
    verify(timelineQueryService).search(criteria.capture());
    assertThat(criteria.getValue().query()).isEqualTo("rent");
    assertThat(criteria.getValue().actionKind()).isEqualTo(ActionKind.DELETE);
    assertThat(criteria.getValue().days()).isEqualTo(30);
    assertThat(criteria.getValue().limit()).isEqualTo(25);
  }

  @Test
  void undoHistoryRejectsOversizedPage() throws Exception {
    when(timelineQueryService.undoHistory(eq("owner-1"), eq(500), eq(0)))
        .thenThrow(new IllegalArgumentException("limit must be between 1 and 100"));

    mockMvc
        .perform(get("/admin/audit/users/{userId}/undo-history", "owner-1").param("limit", "500"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("limit must be between 1 and 100"));
  }

  private static UndoAction action(UndoStatus status, UndoFailureKind failureKind) {
    return new UndoAction(
        UNDO_ID,
        RECORD_ID,
        "admin-1",
        status,
        "deleted by mistake",
        null,
        null,
        failureKind,
        failureKind == null ? null : "another undo of this record is running or has completed",
        NOW,
        status == UndoStatus.PENDING ? null : NOW,
        status == UndoStatus.COMPLETED ? NOW : null,
        status == UndoStatus.CANCELLED ? "admin-2" : null,
        status == UndoStatus.CANCELLED ? NOW : null);
  }
}
