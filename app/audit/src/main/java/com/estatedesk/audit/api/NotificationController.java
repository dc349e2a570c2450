package com.estatedesk.audit.api;

import com.estatedesk.audit.service.NotificationCenter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Notification bell endpoints for the affected user. */
@RestController
@RequestMapping("/users/{user_id}/notifications")
@RequiredArgsConstructor
@Validated
public class NotificationController {

  private final NotificationCenter notificationCenter;

  @GetMapping
  public NotificationListResponse list(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId,
      @RequestParam(value = "unread_only", defaultValue = "false") boolean unreadOnly,
      @RequestParam(value = "limit", defaultValue = "20") int limit,
      @RequestParam(value = "offset", defaultValue = "0") int offset) {
    return NotificationListResponse.from(
        notificationCenter.list(userId, unreadOnly, limit, offset));
  }

  @GetMapping("/summary")
  public NotificationSummaryResponse summary(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
    return NotificationSummaryResponse.from(notificationCenter.summary(userId));
  }

  @PostMapping("/mark-read")
  public CountResponse markRead(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId,
      @Valid @RequestBody NotificationIdsRequest request) {
    final int updated =
        request.markAll()
            ? notificationCenter.markAllRead(userId)
            : notificationCenter.markRead(userId, request.ids());
    return new CountResponse(updated);
  }

  @PostMapping("/archive")
  public CountResponse archive(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId,
      @Valid @RequestBody ArchiveRequest request) {
    int archived = 0;
    if (request.ids() != null && !request.ids().isEmpty()) {
      archived += notificationCenter.archive(userId, request.ids());
    }
    if (request.olderThanDays() != null) {
      archived += notificationCenter.archiveOlderThan(userId, request.olderThanDays());
    }
    return new CountResponse(archived);
  }
}
