/*
 * Where: Notification engine API
 * What: Inbox endpoints: grouped notifications, unread count and read marks
 * Why: Notifications are polled by clients rather than pushed
 */
package com.example.docnotify.engine.api;

import com.example.docnotify.engine.service.NotificationInboxService;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users/{user_id}/notifications")
@RequiredArgsConstructor
@Validated
public class NotificationInboxController {

  private final NotificationInboxService inboxService;

  @GetMapping
  public NotificationInboxResponse inbox(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
    final List<NotificationGroupSummary> groups =
        inboxService.getNotificationGroups(userId).stream()
            .map(NotificationGroupSummary::from)
            .toList();
    return new NotificationInboxResponse(userId, inboxService.countUnread(userId), groups);
  }

  @GetMapping("/unread-count")
  public UnreadCountResponse unreadCount(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
    return new UnreadCountResponse(userId, inboxService.countUnread(userId));
  }

  @PostMapping("/{notification_id}/read")
  public ResponseEntity<Void> markRead(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId,
      @PathVariable("notification_id") UUID notificationId) {
    inboxService.markRead(userId, notificationId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/read-all")
  public UnreadCountResponse markAllRead(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
    inboxService.markAllRead(userId);
    return new UnreadCountResponse(userId, inboxService.countUnread(userId));
  }
}
