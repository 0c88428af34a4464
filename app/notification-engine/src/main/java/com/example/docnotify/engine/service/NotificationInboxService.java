/*
 * Where: Notification engine service layer
 * What: Reads a user's notifications as display groups and tracks read state
 * Why: Grouping is a view concern applied to the stored notifications on every read
 */
package com.example.docnotify.engine.service;

import com.example.docnotify.engine.model.NotificationGroup;
import com.example.docnotify.engine.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationInboxService {

  private final NotificationRepository notificationRepository;
  private final Clock clock;

  public List<NotificationGroup> getNotificationGroups(String userId) {
    // findByUserId returns created_on ascending, which grouping requires
    return NotificationGrouping.groupNotifications(notificationRepository.findByUserId(userId));
  }

  public int countUnread(String userId) {
    return notificationRepository.countUnread(userId);
  }

  public void markRead(String userId, UUID notificationId) {
    final int updated = notificationRepository.markRead(notificationId, userId, Instant.now(clock));
    if (updated == 0) {
      throw new NotificationNotFoundException(notificationId);
    }
  }

  public int markAllRead(String userId) {
    return notificationRepository.markAllRead(userId, Instant.now(clock));
  }
}
