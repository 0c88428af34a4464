/*
 * Where: Notification engine service layer
 * What: Collapses a chronological notification list into display groups
 * Why: Bursts of related activity read better as one entry than as many
 */
package com.example.docnotify.engine.service;

import com.example.docnotify.engine.model.NotificationGroup;
import com.example.docnotify.engine.model.NotificationRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public final class NotificationGrouping {
  private NotificationGrouping() {}

  /**
   * Groups contiguous runs of notifications that share event type and (structurally equal) event
   * params. Matching notifications separated by a different one end up in separate groups.
   *
   * @param notifications ordered by {@code createdOn} ascending; the order is not checked
   * @return one group per run, in input order
   */
  public static List<NotificationGroup> groupNotifications(List<NotificationRecord> notifications) {
    final List<NotificationGroup> groups = new ArrayList<>();
    GroupBuilder current = null;
    for (NotificationRecord notification : notifications) {
      if (current != null && current.accepts(notification)) {
        current.add(notification);
        continue;
      }
      if (current != null) {
        groups.add(current.build());
      }
      current = new GroupBuilder(notification);
    }
    if (current != null) {
      groups.add(current.build());
    }
    return groups;
  }

  private static final class GroupBuilder {

    private final NotificationRecord first;
    private final List<UUID> notificationIds = new ArrayList<>();
    private Instant lastCreatedOn;

    private GroupBuilder(NotificationRecord first) {
      this.first = first;
      add(first);
    }

    // JsonNode.equals compares trees structurally
    private boolean accepts(NotificationRecord notification) {
      return Objects.equals(first.eventType(), notification.eventType())
          && Objects.equals(first.eventParams(), notification.eventParams());
    }

    private void add(NotificationRecord notification) {
      notificationIds.add(notification.notificationId());
      lastCreatedOn = notification.createdOn();
    }

    private NotificationGroup build() {
      return new NotificationGroup(
          notificationIds, first.eventType(), first.eventParams(), first.createdOn(), lastCreatedOn);
    }
  }
}
