/*
 * Where: Notification engine API model
 * What: One display group of the inbox
 */
package com.example.docnotify.engine.api;

import com.example.docnotify.engine.model.NotificationGroup;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationGroupSummary(
    List<UUID> notificationIds,
    String eventType,
    JsonNode eventParams,
    Instant firstCreatedOn,
    Instant lastCreatedOn) {

  public NotificationGroupSummary {
    notificationIds = List.copyOf(notificationIds);
  }

  static NotificationGroupSummary from(NotificationGroup group) {
    return new NotificationGroupSummary(
        group.notificationIds(),
        group.eventType(),
        group.eventParams(),
        group.firstCreatedOn(),
        group.lastCreatedOn());
  }
}
