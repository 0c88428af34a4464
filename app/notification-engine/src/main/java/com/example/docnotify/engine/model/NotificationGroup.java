package com.example.docnotify.engine.model;

import com.example.docnotify.common.JsonTrees;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** View-time run of contiguous notifications about the same event type and params. */
public record NotificationGroup(
    List<UUID> notificationIds,
    String eventType,
    JsonNode eventParams,
    Instant firstCreatedOn,
    Instant lastCreatedOn) {

  public NotificationGroup {
    notificationIds = List.copyOf(notificationIds);
    eventParams = JsonTrees.copyOf(eventParams);
  }

  /** Grouping key; callers get a copy so a group can never be re-keyed. */
  @Override
  public JsonNode eventParams() {
    return JsonTrees.copyOf(eventParams);
  }
}
