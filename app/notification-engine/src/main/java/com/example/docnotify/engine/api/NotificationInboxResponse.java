/*
 * Where: Notification engine API model
 * What: Grouped inbox of one user
 * Why: Fix the response shape of the inbox endpoint
 */
package com.example.docnotify.engine.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationInboxResponse(
    String userId, int unreadCount, List<NotificationGroupSummary> groups) {
  public NotificationInboxResponse {
    // EI_EXPOSE_REP: keep an unmodifiable copy of the caller's list
    if (groups != null) {
      groups = Collections.unmodifiableList(new ArrayList<>(groups));
    }
  }
}
