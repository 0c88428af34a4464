/*
 * Where: Notification engine domain model
 * What: One notification for one recipient, with the triggering event denormalized
 * Why: Grouping and display never need to join back to the event log
 */
package com.example.docnotify.engine.model;

import com.example.docnotify.common.JsonTrees;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String notifiedUserId,
    UUID eventId,
    String eventType,
    JsonNode eventParams,
    List<NotificationReason> reasons,
    Instant createdOn,
    Instant expiresOn,
    Instant readOn) {

  public static final int NOTIFICATION_EXPIRATION_IN_MONTHS = 6;

  public NotificationRecord {
    if (reasons == null || reasons.isEmpty()) {
      throw new IllegalArgumentException("notification requires at least one reason");
    }
    reasons = List.copyOf(reasons);
    eventParams = JsonTrees.copyOf(eventParams);
  }

  @Override
  public JsonNode eventParams() {
    return JsonTrees.copyOf(eventParams);
  }

  /** createdOn is the event's createdOn so notifications sort in causal event order. */
  public static NotificationRecord forEvent(
      UUID notificationId, String notifiedUserId, EventRecord event, List<NotificationReason> reasons) {
    return new NotificationRecord(
        notificationId,
        notifiedUserId,
        event.eventId(),
        event.type(),
        event.params(),
        reasons,
        event.createdOn(),
        expiresOn(event.createdOn()),
        null);
  }

  static Instant expiresOn(Instant createdOn) {
    return createdOn
        .atZone(ZoneOffset.UTC)
        .plusMonths(NOTIFICATION_EXPIRATION_IN_MONTHS)
        .toInstant();
  }
}
