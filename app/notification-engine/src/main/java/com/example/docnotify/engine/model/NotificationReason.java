/*
 * Where: Notification engine domain model
 * What: Why a user receives a notification
 * Why: The declaration order is the order reasons are reported in
 */
package com.example.docnotify.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationReason {
  ROOM_MEMBERSHIP("roomMembership"),
  DOCUMENT_FAVORITE("documentFavorite"),
  USER_FAVORITE("userFavorite");

  private final String value;

  NotificationReason(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static NotificationReason fromValue(String value) {
    for (NotificationReason reason : values()) {
      if (reason.value.equals(value)) {
        return reason;
      }
    }
    throw new IllegalArgumentException("unsupported notification reason: " + value);
  }
}
