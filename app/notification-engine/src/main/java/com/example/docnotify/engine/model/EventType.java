/*
 * Where: Notification engine domain model
 * What: Enumerates the domain event types that can trigger notifications
 * Why: Keep the stored type string and the dispatch table in one place
 */
package com.example.docnotify.engine.model;

public enum EventType {
  REVISION_CREATED("revisionCreated"),
  COMMENT_CREATED("commentCreated");

  private final String value;

  EventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Maps the stored type string to the enum.
   *
   * @throws UnknownEventTypeException when no handler exists for {@code type}
   */
  public static EventType fromValue(String type) {
    for (EventType eventType : values()) {
      if (eventType.value.equals(type)) {
        return eventType;
      }
    }
    throw new UnknownEventTypeException(type);
  }
}
