/*
 * Where: Notification engine service layer
 * What: Signals a notification that does not exist for the requesting user
 * Why: Mapped to 404 so users cannot probe other users' notification ids
 */
package com.example.docnotify.engine.service;

import java.util.UUID;

public class NotificationNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public NotificationNotFoundException(UUID notificationId) {
    super("notification not found: " + notificationId);
  }
}
