/*
 * Where: Notification engine API
 * What: Error codes carried by error responses
 * Why: Let clients tell causes apart under the same HTTP status
 */
package com.example.docnotify.engine.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOTIFICATION_NOT_FOUND
}
