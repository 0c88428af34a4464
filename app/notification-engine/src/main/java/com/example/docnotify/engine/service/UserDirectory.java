/*
 * Where: Notification engine service layer
 * What: Source of candidate recipients
 * Why: The full user population must never be materialized at once
 */
package com.example.docnotify.engine.service;

public interface UserDirectory {

  /** Opens a lazy cursor over all active users; the caller must close it. */
  UserCursor openActiveUsersCursor();
}
