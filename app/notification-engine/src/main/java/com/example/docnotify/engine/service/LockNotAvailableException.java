/*
 * Where: Notification engine service layer
 * What: Signals that another holder owns a lock
 * Why: Lock contention is an expected outcome, not a processing failure
 */
package com.example.docnotify.engine.service;

public class LockNotAvailableException extends Exception {

  private static final long serialVersionUID = 1L;

  public LockNotAvailableException(String lockKey) {
    super("lock is held by another worker: " + lockKey);
  }
}
