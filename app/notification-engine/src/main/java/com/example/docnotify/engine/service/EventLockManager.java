/*
 * Where: Notification engine service layer
 * What: Takes and releases the per-event lock
 * Why: Only one worker may process a given event at a time
 */
package com.example.docnotify.engine.service;

import com.example.docnotify.engine.config.EventProcessingProperties;
import com.example.docnotify.engine.model.EventLock;
import com.example.docnotify.engine.repository.LockRepository;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Advisory locks backed by the {@code locks} table.
 *
 * <p>A lock stays valid until {@code notification.processing.lock-ttl} has passed; after that any
 * worker may take it over. Holders always release in a {@code finally} block, the TTL only covers
 * holders that died without doing so.
 */
@Component
@RequiredArgsConstructor
public class EventLockManager {

  private static final Logger logger = LoggerFactory.getLogger(EventLockManager.class);
  private static final String EVENT_LOCK_PREFIX = "event:";
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final LockRepository lockRepository;
  private final EventProcessingProperties properties;
  private final Clock clock;

  public EventLock acquireEventLock(UUID eventId) throws LockNotAvailableException {
    final Instant now = Instant.now(clock);
    final String lockKey = eventLockKey(eventId);
    return lockRepository
        .tryAcquire(lockKey, resolveLockedBy(), now, now.plus(properties.lockTtl()))
        .orElseThrow(() -> new LockNotAvailableException(lockKey));
  }

  /** Never throws; a lock that cannot be deleted expires on its own. */
  public void releaseLock(EventLock lock) {
    if (lock == null) {
      return;
    }
    try {
      final int deleted = lockRepository.release(lock);
      if (deleted == 0) {
        logger.warn(
            "lock was already released or taken over lockKey={} lockId={}",
            lock.lockKey(),
            lock.lockId());
      }
    } catch (DataAccessException ex) {
      logger.warn(
          "lock release failed lockKey={} expiresOn={}", lock.lockKey(), lock.expiresOn(), ex);
    }
  }

  static String eventLockKey(UUID eventId) {
    return EVENT_LOCK_PREFIX + eventId;
  }

  @VisibleForTesting
  String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
