/*
 * Where: Notification engine service layer
 * What: Applies the retention policy to notifications, processed events and locks
 * Why: Prevent unbounded growth while surfacing events the processor never finished
 */
package com.example.docnotify.engine.service;

import com.example.docnotify.engine.config.NotificationRetentionProperties;
import com.example.docnotify.engine.repository.EventRepository;
import com.example.docnotify.engine.repository.LockRepository;
import com.example.docnotify.engine.repository.NotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationRepository notificationRepository;
  private final EventRepository eventRepository;
  private final LockRepository lockRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.processedEventRetentionDays()));
    final int staleUnprocessedCount = eventRepository.countStaleUnprocessed(threshold);
    if (staleUnprocessedCount > 0) {
      logger.error(
          "event retention found stale unprocessed events count={} threshold={}",
          staleUnprocessedCount,
          threshold);
    }
    final int deletedNotifications = notificationRepository.deleteExpired(now);
    final int deletedEvents = eventRepository.deleteProcessedOlderThan(threshold);
    final int deletedLocks = lockRepository.deleteExpired(now);
    logger.info(
        "notification retention cleanup deleted notifications={} processedEvents={} locks={} threshold={}",
        deletedNotifications,
        deletedEvents,
        deletedLocks,
        threshold);
  }
}
