/*
 * Where: Notification engine worker
 * What: Drains the event log on a fixed delay
 * Why: Events are processed asynchronously from the actions that record them
 */
package com.example.docnotify.engine.service;

import com.example.docnotify.engine.config.EventProcessingProperties;
import com.example.docnotify.engine.model.ProcessingContext;
import com.example.docnotify.engine.repository.EventRepository;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.processing.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class EventProcessingWorker {

  private static final Logger logger = LoggerFactory.getLogger(EventProcessingWorker.class);

  private final EventProcessingService processingService;
  private final EventRepository eventRepository;
  private final EventProcessingProperties properties;
  private final NotificationMetrics metrics;
  private final ProcessingContext context = new ProcessingContext();

  @Scheduled(fixedDelayString = "${notification.processing.poll-interval}")
  public void run() {
    int processed = 0;
    while (processed < properties.maxEventsPerRun()
        && !context.isCancellationRequested()
        && processingService.processNextEvent(context)) {
      processed++;
    }
    updateBacklog();
  }

  @PreDestroy
  public void shutdown() {
    logger.info("event processing worker stopping");
    context.requestCancellation();
  }

  ProcessingContext context() {
    return context;
  }

  private void updateBacklog() {
    try {
      metrics.updateBacklogCurrent(eventRepository.countUnprocessed());
    } catch (DataAccessException ex) {
      logger.warn("event backlog count failed", ex);
    }
  }
}
