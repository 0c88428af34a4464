/*
 * Where: Notification engine service layer
 * What: Turns one unprocessed event into notifications for every interested user
 * Why: The event outcome and its notifications must be committed together, exactly once
 */
package com.example.docnotify.engine.service;

import com.example.docnotify.engine.model.CommentCreatedParams;
import com.example.docnotify.engine.model.DocumentRecord;
import com.example.docnotify.engine.model.EventLock;
import com.example.docnotify.engine.model.EventRecord;
import com.example.docnotify.engine.model.EventType;
import com.example.docnotify.engine.model.NotificationReason;
import com.example.docnotify.engine.model.NotificationRecord;
import com.example.docnotify.engine.model.ProcessingContext;
import com.example.docnotify.engine.model.ProcessingResult;
import com.example.docnotify.engine.model.RevisionCreatedParams;
import com.example.docnotify.engine.model.RevisionRecord;
import com.example.docnotify.engine.model.RoomRecord;
import com.example.docnotify.engine.model.UserRecord;
import com.example.docnotify.engine.repository.EventRepository;
import com.example.docnotify.engine.repository.NotificationRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Processes the event log one event at a time.
 *
 * <p>Each attempt runs under the event's lock and inside a single transaction: the event row is
 * re-read with a row lock, the handler computes every notification in memory, and the batch insert
 * plus the event update commit together. A failing handler runs in a savepoint so its partial
 * writes are undone while the error trail is still persisted. After {@link
 * #MAX_PROCESSING_ATTEMPTS} recorded failures the event is closed anyway so it cannot block the
 * queue.
 */
@Service
@RequiredArgsConstructor
public class EventProcessingService {

  private static final Logger logger = LoggerFactory.getLogger(EventProcessingService.class);
  static final int MAX_PROCESSING_ATTEMPTS = 3;
  static final String MDC_EVENT_ID = "event_id";

  private final EventRepository eventRepository;
  private final NotificationRepository notificationRepository;
  private final UserDirectory userDirectory;
  private final DocumentResolver documentResolver;
  private final DocumentRevisionResolver documentRevisionResolver;
  private final RoomResolver roomResolver;
  private final EventLockManager lockManager;
  private final ProcessingErrorSerializer errorSerializer;
  private final NotificationMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * Processes the oldest unprocessed event.
   *
   * @return {@code true} when an attempt was made and recorded, {@code false} when there was
   *     nothing to do, the lock was held elsewhere, the caller is shutting down or the attempt
   *     failed outside of the handler
   */
  public boolean processNextEvent(ProcessingContext context) {
    UUID eventId = null;
    try {
      final Optional<UUID> next = eventRepository.findOldestUnprocessedEventId();
      if (next.isEmpty()) {
        logger.debug("no event to process");
        return false;
      }
      eventId = next.get();
      if (context.isCancellationRequested()) {
        return false;
      }
      return processEvent(eventId, context);
    } catch (RuntimeException ex) {
      logger.error("event processing aborted eventId={}", eventId, ex);
      return false;
    }
  }

  @VisibleForTesting
  boolean processEvent(UUID eventId, ProcessingContext context) {
    final EventLock lock;
    try {
      lock = lockManager.acquireEventLock(eventId);
    } catch (LockNotAvailableException ex) {
      logger.debug("event lock not available eventId={}", eventId);
      metrics.recordEventResult(NotificationMetrics.RESULT_SKIPPED);
      return false;
    }

    MDC.put(MDC_EVENT_ID, eventId.toString());
    try {
      final AttemptOutcome outcome =
          transactionTemplate().execute(status -> {
            final Optional<EventRecord> loaded = eventRepository.findByIdForUpdate(eventId);
            if (loaded.isEmpty() || loaded.get().isProcessed()) {
              return AttemptOutcome.ALREADY_PROCESSED;
            }
            final AttemptOutcome attempted = attempt(loaded.get(), context);
            if (attempted.result() == ProcessingResult.CANCELLED) {
              status.setRollbackOnly();
            }
            return attempted;
          });
      return recordOutcome(eventId, outcome);
    } finally {
      MDC.remove(MDC_EVENT_ID);
      lockManager.releaseLock(lock);
    }
  }

  private AttemptOutcome attempt(EventRecord event, ProcessingContext context) {
    logger.debug("processing event type={}", event.type());
    HandlerOutcome handlerOutcome;
    EventRecord updated = event;
    try {
      handlerOutcome = savepointTemplate().execute(status -> dispatch(event, context));
    } catch (RuntimeException ex) {
      updated = event.withProcessingError(errorSerializer.serialize(ex, Instant.now(clock)));
      handlerOutcome = HandlerOutcome.FAILED;
      logger.warn(
          "event processing failed eventId={} attempt={}",
          event.eventId(),
          updated.processingErrors().size(),
          ex);
    }
    if (handlerOutcome.result() == ProcessingResult.CANCELLED) {
      return new AttemptOutcome(ProcessingResult.CANCELLED, false, 0);
    }

    final boolean succeeded = handlerOutcome.result() == ProcessingResult.SUCCEEDED;
    final boolean exhausted = updated.processingErrors().size() >= MAX_PROCESSING_ATTEMPTS;
    if (succeeded || exhausted) {
      updated = updated.withProcessedOn(Instant.now(clock));
    }
    eventRepository.update(updated);
    return new AttemptOutcome(handlerOutcome.result(), !succeeded && exhausted, handlerOutcome.created());
  }

  private HandlerOutcome dispatch(EventRecord event, ProcessingContext context) {
    switch (EventType.fromValue(event.type())) {
      case REVISION_CREATED:
        return processRevisionCreatedEvent(event, context);
      case COMMENT_CREATED:
        return processCommentCreatedEvent(event, context);
      default:
        throw new IllegalStateException("no handler for event type " + event.type());
    }
  }

  private HandlerOutcome processRevisionCreatedEvent(EventRecord event, ProcessingContext context) {
    final RevisionCreatedParams params = RevisionCreatedParams.from(event.params());
    final RevisionRecord revision =
        documentRevisionResolver.findRevisionById(params.revisionId()).orElse(null);
    final DocumentRecord document =
        documentResolver.findDocumentById(params.documentId()).orElse(null);
    final RoomRecord room = findRoom(params.roomId());
    return createNotifications(
        event,
        context,
        candidate ->
            NotificationReasons.forRevisionCreatedEvent(event, revision, document, room, candidate));
  }

  private HandlerOutcome processCommentCreatedEvent(EventRecord event, ProcessingContext context) {
    final CommentCreatedParams params = CommentCreatedParams.from(event.params());
    final DocumentRecord document =
        documentResolver.findDocumentById(params.documentId()).orElse(null);
    final RoomRecord room = findRoom(params.roomId());
    return createNotifications(
        event,
        context,
        candidate -> NotificationReasons.forCommentCreatedEvent(event, document, room, candidate));
  }

  private RoomRecord findRoom(String roomId) {
    if (roomId == null) {
      return null;
    }
    return roomResolver.findRoomById(roomId).orElse(null);
  }

  private HandlerOutcome createNotifications(
      EventRecord event,
      ProcessingContext context,
      Function<UserRecord, List<NotificationReason>> reasonsFor) {
    try (UserCursor candidates = userDirectory.openActiveUsersCursor()) {
      final List<NotificationRecord> batch = new ArrayList<>();
      while (candidates.hasNext()) {
        if (context.isCancellationRequested()) {
          // nothing was written yet; dropping the batch discards the attempt
          return HandlerOutcome.CANCELLED;
        }
        final UserRecord candidate = candidates.next();
        final List<NotificationReason> reasons = reasonsFor.apply(candidate);
        if (!reasons.isEmpty()) {
          batch.add(
              NotificationRecord.forEvent(UUID.randomUUID(), candidate.userId(), event, reasons));
        }
      }
      if (!batch.isEmpty()) {
        notificationRepository.insertAll(batch);
      }
      return new HandlerOutcome(ProcessingResult.SUCCEEDED, batch.size());
    }
  }

  private boolean recordOutcome(UUID eventId, AttemptOutcome outcome) {
    if (outcome == null || outcome == AttemptOutcome.ALREADY_PROCESSED) {
      logger.debug("event already processed eventId={}", eventId);
      metrics.recordEventResult(NotificationMetrics.RESULT_SKIPPED);
      return true;
    }
    switch (outcome.result()) {
      case SUCCEEDED:
        metrics.recordEventResult(NotificationMetrics.RESULT_SUCCEEDED);
        metrics.recordNotificationsCreated(outcome.created());
        logger.info("event processed eventId={} notifications={}", eventId, outcome.created());
        return true;
      case CANCELLED:
        metrics.recordEventResult(NotificationMetrics.RESULT_CANCELLED);
        logger.info("event processing cancelled eventId={}", eventId);
        return false;
      case FAILED:
      default:
        if (outcome.exhausted()) {
          metrics.recordEventResult(NotificationMetrics.RESULT_EXHAUSTED);
          logger.error(
              "event marked processed after {} failed attempts eventId={}",
              MAX_PROCESSING_ATTEMPTS,
              eventId);
        } else {
          metrics.recordEventResult(NotificationMetrics.RESULT_FAILED);
        }
        return true;
    }
  }

  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }

  TransactionTemplate savepointTemplate() {
    final TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    return template;
  }

  private record HandlerOutcome(ProcessingResult result, int created) {
    static final HandlerOutcome FAILED = new HandlerOutcome(ProcessingResult.FAILED, 0);
    static final HandlerOutcome CANCELLED = new HandlerOutcome(ProcessingResult.CANCELLED, 0);
  }

  private record AttemptOutcome(ProcessingResult result, boolean exhausted, int created) {
    static final AttemptOutcome ALREADY_PROCESSED = new AttemptOutcome(null, false, 0);
  }
}
