/*
 * Where: Notification engine service layer
 * What: Appends domain events to the event log
 * Why: Document and comment actions only record facts; recipients are computed later
 */
package com.example.docnotify.engine.service;

import com.example.docnotify.engine.model.CommentCreatedParams;
import com.example.docnotify.engine.model.EventRecord;
import com.example.docnotify.engine.model.EventType;
import com.example.docnotify.engine.model.RevisionCreatedParams;
import com.example.docnotify.engine.repository.EventRepository;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EventRecorder {

  private final EventRepository eventRepository;
  private final Clock clock;

  public EventRecord recordRevisionCreatedEvent(
      String revisionId, String documentId, String roomId, String userId) {
    final RevisionCreatedParams params =
        new RevisionCreatedParams(revisionId, documentId, roomId, userId);
    return record(EventType.REVISION_CREATED, params.toJson());
  }

  public EventRecord recordCommentCreatedEvent(
      String commentId, String documentId, String roomId, String userId) {
    final CommentCreatedParams params =
        new CommentCreatedParams(commentId, documentId, roomId, userId);
    return record(EventType.COMMENT_CREATED, params.toJson());
  }

  private EventRecord record(EventType type, JsonNode params) {
    final EventRecord event =
        EventRecord.unprocessed(UUID.randomUUID(), type, params, Instant.now(clock));
    eventRepository.insert(event);
    return event;
  }
}
