/*
 * Where: Notification engine domain model
 * What: Snapshot of one row of the event log
 * Why: The processor reloads, mutates and persists events inside one transaction
 */
package com.example.docnotify.engine.model;

import com.example.docnotify.common.JsonTrees;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * An append-only domain occurrence. Only {@code processedOn} and {@code processingErrors} ever
 * change: {@code processedOn} goes from {@code null} to a timestamp exactly once and the error list
 * only grows.
 */
public record EventRecord(
    UUID eventId,
    String type,
    JsonNode params,
    Instant createdOn,
    Instant processedOn,
    List<ProcessingError> processingErrors) {

  public EventRecord {
    params = JsonTrees.copyOf(params);
    processingErrors = processingErrors == null ? List.of() : List.copyOf(processingErrors);
  }

  public static EventRecord unprocessed(UUID eventId, EventType type, JsonNode params, Instant createdOn) {
    return new EventRecord(eventId, type.value(), params, createdOn, null, List.of());
  }

  /** Detached copy; the stored payload never changes once the event is recorded. */
  @Override
  public JsonNode params() {
    return JsonTrees.copyOf(params);
  }

  public boolean isProcessed() {
    return processedOn != null;
  }

  /** Id of the user whose action caused the event. */
  public String actorUserId() {
    return EventParams.text(params, "userId");
  }

  public EventRecord withProcessingError(ProcessingError error) {
    final List<ProcessingError> errors = new ArrayList<>(processingErrors);
    errors.add(error);
    return new EventRecord(eventId, type, params, createdOn, processedOn, errors);
  }

  public EventRecord withProcessedOn(Instant newProcessedOn) {
    if (processedOn != null) {
      throw new IllegalStateException("event " + eventId + " is already processed");
    }
    return new EventRecord(eventId, type, params, createdOn, newProcessedOn, processingErrors);
  }
}
