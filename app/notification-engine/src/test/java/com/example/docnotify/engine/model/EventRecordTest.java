package com.example.docnotify.engine.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class EventRecordTest {

  private static final Instant CREATED_ON = Instant.parse("2026-01-17T00:00:00Z");

  @Test
  void processedOnIsSetExactlyOnce() {
    final EventRecord processed = event().withProcessedOn(CREATED_ON.plusSeconds(1));

    assertThat(processed.isProcessed()).isTrue();
    assertThatThrownBy(() -> processed.withProcessedOn(CREATED_ON.plusSeconds(2)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void processingErrorsOnlyGrow() {
    final EventRecord original = event();
    final ProcessingError error =
        new ProcessingError("java.lang.IllegalStateException", "boom", "", null, CREATED_ON);

    final EventRecord failed = original.withProcessingError(error).withProcessingError(error);

    assertThat(original.processingErrors()).isEmpty();
    assertThat(failed.processingErrors()).hasSize(2);
    assertThat(failed.isProcessed()).isFalse();
  }

  @Test
  void paramsCannotBeChangedThroughTheAccessor() {
    final EventRecord event = event();

    ((ObjectNode) event.params()).put("userId", "someone-else");

    assertThat(event.actorUserId()).isEqualTo("user-1");
    assertThat(event.params().get("userId").asText()).isEqualTo("user-1");
  }

  @Test
  void eventTypeValuesRoundTrip() {
    assertThat(EventType.fromValue("revisionCreated")).isEqualTo(EventType.REVISION_CREATED);
    assertThat(EventType.fromValue("commentCreated")).isEqualTo(EventType.COMMENT_CREATED);
    assertThatThrownBy(() -> EventType.fromValue("documentDeleted"))
        .isInstanceOf(UnknownEventTypeException.class)
        .hasMessage("Event type documentDeleted is unknown");
  }

  private static EventRecord event() {
    return EventRecord.unprocessed(
        UUID.randomUUID(),
        EventType.REVISION_CREATED,
        new RevisionCreatedParams("revision-1", "document-1", "room-1", "user-1").toJson(),
        CREATED_ON);
  }
}
