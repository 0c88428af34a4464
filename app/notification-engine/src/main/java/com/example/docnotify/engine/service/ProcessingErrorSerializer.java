/*
 * Where: Notification engine service layer
 * What: Converts a handler failure into a storable ProcessingError
 * Why: Operators diagnose poison events from the persisted error trail only
 */
package com.example.docnotify.engine.service;

import com.example.docnotify.engine.config.EventProcessingProperties;
import com.example.docnotify.engine.model.ProcessingError;
import com.google.common.base.Ascii;
import java.time.Instant;
import java.util.Arrays;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProcessingErrorSerializer {

  static final int MAX_STACK_FRAMES = 20;
  static final int MAX_CAUSE_DEPTH = 5;
  private static final String TRUNCATION_INDICATOR = "...";

  private final EventProcessingProperties properties;

  public ProcessingError serialize(Throwable error, Instant occurredOn) {
    return serialize(error, occurredOn, 0);
  }

  private ProcessingError serialize(Throwable error, Instant occurredOn, int depth) {
    final Throwable cause = error.getCause();
    final ProcessingError serializedCause =
        cause != null && cause != error && depth < MAX_CAUSE_DEPTH
            ? serialize(cause, occurredOn, depth + 1)
            : null;
    return new ProcessingError(
        error.getClass().getName(),
        truncate(error.getMessage()),
        stack(error),
        serializedCause,
        occurredOn);
  }

  private String stack(Throwable error) {
    return Arrays.stream(error.getStackTrace())
        .limit(MAX_STACK_FRAMES)
        .map(StackTraceElement::toString)
        .collect(Collectors.joining("\n"));
  }

  private String truncate(String message) {
    if (message == null) {
      return "unknown error";
    }
    return Ascii.truncate(message, properties.errorMessageMaxLength(), TRUNCATION_INDICATOR);
  }
}
