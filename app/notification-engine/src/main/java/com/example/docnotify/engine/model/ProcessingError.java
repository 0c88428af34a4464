/*
 * Where: Notification engine domain model
 * What: Serialized failure of one processing attempt
 * Why: events.processing_errors keeps one entry per failed attempt for operators
 */
package com.example.docnotify.engine.model;

import java.time.Instant;

public record ProcessingError(
    String name, String message, String stack, ProcessingError cause, Instant occurredOn) {}
