package com.example.docnotify.engine.model;

import java.time.Instant;
import java.util.UUID;

/** Row of the locks table held by one worker while it processes one event. */
public record EventLock(
    UUID lockId, String lockKey, String lockedBy, Instant acquiredOn, Instant expiresOn) {}
