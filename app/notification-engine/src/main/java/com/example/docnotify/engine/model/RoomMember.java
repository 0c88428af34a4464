package com.example.docnotify.engine.model;

import java.time.Instant;

public record RoomMember(String userId, Instant joinedOn) {}
