package com.example.docnotify.engine.model;

/** Room specific state of a document or revision; {@code null} for documents outside a room. */
public record RoomContext(boolean draft) {}
