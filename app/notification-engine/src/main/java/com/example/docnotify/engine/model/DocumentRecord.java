package com.example.docnotify.engine.model;

public record DocumentRecord(String documentId, String roomId, RoomContext roomContext) {

  public boolean isDraft() {
    return roomContext != null && roomContext.draft();
  }
}
