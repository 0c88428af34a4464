/*
 * Where: Notification engine domain model
 * What: Room ownership and membership snapshot
 * Why: Room membership is one of the notification reasons
 */
package com.example.docnotify.engine.model;

import java.util.List;

public record RoomRecord(String roomId, String owner, List<RoomMember> members) {

  public RoomRecord {
    members = members == null ? List.of() : List.copyOf(members);
  }

  public boolean isOwnerOrMember(String userId) {
    if (userId == null) {
      return false;
    }
    if (userId.equals(owner)) {
      return true;
    }
    return members.stream().anyMatch(member -> userId.equals(member.userId()));
  }
}
