/*
 * Where: Notification engine domain model
 * What: Snapshot of a candidate recipient taken from the user directory
 * Why: Reason computation needs identity, account age and favorites only
 */
package com.example.docnotify.engine.model;

import java.time.Instant;
import java.util.List;

public record UserRecord(String userId, Instant createdOn, List<Favorite> favorites) {

  public UserRecord {
    favorites = favorites == null ? List.of() : List.copyOf(favorites);
  }

  public boolean hasFavorite(FavoriteType type, String id) {
    if (id == null) {
      return false;
    }
    for (Favorite favorite : favorites) {
      if (favorite.type() == type && id.equals(favorite.id())) {
        return true;
      }
    }
    return false;
  }
}
