/*
 * Where: Notification engine service layer
 * What: Decides whether and why a candidate user is notified about an event
 * Why: Keep recipient selection pure so it can be tested without a database
 */
package com.example.docnotify.engine.service;

import com.example.docnotify.engine.model.DocumentRecord;
import com.example.docnotify.engine.model.EventRecord;
import com.example.docnotify.engine.model.FavoriteType;
import com.example.docnotify.engine.model.NotificationReason;
import com.example.docnotify.engine.model.RevisionRecord;
import com.example.docnotify.engine.model.RoomRecord;
import com.example.docnotify.engine.model.UserRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Reason computation for the supported event types.
 *
 * <p>Both functions first apply the same early exits, in order: the referenced entity was deleted,
 * the entity is a room draft, the candidate caused the event, the event predates the candidate's
 * account. Otherwise every applicable reason is collected in {@link NotificationReason} declaration
 * order. An empty result means "do not notify".
 */
public final class NotificationReasons {
  private NotificationReasons() {}

  public static List<NotificationReason> forRevisionCreatedEvent(
      EventRecord event,
      RevisionRecord revision,
      DocumentRecord document,
      RoomRecord room,
      UserRecord candidate) {
    if (revision == null || document == null) {
      return List.of();
    }
    if (revision.isDraft() || document.isDraft()) {
      return List.of();
    }
    return collectReasons(event, document, room, candidate);
  }

  public static List<NotificationReason> forCommentCreatedEvent(
      EventRecord event, DocumentRecord document, RoomRecord room, UserRecord candidate) {
    if (document == null) {
      return List.of();
    }
    if (document.isDraft()) {
      return List.of();
    }
    return collectReasons(event, document, room, candidate);
  }

  private static List<NotificationReason> collectReasons(
      EventRecord event, DocumentRecord document, RoomRecord room, UserRecord candidate) {
    final String actorUserId = event.actorUserId();
    if (candidate.userId().equals(actorUserId)) {
      return List.of();
    }
    // accounts never hear about events older than themselves
    if (candidate.createdOn() != null && event.createdOn().isBefore(candidate.createdOn())) {
      return List.of();
    }

    final List<NotificationReason> reasons = new ArrayList<>(NotificationReason.values().length);
    if (room != null && room.isOwnerOrMember(candidate.userId())) {
      reasons.add(NotificationReason.ROOM_MEMBERSHIP);
    }
    if (candidate.hasFavorite(FavoriteType.DOCUMENT, document.documentId())) {
      reasons.add(NotificationReason.DOCUMENT_FAVORITE);
    }
    if (candidate.hasFavorite(FavoriteType.USER, actorUserId)) {
      reasons.add(NotificationReason.USER_FAVORITE);
    }
    return List.copyOf(reasons);
  }
}
