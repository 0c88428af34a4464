/*
 * Where: Notification engine domain model
 * What: Typed view of the params of a commentCreated event
 * Why: Events store params as free-form JSON; handlers need named fields
 */
package com.example.docnotify.engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public record CommentCreatedParams(
    String commentId, String documentId, String roomId, String userId) {

  public static CommentCreatedParams from(JsonNode params) {
    return new CommentCreatedParams(
        EventParams.text(params, "commentId"),
        EventParams.text(params, "documentId"),
        EventParams.text(params, "roomId"),
        EventParams.text(params, "userId"));
  }

  public ObjectNode toJson() {
    final ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("commentId", commentId);
    node.put("documentId", documentId);
    node.put("roomId", roomId);
    node.put("userId", userId);
    return node;
  }
}
