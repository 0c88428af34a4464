/*
 * Where: Notification engine domain model
 * What: Typed view of the params of a revisionCreated event
 * Why: Events store params as free-form JSON; handlers need named fields
 */
package com.example.docnotify.engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public record RevisionCreatedParams(
    String revisionId, String documentId, String roomId, String userId) {

  public static RevisionCreatedParams from(JsonNode params) {
    return new RevisionCreatedParams(
        EventParams.text(params, "revisionId"),
        EventParams.text(params, "documentId"),
        EventParams.text(params, "roomId"),
        EventParams.text(params, "userId"));
  }

  public ObjectNode toJson() {
    final ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("revisionId", revisionId);
    node.put("documentId", documentId);
    node.put("roomId", roomId);
    node.put("userId", userId);
    return node;
  }
}
