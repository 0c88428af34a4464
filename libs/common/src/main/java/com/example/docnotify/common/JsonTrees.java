/*
 * Where: Shared utilities
 * What: Detached copies of Jackson trees used as structured payloads
 * Why: Records holding JsonNode must not share mutable nodes with callers
 */
package com.example.docnotify.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class JsonTrees {
  private JsonTrees() {}

  public static ObjectNode emptyObject() {
    return JsonNodeFactory.instance.objectNode();
  }

  /** Returns a deep copy of {@code node}, or an empty object for {@code null}/missing nodes. */
  public static JsonNode copyOf(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return emptyObject();
    }
    return node.deepCopy();
  }
}
