package com.example.docnotify.engine.model;

import com.fasterxml.jackson.databind.JsonNode;

final class EventParams {
  private EventParams() {}

  static String text(JsonNode params, String field) {
    if (params == null) {
      return null;
    }
    final JsonNode value = params.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }
}
