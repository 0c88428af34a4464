/*
 * Where: Shared utility tests
 * What: Verifies JSON payload copies are detached and structurally equal
 * Why: Grouping relies on structural equality of copied payloads
 */
package com.example.docnotify.common;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JsonTreesTest {

  @Test
  void copyOfIsEqualButDetached() {
    final ObjectNode original = JsonTrees.emptyObject().put("documentId", "d_1");

    final JsonNode copy = JsonTrees.copyOf(original);
    original.put("documentId", "d_2");

    assertThat(copy.get("documentId").asText()).isEqualTo("d_1");
    assertThat(copy).isNotSameAs(original);
  }

  @Test
  void copyOfNullYieldsEmptyObject() {
    assertThat(JsonTrees.copyOf(null)).isEqualTo(JsonTrees.emptyObject());
    assertThat(JsonTrees.copyOf(NullNode.getInstance())).isEqualTo(JsonTrees.emptyObject());
  }

  @Test
  void timestampConversionKeepsInstant() {
    final Instant instant = Instant.parse("2023-02-28T12:01:00Z");

    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
