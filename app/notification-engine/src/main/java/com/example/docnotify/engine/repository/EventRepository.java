/*
 * Where: Notification engine data access
 * What: Reads and updates the events table (the event log)
 * Why: The processor needs oldest-first pickup and in-transaction reload/update
 */
package com.example.docnotify.engine.repository;

import static com.example.docnotify.common.JdbcTimestampUtils.toInstant;
import static com.example.docnotify.common.JdbcTimestampUtils.toTimestamp;

import com.example.docnotify.engine.model.EventRecord;
import com.example.docnotify.engine.model.ProcessingError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class EventRepository {

  private static final TypeReference<List<ProcessingError>> PROCESSING_ERRORS_TYPE =
      new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public void insert(EventRecord event) {
    final String sql =
        """
        INSERT INTO events (
          event_id,
          type,
          params,
          created_on,
          processed_on,
          processing_errors
        ) VALUES (
          :eventId,
          :type,
          :params::jsonb,
          :createdOn,
          :processedOn,
          :processingErrors::jsonb
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", event.eventId())
            .addValue("type", event.type())
            .addValue("params", writeJson(event.params()))
            .addValue("createdOn", toTimestamp(event.createdOn()))
            .addValue("processedOn", toTimestamp(event.processedOn()))
            .addValue("processingErrors", writeJson(event.processingErrors()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<UUID> findOldestUnprocessedEventId() {
    final String sql =
        """
        SELECT event_id
        FROM events
        WHERE processed_on IS NULL
        ORDER BY created_on, event_id
        LIMIT 1
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource(),
            (rs, rowNum) -> UUID.fromString(rs.getString("event_id")))
        .stream()
        .findFirst();
  }

  public Optional<EventRecord> findById(UUID eventId) {
    final String sql =
        """
        SELECT event_id, type, params::text AS params_text, created_on, processed_on,
               processing_errors::text AS processing_errors_text
        FROM events
        WHERE event_id = :eventId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<EventRecord> findByIdForUpdate(UUID eventId) {
    // the row lock keeps the reload and the final update on one consistent version
    final String sql =
        """
        SELECT event_id, type, params::text AS params_text, created_on, processed_on,
               processing_errors::text AS processing_errors_text
        FROM events
        WHERE event_id = :eventId
        FOR UPDATE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public int update(EventRecord event) {
    // processed_on never goes back to NULL once set
    final String sql =
        """
        UPDATE events
        SET processed_on = COALESCE(processed_on, :processedOn),
            processing_errors = :processingErrors::jsonb
        WHERE event_id = :eventId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", event.eventId())
            .addValue("processedOn", toTimestamp(event.processedOn()))
            .addValue("processingErrors", writeJson(event.processingErrors()));
    return jdbcTemplate.update(sql, params);
  }

  public int countUnprocessed() {
    final String sql = "SELECT COUNT(*) FROM events WHERE processed_on IS NULL";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public int countStaleUnprocessed(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM events
        WHERE processed_on IS NULL
          AND created_on < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteProcessedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM events
        WHERE processed_on IS NOT NULL
          AND processed_on < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private EventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    try {
      return new EventRecord(
          UUID.fromString(rs.getString("event_id")),
          rs.getString("type"),
          objectMapper.readTree(rs.getString("params_text")),
          rs.getTimestamp("created_on").toInstant(),
          toInstant(rs.getTimestamp("processed_on")),
          objectMapper.readValue(rs.getString("processing_errors_text"), PROCESSING_ERRORS_TYPE));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("event row parse failure eventId=" + rs.getString("event_id"), ex);
    }
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("event json serialization failure", ex);
    }
  }
}
