/*
 * Where: Notification engine data access
 * What: Inserts, reads, acknowledges and expires rows of the notifications table
 * Why: Supports the event processor, the inbox API and the retention sweep
 */
package com.example.docnotify.engine.repository;

import static com.example.docnotify.common.JdbcTimestampUtils.toInstant;
import static com.example.docnotify.common.JdbcTimestampUtils.toTimestamp;

import com.example.docnotify.engine.model.NotificationReason;
import com.example.docnotify.engine.model.NotificationRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final TypeReference<List<String>> REASONS_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @Transactional(propagation = Propagation.MANDATORY)
  public void insertAll(List<NotificationRecord> records) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          notified_user_id,
          event_id,
          event_type,
          event_params,
          reasons,
          created_on,
          expires_on,
          read_on
        ) VALUES (
          :notificationId,
          :notifiedUserId,
          :eventId,
          :eventType,
          :eventParams::jsonb,
          :reasons::jsonb,
          :createdOn,
          :expiresOn,
          :readOn
        )
        """;
    final SqlParameterSource[] batch =
        records.stream().map(this::toParams).toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }

  public List<NotificationRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT notification_id, notified_user_id, event_id, event_type,
               event_params::text AS event_params_text, reasons::text AS reasons_text,
               created_on, expires_on, read_on
        FROM notifications
        WHERE notified_user_id = :userId
        ORDER BY created_on, notification_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationRecord> findByEventId(UUID eventId) {
    final String sql =
        """
        SELECT notification_id, notified_user_id, event_id, event_type,
               event_params::text AS event_params_text, reasons::text AS reasons_text,
               created_on, expires_on, read_on
        FROM notifications
        WHERE event_id = :eventId
        ORDER BY notified_user_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markRead(UUID notificationId, String userId, Instant readOn) {
    // already read rows keep their first read_on
    final String sql =
        """
        UPDATE notifications
        SET read_on = COALESCE(read_on, :readOn)
        WHERE notification_id = :notificationId
          AND notified_user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("userId", userId)
            .addValue("readOn", toTimestamp(readOn));
    return jdbcTemplate.update(sql, params);
  }

  public int markAllRead(String userId, Instant readOn) {
    final String sql =
        """
        UPDATE notifications
        SET read_on = :readOn
        WHERE notified_user_id = :userId
          AND read_on IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("readOn", toTimestamp(readOn));
    return jdbcTemplate.update(sql, params);
  }

  public int countUnread(String userId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE notified_user_id = :userId
          AND read_on IS NULL
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE expires_on <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource toParams(NotificationRecord record) {
    final List<String> reasons =
        record.reasons().stream().map(NotificationReason::value).toList();
    return new MapSqlParameterSource()
        .addValue("notificationId", record.notificationId())
        .addValue("notifiedUserId", record.notifiedUserId())
        .addValue("eventId", record.eventId())
        .addValue("eventType", record.eventType())
        .addValue("eventParams", writeJson(record.eventParams()))
        .addValue("reasons", writeJson(reasons))
        .addValue("createdOn", toTimestamp(record.createdOn()))
        .addValue("expiresOn", toTimestamp(record.expiresOn()))
        .addValue("readOn", toTimestamp(record.readOn()));
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    try {
      final List<NotificationReason> reasons =
          objectMapper.readValue(rs.getString("reasons_text"), REASONS_TYPE).stream()
              .map(NotificationReason::fromValue)
              .toList();
      return new NotificationRecord(
          UUID.fromString(rs.getString("notification_id")),
          rs.getString("notified_user_id"),
          UUID.fromString(rs.getString("event_id")),
          rs.getString("event_type"),
          objectMapper.readTree(rs.getString("event_params_text")),
          reasons,
          rs.getTimestamp("created_on").toInstant(),
          rs.getTimestamp("expires_on").toInstant(),
          toInstant(rs.getTimestamp("read_on")));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "notification row parse failure id=" + rs.getString("notification_id"), ex);
    }
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification json serialization failure", ex);
    }
  }
}
