/*
 * Where: Notification engine data access
 * What: Reads the rooms and room_members read models
 * Why: Room owners and members are notified about activity in their rooms
 */
package com.example.docnotify.engine.repository;

import static com.example.docnotify.common.JdbcTimestampUtils.toInstant;

import com.example.docnotify.engine.model.RoomMember;
import com.example.docnotify.engine.model.RoomRecord;
import com.example.docnotify.engine.service.RoomResolver;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RoomRepository implements RoomResolver {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<RoomRecord> findRoomById(String roomId) {
    final String roomSql =
        """
        SELECT room_id, owner_user_id
        FROM rooms
        WHERE room_id = :roomId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("roomId", roomId);
    final Optional<String> owner =
        jdbcTemplate
            .query(roomSql, params, (rs, rowNum) -> rs.getString("owner_user_id"))
            .stream()
            .findFirst();
    if (owner.isEmpty()) {
      return Optional.empty();
    }
    final String membersSql =
        """
        SELECT user_id, joined_on
        FROM room_members
        WHERE room_id = :roomId
        ORDER BY joined_on, user_id
        """;
    final List<RoomMember> members =
        jdbcTemplate.query(
            membersSql,
            params,
            (rs, rowNum) ->
                new RoomMember(rs.getString("user_id"), toInstant(rs.getTimestamp("joined_on"))));
    return Optional.of(new RoomRecord(roomId, owner.get(), members));
  }
}
