/*
 * Where: Notification engine data access
 * What: Reads the users/user_favorites read model
 * Why: Supplies candidate recipients to the event processor page by page
 */
package com.example.docnotify.engine.repository;

import com.example.docnotify.engine.config.EventProcessingProperties;
import com.example.docnotify.engine.model.Favorite;
import com.example.docnotify.engine.model.FavoriteType;
import com.example.docnotify.engine.model.UserRecord;
import com.example.docnotify.engine.service.UserCursor;
import com.example.docnotify.engine.service.UserDirectory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserRepository implements UserDirectory {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final EventProcessingProperties properties;

  @Override
  public UserCursor openActiveUsersCursor() {
    final int pageSize = properties.userBatchSize();
    return new PagedUserCursor(afterUserId -> findActivePage(afterUserId, pageSize), pageSize);
  }

  List<UserRecord> findActivePage(String afterUserId, int limit) {
    final String sql =
        """
        SELECT user_id, created_on
        FROM users
        WHERE account_closed_on IS NULL
          AND user_id > :afterUserId
        ORDER BY user_id
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("afterUserId", afterUserId).addValue("limit", limit);
    final Map<String, Instant> createdOnByUserId = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          createdOnByUserId.put(rs.getString("user_id"), rs.getTimestamp("created_on").toInstant());
        });
    if (createdOnByUserId.isEmpty()) {
      return List.of();
    }
    final Map<String, List<Favorite>> favorites = findFavorites(createdOnByUserId.keySet());
    final List<UserRecord> users = new ArrayList<>(createdOnByUserId.size());
    createdOnByUserId.forEach(
        (userId, createdOn) ->
            users.add(new UserRecord(userId, createdOn, favorites.getOrDefault(userId, List.of()))));
    return users;
  }

  private Map<String, List<Favorite>> findFavorites(Iterable<String> userIds) {
    final String sql =
        """
        SELECT user_id, type, target_id
        FROM user_favorites
        WHERE user_id IN (:userIds)
        ORDER BY user_id, set_on
        """;
    final List<String> ids = new ArrayList<>();
    userIds.forEach(ids::add);
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userIds", ids);
    final Map<String, List<Favorite>> favorites = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          favorites
              .computeIfAbsent(rs.getString("user_id"), ignored -> new ArrayList<>())
              .add(
                  new Favorite(
                      FavoriteType.fromValue(rs.getString("type")), rs.getString("target_id")));
        });
    return favorites;
  }
}
