/*
 * Where: Notification engine data access
 * What: Acquires and releases rows of the locks table
 * Why: Per-event mutual exclusion across workers and processes
 */
package com.example.docnotify.engine.repository;

import static com.example.docnotify.common.JdbcTimestampUtils.toTimestamp;

import com.example.docnotify.engine.model.EventLock;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class LockRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts the lock row, or takes over a row whose {@code expires_on} has passed.
   *
   * @return the acquired lock, or empty while another holder's lock is still valid
   */
  public Optional<EventLock> tryAcquire(
      String lockKey, String lockedBy, Instant now, Instant expiresOn) {
    final String sql =
        """
        INSERT INTO locks (lock_key, lock_id, locked_by, acquired_on, expires_on)
        VALUES (:lockKey, :lockId, :lockedBy, :now, :expiresOn)
        ON CONFLICT (lock_key) DO UPDATE
          SET lock_id = EXCLUDED.lock_id,
              locked_by = EXCLUDED.locked_by,
              acquired_on = EXCLUDED.acquired_on,
              expires_on = EXCLUDED.expires_on
        WHERE locks.expires_on <= :now
        RETURNING lock_key, lock_id, locked_by, acquired_on, expires_on
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lockKey", lockKey)
            .addValue("lockId", UUID.randomUUID())
            .addValue("lockedBy", lockedBy)
            .addValue("now", toTimestamp(now))
            .addValue("expiresOn", toTimestamp(expiresOn));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Deletes only the caller's row so a holder that lost its lock cannot free a successor's. */
  public int release(EventLock lock) {
    final String sql =
        """
        DELETE FROM locks
        WHERE lock_key = :lockKey
          AND lock_id = :lockId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lockKey", lock.lockKey())
            .addValue("lockId", lock.lockId());
    return jdbcTemplate.update(sql, params);
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM locks
        WHERE expires_on <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private EventLock mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new EventLock(
        UUID.fromString(rs.getString("lock_id")),
        rs.getString("lock_key"),
        rs.getString("locked_by"),
        rs.getTimestamp("acquired_on").toInstant(),
        rs.getTimestamp("expires_on").toInstant());
  }
}
