/*
 * Where: Notification engine retention tests
 * What: Verifies cleanup deletes only eligible notifications, events and locks
 * Why: Unprocessed events and live notifications must survive every sweep
 */
package com.example.docnotify.engine.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.docnotify.engine.AbstractPostgresContainerTest;
import com.example.docnotify.engine.config.NotificationRetentionProperties;
import com.example.docnotify.engine.model.EventRecord;
import com.example.docnotify.engine.model.EventType;
import com.example.docnotify.engine.model.NotificationReason;
import com.example.docnotify.engine.model.NotificationRecord;
import com.example.docnotify.engine.model.RevisionCreatedParams;
import com.example.docnotify.engine.repository.EventRepository;
import com.example.docnotify.engine.repository.LockRepository;
import com.example.docnotify.engine.repository.NotificationRepository;
import com.example.docnotify.engine.repository.ReadModelFixtures;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRetentionServiceTest extends AbstractPostgresContainerTest {

  // Time-sensitive threshold tests are fixed to avoid boundary flakiness.
  private static final Instant FIXED_NOW = Instant.parse("2024-01-01T00:00:00Z");

  @TestConfiguration
  static class FixedClockConfig {
    @Bean(name = "testClock")
    @Primary
    Clock clock() {
      return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    }
  }

  @Autowired private NotificationRetentionService retentionService;
  @Autowired private NotificationRetentionProperties retentionProperties;
  @Autowired private EventRepository eventRepository;
  @Autowired private NotificationRepository notificationRepository;
  @Autowired private LockRepository lockRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private PlatformTransactionManager transactionManager;

  @BeforeEach
  void cleanup() {
    new ReadModelFixtures(jdbcTemplate).deleteAll();
  }

  @Test
  void cleanupRemovesOnlyEligibleRows() {
    final Instant threshold =
        FIXED_NOW.minus(Duration.ofDays(retentionProperties.processedEventRetentionDays()));
    final Instant old = threshold.minusSeconds(1);

    eventRepository.insert(event(old).withProcessedOn(old));
    eventRepository.insert(event(old).withProcessedOn(threshold));
    eventRepository.insert(event(old));

    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status ->
                notificationRepository.insertAll(
                    List.of(
                        notification(FIXED_NOW.minusSeconds(1)),
                        notification(FIXED_NOW),
                        notification(FIXED_NOW.plusSeconds(1)))));

    lockRepository.tryAcquire("event:expired", "worker-1", old, FIXED_NOW.minusSeconds(1));
    lockRepository.tryAcquire("event:valid", "worker-1", FIXED_NOW, FIXED_NOW.plusSeconds(300));

    retentionService.cleanup();

    assertThat(count("SELECT COUNT(*) FROM events")).isEqualTo(2);
    assertThat(count("SELECT COUNT(*) FROM events WHERE processed_on IS NULL")).isEqualTo(1);
    assertThat(count("SELECT COUNT(*) FROM notifications")).isEqualTo(1);
    assertThat(count("SELECT COUNT(*) FROM locks")).isEqualTo(1);
  }

  private static EventRecord event(Instant createdOn) {
    return EventRecord.unprocessed(
        UUID.randomUUID(),
        EventType.REVISION_CREATED,
        new RevisionCreatedParams("revision-1", "document-1", null, "user-1").toJson(),
        createdOn);
  }

  private static NotificationRecord notification(Instant expiresOn) {
    final Instant createdOn = expiresOn.minus(Duration.ofDays(180));
    return new NotificationRecord(
        UUID.randomUUID(),
        "user-2",
        UUID.randomUUID(),
        "revisionCreated",
        new RevisionCreatedParams("revision-1", "document-1", null, "user-1").toJson(),
        List.of(NotificationReason.DOCUMENT_FAVORITE),
        createdOn,
        expiresOn,
        null);
  }

  private int count(String sql) {
    final Integer result = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return result == null ? 0 : result;
  }
}
