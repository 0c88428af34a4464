/*
 * Where: Notification engine notification store integration tests
 * What: Verifies batch insert, chronological reads, read marks and expiry on Postgres
 * Why: The inbox relies on created_on ordering and per-user isolation
 */
package com.example.docnotify.engine.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.docnotify.engine.AbstractPostgresContainerTest;
import com.example.docnotify.engine.model.NotificationReason;
import com.example.docnotify.engine.model.NotificationRecord;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");
  private static final String USER_ID = "user-1";
  private static final String OTHER_USER_ID = "user-2";

  @Autowired private NotificationRepository notificationRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private PlatformTransactionManager transactionManager;

  @BeforeEach
  void cleanup() {
    new ReadModelFixtures(jdbcTemplate).deleteAll();
  }

  @Test
  void insertAllAndReadBackInCreationOrder() {
    final NotificationRecord later = notification(USER_ID, BASE_TIME.plusSeconds(60));
    final NotificationRecord earlier = notification(USER_ID, BASE_TIME);
    final NotificationRecord foreign = notification(OTHER_USER_ID, BASE_TIME);
    insertAll(List.of(later, earlier, foreign));

    final List<NotificationRecord> loaded = notificationRepository.findByUserId(USER_ID);

    assertThat(loaded).extracting(NotificationRecord::notificationId)
        .containsExactly(earlier.notificationId(), later.notificationId());
    assertThat(loaded.get(0)).isEqualTo(earlier);
  }

  @Test
  void rejectsSecondNotificationForSameEventAndUser() {
    final NotificationRecord first = notification(USER_ID, BASE_TIME);
    final NotificationRecord duplicate =
        new NotificationRecord(
            UUID.randomUUID(),
            USER_ID,
            first.eventId(),
            first.eventType(),
            first.eventParams(),
            first.reasons(),
            first.createdOn(),
            first.expiresOn(),
            null);

    assertThatThrownBy(() -> insertAll(List.of(first, duplicate)))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThat(notificationRepository.findByUserId(USER_ID)).isEmpty();
  }

  @Test
  void markReadOnlyTouchesTheOwnersNotification() {
    final NotificationRecord notification = notification(USER_ID, BASE_TIME);
    insertAll(List.of(notification));
    final Instant readOn = BASE_TIME.plusSeconds(5);

    assertThat(notificationRepository.markRead(notification.notificationId(), OTHER_USER_ID, readOn))
        .isZero();
    assertThat(notificationRepository.markRead(notification.notificationId(), USER_ID, readOn))
        .isEqualTo(1);
    notificationRepository.markRead(notification.notificationId(), USER_ID, readOn.plusSeconds(5));

    assertThat(notificationRepository.findByUserId(USER_ID).get(0).readOn()).isEqualTo(readOn);
    assertThat(notificationRepository.countUnread(USER_ID)).isZero();
  }

  @Test
  void markAllReadCountsOnlyUnread() {
    insertAll(
        List.of(
            notification(USER_ID, BASE_TIME),
            notification(USER_ID, BASE_TIME.plusSeconds(1)),
            notification(OTHER_USER_ID, BASE_TIME)));

    assertThat(notificationRepository.countUnread(USER_ID)).isEqualTo(2);
    assertThat(notificationRepository.markAllRead(USER_ID, BASE_TIME)).isEqualTo(2);
    assertThat(notificationRepository.markAllRead(USER_ID, BASE_TIME)).isZero();
    assertThat(notificationRepository.countUnread(OTHER_USER_ID)).isEqualTo(1);
  }

  @Test
  void deleteExpiredRemovesRowsAtOrPastExpiry() {
    final NotificationRecord expired = notification(USER_ID, BASE_TIME.minusSeconds(1));
    final NotificationRecord live = notification(USER_ID, BASE_TIME.plusSeconds(1));
    insertAll(List.of(expired, live));

    final int deleted = notificationRepository.deleteExpired(expired.expiresOn());

    assertThat(deleted).isEqualTo(1);
    assertThat(notificationRepository.findByUserId(USER_ID))
        .extracting(NotificationRecord::notificationId)
        .containsExactly(live.notificationId());
  }

  private void insertAll(List<NotificationRecord> records) {
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(status -> notificationRepository.insertAll(records));
  }

  private static NotificationRecord notification(String userId, Instant createdOn) {
    return new NotificationRecord(
        UUID.randomUUID(),
        userId,
        UUID.randomUUID(),
        "commentCreated",
        JsonNodeFactory.instance.objectNode().put("documentId", "document-1").putNull("roomId"),
        List.of(NotificationReason.DOCUMENT_FAVORITE, NotificationReason.USER_FAVORITE),
        createdOn,
        createdOn.plusSeconds(3600),
        null);
  }
}
