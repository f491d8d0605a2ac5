/*
 * どこで: Notification リポジトリの統合テスト
 * 何を: 冪等登録、終端状態ガード、取得順序を Postgres で検証する
 * なぜ: 部分ユニークインデックスと ON CONFLICT の組み合わせが DB 方言で崩れないことを保証するため
 */
package com.mos.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.mos.notification.AbstractPostgresContainerTest;
import com.mos.notification.TaskFixtures;
import com.mos.notification.model.NotificationEventRecord;
import com.mos.notification.model.NotificationEventStatus;
import com.mos.notification.model.TaskSnapshot;
import com.mos.notification.model.TaskStatus;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationEventRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-10T01:00:00Z");
  private static final LocalDate DUE_DATE = LocalDate.of(2026, 3, 10);

  @Autowired private NotificationEventRepository eventRepository;
  @Autowired private TaskQueryRepository taskQueryRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    TaskFixtures.deleteAll(jdbcTemplate);
  }

  @Test
  void deadlineReminderInsertIsIdempotentPerTaskAndStage() {
    final UUID taskId = TaskFixtures.insertTask(jdbcTemplate, "Pay rent", "backlog", DUE_DATE, null);

    final boolean first =
        eventRepository.insertDeadlineReminderIfAbsent(
            UUID.randomUUID(), taskId, "D-0", "{\"stage\":\"D-0\"}", BASE_TIME);
    final boolean second =
        eventRepository.insertDeadlineReminderIfAbsent(
            UUID.randomUUID(), taskId, "D-0", "{\"stage\":\"D-0\"}", BASE_TIME.plusSeconds(300));
    final boolean otherStage =
        eventRepository.insertDeadlineReminderIfAbsent(
            UUID.randomUUID(), taskId, "T-2H", "{\"stage\":\"T-2H\"}", BASE_TIME);

    assertThat(first).isTrue();
    assertThat(second).isFalse();
    assertThat(otherStage).isTrue();
    assertThat(eventRepository.countByStatus(NotificationEventStatus.CREATED)).isEqualTo(2);
  }

  @Test
  void followupEventsAreNotDeduplicated() {
    eventRepository.insert(followup("morning", BASE_TIME));
    eventRepository.insert(followup("morning", BASE_TIME.plusSeconds(1)));

    assertThat(eventRepository.countByStatus(NotificationEventStatus.CREATED)).isEqualTo(2);
  }

  @Test
  void terminalEventsCannotTransitionAgain() {
    final NotificationEventRecord event = followup("noon", BASE_TIME);
    eventRepository.insert(event);

    final int rendered = eventRepository.markRendered(event.eventId(), "hello", BASE_TIME);
    final int failedAfterRendered = eventRepository.markFailed(event.eventId(), "late failure");
    final int renderedTwice = eventRepository.markRendered(event.eventId(), "again", BASE_TIME);

    assertThat(rendered).isEqualTo(1);
    assertThat(failedAfterRendered).isZero();
    assertThat(renderedTwice).isZero();
    final NotificationEventRecord stored = eventRepository.findById(event.eventId()).orElseThrow();
    assertThat(stored.status()).isEqualTo(NotificationEventStatus.RENDERED);
    assertThat(stored.renderedText()).isEqualTo("hello");
    assertThat(stored.renderedAt()).isEqualTo(BASE_TIME);
  }

  @Test
  void failedEventKeepsErrorInRenderedTextWithoutRenderedAt() {
    final NotificationEventRecord event = followup("evening", BASE_TIME);
    eventRepository.insert(event);

    assertThat(eventRepository.markFailed(event.eventId(), "backend unavailable")).isEqualTo(1);

    final NotificationEventRecord stored = eventRepository.findById(event.eventId()).orElseThrow();
    assertThat(stored.status()).isEqualTo(NotificationEventStatus.FAILED);
    assertThat(stored.renderedText()).isEqualTo("backend unavailable");
    assertThat(stored.renderedAt()).isNull();
  }

  @Test
  void oldestCreatedEventsComeFirstAndLimitIsApplied() {
    final NotificationEventRecord newest = followup("evening", BASE_TIME.plusSeconds(120));
    final NotificationEventRecord oldest = followup("morning", BASE_TIME);
    final NotificationEventRecord middle = followup("noon", BASE_TIME.plusSeconds(60));
    eventRepository.insert(newest);
    eventRepository.insert(oldest);
    eventRepository.insert(middle);

    final List<NotificationEventRecord> batch =
        eventRepository.findOldestByStatus(NotificationEventStatus.CREATED, 2);
    final List<NotificationEventRecord> latest =
        eventRepository.findLatestByStatus(NotificationEventStatus.CREATED, 1);

    assertThat(batch)
        .extracting(NotificationEventRecord::eventId)
        .containsExactly(oldest.eventId(), middle.eventId());
    assertThat(latest)
        .extracting(NotificationEventRecord::eventId)
        .containsExactly(newest.eventId());
    assertThat(batch.get(0).payloadJson()).contains("\"slot\"");
  }

  @Test
  void dueTaskQueryExcludesTerminalAndUndatedTasks() {
    final UUID later =
        TaskFixtures.insertTask(
            jdbcTemplate, "Later", "doing", DUE_DATE.plusDays(3), LocalTime.of(9, 30));
    final UUID sooner = TaskFixtures.insertTask(jdbcTemplate, "Sooner", "waiting", DUE_DATE, null);
    TaskFixtures.insertTask(jdbcTemplate, "Done", "done", DUE_DATE, null);
    TaskFixtures.insertTask(jdbcTemplate, "Undated", "backlog", null, null);

    final List<TaskSnapshot> tasks = taskQueryRepository.listDueTasks(200);

    assertThat(tasks).extracting(TaskSnapshot::taskId).containsExactly(sooner, later);
    assertThat(tasks.get(1).status()).isEqualTo(TaskStatus.DOING);
    assertThat(tasks.get(1).dueTime()).isEqualTo(LocalTime.of(9, 30));
    assertThat(taskQueryRepository.countDueOn(DUE_DATE)).isEqualTo(1);
    assertThat(taskQueryRepository.countOverdue(DUE_DATE.plusDays(1))).isEqualTo(1);
    assertThat(taskQueryRepository.countByStatus(TaskStatus.DOING)).isEqualTo(1);
  }

  private static NotificationEventRecord followup(String slot, Instant createdAt) {
    return new NotificationEventRecord(
        UUID.randomUUID(),
        "followup_summary",
        null,
        null,
        slot,
        "{\"kind\":\"followup_summary\",\"slot\":\"" + slot + "\"}",
        null,
        NotificationEventStatus.CREATED,
        createdAt,
        null);
  }
}
