/*
 * どこで: Notification 段階判定のユニットテスト
 * 何を: 日数/時刻の境界ごとに返る段階と並び順を検証する
 * なぜ: 閾値の取りこぼしや重複がリマインドの過不足に直結するため
 */
package com.mos.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.mos.notification.model.ReminderStage;
import com.mos.notification.model.TaskSnapshot;
import com.mos.notification.model.TaskStatus;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class DeadlineStageEvaluatorTest {

  private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
  private static final ZonedDateTime NOW = ZonedDateTime.of(2026, 3, 10, 10, 0, 0, 0, TOKYO);
  private static final LocalDate TODAY = NOW.toLocalDate();

  private final DeadlineStageEvaluator evaluator = new DeadlineStageEvaluator();

  static Stream<Arguments> stageTable() {
    return Stream.of(
        Arguments.of(TODAY.plusDays(7), null, List.of(ReminderStage.D_MINUS_7)),
        Arguments.of(TODAY.plusDays(3), null, List.of(ReminderStage.D_MINUS_3)),
        Arguments.of(TODAY.plusDays(1), null, List.of(ReminderStage.D_MINUS_1)),
        Arguments.of(TODAY, null, List.of(ReminderStage.D_0)),
        Arguments.of(TODAY.plusDays(5), null, List.of()),
        Arguments.of(TODAY.plusDays(8), null, List.of()),
        Arguments.of(TODAY.minusDays(1), null, List.of(ReminderStage.OVERDUE)),
        Arguments.of(TODAY.minusDays(1), LocalTime.of(23, 0), List.of(ReminderStage.OVERDUE)),
        Arguments.of(
            TODAY, LocalTime.of(11, 30), List.of(ReminderStage.T_MINUS_2H, ReminderStage.D_0)),
        Arguments.of(
            TODAY, LocalTime.of(12, 0), List.of(ReminderStage.T_MINUS_2H, ReminderStage.D_0)),
        Arguments.of(TODAY, LocalTime.of(12, 1), List.of(ReminderStage.D_0)),
        Arguments.of(
            TODAY,
            LocalTime.of(10, 30),
            List.of(ReminderStage.T_MINUS_30M, ReminderStage.T_MINUS_2H, ReminderStage.D_0)),
        Arguments.of(
            TODAY,
            LocalTime.of(10, 20),
            List.of(ReminderStage.T_MINUS_30M, ReminderStage.T_MINUS_2H, ReminderStage.D_0)),
        Arguments.of(
            TODAY,
            LocalTime.of(10, 0),
            List.of(ReminderStage.T_MINUS_30M, ReminderStage.T_MINUS_2H, ReminderStage.D_0)),
        Arguments.of(TODAY, LocalTime.of(9, 59), List.of(ReminderStage.OVERDUE)),
        // 翌日の時刻指定は当日判定に使わない
        Arguments.of(TODAY.plusDays(1), LocalTime.of(10, 10), List.of(ReminderStage.D_MINUS_1)));
  }

  @ParameterizedTest
  @MethodSource("stageTable")
  void evaluatesStagesForDueDateAndTime(
      LocalDate dueDate, LocalTime dueTime, List<ReminderStage> expected) {
    final List<ReminderStage> stages =
        evaluator.evaluate(task(TaskStatus.BACKLOG, dueDate, dueTime), NOW);

    assertThat(stages).containsExactlyElementsOf(expected);
  }

  @Test
  void terminalTasksGetNoStages() {
    assertThat(evaluator.evaluate(task(TaskStatus.DONE, TODAY, null), NOW)).isEmpty();
    assertThat(evaluator.evaluate(task(TaskStatus.CANCELED, TODAY.minusDays(3), null), NOW))
        .isEmpty();
  }

  @Test
  void tasksWithoutDueDateGetNoStagesEvenWithDueTime() {
    assertThat(evaluator.evaluate(task(TaskStatus.DOING, null, null), NOW)).isEmpty();
    assertThat(evaluator.evaluate(task(TaskStatus.DOING, null, LocalTime.of(10, 10)), NOW))
        .isEmpty();
  }

  @Test
  void calendarDayFollowsZoneOfNow() {
    // UTC では前日 23:30 だが東京では 3/10 08:30
    final ZonedDateTime utcEvening = ZonedDateTime.parse("2026-03-09T23:30:00Z");
    final ZonedDateTime tokyoMorning = utcEvening.withZoneSameInstant(TOKYO);

    assertThat(evaluator.evaluate(task(TaskStatus.BACKLOG, TODAY, null), tokyoMorning))
        .containsExactly(ReminderStage.D_0);
    assertThat(evaluator.evaluate(task(TaskStatus.BACKLOG, TODAY, null), utcEvening))
        .containsExactly(ReminderStage.D_MINUS_1);
  }

  @Test
  void missedThresholdDayIsNotCaughtUp() {
    // D-3 を過ぎて D-2 になった日は何も返さない
    assertThat(evaluator.evaluate(task(TaskStatus.WAITING, TODAY.plusDays(2), null), NOW))
        .isEmpty();
  }

  private static TaskSnapshot task(TaskStatus status, LocalDate dueDate, LocalTime dueTime) {
    return new TaskSnapshot(
        UUID.randomUUID(), "Write report", "", status, "normal", dueDate, dueTime);
  }
}
