/*
 * どこで: Notification サービス層
 * 何を: タスクの期限と現在時刻から該当するリマインド段階を判定する
 * なぜ: I/O を持たない純粋関数にして境界値をテーブルで検証できるようにするため
 */
package com.mos.notification.service;

import com.mos.notification.model.ReminderStage;
import com.mos.notification.model.TaskSnapshot;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class DeadlineStageEvaluator {

  private static final Duration TWO_HOURS = Duration.ofHours(2);
  private static final Duration THIRTY_MINUTES = Duration.ofMinutes(30);

  private static final Map<Long, ReminderStage> DAY_STAGES =
      Map.of(
          7L, ReminderStage.D_MINUS_7,
          3L, ReminderStage.D_MINUS_3,
          1L, ReminderStage.D_MINUS_1,
          0L, ReminderStage.D_0);

  /**
   * Returns the stages that apply to the task at {@code now}, most urgent first.
   *
   * <p>Day stages match only on their exact day; a day the scan did not run on is not caught up
   * later. A due time is only considered on the due date itself, interpreted in the zone of {@code
   * now}.
   */
  public List<ReminderStage> evaluate(TaskSnapshot task, ZonedDateTime now) {
    if (task.status() == null || task.status().isTerminal()) {
      return List.of();
    }
    final LocalDate dueDate = task.dueDate();
    if (dueDate == null) {
      return List.of();
    }
    final LocalDate today = now.toLocalDate();
    final long daysLeft = ChronoUnit.DAYS.between(today, dueDate);
    if (daysLeft < 0) {
      return List.of(ReminderStage.OVERDUE);
    }

    final List<ReminderStage> stages = new ArrayList<>();
    final ReminderStage dayStage = DAY_STAGES.get(daysLeft);
    if (dayStage != null) {
      stages.add(dayStage);
    }

    if (task.dueTime() != null && dueDate.equals(today)) {
      final ZonedDateTime dueAt = ZonedDateTime.of(dueDate, task.dueTime(), now.getZone());
      final Duration delta = Duration.between(now, dueAt);
      if (delta.isNegative()) {
        // 当日でも時刻を過ぎたら OVERDUE のみ
        return List.of(ReminderStage.OVERDUE);
      }
      if (delta.compareTo(TWO_HOURS) <= 0) {
        stages.add(ReminderStage.T_MINUS_2H);
      }
      if (delta.compareTo(THIRTY_MINUTES) <= 0) {
        stages.add(ReminderStage.T_MINUS_30M);
      }
    }

    stages.sort(Comparator.naturalOrder());
    return List.copyOf(stages);
  }
}
