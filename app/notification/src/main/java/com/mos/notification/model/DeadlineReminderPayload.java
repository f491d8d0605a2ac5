/*
 * どこで: Notification ドメインモデル
 * 何を: 期限リマインドイベントの payload(JSON) 形状
 * なぜ: 生成時点のタスク内容を固定し、後段のレンダリング入力にするため
 */
package com.mos.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeadlineReminderPayload(String kind, String stage, String now, TaskPayload task) {

  public static DeadlineReminderPayload of(
      TaskSnapshot task, ReminderStage stage, ZonedDateTime now) {
    return new DeadlineReminderPayload(
        NotificationEventKind.TASK_DEADLINE_REMINDER.dbValue(),
        stage.label(),
        now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
        new TaskPayload(
            task.taskId().toString(),
            task.title(),
            task.description(),
            task.status().dbValue(),
            task.priority(),
            formatDate(task.dueDate()),
            formatTime(task.dueTime())));
  }

  private static String formatDate(LocalDate date) {
    return date == null ? null : date.toString();
  }

  private static String formatTime(LocalTime time) {
    return time == null ? null : time.toString();
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record TaskPayload(
      String id,
      String title,
      String description,
      String status,
      String priority,
      String dueDate,
      String dueTime) {}
}
