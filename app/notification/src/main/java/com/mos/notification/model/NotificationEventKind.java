/*
 * どこで: Notification ドメインモデル
 * 何を: notification_events.kind の値
 * なぜ: レンダリング時のプロンプト選択と一意制約の対象を区別するため
 */
package com.mos.notification.model;

import java.util.Arrays;
import java.util.Optional;

public enum NotificationEventKind {
  TASK_DEADLINE_REMINDER("task_deadline_reminder"),
  FOLLOWUP_SUMMARY("followup_summary");

  private final String dbValue;

  NotificationEventKind(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  // DB に未知の kind が残っていても行単位の失敗として扱えるよう Optional で返す
  public static Optional<NotificationEventKind> fromDbValue(String value) {
    return Arrays.stream(values()).filter(kind -> kind.dbValue.equals(value)).findFirst();
  }
}
