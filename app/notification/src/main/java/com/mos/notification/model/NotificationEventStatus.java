/*
 * どこで: Notification ドメインモデル
 * 何を: 通知イベントの状態を表す列挙
 * なぜ: DB と処理ロジックの状態を一致させるため
 */
package com.mos.notification.model;

import java.util.Arrays;

public enum NotificationEventStatus {
  CREATED("created"),
  RENDERED("rendered"),
  FAILED("failed");

  private final String dbValue;

  NotificationEventStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public static NotificationEventStatus fromDbValue(String value) {
    return Arrays.stream(values())
        .filter(status -> status.dbValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown event status: " + value));
  }
}
