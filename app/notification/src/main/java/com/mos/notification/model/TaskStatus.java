/*
 * どこで: Notification ドメインモデル
 * 何を: tasks.status の値を表す列挙
 * なぜ: 終了状態のタスクを期限判定から外すため
 *       tasks は外部所有で値が保証されないため、未知の値は UNKNOWN(非終了)として扱う
 */
package com.mos.notification.model;

import java.util.Arrays;
import java.util.Locale;

public enum TaskStatus {
  BACKLOG("backlog", false),
  DOING("doing", false),
  WAITING("waiting", false),
  DONE("done", true),
  CANCELED("canceled", true),
  UNKNOWN("unknown", false);

  private final String dbValue;
  private final boolean terminal;

  TaskStatus(String dbValue, boolean terminal) {
    this.dbValue = dbValue;
    this.terminal = terminal;
  }

  public String dbValue() {
    return dbValue;
  }

  public boolean isTerminal() {
    return terminal;
  }

  public static TaskStatus fromDbValue(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(status -> status.dbValue.equals(normalized))
        .findFirst()
        .orElse(UNKNOWN);
  }
}
