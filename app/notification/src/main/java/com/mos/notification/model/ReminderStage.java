/*
 * どこで: Notification ドメインモデル
 * 何を: 期限リマインドの段階ラベル
 * なぜ: 宣言順をそのまま緊急度順として使うため
 */
package com.mos.notification.model;

/** Declaration order is the urgency order used to sort evaluated stages. */
public enum ReminderStage {
  OVERDUE("OVERDUE"),
  T_MINUS_30M("T-30M"),
  T_MINUS_2H("T-2H"),
  D_0("D-0"),
  D_MINUS_1("D-1"),
  D_MINUS_3("D-3"),
  D_MINUS_7("D-7");

  private final String label;

  ReminderStage(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
