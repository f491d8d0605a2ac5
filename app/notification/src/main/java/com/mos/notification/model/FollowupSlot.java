/*
 * どこで: Notification ドメインモデル
 * 何を: フォローアップの時間帯ラベル
 * なぜ: followup_summary イベントの slot 値を固定するため
 */
package com.mos.notification.model;

import java.util.Arrays;
import java.util.Locale;

public enum FollowupSlot {
  MORNING("morning"),
  NOON("noon"),
  EVENING("evening");

  private final String label;

  FollowupSlot(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static FollowupSlot fromLabel(String label) {
    final String normalized = label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(slot -> slot.label.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown followup slot: " + label));
  }
}
