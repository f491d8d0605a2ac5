/*
 * どこで: Notification ドメインモデル
 * 何を: 配信チャネル
 * なぜ: 現状は in_app のみだが、チャネル追加時は配信行を増やすだけで済むようにするため
 */
package com.mos.notification.model;

public enum DeliveryChannel {
  IN_APP("in_app");

  private final String dbValue;

  DeliveryChannel(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }
}
