/*
 * どこで: Notification アプリの設定バインド
 * 何を: 期限スキャンの間隔/上限設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.mos.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.reminder")
public record ReminderScanProperties(
    boolean enabled, Duration scanInterval, int limitNewEvents, int candidateLimit) {

  public ReminderScanProperties {
    candidateLimit = candidateLimit <= 0 ? 200 : candidateLimit;
  }
}
