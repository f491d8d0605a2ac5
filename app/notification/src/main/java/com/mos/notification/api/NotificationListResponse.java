/*
 * どこで: Notification API モデル
 * 何を: 通知イベント一覧のレスポンス
 * なぜ: API レスポンスの構造を固定するため
 */
package com.mos.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationListResponse(String status, List<NotificationEventSummary> notifications) {
  public NotificationListResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 不変リストとして保持する
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
