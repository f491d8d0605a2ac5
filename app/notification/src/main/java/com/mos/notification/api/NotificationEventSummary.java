/*
 * どこで: Notification API モデル
 * 何を: 通知イベント一覧の要素
 * なぜ: 状態・生成文・ペイロードをまとめて確認できるようにするため
 */
package com.mos.notification.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationEventSummary(
    UUID eventId,
    String kind,
    UUID taskId,
    String stage,
    String slot,
    String status,
    String renderedText,
    Instant createdAt,
    Instant renderedAt,
    JsonNode payload) {}
