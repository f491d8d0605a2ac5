/*
 * どこで: Notification ドメインモデル
 * 何を: notification_events テーブルのスナップショット
 * なぜ: スキャン/レンダリング/デバッグ API で共通化するため
 */
package com.mos.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationEventRecord(
    UUID eventId,
    String kind,
    UUID taskId,
    String stage,
    String slot,
    String payloadJson,
    String renderedText,
    NotificationEventStatus status,
    Instant createdAt,
    Instant renderedAt) {}
