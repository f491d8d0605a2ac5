/*
 * どこで: Notification ドメインモデル
 * 何を: notification_deliveries テーブルのスナップショット
 * なぜ: 配信試行を監査可能な形で残すため
 */
package com.mos.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationDeliveryRecord(
    UUID deliveryId,
    UUID eventId,
    DeliveryChannel channel,
    DeliveryStatus status,
    String destination,
    String error,
    Instant sentAt) {}
