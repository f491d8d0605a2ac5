/*
 * どこで: Notification ドメインモデル
 * 何を: messages テーブル(フィード)のスナップショット
 * なぜ: レンダリング結果をフィードへ投影するため
 */
package com.mos.notification.model;

import java.time.Instant;
import java.util.UUID;

public record FeedMessageRecord(
    UUID messageId, MessageRole role, String content, UUID eventId, Instant createdAt) {}
