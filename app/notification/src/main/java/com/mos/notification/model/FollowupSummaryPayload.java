/*
 * どこで: Notification ドメインモデル
 * 何を: フォローアップイベントの payload(JSON) 形状
 * なぜ: 時間帯ごとの集計値をレンダリング入力として固定するため
 */
package com.mos.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FollowupSummaryPayload(String kind, String slot, String now, FollowupStats stats) {}
