/*
 * どこで: Notification ドメインモデル
 * 何を: 期限判定に使う tasks テーブルの読み取り専用スナップショット
 * なぜ: タスク本体は CRUD 側の所有物であり、このサービスでは更新しないため
 */
package com.mos.notification.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

public record TaskSnapshot(
    UUID taskId,
    String title,
    String description,
    TaskStatus status,
    String priority,
    LocalDate dueDate,
    LocalTime dueTime) {}
