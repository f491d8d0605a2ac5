/*
 * どこで: Notification アプリの設定バインド
 * 何を: 朝/昼/夕フォローアップの有効化とスケジュールを保持する
 * なぜ: 実行時刻を環境ごとに変更できるようにするため
 */
package com.mos.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.followup")
public record FollowupProperties(
    boolean enabled, String morningCron, String noonCron, String eveningCron) {}
