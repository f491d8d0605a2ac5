/*
 * どこで: Notification サービス層
 * 何を: 通知ペイロードの JSON 直列化失敗を示す例外
 * なぜ: Jackson の検査例外をサービス境界で非検査例外へ揃えるため
 */
package com.mos.notification.service;

public class NotificationPayloadException extends RuntimeException {

  public NotificationPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
