/*
 * どこで: Notification サービス層
 * 何を: 1 件のイベントをレンダリングできなかったことを示す例外
 * なぜ: 未知の kind や生成失敗を failed 遷移の理由として運ぶため
 */
package com.mos.notification.service;

public class NotificationRenderException extends RuntimeException {

  public NotificationRenderException(String message) {
    super(message);
  }

  public NotificationRenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
