/*
 * どこで: Notification API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: 起動確認を actuator 無しでも行えるようにするため
 */
package com.mos.notification.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  static final String STATUS_TEXT = "notification: ok";

  @GetMapping("/")
  public String home() {
    return STATUS_TEXT;
  }
}
