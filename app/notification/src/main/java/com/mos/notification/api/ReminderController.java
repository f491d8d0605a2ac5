/*
 * どこで: Notification 運用 API
 * 何を: 期限スキャンを手動で起動する
 * なぜ: スケジュールを待たずに動作確認・再走査できるようにするため
 */
package com.mos.notification.api;

import com.mos.notification.config.ReminderScanProperties;
import com.mos.notification.service.ReminderScanService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reminders")
@RequiredArgsConstructor
public class ReminderController {

  private final ReminderScanService scanService;
  private final ReminderScanProperties properties;

  @PostMapping("/scan")
  public ReminderScanResponse scan(@RequestParam(name = "limit", required = false) Integer limit) {
    final int effectiveLimit = limit == null ? properties.limitNewEvents() : limit;
    if (effectiveLimit < 1) {
      throw new InvalidNotificationRequestException("limit must be positive");
    }
    return new ReminderScanResponse(scanService.scan(effectiveLimit));
  }
}
