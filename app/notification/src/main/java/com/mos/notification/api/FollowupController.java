/*
 * どこで: Notification 運用 API
 * 何を: 指定スロットのフォローアップを手動で起動する
 * なぜ: cron を待たずに要約通知を確認できるようにするため
 */
package com.mos.notification.api;

import com.mos.notification.model.FollowupSlot;
import com.mos.notification.service.FollowupService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/followup")
@RequiredArgsConstructor
public class FollowupController {

  private final FollowupService followupService;

  @PostMapping("/run")
  public FollowupRunResponse run(@RequestParam(name = "slot") String slot) {
    final FollowupSlot resolved;
    try {
      resolved = FollowupSlot.fromLabel(slot);
    } catch (IllegalArgumentException ex) {
      throw new InvalidNotificationRequestException(ex.getMessage());
    }
    final UUID eventId = followupService.enqueue(resolved);
    return new FollowupRunResponse(eventId, resolved.label());
  }
}
