/*
 * どこで: Notification フォローアップワーカー
 * 何を: 朝/昼/夕の cron でフォローアップを起動する
 * なぜ: 設定したタイムゾーンの壁時計に合わせて要約を出すため
 */
package com.mos.notification.service;

import com.mos.notification.model.FollowupSlot;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.followup.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class FollowupWorker {

  private static final Logger logger = LoggerFactory.getLogger(FollowupWorker.class);
  static final String JOB_NAME = "followup";

  private final FollowupService followupService;

  @Scheduled(cron = "${notification.followup.morning-cron}", zone = "${app.time-zone}")
  public void morning() {
    run(FollowupSlot.MORNING);
  }

  @Scheduled(cron = "${notification.followup.noon-cron}", zone = "${app.time-zone}")
  public void noon() {
    run(FollowupSlot.NOON);
  }

  @Scheduled(cron = "${notification.followup.evening-cron}", zone = "${app.time-zone}")
  public void evening() {
    run(FollowupSlot.EVENING);
  }

  void run(FollowupSlot slot) {
    MDC.put(WorkerMdc.JOB_KEY, JOB_NAME);
    try {
      followupService.enqueue(slot);
    } catch (RuntimeException ex) {
      logger.error("followup run failed slot={}", slot.label(), ex);
    } finally {
      MDC.remove(WorkerMdc.JOB_KEY);
    }
  }
}
