/*
 * どこで: Notification スキャンワーカー
 * 何を: スケジュールで期限スキャンを起動する
 * なぜ: 期限到来タスクのリマインドを一定間隔で作るため
 */
package com.mos.notification.service;

import com.mos.notification.config.ReminderScanProperties;
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
    name = "notification.reminder.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReminderScanWorker {

  private static final Logger logger = LoggerFactory.getLogger(ReminderScanWorker.class);
  static final String JOB_NAME = "reminder-scan";

  private final ReminderScanService scanService;
  private final ReminderScanProperties properties;

  @Scheduled(fixedDelayString = "${notification.reminder.scan-interval}")
  public void run() {
    MDC.put(WorkerMdc.JOB_KEY, JOB_NAME);
    try {
      scanService.scan(properties.limitNewEvents());
    } catch (RuntimeException ex) {
      // 次周期で再走査されるため、ここではログのみ残してスケジューラを止めない
      logger.error("reminder scan aborted", ex);
    } finally {
      MDC.remove(WorkerMdc.JOB_KEY);
    }
  }
}
