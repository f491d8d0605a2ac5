/*
 * どこで: Notification レンダリングワーカー
 * 何を: スケジュールで created イベントのレンダリングを起動する
 * なぜ: 未処理の通知を一定間隔で文章化するため
 */
package com.mos.notification.service;

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
    name = "notification.render.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationRenderWorker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRenderWorker.class);
  static final String JOB_NAME = "notification-render";

  private final NotificationRenderService renderService;

  @Scheduled(fixedDelayString = "${notification.render.poll-interval}")
  public void run() {
    MDC.put(WorkerMdc.JOB_KEY, JOB_NAME);
    try {
      renderService.renderPendingBatch();
    } catch (RuntimeException ex) {
      logger.error("notification render batch aborted", ex);
    } finally {
      MDC.remove(WorkerMdc.JOB_KEY);
    }
  }
}
