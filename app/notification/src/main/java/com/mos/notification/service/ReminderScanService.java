/*
 * どこで: Notification サービス層
 * 何を: 期限付きタスクを走査し、該当段階のリマインドイベントを冪等に登録する
 * なぜ: 同じ (task, stage) を何度スキャンしても通知が 1 件に収まるようにするため
 */
package com.mos.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mos.notification.config.ReminderScanProperties;
import com.mos.notification.model.DeadlineReminderPayload;
import com.mos.notification.model.ReminderStage;
import com.mos.notification.model.TaskSnapshot;
import com.mos.notification.repository.NotificationEventRepository;
import com.mos.notification.repository.TaskQueryRepository;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReminderScanService {

  private static final Logger logger = LoggerFactory.getLogger(ReminderScanService.class);

  private final TaskQueryRepository taskQueryRepository;
  private final NotificationEventRepository eventRepository;
  private final DeadlineStageEvaluator stageEvaluator;
  private final ReminderScanProperties properties;
  private final ObjectMapper objectMapper;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * Creates deadline reminder events for due tasks.
   *
   * <p>Each insert commits on its own. The scan stops as soon as {@code limitNewEvents} new events
   * exist; already existing (task, stage) pairs are skipped without counting. Storage errors abort
   * the scan and propagate, leaving earlier inserts in place.
   *
   * @return the number of events actually inserted
   */
  public int scan(int limitNewEvents) {
    if (limitNewEvents <= 0) {
      return 0;
    }
    final ZonedDateTime now = ZonedDateTime.now(clock);
    final List<TaskSnapshot> candidates =
        taskQueryRepository.listDueTasks(properties.candidateLimit());
    int created = 0;
    try {
      for (TaskSnapshot task : candidates) {
        for (ReminderStage stage : stageEvaluator.evaluate(task, now)) {
          final String payloadJson = toJson(DeadlineReminderPayload.of(task, stage, now));
          final boolean inserted =
              eventRepository.insertDeadlineReminderIfAbsent(
                  UUID.randomUUID(), task.taskId(), stage.label(), payloadJson, now.toInstant());
          if (!inserted) {
            continue;
          }
          created++;
          logger.debug("deadline reminder created taskId={} stage={}", task.taskId(), stage.label());
          if (created >= limitNewEvents) {
            return created;
          }
        }
      }
      return created;
    } finally {
      metrics.recordRemindersCreated(created);
      logger.info(
          "reminder scan finished candidates={} created={} limit={}",
          candidates.size(),
          created,
          limitNewEvents);
    }
  }

  private String toJson(Object payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new NotificationPayloadException("failed to serialize reminder payload", ex);
    }
  }
}
