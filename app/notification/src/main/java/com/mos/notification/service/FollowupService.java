/*
 * どこで: Notification サービス層
 * 何を: 朝/昼/夕のフォローアップ集計を行い、要約イベントと実行履歴を登録する
 * なぜ: 期限切れ・当日期限・進行中の件数を定時に知らせるため
 */
package com.mos.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mos.notification.model.FollowupSlot;
import com.mos.notification.model.FollowupStats;
import com.mos.notification.model.FollowupSummaryPayload;
import com.mos.notification.model.NotificationEventKind;
import com.mos.notification.model.NotificationEventRecord;
import com.mos.notification.model.NotificationEventStatus;
import com.mos.notification.model.TaskStatus;
import com.mos.notification.repository.FollowupRunRepository;
import com.mos.notification.repository.NotificationEventRepository;
import com.mos.notification.repository.TaskQueryRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class FollowupService {

  private static final Logger logger = LoggerFactory.getLogger(FollowupService.class);

  private final TaskQueryRepository taskQueryRepository;
  private final NotificationEventRepository eventRepository;
  private final FollowupRunRepository followupRunRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** Records a followup run for the slot and enqueues its summary event for rendering. */
  @Transactional
  public UUID enqueue(FollowupSlot slot) {
    final ZonedDateTime now = ZonedDateTime.now(clock);
    final LocalDate today = now.toLocalDate();
    final FollowupStats stats =
        new FollowupStats(
            taskQueryRepository.countOverdue(today),
            taskQueryRepository.countDueOn(today),
            taskQueryRepository.countByStatus(TaskStatus.DOING));
    final String kind = NotificationEventKind.FOLLOWUP_SUMMARY.dbValue();
    final String payloadJson =
        toJson(
            new FollowupSummaryPayload(
                kind, slot.label(), now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME), stats));

    final UUID eventId = UUID.randomUUID();
    eventRepository.insert(
        new NotificationEventRecord(
            eventId,
            kind,
            null,
            null,
            slot.label(),
            payloadJson,
            null,
            NotificationEventStatus.CREATED,
            now.toInstant(),
            null));
    followupRunRepository.insert(UUID.randomUUID(), slot.label(), toJson(stats), now.toInstant());
    logger.info(
        "followup enqueued eventId={} slot={} overdue={} dueToday={} doing={}",
        eventId,
        slot.label(),
        stats.overdue(),
        stats.dueToday(),
        stats.doing());
    return eventId;
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new NotificationPayloadException("failed to serialize followup payload", ex);
    }
  }
}
