/*
 * どこで: Notification フォローアップのユニットテスト
 * 何を: 集計値・要約イベント・実行履歴の登録内容を検証する
 * なぜ: タイムゾーン基準の「今日」で集計されることを保証するため
 */
package com.mos.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mos.notification.model.FollowupSlot;
import com.mos.notification.model.NotificationEventRecord;
import com.mos.notification.model.NotificationEventStatus;
import com.mos.notification.model.TaskStatus;
import com.mos.notification.repository.FollowupRunRepository;
import com.mos.notification.repository.NotificationEventRepository;
import com.mos.notification.repository.TaskQueryRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FollowupServiceTest {

  // UTC では 3/9 だが東京では 3/10 の朝
  private static final Instant FIXED_NOW = Instant.parse("2026-03-09T23:00:00Z");
  private static final LocalDate TOKYO_TODAY = LocalDate.of(2026, 3, 10);

  @Mock private TaskQueryRepository taskQueryRepository;
  @Mock private NotificationEventRepository eventRepository;
  @Mock private FollowupRunRepository followupRunRepository;

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void enqueueStoresSummaryEventAndRunRecord() throws Exception {
    final FollowupService service =
        new FollowupService(
            taskQueryRepository,
            eventRepository,
            followupRunRepository,
            objectMapper,
            Clock.fixed(FIXED_NOW, ZoneId.of("Asia/Tokyo")));
    when(taskQueryRepository.countOverdue(TOKYO_TODAY)).thenReturn(2);
    when(taskQueryRepository.countDueOn(TOKYO_TODAY)).thenReturn(3);
    when(taskQueryRepository.countByStatus(TaskStatus.DOING)).thenReturn(1);

    final UUID eventId = service.enqueue(FollowupSlot.MORNING);

    final ArgumentCaptor<NotificationEventRecord> captor =
        ArgumentCaptor.forClass(NotificationEventRecord.class);
    verify(eventRepository).insert(captor.capture());
    final NotificationEventRecord event = captor.getValue();
    assertThat(event.eventId()).isEqualTo(eventId);
    assertThat(event.kind()).isEqualTo("followup_summary");
    assertThat(event.slot()).isEqualTo("morning");
    assertThat(event.taskId()).isNull();
    assertThat(event.stage()).isNull();
    assertThat(event.status()).isEqualTo(NotificationEventStatus.CREATED);
    assertThat(event.createdAt()).isEqualTo(FIXED_NOW);

    final JsonNode payload = objectMapper.readTree(event.payloadJson());
    assertThat(payload.get("slot").asText()).isEqualTo("morning");
    assertThat(payload.get("now").asText()).isEqualTo("2026-03-10T08:00:00+09:00");
    assertThat(payload.at("/stats/overdue").asInt()).isEqualTo(2);
    assertThat(payload.at("/stats/due_today").asInt()).isEqualTo(3);
    assertThat(payload.at("/stats/doing").asInt()).isEqualTo(1);

    final ArgumentCaptor<String> statsJson = ArgumentCaptor.forClass(String.class);
    verify(followupRunRepository)
        .insert(any(UUID.class), eq("morning"), statsJson.capture(), eq(FIXED_NOW));
    assertThat(objectMapper.readTree(statsJson.getValue())).isEqualTo(payload.get("stats"));
  }
}
