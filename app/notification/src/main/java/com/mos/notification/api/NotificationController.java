/*
 * どこで: Notification 運用 API
 * 何を: 通知イベントの一覧取得と手動レンダリングを提供する
 * なぜ: failed を含む処理結果を運用者が確認し、バッチを即時実行できるようにするため
 */
package com.mos.notification.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mos.notification.config.NotificationRenderProperties;
import com.mos.notification.model.NotificationEventRecord;
import com.mos.notification.model.NotificationEventStatus;
import com.mos.notification.repository.NotificationEventRepository;
import com.mos.notification.service.NotificationRenderService;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

  static final int MAX_LIST_LIMIT = 200;

  private final NotificationEventRepository eventRepository;
  private final NotificationRenderService renderService;
  private final NotificationRenderProperties renderProperties;
  private final ObjectMapper objectMapper;

  @GetMapping
  public NotificationListResponse list(
      @RequestParam(name = "status", defaultValue = "rendered") String status,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    final NotificationEventStatus resolved = resolveStatus(status);
    final int effectiveLimit = Math.min(Math.max(limit, 1), MAX_LIST_LIMIT);
    final List<NotificationEventSummary> items =
        eventRepository.findLatestByStatus(resolved, effectiveLimit).stream()
            .map(this::toSummary)
            .toList();
    return new NotificationListResponse(resolved.dbValue(), items);
  }

  @PostMapping("/render")
  public RenderBatchResponse render(
      @RequestParam(name = "batch_size", required = false) Integer batchSize) {
    final int effectiveBatchSize = batchSize == null ? renderProperties.batchSize() : batchSize;
    if (effectiveBatchSize < 1) {
      throw new InvalidNotificationRequestException("batch_size must be positive");
    }
    return new RenderBatchResponse(renderService.renderPendingBatch(effectiveBatchSize));
  }

  private NotificationEventStatus resolveStatus(String status) {
    try {
      return NotificationEventStatus.fromDbValue(status.trim().toLowerCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new InvalidNotificationRequestException("unknown notification status: " + status);
    }
  }

  private NotificationEventSummary toSummary(NotificationEventRecord record) {
    return new NotificationEventSummary(
        record.eventId(),
        record.kind(),
        record.taskId(),
        record.stage(),
        record.slot(),
        record.status().dbValue(),
        record.renderedText(),
        record.createdAt(),
        record.renderedAt(),
        readPayload(record.payloadJson()));
  }

  private JsonNode readPayload(String payloadJson) {
    try {
      return payloadJson == null ? null : objectMapper.readTree(payloadJson);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification payload parse failure", ex);
    }
  }
}
