/*
 * どこで: Notification サービス層
 * 何を: created イベントを文章化し、rendered/failed へ遷移させて配信・フィードへ投影する
 * なぜ: 1 件ごとに独立したトランザクションで処理し、部分失敗をバッチ全体へ波及させないため
 */
package com.mos.notification.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.mos.notification.config.NotificationRenderProperties;
import com.mos.notification.model.DeliveryChannel;
import com.mos.notification.model.DeliveryStatus;
import com.mos.notification.model.FeedMessageRecord;
import com.mos.notification.model.MessageRole;
import com.mos.notification.model.NotificationDeliveryRecord;
import com.mos.notification.model.NotificationEventKind;
import com.mos.notification.model.NotificationEventRecord;
import com.mos.notification.model.NotificationEventStatus;
import com.mos.notification.repository.FeedMessageRepository;
import com.mos.notification.repository.NotificationDeliveryRepository;
import com.mos.notification.repository.NotificationEventRepository;
import com.mos.notification.textgen.RetryingTextGenerator;
import com.mos.notification.textgen.TextGenerationResult;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class NotificationRenderService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRenderService.class);

  static final String RESULT_RENDERED = "rendered";
  static final String RESULT_FAILED = "failed";
  static final String RESULT_SKIPPED = "skipped";
  static final String RESULT_ERROR = "error";

  private final NotificationEventRepository eventRepository;
  private final NotificationDeliveryRepository deliveryRepository;
  private final FeedMessageRepository feedMessageRepository;
  private final RetryingTextGenerator textGenerator;
  private final NotificationRenderProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public int renderPendingBatch() {
    return renderPendingBatch(properties.batchSize());
  }

  /**
   * Renders up to {@code batchSize} created events, oldest first.
   *
   * @return the number of events that reached {@code rendered} in this call
   */
  public int renderPendingBatch(int batchSize) {
    if (batchSize <= 0) {
      return 0;
    }
    final List<NotificationEventRecord> pending =
        eventRepository.findOldestByStatus(NotificationEventStatus.CREATED, batchSize);
    int rendered = 0;
    for (NotificationEventRecord event : pending) {
      try {
        final String text = renderText(event);
        if (commitRendered(event, text)) {
          rendered++;
          metrics.recordRenderResult(RESULT_RENDERED);
        } else {
          // 別の renderer が先に終端状態へ遷移させた
          logger.warn(
              "notification rendered but event already left created eventId={}", event.eventId());
          metrics.recordRenderResult(RESULT_SKIPPED);
        }
      } catch (RuntimeException ex) {
        handleFailure(event, ex);
      }
    }
    refreshBacklog();
    if (!pending.isEmpty()) {
      logger.info("notification render batch finished fetched={} rendered={}", pending.size(), rendered);
    }
    return rendered;
  }

  private String renderText(NotificationEventRecord event) {
    final String prompt = promptFor(event.kind());
    final TextGenerationResult result = textGenerator.generate(prompt, event.payloadJson());
    if (!result.isOk()) {
      throw new NotificationRenderException(
          "text generation failed outcome=" + result.outcome() + ": " + result.error());
    }
    final JsonNode textNode = result.body() == null ? null : result.body().get("text");
    if (textNode == null || !textNode.isTextual() || textNode.asText().isBlank()) {
      throw new NotificationRenderException("text generation returned no text");
    }
    return textNode.asText().trim();
  }

  private String promptFor(String kind) {
    final NotificationEventKind resolved =
        NotificationEventKind.fromDbValue(kind)
            .orElseThrow(() -> new NotificationRenderException("unknown notification kind: " + kind));
    return switch (resolved) {
      case TASK_DEADLINE_REMINDER -> properties.reminderPrompt();
      case FOLLOWUP_SUMMARY -> properties.followupPrompt();
    };
  }

  private boolean commitRendered(NotificationEventRecord event, String text) {
    final Instant now = Instant.now(clock);
    // 終端更新・配信・フィードを同一トランザクションにまとめ、ガード更新が空振りなら全て戻す
    final Boolean committed =
        transactionTemplate()
            .execute(
                status -> {
                  final int updated = eventRepository.markRendered(event.eventId(), text, now);
                  if (updated == 0) {
                    status.setRollbackOnly();
                    return false;
                  }
                  deliveryRepository.insert(
                      new NotificationDeliveryRecord(
                          UUID.randomUUID(),
                          event.eventId(),
                          DeliveryChannel.IN_APP,
                          DeliveryStatus.SENT,
                          null,
                          null,
                          now),
                      now);
                  feedMessageRepository.insert(
                      new FeedMessageRecord(
                          UUID.randomUUID(), MessageRole.ASSISTANT, text, event.eventId(), now));
                  return true;
                });
    return Boolean.TRUE.equals(committed);
  }

  @VisibleForTesting
  void handleFailure(NotificationEventRecord event, RuntimeException ex) {
    logger.warn(
        "notification render failed eventId={} kind={}", event.eventId(), event.kind(), ex);
    try {
      final int updated = eventRepository.markFailed(event.eventId(), truncateError(ex.getMessage()));
      if (updated == 0) {
        logger.warn(
            "notification failure not recorded because event already left created eventId={}",
            event.eventId());
        metrics.recordRenderResult(RESULT_SKIPPED);
        return;
      }
      metrics.recordRenderResult(RESULT_FAILED);
    } catch (DataAccessException writeEx) {
      logger.error(
          "failed to record render failure; event stays created eventId={}",
          event.eventId(),
          writeEx);
      metrics.recordRenderResult(RESULT_ERROR);
    }
  }

  private void refreshBacklog() {
    try {
      metrics.updateBacklogCurrent(eventRepository.countByStatus(NotificationEventStatus.CREATED));
    } catch (DataAccessException ex) {
      logger.warn("failed to refresh notification backlog gauge", ex);
    }
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}
