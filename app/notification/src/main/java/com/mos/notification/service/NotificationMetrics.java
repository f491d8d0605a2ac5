/*
 * どこで: Notification サービス層
 * 何を: スキャン生成数/レンダリング結果/未処理 backlog/テキスト生成時間を記録する
 * なぜ: 非同期パイプラインの滞留と失敗率を Prometheus から直接観測できるようにするため
 */
package com.mos.notification.service;

import com.mos.notification.textgen.TextGenerationResult;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  static final String METRIC_REMINDER_CREATED_TOTAL = "notification.reminder.created.total";
  static final String METRIC_RENDER_TOTAL = "notification.render.total";
  static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";
  static final String METRIC_TEXT_GENERATION = "notification.text_generation.duration";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> renderCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> textGenerationTimers = new ConcurrentHashMap<>();
  private final Counter reminderCreatedCounter;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of notification events waiting to be rendered")
        .register(meterRegistry);
    this.reminderCreatedCounter =
        Counter.builder(METRIC_REMINDER_CREATED_TOTAL)
            .description("Total number of deadline reminder events created by scans")
            .register(meterRegistry);
  }

  public void recordRemindersCreated(int created) {
    if (created > 0) {
      reminderCreatedCounter.increment(created);
    }
  }

  public void recordRenderResult(String result) {
    renderCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_RENDER_TOTAL)
                    .description("Notification render outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordTextGeneration(
      String backend, TextGenerationResult.Outcome outcome, Duration elapsed) {
    final String outcomeTag = outcome.name().toLowerCase(Locale.ROOT);
    textGenerationTimers
        .computeIfAbsent(
            backend + ":" + outcomeTag,
            ignored ->
                Timer.builder(METRIC_TEXT_GENERATION)
                    .description("Single text generation backend call duration")
                    .tags(Tags.of("backend", backend, "outcome", outcomeTag))
                    .register(meterRegistry))
        .record(elapsed);
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}
