/*
 * どこで: Notification テキスト生成層
 * 何を: 再試行可能な失敗だけをバックオフ付きで再試行し、最終結果を返す
 * なぜ: 一時障害(レート制限/接続失敗)を吸収しつつ、呼び出し側へは1件分の結果だけを返すため
 */
package com.mos.notification.textgen;

import com.google.common.annotations.VisibleForTesting;
import com.mos.notification.config.TextGenerationProperties;
import com.mos.notification.service.NotificationMetrics;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class RetryingTextGenerator {

  private static final Logger logger = LoggerFactory.getLogger(RetryingTextGenerator.class);

  private final TextGenerationBackend backend;
  private final NotificationMetrics metrics;
  private final BackoffPolicy backoffPolicy;
  private final Sleeper sleeper;
  private final int maxAttempts;

  @Autowired
  public RetryingTextGenerator(
      TextGenerationBackend backend,
      TextGenerationProperties properties,
      NotificationMetrics metrics) {
    this(backend, metrics, new BackoffPolicy(properties), Sleeper.THREAD, properties.maxAttempts());
  }

  @VisibleForTesting
  RetryingTextGenerator(
      TextGenerationBackend backend,
      NotificationMetrics metrics,
      BackoffPolicy backoffPolicy,
      Sleeper sleeper,
      int maxAttempts) {
    this.backend = backend;
    this.metrics = metrics;
    this.backoffPolicy = backoffPolicy;
    this.sleeper = sleeper;
    this.maxAttempts = maxAttempts;
  }

  public TextGenerationResult generate(String systemPrompt, String userPayload) {
    TextGenerationResult last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      last = callOnce(systemPrompt, userPayload);
      if (!last.isRetryable()) {
        return last;
      }
      if (attempt == maxAttempts) {
        break;
      }
      final Duration delay = backoffPolicy.delayFor(attempt);
      logger.warn(
          "text generation retry scheduled backend={} attempt={} delayMs={} error={}",
          backend.name(),
          attempt,
          delay.toMillis(),
          last.error());
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return TextGenerationResult.retryable(
            "interrupted while waiting to retry: " + last.error());
      }
    }
    return TextGenerationResult.retryable(
        "text generation attempts exhausted attempts=" + maxAttempts + ": " + last.error());
  }

  public String backendName() {
    return backend.name();
  }

  private TextGenerationResult callOnce(String systemPrompt, String userPayload) {
    final long startedAt = System.nanoTime();
    TextGenerationResult result;
    try {
      result = backend.generate(systemPrompt, userPayload);
      if (result == null) {
        result = TextGenerationResult.fatal("backend returned no result");
      }
    } catch (RuntimeException ex) {
      // 分類されずに漏れた例外は再試行しても回復しない前提で恒久失敗に寄せる
      logger.error("text generation backend threw unexpectedly backend={}", backend.name(), ex);
      result = TextGenerationResult.fatal("unexpected backend error: " + ex.getMessage());
    }
    metrics.recordTextGeneration(
        backend.name(), result.outcome(), Duration.ofNanos(System.nanoTime() - startedAt));
    return result;
  }
}
