/*
 * どこで: Notification テキスト生成層
 * 何を: 再試行間隔(指数バックオフ + 上限 + ジッター + 下限)を計算する
 * なぜ: ジッター源を注入可能にして待機時間を決定的にテストできるようにするため
 */
package com.mos.notification.textgen;

import com.mos.notification.config.TextGenerationProperties;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public class BackoffPolicy {

  private final TextGenerationProperties properties;
  private final DoubleSupplier unitRandom;

  public BackoffPolicy(TextGenerationProperties properties) {
    this(properties, () -> ThreadLocalRandom.current().nextDouble());
  }

  public BackoffPolicy(TextGenerationProperties properties, DoubleSupplier unitRandom) {
    this.properties = properties;
    this.unitRandom = unitRandom;
  }

  /** Delay to wait after the given failed attempt (1-based) before the next one. */
  public Duration delayFor(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter = jitterMin + unitRandom.getAsDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }
}
