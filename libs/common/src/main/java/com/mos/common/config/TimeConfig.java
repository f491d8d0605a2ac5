/*
 * どこで: Common 共通設定
 * 何を: 設定したタイムゾーンを持つ Clock を DI 可能にする
 * なぜ: 「今日」「現在時刻」の判定を各アプリで同一の時刻注入に揃えるため
 */
package com.mos.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${app.time-zone:UTC}") String timeZone) {
    // Instant は常に UTC、暦日の判定だけがこのゾーンに従う
    return Clock.system(ZoneId.of(timeZone));
  }
}
