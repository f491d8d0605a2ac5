/*
 * どこで: Notification のログ設定テスト
 * 何を: JSON ログ設定とワーカー/管理 API 用 MDC フィールド定義の存在を検証する
 * なぜ: 設定変更で構造化ログや job/trigger による追跡が欠落する回帰を防ぐため
 */
package com.mos.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationContainsJsonAndMdcFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("\"job\":\"%X{job:-}\"");
    assertThat(configText).contains("\"trigger\":\"%X{trigger:-}\"");
    assertThat(configText).contains("\"request_id\":\"%X{request_id:-}\"");
  }
}
