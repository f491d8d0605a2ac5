/*
 * どこで: Notification アプリ設定
 * 何を: 設定値に応じたテキスト生成バックエンドを 1 つだけ組み立てる
 * なぜ: バックエンド選択を起動時に固定し、利用側は抽象だけに依存させるため
 */
package com.mos.notification.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mos.notification.textgen.LocalProcessTextGenerationBackend;
import com.mos.notification.textgen.OpenAiTextGenerationBackend;
import com.mos.notification.textgen.TextGenerationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class TextGenerationConfig {

  private static final Logger logger = LoggerFactory.getLogger(TextGenerationConfig.class);

  @Bean
  TextGenerationBackend textGenerationBackend(
      TextGenerationProperties properties,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper) {
    final TextGenerationProperties.Cli cli = properties.cli();
    final TextGenerationBackend backend =
        switch (properties.backend()) {
          case OPENAI_API ->
              new OpenAiTextGenerationBackend(
                  openAiRestClient(restClientBuilder, properties.openai()),
                  properties.openai(),
                  objectMapper);
          case CLAUDE_CLI ->
              new LocalProcessTextGenerationBackend(
                  "claude_cli", cli.claudeCommand(), cli.processTimeout(), objectMapper);
          case OLLAMA_CLI ->
              new LocalProcessTextGenerationBackend(
                  "ollama_cli", cli.ollamaCommand(), cli.processTimeout(), objectMapper);
        };
    logger.info(
        "text generation backend selected backend={} maxAttempts={}",
        backend.name(),
        properties.maxAttempts());
    return backend;
  }

  private RestClient openAiRestClient(
      RestClient.Builder builder, TextGenerationProperties.OpenAi openAi) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(openAi.connectTimeout());
    requestFactory.setReadTimeout(openAi.readTimeout());
    return builder.baseUrl(openAi.baseUrl()).requestFactory(requestFactory).build();
  }
}
