/*
 * どこで: Notification アプリの設定バインド
 * 何を: テキスト生成バックエンドの選択、リトライ、クライアント設定を保持する
 * なぜ: 環境ごとにバックエンド切替とリトライ調整をコード変更なしで行うため
 */
package com.mos.notification.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.text-generation")
public record TextGenerationProperties(
    Backend backend,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    OpenAi openai,
    Cli cli) {

  public enum Backend {
    OPENAI_API,
    CLAUDE_CLI,
    OLLAMA_CLI
  }

  public TextGenerationProperties {
    backend = backend == null ? Backend.OPENAI_API : backend;
    maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    openai = openai == null ? new OpenAi(null, null, null, null, null, null) : openai;
    cli = cli == null ? new Cli(null, null, null) : cli;
  }

  public record OpenAi(
      String baseUrl,
      String apiKey,
      String model,
      Double temperature,
      Duration connectTimeout,
      Duration readTimeout) {

    public OpenAi {
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.openai.com/v1" : baseUrl;
      apiKey = apiKey == null ? "" : apiKey;
      model = model == null || model.isBlank() ? "gpt-4.1-mini" : model;
      temperature = temperature == null ? 0.2d : temperature;
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofSeconds(60) : readTimeout;
    }
  }

  public record Cli(
      List<String> claudeCommand, List<String> ollamaCommand, Duration processTimeout) {

    public Cli {
      claudeCommand =
          claudeCommand == null || claudeCommand.isEmpty()
              ? List.of("claude", "--format", "json")
              : List.copyOf(claudeCommand);
      ollamaCommand =
          ollamaCommand == null || ollamaCommand.isEmpty()
              ? List.of("ollama", "run", "llama3.1", "--format", "json")
              : List.copyOf(ollamaCommand);
      processTimeout = processTimeout == null ? Duration.ofSeconds(120) : processTimeout;
    }
  }
}
