/*
 * どこで: Notification テキスト生成層
 * 何を: テキスト生成バックエンドの抽象化インターフェース
 * なぜ: OpenAI API / ローカル CLI / テスト用スタブを設定で差し替えるため
 */
package com.mos.notification.textgen;

/**
 * One request/response exchange with a text generator.
 *
 * <p>Implementations make exactly one attempt and report failures as classified results instead of
 * throwing; retrying is left to {@link RetryingTextGenerator}.
 */
public interface TextGenerationBackend {

  TextGenerationResult generate(String systemPrompt, String userPayload);

  /** Name used in logs and metric tags. */
  String name();
}
