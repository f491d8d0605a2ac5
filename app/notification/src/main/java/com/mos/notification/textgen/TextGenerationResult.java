/*
 * どこで: Notification テキスト生成層
 * 何を: バックエンド呼び出し結果を OK / 再試行可能 / 恒久失敗に分類して表す
 * なぜ: 例外ではなく値で再試行判定を行うため
 */
package com.mos.notification.textgen;

import com.fasterxml.jackson.databind.JsonNode;

public record TextGenerationResult(Outcome outcome, JsonNode body, String error) {

  public enum Outcome {
    OK,
    RETRYABLE,
    FATAL
  }

  public static TextGenerationResult ok(JsonNode body) {
    return new TextGenerationResult(Outcome.OK, body, null);
  }

  public static TextGenerationResult retryable(String error) {
    return new TextGenerationResult(Outcome.RETRYABLE, null, error);
  }

  public static TextGenerationResult fatal(String error) {
    return new TextGenerationResult(Outcome.FATAL, null, error);
  }

  public boolean isOk() {
    return outcome == Outcome.OK;
  }

  public boolean isRetryable() {
    return outcome == Outcome.RETRYABLE;
  }
}
