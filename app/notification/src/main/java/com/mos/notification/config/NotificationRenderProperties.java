/*
 * どこで: Notification アプリの設定バインド
 * 何を: レンダリングのポーリング/バッチ/プロンプト設定を保持する
 * なぜ: 運用パラメータとプロンプト文面をコード外へ出すため
 */
package com.mos.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.render")
public record NotificationRenderProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    int errorMessageMaxLength,
    String reminderPrompt,
    String followupPrompt) {

  static final String DEFAULT_REMINDER_PROMPT =
      """
      You write a deadline reminder announcement for a personal task manager.
      Return ONLY JSON: {"text": "..."}.

      Requirements:
      - Make it actionable: include a "next step" that can be done in ~15 minutes.
      - Ask at most ONE clarification question, only if needed.
      - Be concise but specific.
      """
          .strip();

  static final String DEFAULT_FOLLOWUP_PROMPT =
      """
      You write a short follow-up summary (morning/noon/evening) for a personal task manager.
      Return ONLY JSON: {"text": "..."}.
      Be concise, prioritize urgent items, avoid repetition.
      """
          .strip();

  public NotificationRenderProperties {
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
    reminderPrompt =
        reminderPrompt == null || reminderPrompt.isBlank()
            ? DEFAULT_REMINDER_PROMPT
            : reminderPrompt.strip();
    followupPrompt =
        followupPrompt == null || followupPrompt.isBlank()
            ? DEFAULT_FOLLOWUP_PROMPT
            : followupPrompt.strip();
  }
}
