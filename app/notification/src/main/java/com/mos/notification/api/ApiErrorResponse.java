/*
 * どこで: Notification API モデル
 * 何を: API エラー応答の共通 DTO
 * なぜ: エラー形式を統一し、運用ツール側で機械的に処理できるようにするため
 */
package com.mos.notification.api;

public record ApiErrorResponse(String code, String message) {}
