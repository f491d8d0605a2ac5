/*
 * どこで: Notification API
 * 何を: API の例外を標準エラー形式へ変換する
 * なぜ: 失敗時の契約を一定に保ち、呼び出し側の分岐を簡潔にするため
 */
package com.mos.notification.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({InvalidNotificationRequestException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiErrorResponse> handleBadRequest(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }

  /** Storage failures surface as 503 so operators can retry the trigger later. */
  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    logger.error("notification api storage failure", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("STORAGE_UNAVAILABLE", "storage is unavailable"));
  }
}
