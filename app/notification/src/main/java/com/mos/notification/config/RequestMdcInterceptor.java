/*
 * どこで: Notification Web 設定
 * 何を: 管理 API のリクエストごとに request_id / trigger / operation を MDC に積み、完了時に外す
 * なぜ: 手動トリガーされたスキャン/レンダリング/フォローアップのログを定期実行と区別して追えるようにするため
 */
package com.mos.notification.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String REQUEST_ID_KEY = "request_id";
  static final String TRIGGER_KEY = "trigger";
  static final String OPERATION_KEY = "operation";
  static final String TRIGGER_API = "api";
  private static final List<String> KEYS =
      List.of(REQUEST_ID_KEY, TRIGGER_KEY, OPERATION_KEY, "http_method", "http_path");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = resolveRequestId(request);
    MDC.put(REQUEST_ID_KEY, requestId);
    MDC.put(TRIGGER_KEY, TRIGGER_API);
    MDC.put("http_method", request.getMethod());
    MDC.put("http_path", request.getRequestURI());
    if (handler instanceof HandlerMethod handlerMethod) {
      MDC.put(OPERATION_KEY, operationOf(handlerMethod));
    }
    // 呼び出し側がワーカーログと突き合わせられるよう応答にも返す
    response.setHeader(REQUEST_ID_HEADER, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    KEYS.forEach(MDC::remove);
  }

  // ReminderController#scan -> reminder.scan
  static String operationOf(HandlerMethod handlerMethod) {
    final String controller = handlerMethod.getBeanType().getSimpleName();
    final String resource =
        controller.endsWith("Controller")
            ? controller.substring(0, controller.length() - "Controller".length())
            : controller;
    return resource.toLowerCase(Locale.ROOT) + "." + handlerMethod.getMethod().getName();
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId != null && !requestId.isBlank()) {
      return requestId.trim();
    }
    return UUID.randomUUID().toString();
  }
}
