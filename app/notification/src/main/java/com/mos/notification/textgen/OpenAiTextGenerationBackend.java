/*
 * どこで: Notification テキスト生成層
 * 何を: OpenAI 互換 chat/completions API を 1 回呼び出し、結果を分類して返す
 * なぜ: HTTP ステータスと接続障害を再試行可否に写像し、再試行判断を呼び出し側へ委ねるため
 */
package com.mos.notification.textgen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mos.notification.config.TextGenerationProperties;
import java.net.SocketTimeoutException;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class OpenAiTextGenerationBackend implements TextGenerationBackend {

  static final String NAME = "openai_api";
  static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

  private final RestClient restClient;
  private final TextGenerationProperties.OpenAi properties;
  private final ObjectMapper objectMapper;

  public OpenAiTextGenerationBackend(
      RestClient restClient, TextGenerationProperties.OpenAi properties, ObjectMapper objectMapper) {
    this.restClient = restClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public TextGenerationResult generate(String systemPrompt, String userPayload) {
    if (properties.apiKey().isBlank()) {
      return TextGenerationResult.fatal("openai api key is not configured");
    }
    final ChatCompletionRequest request =
        new ChatCompletionRequest(
            properties.model(),
            List.of(new ChatMessage("system", systemPrompt), new ChatMessage("user", userPayload)),
            new ResponseFormat("json_object"),
            properties.temperature());
    final JsonNode response;
    try {
      response =
          restClient
              .post()
              .uri(CHAT_COMPLETIONS_PATH)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      return mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      return TextGenerationResult.retryable(
          (isTimeout(ex) ? "openai request timeout: " : "openai connection failed: ")
              + ex.getMessage());
    } catch (RuntimeException ex) {
      return TextGenerationResult.fatal("openai response parse failed: " + ex.getMessage());
    }
    return parseContent(response);
  }

  private TextGenerationResult parseContent(JsonNode response) {
    final JsonNode content =
        response == null ? null : response.path("choices").path(0).path("message").path("content");
    if (content == null || !content.isTextual() || content.asText().isBlank()) {
      return TextGenerationResult.fatal("openai response has no message content");
    }
    try {
      final JsonNode body = objectMapper.readTree(content.asText());
      if (body == null || !body.isObject()) {
        return TextGenerationResult.fatal("openai message content is not a JSON object");
      }
      return TextGenerationResult.ok(body);
    } catch (JsonProcessingException ex) {
      return TextGenerationResult.fatal("openai message content is not valid JSON: " + ex.getOriginalMessage());
    }
  }

  private TextGenerationResult mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    final String message = "openai returned status=" + status + ": " + ex.getResponseBodyAsString();
    if (status == 429 || status == 408 || ex.getStatusCode().is5xxServerError()) {
      return TextGenerationResult.retryable(message);
    }
    // 401/403/404 を含むその他 4xx は再試行しても結果が変わらない
    return TextGenerationResult.fatal(message);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record ChatCompletionRequest(
      String model, List<ChatMessage> messages, ResponseFormat responseFormat, Double temperature) {}

  record ChatMessage(String role, String content) {}

  record ResponseFormat(String type) {}
}
