/*
 * どこで: Notification テキスト生成層のユニットテスト
 * 何を: chat/completions の要求内容と HTTP 応答ごとの結果分類を検証する
 * なぜ: 再試行可否の判定を誤ると恒久失敗を無駄に再送したり一時障害で諦めたりするため
 */
package com.mos.notification.textgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mos.notification.config.TextGenerationProperties;
import java.io.IOException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class OpenAiTextGenerationBackendTest {

  private static final String BASE_URL = "http://llm.test/v1";
  private static final String COMPLETIONS_URL = BASE_URL + "/chat/completions";

  private MockRestServiceServer server;
  private OpenAiTextGenerationBackend backend;

  @BeforeEach
  void setUp() {
    backend = newBackend("sk-test");
  }

  @Test
  void parsesJsonObjectFromMessageContent() {
    server
        .expect(requestTo(COMPLETIONS_URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Authorization", "Bearer sk-test"))
        .andExpect(jsonPath("$.model").value("gpt-test"))
        .andExpect(jsonPath("$.response_format.type").value("json_object"))
        .andExpect(jsonPath("$.messages[0].role").value("system"))
        .andExpect(jsonPath("$.messages[0].content").value("be brief"))
        .andExpect(jsonPath("$.messages[1].role").value("user"))
        .andExpect(jsonPath("$.messages[1].content").value("{\"stage\":\"D-1\"}"))
        .andRespond(
            withSuccess(
                """
                {"choices":[{"message":{"role":"assistant","content":"{\\"text\\":\\"Due tomorrow.\\"}"}}]}
                """,
                MediaType.APPLICATION_JSON));

    final TextGenerationResult result = backend.generate("be brief", "{\"stage\":\"D-1\"}");

    assertThat(result.isOk()).isTrue();
    assertThat(result.body().get("text").asText()).isEqualTo("Due tomorrow.");
    server.verify();
  }

  @Test
  void rateLimitIsRetryable() {
    server.expect(requestTo(COMPLETIONS_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    assertThat(backend.generate("p", "{}").outcome())
        .isEqualTo(TextGenerationResult.Outcome.RETRYABLE);
  }

  @Test
  void serverErrorIsRetryable() {
    server.expect(requestTo(COMPLETIONS_URL)).andRespond(withServerError());

    assertThat(backend.generate("p", "{}").outcome())
        .isEqualTo(TextGenerationResult.Outcome.RETRYABLE);
  }

  @Test
  void authenticationAndNotFoundAreFatal() {
    server.expect(requestTo(COMPLETIONS_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));
    server.expect(requestTo(COMPLETIONS_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

    final TextGenerationResult unauthorized = backend.generate("p", "{}");
    final TextGenerationResult notFound = backend.generate("p", "{}");

    assertThat(unauthorized.outcome()).isEqualTo(TextGenerationResult.Outcome.FATAL);
    assertThat(unauthorized.error()).contains("status=401");
    assertThat(notFound.outcome()).isEqualTo(TextGenerationResult.Outcome.FATAL);
  }

  @Test
  void timeoutAndConnectionFailureAreRetryable() {
    server
        .expect(requestTo(COMPLETIONS_URL))
        .andRespond(withException(new SocketTimeoutException("Read timed out")));
    server
        .expect(requestTo(COMPLETIONS_URL))
        .andRespond(withException(new IOException("Connection refused")));

    final TextGenerationResult timeout = backend.generate("p", "{}");
    final TextGenerationResult refused = backend.generate("p", "{}");

    assertThat(timeout.isRetryable()).isTrue();
    assertThat(timeout.error()).contains("timeout");
    assertThat(refused.isRetryable()).isTrue();
    assertThat(refused.error()).contains("connection failed");
  }

  @Test
  void nonJsonContentIsFatal() {
    server
        .expect(requestTo(COMPLETIONS_URL))
        .andRespond(
            withSuccess(
                "{\"choices\":[{\"message\":{\"content\":\"Sure! Here you go\"}}]}",
                MediaType.APPLICATION_JSON));

    final TextGenerationResult result = backend.generate("p", "{}");

    assertThat(result.outcome()).isEqualTo(TextGenerationResult.Outcome.FATAL);
    assertThat(result.error()).contains("not valid JSON");
  }

  @Test
  void jsonArrayContentIsFatal() {
    server
        .expect(requestTo(COMPLETIONS_URL))
        .andRespond(
            withSuccess(
                "{\"choices\":[{\"message\":{\"content\":\"[1,2]\"}}]}",
                MediaType.APPLICATION_JSON));

    assertThat(backend.generate("p", "{}").outcome())
        .isEqualTo(TextGenerationResult.Outcome.FATAL);
  }

  @Test
  void missingContentIsFatal() {
    server
        .expect(requestTo(COMPLETIONS_URL))
        .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

    assertThat(backend.generate("p", "{}").outcome())
        .isEqualTo(TextGenerationResult.Outcome.FATAL);
  }

  @Test
  void missingApiKeyFailsWithoutCallingServer() {
    final OpenAiTextGenerationBackend unconfigured = newBackend("");

    final TextGenerationResult result = unconfigured.generate("p", "{}");

    assertThat(result.outcome()).isEqualTo(TextGenerationResult.Outcome.FATAL);
    assertThat(result.error()).contains("api key");
    server.verify();
  }

  private OpenAiTextGenerationBackend newBackend(String apiKey) {
    final RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    return new OpenAiTextGenerationBackend(
        builder.build(),
        new TextGenerationProperties.OpenAi(BASE_URL, apiKey, "gpt-test", 0.2d, null, null),
        new ObjectMapper());
  }
}
