/*
 * どこで: Notification テキスト生成層
 * 何を: ローカル CLI (claude / ollama) を起動し、stdin にプロンプトを渡して stdout の JSON を読む
 * なぜ: API キー無しの開発環境でも同じパイプラインでレンダリングできるようにするため
 */
package com.mos.notification.textgen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalProcessTextGenerationBackend implements TextGenerationBackend, AutoCloseable {

  private static final Logger logger =
      LoggerFactory.getLogger(LocalProcessTextGenerationBackend.class);
  private static final Duration STREAM_DRAIN_TIMEOUT = Duration.ofSeconds(5);
  private static final int MAX_STDERR_IN_ERROR = 500;

  private final String name;
  private final List<String> command;
  private final Duration processTimeout;
  private final ObjectMapper objectMapper;
  private final ExecutorService streamReaders;

  public LocalProcessTextGenerationBackend(
      String name, List<String> command, Duration processTimeout, ObjectMapper objectMapper) {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command is required");
    }
    this.name = name;
    this.command = List.copyOf(command);
    this.processTimeout = processTimeout;
    this.objectMapper = objectMapper;
    this.streamReaders =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat(name + "-io-%d").setDaemon(true).build());
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public TextGenerationResult generate(String systemPrompt, String userPayload) {
    final Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException ex) {
      return TextGenerationResult.fatal(
          name + " command could not be started: " + command.get(0) + ": " + ex.getMessage());
    }
    // stdin 書き込みと stdout/stderr の読み取りを並行に行い、パイプ詰まりで processTimeout を超えて待たない
    final CompletableFuture<String> stdout = readAsync(process.getInputStream());
    final CompletableFuture<String> stderr = readAsync(process.getErrorStream());
    CompletableFuture.runAsync(
        () -> writePrompt(process, systemPrompt + "\n\n" + userPayload), streamReaders);

    try {
      if (!process.waitFor(processTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        return TextGenerationResult.retryable(
            name + " timed out after " + processTimeout.toMillis() + "ms");
      }
      final int exitCode = process.exitValue();
      if (exitCode != 0) {
        return TextGenerationResult.fatal(
            name + " exited with code " + exitCode + ": " + abbreviate(drain(stderr)));
      }
      return parseOutput(drain(stdout));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      return TextGenerationResult.retryable(name + " interrupted while waiting for output");
    } catch (ExecutionException | TimeoutException ex) {
      return TextGenerationResult.fatal(name + " output could not be read: " + ex.getMessage());
    }
  }

  private void writePrompt(Process process, String prompt) {
    try (OutputStream stdin = process.getOutputStream()) {
      stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
    } catch (IOException ex) {
      // stdin を読まずに終了した/強制終了されたプロセスは終了コードかタイムアウトで判定する
      logger.debug("{} closed stdin before the prompt was written", name, ex);
    }
  }

  private TextGenerationResult parseOutput(String output) {
    if (output == null || output.isBlank()) {
      return TextGenerationResult.fatal(name + " produced no output");
    }
    try {
      final JsonNode body = objectMapper.readTree(output.strip());
      if (body == null || !body.isObject()) {
        return TextGenerationResult.fatal(name + " output is not a JSON object");
      }
      return TextGenerationResult.ok(body);
    } catch (JsonProcessingException ex) {
      return TextGenerationResult.fatal(name + " output is not valid JSON: " + ex.getOriginalMessage());
    }
  }

  private CompletableFuture<String> readAsync(InputStream stream) {
    return CompletableFuture.supplyAsync(
        () -> {
          try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
          } catch (IOException ex) {
            throw new UncheckedIOException(ex);
          }
        },
        streamReaders);
  }

  private String drain(CompletableFuture<String> output)
      throws InterruptedException, ExecutionException, TimeoutException {
    return output.get(STREAM_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
  }

  private String abbreviate(String text) {
    final String stripped = text == null ? "" : text.strip();
    return stripped.length() <= MAX_STDERR_IN_ERROR
        ? stripped
        : stripped.substring(0, MAX_STDERR_IN_ERROR);
  }

  @Override
  public void close() {
    streamReaders.shutdownNow();
  }
}
