package me.golemcore.agent.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.LlmBackendException;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter for a local Ollama server ({@code POST /api/chat}).
 *
 * <p>
 * Two independently bounded retry loops:
 * <ul>
 * <li>connection failures: up to {@code connect-retries} attempts, waiting
 * {@code attempt * connect-backoff-ms} between them
 * <li>model still loading ({@code done_reason == "load"}): up to
 * {@code load-retries} extra attempts with a fixed {@code load-retry-delay-ms}
 * </ul>
 * Neither loop consumes the other's budget. The overall per-call deadline is
 * the OkHttp call timeout ({@code agent.llm.timeout-ms}).
 *
 * <p>
 * Provider ID: {@code "ollama"}
 */
@Component
@Slf4j
public class OllamaLlmAdapter implements LlmProviderAdapter {

    static final String DONE_REASON_LOAD = "load";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String CHAT_ENDPOINT = "api/chat";

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final AgentProperties.OllamaProperties ollama;

    public OllamaLlmAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper, AgentProperties properties) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.ollama = properties.getLlm().getOllama();
    }

    @Override
    public String getProviderId() {
        return "ollama";
    }

    @Override
    public void initialize() {
        log.info("[LLM] Ollama adapter initialized: {} model={}", ollama.getBaseUrl(), ollama.getModel());
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> generate(request));
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        int loadRetries = Math.max(0, ollama.getLoadRetries());
        return Flux.defer(() -> streamOnce(request))
                .retryWhen(Retry.fixedDelay(loadRetries, Duration.ofMillis(ollama.getLoadRetryDelayMs()))
                        .filter(ModelLoadingException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("[LLM] Model is loading, retrying stream in {}ms ({}/{})",
                                ollama.getLoadRetryDelayMs(), signal.totalRetries() + 1, loadRetries))
                        .onRetryExhaustedThrow((spec, signal) -> new LlmBackendException(
                                "Model still loading after " + loadRetries + " retries", signal.failure())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public String getCurrentModel() {
        return ollama.getModel();
    }

    @Override
    public boolean isAvailable() {
        return ollama.getBaseUrl() != null && !ollama.getBaseUrl().isBlank();
    }

    // ==================== single-shot ====================

    private LlmResponse generate(LlmRequest request) {
        int loadRetries = Math.max(0, ollama.getLoadRetries());
        for (int loadAttempt = 0;; loadAttempt++) {
            OllamaChatResponse response = executeOnce(request);
            if (DONE_REASON_LOAD.equals(response.getDoneReason())) {
                if (loadAttempt >= loadRetries) {
                    throw new LlmBackendException("Model still loading after " + loadRetries + " retries");
                }
                log.warn("[LLM] Model is loading, retrying in {}ms ({}/{})",
                        ollama.getLoadRetryDelayMs(), loadAttempt + 1, loadRetries);
                sleepBeforeRetry(ollama.getLoadRetryDelayMs());
                continue;
            }
            return LlmResponse.builder()
                    .content(response.text())
                    .model(response.getModel())
                    .finishReason(response.getDoneReason())
                    .build();
        }
    }

    private OllamaChatResponse executeOnce(LlmRequest request) {
        try (Response response = executeWithConnectRetry(request, false)) {
            ResponseBody body = response.body();
            String raw = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new LlmBackendException("Ollama returned HTTP " + response.code() + ": " + raw);
            }
            if (raw.isBlank()) {
                throw new LlmBackendException("Ollama returned an empty response");
            }
            OllamaChatResponse parsed = parse(raw);
            if (parsed.getError() != null && !parsed.getError().isBlank()) {
                throw new LlmBackendException("Ollama error: " + parsed.getError());
            }
            return parsed;
        } catch (IOException e) {
            throw new LlmBackendException("Failed to read Ollama response: " + e.getMessage(), e);
        }
    }

    /**
     * Executes the HTTP call, retrying transport failures only. HTTP error
     * statuses are returned to the caller untouched.
     */
    private Response executeWithConnectRetry(LlmRequest request, boolean stream) {
        Request httpRequest = buildHttpRequest(request, stream);
        int maxAttempts = Math.max(1, ollama.getConnectRetries());
        for (int attempt = 1;; attempt++) {
            try {
                return okHttpClient.newCall(httpRequest).execute();
            } catch (IOException e) {
                if (attempt >= maxAttempts || Thread.currentThread().isInterrupted()) {
                    log.error("[LLM] Ollama request failed after {} attempt(s): {}", attempt, e.getMessage());
                    throw new LlmBackendException(
                            "Ollama request failed after " + attempt + " attempt(s): " + e.getMessage(), e);
                }
                long backoffMs = ollama.getConnectBackoffMs() * attempt;
                log.warn("[LLM] Ollama request failed (attempt {}/{}), retrying in {}ms: {}",
                        attempt, maxAttempts, backoffMs, e.getMessage());
                sleepBeforeRetry(backoffMs);
            }
        }
    }

    // ==================== streaming ====================

    private Flux<LlmChunk> streamOnce(LlmRequest request) {
        return Flux.using(
                () -> {
                    Response response = executeWithConnectRetry(request, true);
                    if (!response.isSuccessful()) {
                        String raw = response.body() != null ? response.body().string() : "";
                        response.close();
                        throw new LlmBackendException("Ollama returned HTTP " + response.code() + ": " + raw);
                    }
                    return response;
                },
                response -> Flux.<LlmChunk, BufferedSource>generate(() -> response.body().source(),
                        (source, sink) -> {
                            try {
                                String line = source.readUtf8Line();
                                if (line == null) {
                                    sink.complete();
                                    return source;
                                }
                                if (line.isBlank()) {
                                    return source;
                                }
                                OllamaChatResponse chunk = parse(line);
                                if (chunk.getError() != null && !chunk.getError().isBlank()) {
                                    sink.error(new LlmBackendException("Ollama error: " + chunk.getError()));
                                } else if (DONE_REASON_LOAD.equals(chunk.getDoneReason())) {
                                    sink.error(new ModelLoadingException());
                                } else {
                                    String text = chunk.text();
                                    if (!text.isEmpty()) {
                                        sink.next(LlmChunk.builder().text(text).done(chunk.isDone()).build());
                                    }
                                    if (chunk.isDone()) {
                                        sink.complete();
                                    }
                                }
                            } catch (IOException e) {
                                sink.error(new LlmBackendException("Failed to read Ollama stream: " + e.getMessage(), e));
                            } catch (LlmBackendException e) {
                                sink.error(e);
                            }
                            return source;
                        }),
                Response::close);
    }

    // ==================== helpers ====================

    private Request buildHttpRequest(LlmRequest request, boolean stream) {
        OllamaChatRequest body = OllamaChatRequest.builder()
                .model(ollama.getModel())
                .messages(toOllamaMessages(request))
                .stream(stream)
                .options(OllamaOptions.builder()
                        .temperature(ollama.getTemperature())
                        .numPredict(ollama.getMaxTokens() > 0 ? ollama.getMaxTokens() : null)
                        .build())
                .build();
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new LlmBackendException("Failed to serialize Ollama request", e);
        }
        return new Request.Builder()
                .url(endpointUrl())
                .post(RequestBody.create(json, JSON))
                .build();
    }

    private String endpointUrl() {
        String base = ollama.getBaseUrl();
        return base.endsWith("/") ? base + CHAT_ENDPOINT : base + "/" + CHAT_ENDPOINT;
    }

    private List<OllamaMessage> toOllamaMessages(LlmRequest request) {
        List<OllamaMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(new OllamaMessage(Message.ROLE_SYSTEM, request.getSystemPrompt()));
        }
        if (request.getMessages() != null) {
            for (Message message : request.getMessages()) {
                messages.add(new OllamaMessage(message.getRole(), message.getContent()));
            }
        }
        return messages;
    }

    private OllamaChatResponse parse(String json) {
        try {
            return objectMapper.readValue(json, OllamaChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmBackendException("Malformed Ollama response: " + e.getOriginalMessage(), e);
        }
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmBackendException("Ollama call interrupted during retry backoff", e);
        }
    }

    // ==================== DTOs ====================

    static final class ModelLoadingException extends LlmBackendException {

        private static final long serialVersionUID = 1L;

        ModelLoadingException() {
            super("Model is still loading");
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class OllamaChatRequest {
        private String model;
        private List<OllamaMessage> messages;
        private boolean stream;
        private OllamaOptions options;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OllamaMessage {
        private String role;
        private String content;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class OllamaOptions {
        private Double temperature;
        @JsonProperty("num_predict")
        private Integer numPredict;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OllamaChatResponse {
        private String model;
        private OllamaMessage message;
        private String response; // /api/generate style payloads
        private boolean done;
        @JsonProperty("done_reason")
        private String doneReason;
        private String error;

        String text() {
            if (message != null && message.getContent() != null) {
                return message.getContent();
            }
            return response != null ? response : "";
        }
    }
}
