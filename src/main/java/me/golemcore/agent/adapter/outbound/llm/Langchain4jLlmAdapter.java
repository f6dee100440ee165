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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.LlmBackendException;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * LLM adapter for hosted models through the langchain4j library:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible API endpoint
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * langchain4j's own retries are disabled; transient failures (rate limits,
 * timeouts, connection errors, 5xx) are retried here with exponential back-off.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}, configured via
 * {@code agent.llm.langchain4j.*}.
 */
@Component
@Slf4j
public class Langchain4jLlmAdapter implements LlmProviderAdapter {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int ANTHROPIC_MAX_TOKENS = 4096;

    private final AgentProperties.Langchain4jProperties config;
    private final long timeoutMs;

    private ChatModel chatModel;
    private StreamingChatModel streamingChatModel;
    private volatile boolean initialized = false;

    public Langchain4jLlmAdapter(AgentProperties properties) {
        this.config = properties.getLlm().getLangchain4j();
        this.timeoutMs = properties.getLlm().getTimeoutMs();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (!isAvailable()) {
            log.warn("[LLM] Langchain4j adapter not configured: set agent.llm.langchain4j.api-key");
            return;
        }
        Duration timeout = Duration.ofMillis(timeoutMs);
        if (PROVIDER_ANTHROPIC.equals(config.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(ANTHROPIC_MAX_TOKENS)
                    .timeout(timeout);
            var streamingBuilder = AnthropicStreamingChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .maxTokens(ANTHROPIC_MAX_TOKENS)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
                streamingBuilder.baseUrl(config.getBaseUrl());
            }
            if (config.getTemperature() != null) {
                builder.temperature(config.getTemperature());
                streamingBuilder.temperature(config.getTemperature());
            }
            this.chatModel = builder.build();
            this.streamingChatModel = streamingBuilder.build();
        } else {
            var builder = OpenAiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .maxRetries(0) // Retry handled by our backoff logic
                    .timeout(timeout);
            var streamingBuilder = OpenAiStreamingChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
                streamingBuilder.baseUrl(config.getBaseUrl());
            }
            if (config.getTemperature() != null) {
                builder.temperature(config.getTemperature());
                streamingBuilder.temperature(config.getTemperature());
            }
            this.chatModel = builder.build();
            this.streamingChatModel = streamingBuilder.build();
        }
        initialized = true;
        log.info("[LLM] Langchain4j adapter initialized: provider={}, model={}", config.getProvider(),
                config.getModel());
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            List<ChatMessage> messages = convertMessages(request);
            int maxRetries = Math.max(0, config.getMaxRetries());

            for (int attempt = 0;; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(messages);
                    return LlmResponse.builder()
                            .content(response.aiMessage() != null ? response.aiMessage().text() : null)
                            .model(config.getModel())
                            .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                            .build();
                } catch (RuntimeException e) { // NOSONAR - provider SDKs throw a wide range of unchecked types
                    if (isTransientError(e) && attempt < maxRetries) {
                        long backoffMs = (long) (config.getInitialBackoffMs() * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Transient failure (attempt {}/{}), retrying in {}ms: {}",
                                attempt + 1, maxRetries, backoffMs, e.getMessage());
                        sleepBeforeRetry(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed", e);
                        throw new LlmBackendException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.create(sink -> {
            ensureInitialized();
            AtomicBoolean cancelled = new AtomicBoolean(false);
            sink.onDispose(() -> cancelled.set(true));
            streamingChatModel.chat(convertMessages(request), new SinkHandler(sink, cancelled));
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    @Override
    public String getCurrentModel() {
        return config.getModel();
    }

    @Override
    public boolean isAvailable() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
        if (chatModel == null || streamingChatModel == null) {
            throw new LlmBackendException("Langchain4j adapter not available");
        }
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        if (request.getMessages() == null) {
            return messages;
        }
        for (Message message : request.getMessages()) {
            String content = message.getContent() != null ? message.getContent() : "";
            if (message.isUserMessage()) {
                messages.add(UserMessage.from(content));
            } else if (message.isAssistantMessage()) {
                messages.add(AiMessage.from(content));
            } else {
                messages.add(SystemMessage.from(content));
            }
        }
        return messages;
    }

    private boolean isTransientError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof dev.langchain4j.exception.RateLimitException
                    || current instanceof IOException
                    || current instanceof TimeoutException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("503") || msg.contains("timed out")
                    || msg.contains("Connection reset"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LlmBackendException("LLM chat interrupted during retry backoff", ie);
        }
    }

    /**
     * Bridges langchain4j streaming callbacks to a Flux sink. The SDK offers no
     * cancellation handle, so tokens arriving after cancellation are dropped.
     */
    private static final class SinkHandler implements StreamingChatResponseHandler {

        private final FluxSink<LlmChunk> sink;
        private final AtomicBoolean cancelled;

        private SinkHandler(FluxSink<LlmChunk> sink, AtomicBoolean cancelled) {
            this.sink = sink;
            this.cancelled = cancelled;
        }

        @Override
        public void onPartialResponse(String partialResponse) {
            if (!cancelled.get() && partialResponse != null && !partialResponse.isEmpty()) {
                sink.next(LlmChunk.of(partialResponse));
            }
        }

        @Override
        public void onCompleteResponse(ChatResponse completeResponse) {
            sink.complete();
        }

        @Override
        public void onError(Throwable error) {
            sink.error(new LlmBackendException("LLM stream failed: " + error.getMessage(), error));
        }
    }
}
