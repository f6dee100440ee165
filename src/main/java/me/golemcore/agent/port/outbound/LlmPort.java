package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Port for model backends (local or hosted).
 */
public interface LlmPort {

    /**
     * Provider identifier (e.g., "ollama", "langchain4j", "none").
     */
    String getProviderId();

    /**
     * Single-shot generation. The future completes exceptionally with
     * {@link me.golemcore.agent.domain.exception.LlmBackendException} on
     * timeout, transport failure or an unusable response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Streaming generation. The Flux completes when the backend finishes and
     * errors with {@link me.golemcore.agent.domain.exception.LlmBackendException}
     * on failure. Cancelling the subscription aborts the underlying call.
     */
    Flux<LlmChunk> chatStream(LlmRequest request);

    String getCurrentModel();

    boolean isAvailable();
}
