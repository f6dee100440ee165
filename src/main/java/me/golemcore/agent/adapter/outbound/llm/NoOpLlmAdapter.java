package me.golemcore.agent.adapter.outbound.llm;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stand-in backend selected when {@code agent.llm.provider} names no known
 * provider. Every turn is answered with {@link #PLACEHOLDER}.
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "none";
    static final String PLACEHOLDER = "[No LLM configured]";

    private final AtomicBoolean warned = new AtomicBoolean();

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        warnOnce();
        return CompletableFuture.completedFuture(LlmResponse.builder().content(PLACEHOLDER).build());
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Mono.fromRunnable(this::warnOnce).thenMany(Flux.just(LlmChunk.of(PLACEHOLDER)));
    }

    @Override
    public String getCurrentModel() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    private void warnOnce() {
        if (warned.compareAndSet(false, true)) {
            log.warn("[LLM] No backend configured, answering with a placeholder");
        }
    }
}
