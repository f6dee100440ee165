package me.golemcore.agent.adapter.outbound.llm;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for selecting LLM adapters based on configuration.
 *
 * <p>
 * The active adapter is chosen once, in {@link #init()}, from
 * {@code agent.llm.provider}:
 * <ul>
 * <li>ollama - local Ollama server
 * <li>langchain4j - OpenAI-compatible or Anthropic hosted APIs
 * <li>none - No-op adapter for testing
 * </ul>
 *
 * @see LlmProviderAdapter
 * @see OllamaLlmAdapter
 * @see Langchain4jLlmAdapter
 * @see NoOpLlmAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = NoOpLlmAdapter.PROVIDER_ID;

    private final AgentProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        activeAdapter = adaptersByProvider.get(provider);

        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("[LLM] Provider '{}' not found, using: {}",
                    provider, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            log.info("[LLM] Active provider: {}", provider);
        }
        if (activeAdapter != null) {
            activeAdapter.initialize();
        }
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return requireActive().chat(request);
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return requireActive().chatStream(request);
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }

    private LlmProviderAdapter requireActive() {
        if (activeAdapter == null) {
            throw new IllegalStateException("No LLM adapter available");
        }
        return activeAdapter;
    }
}
