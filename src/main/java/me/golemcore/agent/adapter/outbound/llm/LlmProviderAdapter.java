package me.golemcore.agent.adapter.outbound.llm;

import me.golemcore.agent.port.outbound.LlmPort;

/**
 * Interface for LLM provider adapters.
 *
 * <p>
 * Extends {@link LlmPort} with a lifecycle hook. All provider adapters must
 * implement this interface to be managed by {@link LlmAdapterFactory}.
 *
 * @see LlmAdapterFactory
 */
public interface LlmProviderAdapter extends LlmPort {

    /**
     * Initialize the adapter. Called when adapter is selected.
     */
    default void initialize() {
        // Default no-op
    }
}
