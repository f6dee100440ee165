package me.golemcore.agent.domain.engine;

import me.golemcore.agent.domain.model.AgentStreamEvent;
import me.golemcore.agent.domain.model.CapabilityResult;
import me.golemcore.agent.domain.service.CapabilityRegistry;
import me.golemcore.agent.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Agent orchestration engine.
 *
 * <p>
 * A turn runs the two-phase protocol: a non-streamed phase-1 generation decides
 * whether the model asked for a tool; if so the tool runs once, its outcome is
 * appended as a system message and phase 2 produces the final reply. Turns run
 * against an explicit conversation id; the overloads without one use the active
 * conversation.
 */
public interface AgentEngine {

    /**
     * Binds the backend and capability registry and creates the initial active
     * conversation.
     *
     * @throws me.golemcore.agent.domain.exception.EngineInitializationException
     *             if the initial conversation cannot be created
     */
    void initialize(LlmPort llmPort, CapabilityRegistry registry);

    String process(String input);

    /**
     * Runs one non-streamed turn.
     *
     * @throws me.golemcore.agent.domain.exception.LlmBackendException
     *             if either generation phase fails
     * @throws me.golemcore.agent.domain.exception.ConversationNotFoundException
     *             if the conversation does not exist
     */
    String process(String conversationId, String input);

    Flux<AgentStreamEvent> processStream(String input);

    /**
     * Runs one streamed turn. The returned Flux is the delivery channel: it
     * terminates exactly once, and cancelling it cancels the in-flight backend
     * call.
     */
    Flux<AgentStreamEvent> processStream(String conversationId, String input);

    /**
     * Invokes a capability directly, outside any turn.
     *
     * @throws me.golemcore.agent.domain.exception.CapabilityNotFoundException
     *             if the capability is not registered
     * @throws me.golemcore.agent.domain.exception.CapabilityExecutionException
     *             if the capability fails
     */
    CapabilityResult executeTool(String name, Map<String, Object> parameters);

    String getConversationId();

    /**
     * Switches the active conversation.
     *
     * @throws IllegalArgumentException
     *             if {@code conversationId} is blank; state is left untouched
     */
    void setConversationId(String conversationId);

    /**
     * Records user feedback as a system message in the active conversation.
     */
    void learn(String feedback);

    void learn(String conversationId, String feedback);
}
