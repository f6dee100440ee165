package me.golemcore.agent.domain.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.AgentException;
import me.golemcore.agent.domain.exception.CapabilityExecutionException;
import me.golemcore.agent.domain.exception.CapabilityNotFoundException;
import me.golemcore.agent.domain.exception.ConversationNotFoundException;
import me.golemcore.agent.domain.exception.EngineInitializationException;
import me.golemcore.agent.domain.exception.LlmBackendException;
import me.golemcore.agent.domain.exception.MemoryPersistenceException;
import me.golemcore.agent.domain.model.AgentStreamEvent;
import me.golemcore.agent.domain.model.CapabilityResult;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ThinkingPhase;
import me.golemcore.agent.domain.model.ToolInvocation;
import me.golemcore.agent.domain.service.CapabilityRegistry;
import me.golemcore.agent.domain.service.PromptBuilder;
import me.golemcore.agent.domain.toolcall.ToolCallExtractor;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConversationMemoryPort;
import me.golemcore.agent.port.outbound.LlmPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default {@link AgentEngine}.
 *
 * <p>
 * Working history is a turn-local copy reloaded from memory at the start of
 * every turn, so a turn only ever sees one conversation's transcript. Turns on
 * the same conversation are serialised by a per-conversation permit; turns on
 * different conversations run concurrently.
 *
 * <p>
 * Ordering within a turn: the user message is persisted before phase 1, the
 * tool outcome is appended before the phase-2 prompt is built, and the
 * assistant reply is persisted once it is complete (streaming: once the stream
 * has terminated, with the concatenation of every delivered delta).
 * Persistence failures are logged and never fail a turn.
 */
@Slf4j
public class DefaultAgentEngine implements AgentEngine {

    private static final DateTimeFormatter FEEDBACK_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ConversationMemoryPort memory;
    private final ToolCallExtractor toolCallExtractor;
    private final PromptBuilder promptBuilder;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AgentProperties properties;

    private final Map<String, TurnPermit> turnPermits = new ConcurrentHashMap<>();
    private final AtomicReference<String> activeConversationId = new AtomicReference<>();

    private volatile LlmPort llmPort;
    private volatile CapabilityRegistry registry;

    public DefaultAgentEngine(ConversationMemoryPort memory, ToolCallExtractor toolCallExtractor,
            PromptBuilder promptBuilder, ObjectMapper objectMapper, Clock clock, AgentProperties properties) {
        this.memory = memory;
        this.toolCallExtractor = toolCallExtractor;
        this.promptBuilder = promptBuilder;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
    }

    @Override
    public void initialize(LlmPort llmPort, CapabilityRegistry registry) {
        if (llmPort == null || registry == null) {
            throw new IllegalArgumentException("llmPort and registry are required");
        }
        this.llmPort = llmPort;
        this.registry = registry;
        try {
            String conversationId = memory.createConversation(properties.getMemory().getDefaultTitle());
            activeConversationId.set(conversationId);
            log.info("[Engine] Initialized: provider={}, capabilities={}, conversation={}",
                    llmPort.getProviderId(), registry.getNames(), conversationId);
        } catch (AgentException e) {
            throw new EngineInitializationException("Failed to create initial conversation", e);
        }
    }

    // ==================== active conversation ====================

    @Override
    public String getConversationId() {
        return activeConversationId.get();
    }

    @Override
    public void setConversationId(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId must not be blank");
        }
        String previous = activeConversationId.getAndSet(conversationId);
        if (!conversationId.equals(previous)) {
            log.debug("[Engine] Active conversation switched: {} -> {}", previous, conversationId);
        }
    }

    // ==================== non-streamed turn ====================

    @Override
    public String process(String input) {
        return process(requireActiveConversation(), input);
    }

    @Override
    public String process(String conversationId, String input) {
        TurnPermit permit = acquirePermit(conversationId);
        try {
            Turn turn = openTurn(conversationId, input);
            String preResponse = generate(turn);
            Optional<ToolInvocation> invocation = toolCallExtractor.extract(preResponse);

            String reply;
            if (invocation.isPresent()) {
                ToolOutcome outcome = runTool(invocation.get());
                turn.append(Message.ROLE_SYSTEM, outcome.contextMessage());
                reply = generate(turn);
            } else {
                reply = preResponse;
            }
            turn.append(Message.ROLE_ASSISTANT, reply);
            return reply;
        } finally {
            permit.release();
        }
    }

    // ==================== streamed turn ====================

    @Override
    public Flux<AgentStreamEvent> processStream(String input) {
        return processStream(requireActiveConversation(), input);
    }

    @Override
    public Flux<AgentStreamEvent> processStream(String conversationId, String input) {
        return Flux.defer(() -> {
            TurnPermit permit = acquirePermit(conversationId);
            Turn turn;
            try {
                turn = openTurn(conversationId, input);
            } catch (RuntimeException e) {
                permit.release();
                throw e;
            }
            StringBuilder delivered = new StringBuilder();

            return Flux.concat(
                    Mono.just(AgentStreamEvent.meta(null, conversationId)),
                    Mono.just(AgentStreamEvent.thinking(ThinkingPhase.ANALYZING, "Analyzing the request")),
                    Flux.defer(() -> analyze(turn)),
                    Mono.fromSupplier(
                            () -> AgentStreamEvent.thinking(ThinkingPhase.GENERATING, "Generating the response")),
                    Flux.defer(() -> streamReply(turn, delivered)),
                    Mono.fromSupplier(AgentStreamEvent::done))
                    .doFinally(signal -> {
                        try {
                            completeStream(turn, delivered, signal);
                        } finally {
                            permit.release();
                        }
                    });
        })
                .subscribeOn(Schedulers.boundedElastic())
                .limitRate(Math.max(1, properties.getStream().getChannelCapacity()));
    }

    /**
     * Phase 1 plus the optional tool invocation. Emits the progress events to
     * deliver; the tool outcome, if any, is in the turn history once the flux
     * completes. Cancelling the flux cancels the pending backend call.
     */
    private Flux<AgentStreamEvent> analyze(Turn turn) {
        return generateAsync(turn)
                .publishOn(Schedulers.boundedElastic())
                .flatMapIterable(preResponse -> runDetectedTool(turn, preResponse));
    }

    private List<AgentStreamEvent> runDetectedTool(Turn turn, String preResponse) {
        Optional<ToolInvocation> invocation = toolCallExtractor.extract(preResponse);
        if (invocation.isEmpty()) {
            return List.of();
        }

        String toolName = invocation.get().getToolName();
        List<AgentStreamEvent> events = new ArrayList<>();
        events.add(AgentStreamEvent.thinking(ThinkingPhase.TOOL_CALL, "Calling tool: " + toolName));
        ToolOutcome outcome = runTool(invocation.get());
        turn.append(Message.ROLE_SYSTEM, outcome.contextMessage());
        if (outcome.success()) {
            events.add(AgentStreamEvent.thinking(ThinkingPhase.TOOL_RESULT, "Tool " + toolName + " completed"));
        } else {
            events.add(AgentStreamEvent.thinking(ThinkingPhase.TOOL_ERROR,
                    "Tool " + toolName + " failed: " + outcome.detail()));
        }
        return events;
    }

    private Flux<AgentStreamEvent> streamReply(Turn turn, StringBuilder delivered) {
        LlmRequest request = buildRequest(turn);
        return llmPort.chatStream(request)
                .map(LlmChunk::getText)
                .filter(text -> text != null && !text.isEmpty())
                .map(AgentStreamEvent::content)
                .switchIfEmpty(Mono.fromSupplier(() -> AgentStreamEvent.content(fallbackMessage())))
                .doOnNext(event -> delivered.append(event.getMessage()))
                .onErrorMap(e -> !(e instanceof LlmBackendException),
                        e -> new LlmBackendException("Streaming generation failed: " + e.getMessage(), e));
    }

    private void completeStream(Turn turn, StringBuilder delivered, SignalType signal) {
        if (signal == SignalType.CANCEL) {
            log.debug("[Engine] Stream cancelled by consumer: conversation={}", turn.conversationId);
        } else if (signal == SignalType.ON_ERROR) {
            log.warn("[Engine] Streamed turn failed: conversation={}", turn.conversationId);
        }
        if (delivered.length() > 0) {
            turn.append(Message.ROLE_ASSISTANT, delivered.toString());
        }
    }

    // ==================== tools ====================

    @Override
    public CapabilityResult executeTool(String name, Map<String, Object> parameters) {
        CapabilityRegistry current = requireRegistry();
        CompletableFuture<CapabilityResult> future = current.invoke(name, parameters);
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CapabilityExecutionException executionException) {
                throw executionException;
            }
            throw new CapabilityExecutionException("Capability " + name + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityExecutionException("Capability " + name + " interrupted", e);
        }
    }

    /**
     * Runs the turn's single tool call. Every failure, including an unknown
     * name, becomes a failed outcome.
     */
    private ToolOutcome runTool(ToolInvocation invocation) {
        String toolName = invocation.getToolName();
        log.info("[Tools] Executing '{}' ({} format)", toolName, invocation.getFormat());
        try {
            CapabilityResult result = executeTool(toolName, invocation.getParameters());
            if (result == null) {
                return ToolOutcome.failure(toolName, "capability returned no result");
            }
            if (!result.isSuccess()) {
                log.warn("[Tools] '{}' reported failure: {}", toolName, result.getError());
                return ToolOutcome.failure(toolName, result.getError());
            }
            return ToolOutcome.success(toolName, render(result.getValue()));
        } catch (CapabilityNotFoundException e) {
            log.warn("[Tools] Unknown capability '{}'. Available: {}", toolName, registry.getNames());
            return ToolOutcome.failure(toolName, e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - a failing capability must not abort the turn
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.warn("[Tools] '{}' failed: {}", toolName, e.getMessage());
            return ToolOutcome.failure(toolName, e.getMessage());
        }
    }

    private String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("[Tools] Result not serializable as JSON, using toString: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    // ==================== feedback ====================

    @Override
    public void learn(String feedback) {
        learn(requireActiveConversation(), feedback);
    }

    @Override
    public void learn(String conversationId, String feedback) {
        if (feedback == null || feedback.isBlank()) {
            throw new IllegalArgumentException("feedback must not be blank");
        }
        String stamp = LocalDateTime.now(clock).format(FEEDBACK_TIME);
        memory.addMessage(conversationId, Message.ROLE_SYSTEM, "Feedback (" + stamp + "): " + feedback.trim());
        log.info("[Engine] Feedback recorded: conversation={}", conversationId);
    }

    // ==================== helpers ====================

    private Turn openTurn(String conversationId, String input) {
        if (llmPort == null || registry == null) {
            throw new IllegalStateException("Engine not initialized");
        }
        if (input == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        Turn turn = new Turn(conversationId, loadHistory(conversationId));
        turn.append(Message.ROLE_USER, input);
        return turn;
    }

    private List<Message> loadHistory(String conversationId) {
        try {
            return new ArrayList<>(memory.getConversation(conversationId).getMessages());
        } catch (ConversationNotFoundException e) {
            throw e;
        } catch (MemoryPersistenceException e) {
            log.warn("[Memory] Failed to reload conversation {}, starting with empty history: {}",
                    conversationId, e.getMessage());
            return new ArrayList<>();
        }
    }

    private String generate(Turn turn) {
        long timeoutMs = properties.getLlm().getTimeoutMs();
        CompletableFuture<LlmResponse> pending = llmPort.chat(buildRequest(turn));
        try {
            return contentOrFallback(turn, pending.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (ExecutionException e) {
            throw toBackendException(e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new LlmBackendException("Generation timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmBackendException("Generation interrupted", e);
        }
    }

    /**
     * Non-blocking single-shot generation. Disposing the returned mono, or
     * hitting the timeout, cancels the backend future.
     */
    private Mono<String> generateAsync(Turn turn) {
        long timeoutMs = properties.getLlm().getTimeoutMs();
        return Mono.defer(() -> Mono.fromFuture(llmPort.chat(buildRequest(turn))))
                .timeout(Duration.ofMillis(timeoutMs), Mono.error(
                        () -> new LlmBackendException("Generation timed out after " + timeoutMs + "ms")))
                .map(response -> contentOrFallback(turn, response))
                .switchIfEmpty(Mono.fromSupplier(() -> contentOrFallback(turn, null)))
                .onErrorMap(e -> !(e instanceof LlmBackendException), this::toBackendException);
    }

    private String contentOrFallback(Turn turn, LlmResponse response) {
        String content = response != null ? response.getContent() : null;
        if (content == null || content.isBlank()) {
            log.warn("[LLM] Empty model output, using fallback message: conversation={}", turn.conversationId);
            return fallbackMessage();
        }
        return content;
    }

    private LlmBackendException toBackendException(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.error("[LLM] Generation failed: {}", cause.getMessage());
        if (cause instanceof LlmBackendException backendException) {
            return backendException;
        }
        return new LlmBackendException("Generation failed: " + cause.getMessage(), cause);
    }

    private LlmRequest buildRequest(Turn turn) {
        return promptBuilder.build(turn.history, registry.describeAll());
    }

    private String fallbackMessage() {
        return properties.getPrompt().getFallbackMessage();
    }

    private String requireActiveConversation() {
        String conversationId = activeConversationId.get();
        if (conversationId == null) {
            throw new IllegalStateException("Engine not initialized");
        }
        return conversationId;
    }

    private CapabilityRegistry requireRegistry() {
        CapabilityRegistry current = registry;
        if (current == null) {
            throw new IllegalStateException("Engine not initialized");
        }
        return current;
    }

    private TurnPermit acquirePermit(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId must not be blank");
        }
        TurnPermit permit = turnPermits.compute(conversationId, (id, existing) -> {
            TurnPermit entry = existing != null ? existing : new TurnPermit(id);
            entry.holders++;
            return entry;
        });
        try {
            permit.semaphore.acquire();
        } catch (InterruptedException e) {
            permit.leave();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for conversation " + conversationId, e);
        }
        return permit;
    }

    int trackedConversations() {
        return turnPermits.size();
    }

    /**
     * Per-conversation turn lock. The entry counts the turns holding or
     * waiting for it and leaves the table with the last one.
     */
    private final class TurnPermit {

        private final String conversationId;
        private final Semaphore semaphore = new Semaphore(1);
        private int holders;

        private TurnPermit(String conversationId) {
            this.conversationId = conversationId;
        }

        private void release() {
            semaphore.release();
            leave();
        }

        private void leave() {
            turnPermits.computeIfPresent(conversationId, (id, entry) -> --entry.holders == 0 ? null : entry);
        }
    }

    /**
     * Turn-local working state.
     */
    private final class Turn {

        private final String conversationId;
        private final List<Message> history;

        private Turn(String conversationId, List<Message> history) {
            this.conversationId = conversationId;
            this.history = history;
        }

        /**
         * Appends to the working history, then persists. A failed write is
         * logged; the in-memory history still carries the message.
         */
        private void append(String role, String content) {
            history.add(Message.of(role, content, clock.instant()));
            try {
                memory.addMessage(conversationId, role, content);
            } catch (AgentException e) {
                log.warn("[Memory] Failed to persist {} message for {}: {}", role, conversationId, e.getMessage());
            }
        }
    }
}
