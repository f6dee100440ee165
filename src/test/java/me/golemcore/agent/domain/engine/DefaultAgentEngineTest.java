package me.golemcore.agent.domain.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.adapter.outbound.capability.CalculatorCapability;
import me.golemcore.agent.adapter.outbound.memory.InMemoryConversationMemoryAdapter;
import me.golemcore.agent.domain.component.Capability;
import me.golemcore.agent.domain.exception.CapabilityExecutionException;
import me.golemcore.agent.domain.exception.CapabilityNotFoundException;
import me.golemcore.agent.domain.exception.ConversationNotFoundException;
import me.golemcore.agent.domain.exception.LlmBackendException;
import me.golemcore.agent.domain.exception.MemoryPersistenceException;
import me.golemcore.agent.domain.model.AgentStreamEvent;
import me.golemcore.agent.domain.model.CapabilityResult;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ThinkingPhase;
import me.golemcore.agent.domain.service.CapabilityRegistry;
import me.golemcore.agent.domain.service.PromptBuilder;
import me.golemcore.agent.domain.toolcall.ToolCallConfiguration;
import me.golemcore.agent.domain.toolcall.ToolCallExtractor;
import me.golemcore.agent.domain.toolcall.ToolParameterParser;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.spy;

class DefaultAgentEngineTest {

    private static final String ADD_CALL = "{\"tool\":\"calculator\",\"params\":{\"operation\":\"add\",\"a\":10,\"b\":5}}";

    private AgentProperties properties;
    private InMemoryConversationMemoryAdapter memory;
    private ScriptedLlm llm;
    private CountingCapability counting;
    private CapabilityRegistry registry;
    private DefaultAgentEngine engine;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getPrompt().setSystem("You are a test assistant.");
        memory = spy(new InMemoryConversationMemoryAdapter(Clock.systemUTC()));
        llm = new ScriptedLlm();
        counting = new CountingCapability(new CalculatorCapability(properties));
        registry = new CapabilityRegistry(List.of(counting));
        engine = newEngine();
        engine.initialize(llm, registry);
    }

    // ==================== lifecycle ====================

    @Test
    void shouldCreateInitialConversationOnInitialize() {
        String conversationId = engine.getConversationId();

        assertNotNull(conversationId);
        assertTrue(memory.exists(conversationId));
        assertEquals("New conversation", memory.getConversation(conversationId).getTitle());
    }

    @Test
    void shouldRejectNullCollaboratorsOnInitialize() {
        DefaultAgentEngine fresh = newEngine();

        assertThrows(IllegalArgumentException.class, () -> fresh.initialize(null, registry));
        assertThrows(IllegalArgumentException.class, () -> fresh.initialize(llm, null));
    }

    @Test
    void shouldRejectBlankConversationIdWithoutChangingState() {
        String before = engine.getConversationId();

        assertThrows(IllegalArgumentException.class, () -> engine.setConversationId(""));
        assertThrows(IllegalArgumentException.class, () -> engine.setConversationId("  "));
        assertThrows(IllegalArgumentException.class, () -> engine.setConversationId(null));

        assertEquals(before, engine.getConversationId());
    }

    @Test
    void shouldSwitchActiveConversation() {
        String other = memory.createConversation("other");

        engine.setConversationId(other);
        llm.reply("hello");
        engine.process("hi");

        assertEquals(2, memory.getConversation(other).getMessageCount());
    }

    // ==================== process ====================

    @Test
    void shouldAnswerDirectlyWhenNoToolCall() {
        llm.reply("Paris is the capital of France.");

        String reply = engine.process("What is the capital of France?");

        assertEquals("Paris is the capital of France.", reply);
        assertEquals(0, counting.invocations.get());
        assertEquals(1, llm.chatRequests.size());
        assertTranscript(engine.getConversationId(),
                Message.ROLE_USER, "What is the capital of France?",
                Message.ROLE_ASSISTANT, "Paris is the capital of France.");
    }

    @Test
    void shouldRunToolAndRegenerateWithItsOutput() {
        llm.reply(ADD_CALL);
        llm.reply("10 plus 5 is 15.");

        String reply = engine.process("What is 10 + 5?");

        assertEquals("10 plus 5 is 15.", reply);
        assertEquals(1, counting.invocations.get());
        Message injected = last(llm.chatRequests.get(1).getMessages());
        assertEquals(Message.ROLE_SYSTEM, injected.getRole());
        assertEquals("Tool (calculator) output: 15", injected.getContent());
        assertTranscript(engine.getConversationId(),
                Message.ROLE_USER, "What is 10 + 5?",
                Message.ROLE_SYSTEM, "Tool (calculator) output: 15",
                Message.ROLE_ASSISTANT, "10 plus 5 is 15.");
    }

    @Test
    void shouldInvokeAtMostOneToolPerTurn() {
        llm.reply(ADD_CALL);
        llm.reply(ADD_CALL);

        String reply = engine.process("add twice");

        assertEquals(ADD_CALL, reply);
        assertEquals(1, counting.invocations.get());
    }

    @Test
    void shouldNameUnknownToolInFinalReply() {
        llm.reply("{\"tool\":\"weather\",\"params\":{\"city\":\"Oslo\"}}");

        String reply = engine.process("Weather in Oslo?");

        assertTrue(reply.contains("Tool weather failed"), reply);
        assertTrue(reply.contains("weather"), reply);
        assertEquals(0, counting.invocations.get());
    }

    @Test
    void shouldConvertCapabilityFailureToText() {
        registry.register("broken", new Capability() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public String getDescription() {
                return "always fails";
            }

            @Override
            public CompletableFuture<CapabilityResult> execute(Map<String, Object> parameters) {
                return CompletableFuture.failedFuture(new CapabilityExecutionException("disk on fire"));
            }
        });
        llm.reply("```tool:broken\n\n```");

        String reply = engine.process("break it");

        assertEquals("Tool broken failed: disk on fire", reply);
    }

    @Test
    void shouldReportFailedResultAsToolError() {
        llm.reply("{\"tool\":\"calculator\",\"params\":{\"operation\":\"divide\",\"a\":1,\"b\":0}}");

        String reply = engine.process("1 / 0");

        assertEquals("Tool calculator failed: Division by zero", reply);
    }

    @Test
    void shouldReplaceEmptyOutputWithFallback() {
        llm.reply("   ");

        String reply = engine.process("hello?");

        assertEquals(properties.getPrompt().getFallbackMessage(), reply);
        assertEquals(properties.getPrompt().getFallbackMessage(),
                last(memory.getConversation(engine.getConversationId()).getMessages()).getContent());
    }

    @Test
    void shouldSurfaceBackendFailureAfterPersistingUserMessage() {
        llm.fail(new LlmBackendException("backend down"));

        assertThrows(LlmBackendException.class, () -> engine.process("hello"));

        assertTranscript(engine.getConversationId(), Message.ROLE_USER, "hello");
    }

    @Test
    void shouldPersistInTurnOrder() {
        llm.reply(ADD_CALL);
        llm.reply("15");
        String conversationId = engine.getConversationId();

        engine.process("10 + 5");

        var order = inOrder(memory);
        order.verify(memory).addMessage(conversationId, Message.ROLE_USER, "10 + 5");
        order.verify(memory).addMessage(conversationId, Message.ROLE_SYSTEM, "Tool (calculator) output: 15");
        order.verify(memory).addMessage(conversationId, Message.ROLE_ASSISTANT, "15");
    }

    @Test
    void shouldReturnReplyWhenPersistenceFails() {
        doThrow(new MemoryPersistenceException("disk full", null))
                .when(memory).addMessage(anyString(), eq(Message.ROLE_ASSISTANT), anyString());
        llm.reply("still here");

        assertEquals("still here", engine.process("hi"));
    }

    @Test
    void shouldBuildPromptFromTargetConversationOnly() {
        String first = memory.createConversation("first");
        String second = memory.createConversation("second");
        memory.addMessage(first, Message.ROLE_USER, "secret from first");
        memory.addMessage(second, Message.ROLE_USER, "earlier in second");
        llm.reply("ok");

        engine.process(second, "follow-up");

        List<String> contents = llm.chatRequests.get(0).getMessages().stream().map(Message::getContent).toList();
        assertEquals(List.of("earlier in second", "follow-up"), contents);
    }

    @Test
    void shouldFailForUnknownConversation() {
        assertThrows(ConversationNotFoundException.class, () -> engine.process("conv_missing", "hi"));
        assertTrue(llm.chatRequests.isEmpty());
    }

    // ==================== processStream ====================

    @Test
    void shouldStreamToolTurnInProtocolOrder() {
        llm.reply(ADD_CALL);
        llm.stream("The answer ", "is 15.");
        String conversationId = engine.getConversationId();

        StepVerifier.create(engine.processStream("What is 10 + 5?"))
                .assertNext(event -> {
                    assertEquals(AgentStreamEvent.Type.META, event.getType());
                    assertEquals(conversationId, event.getAgentConversationId());
                })
                .expectNextMatches(thinking(ThinkingPhase.ANALYZING))
                .expectNextMatches(thinking(ThinkingPhase.TOOL_CALL))
                .expectNextMatches(thinking(ThinkingPhase.TOOL_RESULT))
                .expectNextMatches(thinking(ThinkingPhase.GENERATING))
                .expectNextMatches(content("The answer "))
                .expectNextMatches(content("is 15."))
                .expectNextMatches(event -> event.getType() == AgentStreamEvent.Type.DONE
                        && "done".equals(event.getMessage()))
                .verifyComplete();

        awaitTrue(() -> memory.getConversation(conversationId).getMessageCount() == 3);
        assertTranscript(conversationId,
                Message.ROLE_USER, "What is 10 + 5?",
                Message.ROLE_SYSTEM, "Tool (calculator) output: 15",
                Message.ROLE_ASSISTANT, "The answer is 15.");
        assertEquals("Tool (calculator) output: 15", last(llm.streamRequests.get(0).getMessages()).getContent());
    }

    @Test
    void shouldStreamDirectAnswerWithoutToolMarkers() {
        llm.reply("draft answer");
        llm.stream("final ", "answer");

        StepVerifier.create(engine.processStream("hi"))
                .expectNextMatches(event -> event.getType() == AgentStreamEvent.Type.META)
                .expectNextMatches(thinking(ThinkingPhase.ANALYZING))
                .expectNextMatches(thinking(ThinkingPhase.GENERATING))
                .expectNextMatches(content("final "))
                .expectNextMatches(content("answer"))
                .expectNextMatches(event -> event.getType() == AgentStreamEvent.Type.DONE)
                .verifyComplete();

        assertEquals(0, counting.invocations.get());
        assertEquals(llm.chatRequests.get(0), llm.streamRequests.get(0));
    }

    @Test
    void shouldEmitToolErrorForUnknownTool() {
        llm.reply("{\"tool\":\"weather\",\"params\":{}}");
        llm.stream("Sorry, no weather tool.");

        StepVerifier.create(engine.processStream("weather?"))
                .expectNextMatches(event -> event.getType() == AgentStreamEvent.Type.META)
                .expectNextMatches(thinking(ThinkingPhase.ANALYZING))
                .expectNextMatches(thinking(ThinkingPhase.TOOL_CALL))
                .assertNext(event -> {
                    assertEquals(ThinkingPhase.TOOL_ERROR, event.getPhase());
                    assertTrue(event.getMessage().contains("weather"));
                })
                .expectNextMatches(thinking(ThinkingPhase.GENERATING))
                .expectNextMatches(content("Sorry, no weather tool."))
                .expectNextMatches(event -> event.getType() == AgentStreamEvent.Type.DONE)
                .verifyComplete();
    }

    @Test
    void shouldStreamFallbackWhenBackendYieldsNothing() {
        llm.reply("draft");
        llm.stream();
        String fallback = properties.getPrompt().getFallbackMessage();

        StepVerifier.create(engine.processStream("hi").filter(AgentStreamEvent::isContent))
                .expectNextMatches(content(fallback))
                .verifyComplete();
    }

    @Test
    void shouldTerminateWithErrorWhenPhaseOneFails() {
        llm.fail(new LlmBackendException("backend down"));

        StepVerifier.create(engine.processStream("hi"))
                .expectNextMatches(event -> event.getType() == AgentStreamEvent.Type.META)
                .expectNextMatches(thinking(ThinkingPhase.ANALYZING))
                .expectError(LlmBackendException.class)
                .verify();
    }

    @Test
    void shouldCancelBackendStreamAndReleaseConversation() {
        AtomicBoolean cancelled = new AtomicBoolean();
        llm.reply("draft");
        llm.streams.add(Flux.concat(Flux.just(LlmChunk.of("partial")), Flux.<LlmChunk>never())
                .doOnCancel(() -> cancelled.set(true)));
        String conversationId = engine.getConversationId();

        StepVerifier.create(engine.processStream("hi"))
                .expectNextCount(3)
                .expectNextMatches(content("partial"))
                .thenCancel()
                .verify();

        awaitTrue(cancelled::get);
        awaitTrue(() -> memory.getConversation(conversationId).getMessageCount() == 2);
        assertEquals("partial", last(memory.getConversation(conversationId).getMessages()).getContent());

        llm.reply("next turn");
        assertEquals("next turn", engine.process(conversationId, "again"));
    }

    @Test
    void shouldCancelPendingPhaseOneCallWhenConsumerCancels() {
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        llm.pending(pending);
        String conversationId = engine.getConversationId();

        StepVerifier.create(engine.processStream("hi"))
                .expectNextCount(2)
                .then(() -> awaitTrue(() -> llm.chatRequests.size() == 1))
                .thenCancel()
                .verify();

        awaitTrue(pending::isCancelled);
        awaitTrue(() -> engine.trackedConversations() == 0);
        llm.reply("next turn");
        assertEquals("next turn", engine.process(conversationId, "again"));
    }

    @Test
    void shouldCancelStreamedPhaseOneCallOnTimeout() {
        properties.getLlm().setTimeoutMs(50);
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        llm.pending(pending);

        StepVerifier.create(engine.processStream("hi"))
                .expectNextCount(2)
                .expectErrorMatches(error -> error instanceof LlmBackendException
                        && error.getMessage().contains("timed out"))
                .verify();

        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldCancelBlockingPhaseOneCallOnTimeout() {
        properties.getLlm().setTimeoutMs(50);
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        llm.pending(pending);

        LlmBackendException error = assertThrows(LlmBackendException.class, () -> engine.process("hi"));

        assertTrue(error.getMessage().contains("timed out"));
        assertTrue(pending.isCancelled());
        assertEquals(0, engine.trackedConversations());
    }

    // ==================== turn permits ====================

    @Test
    void shouldNotRetainPermitsForFinishedConversations() {
        for (int i = 0; i < 200; i++) {
            String conversationId = memory.createConversation("c" + i);
            llm.reply("ok");
            engine.process(conversationId, "hi");
            if (i % 2 == 0) {
                llm.reply("ok");
                StepVerifier.create(engine.processStream(conversationId, "again"))
                        .expectNextCount(5)
                        .verifyComplete();
            }
            memory.deleteConversation(conversationId);
        }

        awaitTrue(() -> engine.trackedConversations() == 0);
    }

    @Test
    void shouldReleasePermitWhenTurnCannotOpen() {
        assertThrows(ConversationNotFoundException.class, () -> engine.process("conv_missing", "hi"));
        assertThrows(ConversationNotFoundException.class,
                () -> engine.processStream("conv_missing", "hi").blockLast());

        assertEquals(0, engine.trackedConversations());
    }

    // ==================== tools and feedback ====================

    @Test
    void shouldExecuteToolDirectly() {
        CapabilityResult result = engine.executeTool("calculator",
                Map.of("operation", "multiply", "a", "6", "b", "7"));

        assertTrue(result.isSuccess());
        assertEquals(42L, result.getValue());
    }

    @Test
    void shouldThrowForUnknownToolOnDirectExecution() {
        assertThrows(CapabilityNotFoundException.class, () -> engine.executeTool("missing", Map.of()));
    }

    @Test
    void shouldRecordFeedbackAsSystemMessage() {
        engine.learn("Prefer shorter answers");

        Message feedback = last(memory.getConversation(engine.getConversationId()).getMessages());
        assertEquals(Message.ROLE_SYSTEM, feedback.getRole());
        assertTrue(feedback.getContent().startsWith("Feedback ("));
        assertTrue(feedback.getContent().endsWith("): Prefer shorter answers"));
    }

    @Test
    void shouldRejectBlankFeedback() {
        assertThrows(IllegalArgumentException.class, () -> engine.learn(" "));
    }

    // ==================== helpers ====================

    private DefaultAgentEngine newEngine() {
        ToolCallExtractor extractor = new ToolCallConfiguration()
                .toolCallExtractor(new ToolParameterParser(new ObjectMapper()), properties);
        return new DefaultAgentEngine(memory, extractor, new PromptBuilder(properties), new ObjectMapper(),
                Clock.systemUTC(), properties);
    }

    private void assertTranscript(String conversationId, String... roleContentPairs) {
        List<Message> messages = memory.getConversation(conversationId).getMessages();
        assertEquals(roleContentPairs.length / 2, messages.size());
        for (int i = 0; i < messages.size(); i++) {
            assertEquals(roleContentPairs[i * 2], messages.get(i).getRole());
            assertEquals(roleContentPairs[i * 2 + 1], messages.get(i).getContent());
        }
    }

    private static Message last(List<Message> messages) {
        return messages.get(messages.size() - 1);
    }

    private static Predicate<AgentStreamEvent> thinking(ThinkingPhase phase) {
        return event -> event.getType() == AgentStreamEvent.Type.THINKING && event.getPhase() == phase;
    }

    private static Predicate<AgentStreamEvent> content(String text) {
        return event -> event.isContent() && text.equals(event.getMessage());
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted");
            }
        }
    }

    private static final class ScriptedLlm implements LlmPort {

        private final Deque<Object> replies = new ArrayDeque<>();
        private final Deque<Flux<LlmChunk>> streams = new ArrayDeque<>();
        private final List<LlmRequest> chatRequests = new CopyOnWriteArrayList<>();
        private final List<LlmRequest> streamRequests = new CopyOnWriteArrayList<>();

        void reply(String content) {
            replies.add(content);
        }

        void fail(RuntimeException error) {
            replies.add(error);
        }

        void pending(CompletableFuture<LlmResponse> future) {
            replies.add(future);
        }

        void stream(String... chunks) {
            streams.add(Flux.fromArray(chunks).map(LlmChunk::of));
        }

        @Override
        public String getProviderId() {
            return "scripted";
        }

        /**
         * Unscripted calls echo the last prompt message back.
         */
        @Override
        @SuppressWarnings("unchecked")
        public synchronized CompletableFuture<LlmResponse> chat(LlmRequest request) {
            chatRequests.add(request);
            Object next = replies.poll();
            if (next instanceof CompletableFuture<?> future) {
                return (CompletableFuture<LlmResponse>) future;
            }
            if (next instanceof RuntimeException error) {
                return CompletableFuture.failedFuture(error);
            }
            String content = next != null ? (String) next : last(request.getMessages()).getContent();
            return CompletableFuture.completedFuture(LlmResponse.builder().content(content).model("scripted").build());
        }

        @Override
        public synchronized Flux<LlmChunk> chatStream(LlmRequest request) {
            streamRequests.add(request);
            Flux<LlmChunk> next = streams.poll();
            return next != null ? next : Flux.empty();
        }

        @Override
        public String getCurrentModel() {
            return "scripted";
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }

    private static final class CountingCapability implements Capability {

        private final Capability delegate;
        private final AtomicInteger invocations = new AtomicInteger();

        private CountingCapability(Capability delegate) {
            this.delegate = delegate;
        }

        @Override
        public String getName() {
            return delegate.getName();
        }

        @Override
        public String getDescription() {
            return delegate.getDescription();
        }

        @Override
        public CompletableFuture<CapabilityResult> execute(Map<String, Object> parameters) {
            invocations.incrementAndGet();
            return delegate.execute(parameters);
        }
    }
}
