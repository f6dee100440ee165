package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.engine.AgentEngine;
import me.golemcore.agent.domain.exception.ConversationNotFoundException;
import me.golemcore.agent.domain.model.AgentStreamEvent;
import me.golemcore.agent.domain.model.ThinkingPhase;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConversationMemoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatServiceTest {

    private AgentEngine engine;
    private ConversationIdentityBinder binder;
    private ConversationMemoryPort memory;
    private CapabilityRegistry registry;
    private ChatService service;

    @BeforeEach
    void setUp() {
        engine = mock(AgentEngine.class);
        binder = mock(ConversationIdentityBinder.class);
        memory = mock(ConversationMemoryPort.class);
        registry = mock(CapabilityRegistry.class);
        service = new ChatService(engine, binder, memory, registry, new AgentProperties());
    }

    // ==================== chat ====================

    @Test
    void shouldRunTurnAgainstBoundConversation() {
        when(binder.resolve("chat_a")).thenReturn(new ConversationIdentityBinder.Binding("chat_a", "conv_1"));
        when(engine.process("conv_1", "hello")).thenReturn("hi there");

        ChatService.ChatTurnResult result = service.chat("chat_a", "hello");

        assertEquals(new ChatService.ChatTurnResult("chat_a", "conv_1", "hi there"), result);
        verify(engine).setConversationId("conv_1");
    }

    @Test
    void shouldRejectBlankMessageBeforeBinding() {
        assertThrows(IllegalArgumentException.class, () -> service.chat("chat_a", "  "));
        assertThrows(IllegalArgumentException.class, () -> service.chatStream(null, null));

        verify(binder, never()).resolve(anyString());
    }

    @Test
    void shouldRewriteMetaEventWithCallerHandle() {
        when(binder.resolve(null)).thenReturn(new ConversationIdentityBinder.Binding("chat_minted", "conv_1"));
        when(engine.processStream("conv_1", "hello")).thenReturn(Flux.just(
                AgentStreamEvent.meta("conv_1", "conv_1"),
                AgentStreamEvent.thinking(ThinkingPhase.ANALYZING, "Analyzing request"),
                AgentStreamEvent.content("hi"),
                AgentStreamEvent.done()));

        StepVerifier.create(service.chatStream(null, "hello"))
                .assertNext(event -> {
                    assertEquals(AgentStreamEvent.Type.META, event.getType());
                    assertEquals("chat_minted", event.getConversationId());
                    assertEquals("conv_1", event.getAgentConversationId());
                })
                .assertNext(event -> assertEquals(ThinkingPhase.ANALYZING, event.getPhase()))
                .assertNext(event -> assertEquals("hi", event.getMessage()))
                .assertNext(event -> assertEquals(AgentStreamEvent.Type.DONE, event.getType()))
                .verifyComplete();
    }

    // ==================== feedback ====================

    @Test
    void shouldSendFeedbackToActiveConversationWithoutHandle() {
        when(engine.getConversationId()).thenReturn("conv_active");

        service.feedback(null, "great answer");

        verify(engine).learn("conv_active", "great answer");
    }

    @Test
    void shouldSendFeedbackToBoundConversation() {
        when(binder.lookup("chat_a")).thenReturn(Optional.of("conv_1"));

        service.feedback("chat_a", "too long");

        verify(engine).learn("conv_1", "too long");
    }

    @Test
    void shouldAcceptInternalIdForFeedback() {
        when(binder.lookup("conv_2")).thenReturn(Optional.empty());
        when(memory.exists("conv_2")).thenReturn(true);

        service.feedback("conv_2", "thanks");

        verify(engine).learn("conv_2", "thanks");
    }

    @Test
    void shouldRejectFeedbackForUnknownConversation() {
        when(binder.lookup("chat_ghost")).thenReturn(Optional.empty());
        when(memory.exists("chat_ghost")).thenReturn(false);

        assertThrows(ConversationNotFoundException.class, () -> service.feedback("chat_ghost", "hello?"));
        assertThrows(IllegalArgumentException.class, () -> service.feedback("chat_a", " "));
    }

    // ==================== conversations ====================

    @Test
    void shouldUseConfiguredListLimitByDefault() {
        when(memory.listConversations(50)).thenReturn(List.of());

        service.listConversations(null);
        service.listConversations(5);

        verify(memory).listConversations(50);
        verify(memory).listConversations(5);
    }

    @Test
    void shouldResolveHandleBeforeRenaming() {
        when(binder.lookup("chat_a")).thenReturn(Optional.of("conv_1"));

        service.renameConversation("chat_a", "  Budget  ");

        verify(memory).renameConversation("conv_1", "Budget");
        assertThrows(IllegalArgumentException.class, () -> service.renameConversation("chat_a", ""));
    }

    @Test
    void shouldForgetHandlesWhenConversationDeleted() {
        when(binder.lookup("chat_a")).thenReturn(Optional.of("conv_1"));
        when(memory.deleteConversation("conv_1")).thenReturn(true);

        service.deleteConversation("chat_a");

        verify(binder).forgetConversation("conv_1");
    }

    @Test
    void shouldThrowWhenDeletingUnknownConversation() {
        when(binder.lookup("conv_x")).thenReturn(Optional.empty());
        when(memory.deleteConversation("conv_x")).thenReturn(false);

        assertThrows(ConversationNotFoundException.class, () -> service.deleteConversation("conv_x"));
        verify(binder, never()).forgetConversation(anyString());
    }
}
