package me.golemcore.agent.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.adapter.inbound.web.dto.CapabilityDto;
import me.golemcore.agent.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.agent.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.agent.adapter.inbound.web.dto.FeedbackRequest;
import me.golemcore.agent.domain.exception.LlmBackendException;
import me.golemcore.agent.domain.model.AgentStreamEvent;
import me.golemcore.agent.domain.model.ThinkingPhase;
import me.golemcore.agent.domain.service.ChatService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private ChatService chatService;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        chatService = mock(ChatService.class);
        controller = new ChatController(chatService, new ObjectMapper());
    }

    // ==================== POST /api/chat ====================

    @Test
    void shouldReturnAssistantReplyWithBothIds() {
        when(chatService.chat("chat_a", "What is 10 + 5?"))
                .thenReturn(new ChatService.ChatTurnResult("chat_a", "conv_1", "15"));

        StepVerifier.create(controller.chat(new ChatRequest("chat_a", "What is 10 + 5?")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    ChatResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("chat_a", body.getConversationId());
                    assertEquals("conv_1", body.getAgentConversationId());
                    assertEquals("assistant", body.getMessage().getRole());
                    assertEquals("15", body.getMessage().getContent());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectBlankChatMessage() {
        assertThrows(IllegalArgumentException.class, () -> controller.chat(new ChatRequest("chat_a", " ")));
        assertThrows(IllegalArgumentException.class, () -> controller.chat(null));
        verify(chatService, never()).chat(anyString(), anyString());
    }

    // ==================== GET /api/chat/stream ====================

    @Test
    void shouldFrameStreamedTurnAsServerSentEvents() {
        when(chatService.chatStream(null, "hello")).thenReturn(Flux.just(
                AgentStreamEvent.meta("chat_a", "conv_1"),
                AgentStreamEvent.thinking(ThinkingPhase.ANALYZING, "Analyzing request"),
                AgentStreamEvent.thinking(ThinkingPhase.TOOL_CALL, "Calling calculator"),
                AgentStreamEvent.content("Hel"),
                AgentStreamEvent.content("lo"),
                AgentStreamEvent.done()));

        StepVerifier.create(controller.chatStream(null, "hello"))
                .assertNext(sse -> {
                    assertEquals("meta", sse.event());
                    assertEquals("{\"conversation_id\":\"chat_a\",\"agent_conversation_id\":\"conv_1\"}",
                            sse.data());
                })
                .assertNext(sse -> {
                    assertEquals("thinking", sse.event());
                    assertEquals("{\"type\":\"analyzing\",\"message\":\"Analyzing request\"}", sse.data());
                })
                .assertNext(sse -> assertEquals("{\"type\":\"tool_call\",\"message\":\"Calling calculator\"}",
                        sse.data()))
                .assertNext(sse -> {
                    assertNull(sse.event());
                    assertEquals("Hel", sse.data());
                })
                .assertNext(sse -> assertEquals("lo", sse.data()))
                .assertNext(sse -> {
                    assertEquals("done", sse.event());
                    assertEquals("done", sse.data());
                })
                .verifyComplete();
    }

    @Test
    void shouldEmitErrorThenDoneWhenTurnFails() {
        when(chatService.chatStream("chat_a", "hello")).thenReturn(Flux.concat(
                Flux.just(AgentStreamEvent.meta("chat_a", "conv_1")),
                Flux.error(new LlmBackendException("Ollama unreachable"))));

        StepVerifier.create(controller.chatStream("chat_a", "hello"))
                .assertNext(sse -> assertEquals("meta", sse.event()))
                .assertNext(sse -> {
                    assertEquals("error", sse.event());
                    assertEquals("Ollama unreachable", sse.data());
                })
                .assertNext(sse -> assertEquals("done", sse.event()))
                .verifyComplete();
    }

    @Test
    void shouldRejectStreamWithoutMessage() {
        assertThrows(IllegalArgumentException.class, () -> controller.chatStream("chat_a", ""));
    }

    // ==================== feedback and capabilities ====================

    @Test
    void shouldAcceptFeedbackWithNoContent() {
        StepVerifier.create(controller.feedback(new FeedbackRequest("chat_a", "nice")))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();

        verify(chatService).feedback("chat_a", "nice");
    }

    @Test
    void shouldListCapabilities() {
        Map<String, String> descriptions = new LinkedHashMap<>();
        descriptions.put("calculator", "Arithmetic");
        descriptions.put("knowledge_base", "Documents");
        when(chatService.listCapabilities()).thenReturn(descriptions);

        StepVerifier.create(controller.capabilities())
                .assertNext(response -> {
                    List<CapabilityDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(List.of("calculator", "knowledge_base"),
                            body.stream().map(CapabilityDto::getName).toList());
                })
                .verifyComplete();
    }
}
