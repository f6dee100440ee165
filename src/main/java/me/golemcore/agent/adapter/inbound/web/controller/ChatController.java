package me.golemcore.agent.adapter.inbound.web.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.inbound.web.dto.CapabilityDto;
import me.golemcore.agent.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.agent.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.agent.adapter.inbound.web.dto.FeedbackRequest;
import me.golemcore.agent.adapter.inbound.web.dto.MetaEventPayload;
import me.golemcore.agent.adapter.inbound.web.dto.ThinkingEventPayload;
import me.golemcore.agent.domain.model.AgentStreamEvent;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.service.ChatService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Chat endpoints: single-shot JSON turns and SSE-streamed turns.
 *
 * <p>
 * SSE framing per turn: {@code meta}, {@code thinking} frames, unnamed content
 * frames carrying raw deltas, then a terminal {@code done}. A failed turn emits
 * {@code error} before {@code done}.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String EVENT_META = "meta";
    static final String EVENT_THINKING = "thinking";
    static final String EVENT_ERROR = "error";
    static final String EVENT_DONE = "done";
    static final String DONE_SENTINEL = "done";

    private final ChatService chatService;
    private final ObjectMapper objectMapper;

    @PostMapping("/chat")
    public Mono<ResponseEntity<ChatResponse>> chat(@RequestBody ChatRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        return Mono.fromCallable(() -> chatService.chat(request.getConversationId(), request.getMessage()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(ChatResponse.builder()
                        .conversationId(result.handle())
                        .agentConversationId(result.internalId())
                        .message(ChatResponse.MessageDto.builder()
                                .role(Message.ROLE_ASSISTANT)
                                .content(result.reply())
                                .build())
                        .build()));
    }

    @GetMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> chatStream(
            @RequestParam(name = "conversation_id", required = false) String conversationId,
            @RequestParam(required = false) String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        return chatService.chatStream(conversationId, message)
                .map(this::toServerSentEvent)
                .onErrorResume(error -> {
                    log.warn("[API] Streamed turn failed: {}", error.getMessage());
                    return Flux.just(
                            ServerSentEvent.<String>builder().event(EVENT_ERROR).data(errorMessage(error)).build(),
                            doneEvent());
                });
    }

    @PostMapping("/feedback")
    public Mono<ResponseEntity<Void>> feedback(@RequestBody FeedbackRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("feedback is required");
        }
        chatService.feedback(request.getConversationId(), request.getFeedback());
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/capabilities")
    public Mono<ResponseEntity<List<CapabilityDto>>> capabilities() {
        List<CapabilityDto> capabilities = chatService.listCapabilities().entrySet().stream()
                .map(entry -> CapabilityDto.builder()
                        .name(entry.getKey())
                        .description(entry.getValue())
                        .build())
                .toList();
        return Mono.just(ResponseEntity.ok(capabilities));
    }

    private ServerSentEvent<String> toServerSentEvent(AgentStreamEvent event) {
        return switch (event.getType()) {
        case META -> ServerSentEvent.<String>builder()
                .event(EVENT_META)
                .data(toJson(MetaEventPayload.builder()
                        .conversationId(event.getConversationId())
                        .agentConversationId(event.getAgentConversationId())
                        .build()))
                .build();
        case THINKING -> ServerSentEvent.<String>builder()
                .event(EVENT_THINKING)
                .data(toJson(ThinkingEventPayload.builder()
                        .type(event.getPhase() != null ? event.getPhase().getWireName() : null)
                        .message(event.getMessage())
                        .build()))
                .build();
        case CONTENT -> ServerSentEvent.<String>builder()
                .data(event.getMessage())
                .build();
        case DONE -> doneEvent();
        };
    }

    private static ServerSentEvent<String> doneEvent() {
        return ServerSentEvent.<String>builder().event(EVENT_DONE).data(DONE_SENTINEL).build();
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize SSE payload", e);
        }
    }

    private static String errorMessage(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
