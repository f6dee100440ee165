package me.golemcore.agent.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.agent.adapter.inbound.web.dto.ConversationDetailDto;
import me.golemcore.agent.adapter.inbound.web.dto.ConversationListResponse;
import me.golemcore.agent.adapter.inbound.web.dto.ConversationSummaryDto;
import me.golemcore.agent.adapter.inbound.web.dto.RenameConversationRequest;
import me.golemcore.agent.domain.model.Conversation;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.service.ChatService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Conversation browser and management endpoints. Path ids accept either a
 * bound caller handle or an internal conversation id.
 */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationsController {

    private final ChatService chatService;

    @GetMapping
    public Mono<ResponseEntity<ConversationListResponse>> listConversations(
            @RequestParam(required = false) Integer limit) {
        List<ConversationSummaryDto> conversations = chatService.listConversations(limit).stream()
                .map(this::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(ConversationListResponse.builder()
                .conversations(conversations)
                .total(conversations.size())
                .build()));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ConversationDetailDto>> getConversation(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(toDetail(chatService.getConversation(id))));
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<ConversationSummaryDto>> renameConversation(
            @PathVariable String id, @RequestBody RenameConversationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("title is required");
        }
        chatService.renameConversation(id, request.getTitle());
        return Mono.just(ResponseEntity.ok(toSummary(chatService.getConversation(id))));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteConversation(@PathVariable String id) {
        chatService.deleteConversation(id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private ConversationSummaryDto toSummary(Conversation conversation) {
        return ConversationSummaryDto.builder()
                .id(conversation.getId())
                .title(conversation.getTitle())
                .createdAt(format(conversation.getCreatedAt()))
                .updatedAt(format(conversation.getUpdatedAt()))
                .messageCount(conversation.getMessageCount())
                .build();
    }

    private ConversationDetailDto toDetail(Conversation conversation) {
        List<ConversationDetailDto.MessageDto> messages = List.of();
        if (conversation.getMessages() != null) {
            messages = conversation.getMessages().stream()
                    .map(this::toMessageDto)
                    .toList();
        }
        return ConversationDetailDto.builder()
                .id(conversation.getId())
                .title(conversation.getTitle())
                .createdAt(format(conversation.getCreatedAt()))
                .updatedAt(format(conversation.getUpdatedAt()))
                .messages(messages)
                .build();
    }

    private ConversationDetailDto.MessageDto toMessageDto(Message message) {
        return ConversationDetailDto.MessageDto.builder()
                .role(message.getRole())
                .content(message.getContent())
                .timestamp(format(message.getTimestamp()))
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
