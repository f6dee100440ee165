package me.golemcore.agent.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.engine.AgentEngine;
import me.golemcore.agent.domain.exception.ConversationNotFoundException;
import me.golemcore.agent.domain.model.AgentStreamEvent;
import me.golemcore.agent.domain.model.Conversation;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConversationMemoryPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

/**
 * Request-facing entry point: resolves the caller's handle, points the engine
 * at the bound conversation and runs the turn against it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatService {

    private final AgentEngine engine;
    private final ConversationIdentityBinder binder;
    private final ConversationMemoryPort memory;
    private final CapabilityRegistry registry;
    private final AgentProperties properties;

    public ChatTurnResult chat(String handle, String message) {
        String input = requireMessage(message);
        ConversationIdentityBinder.Binding binding = bind(handle);
        String reply = engine.process(binding.internalId(), input);
        return new ChatTurnResult(binding.handle(), binding.internalId(), reply);
    }

    /**
     * Streams one turn. The engine's {@code meta} event is rewritten to carry
     * the caller handle next to the internal id.
     */
    public Flux<AgentStreamEvent> chatStream(String handle, String message) {
        String input = requireMessage(message);
        ConversationIdentityBinder.Binding binding = bind(handle);
        return engine.processStream(binding.internalId(), input)
                .map(event -> event.getType() == AgentStreamEvent.Type.META
                        ? AgentStreamEvent.meta(binding.handle(), binding.internalId())
                        : event);
    }

    public void feedback(String handle, String feedback) {
        if (feedback == null || feedback.isBlank()) {
            throw new IllegalArgumentException("feedback is required");
        }
        String conversationId = handle == null || handle.isBlank()
                ? engine.getConversationId()
                : binder.lookup(handle).orElseGet(() -> requireExisting(handle));
        engine.learn(conversationId, feedback);
    }

    // ==================== conversations ====================

    public List<Conversation> listConversations(Integer limit) {
        int effective = limit != null ? limit : properties.getMemory().getListLimit();
        return memory.listConversations(effective);
    }

    public Conversation getConversation(String id) {
        return memory.getConversation(resolveInternalId(id));
    }

    public void renameConversation(String id, String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        memory.renameConversation(resolveInternalId(id), title.trim());
    }

    public void deleteConversation(String id) {
        String internalId = resolveInternalId(id);
        if (!memory.deleteConversation(internalId)) {
            throw new ConversationNotFoundException(id);
        }
        binder.forgetConversation(internalId);
        log.info("[API] Deleted conversation {}", internalId);
    }

    public Map<String, String> listCapabilities() {
        return registry.describeAll();
    }

    private ConversationIdentityBinder.Binding bind(String handle) {
        ConversationIdentityBinder.Binding binding = binder.resolve(handle);
        engine.setConversationId(binding.internalId());
        return binding;
    }

    /**
     * Accepts either a bound handle or an internal id.
     */
    private String resolveInternalId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("conversation id is required");
        }
        return binder.lookup(id).orElse(id.trim());
    }

    private String requireExisting(String id) {
        String trimmed = id.trim();
        if (!memory.exists(trimmed)) {
            throw new ConversationNotFoundException(trimmed);
        }
        return trimmed;
    }

    private static String requireMessage(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        return message;
    }

    /**
     * Result of a non-streamed turn.
     */
    public record ChatTurnResult(String handle, String internalId, String reply) {
    }
}
