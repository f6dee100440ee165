package me.golemcore.agent.adapter.outbound.memory;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.ConversationNotFoundException;
import me.golemcore.agent.domain.model.Conversation;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.service.ConversationKeys;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Volatile transcript store. Everything is lost on restart.
 *
 * <p>
 * Memory type: {@code "in-memory"}
 */
@Component
@Slf4j
public class InMemoryConversationMemoryAdapter implements ConversationMemoryAdapter {

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, Conversation> conversations = new HashMap<>();

    public InMemoryConversationMemoryAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getType() {
        return "in-memory";
    }

    @Override
    public String createConversation(String title) {
        Instant now = clock.instant();
        Conversation conversation = Conversation.builder()
                .id(ConversationKeys.newConversationId())
                .title(title)
                .createdAt(now)
                .updatedAt(now)
                .build();
        synchronized (lock) {
            conversations.put(conversation.getId(), conversation);
        }
        log.debug("[Memory] Created conversation {}", conversation.getId());
        return conversation.getId();
    }

    @Override
    public void addMessage(String conversationId, String role, String content) {
        synchronized (lock) {
            Conversation conversation = requireConversation(conversationId);
            conversation.addMessage(Message.of(role, content, clock.instant()));
        }
    }

    @Override
    public Conversation getConversation(String conversationId) {
        synchronized (lock) {
            return requireConversation(conversationId).copy();
        }
    }

    @Override
    public List<Conversation> listConversations(int limit) {
        synchronized (lock) {
            return conversations.values().stream()
                    .sorted(ConversationKeys.byRecentActivity())
                    .limit(limit > 0 ? limit : Long.MAX_VALUE)
                    .map(Conversation::copy)
                    .toList();
        }
    }

    @Override
    public boolean exists(String conversationId) {
        synchronized (lock) {
            return conversationId != null && conversations.containsKey(conversationId);
        }
    }

    @Override
    public boolean deleteConversation(String conversationId) {
        synchronized (lock) {
            return conversationId != null && conversations.remove(conversationId) != null;
        }
    }

    @Override
    public void renameConversation(String conversationId, String title) {
        synchronized (lock) {
            Conversation conversation = requireConversation(conversationId);
            conversation.setTitle(title);
            conversation.setUpdatedAt(clock.instant());
        }
    }

    private Conversation requireConversation(String conversationId) {
        Conversation conversation = conversationId != null ? conversations.get(conversationId) : null;
        if (conversation == null) {
            throw new ConversationNotFoundException(conversationId);
        }
        return conversation;
    }
}
