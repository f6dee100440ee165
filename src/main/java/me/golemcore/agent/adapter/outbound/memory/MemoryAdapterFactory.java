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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.Conversation;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConversationMemoryPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the memory backend once, from {@code agent.memory.type}:
 * <ul>
 * <li>file - one JSON transcript per conversation in the workspace
 * <li>in-memory - volatile, for tests and throwaway runs
 * </ul>
 * Unknown types fall back to {@code in-memory}.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class MemoryAdapterFactory implements ConversationMemoryPort {

    private static final String TYPE_IN_MEMORY = "in-memory";

    private final AgentProperties properties;
    private final List<ConversationMemoryAdapter> adapters;

    private final Map<String, ConversationMemoryAdapter> adaptersByType = new ConcurrentHashMap<>();
    private ConversationMemoryAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (ConversationMemoryAdapter adapter : adapters) {
            adaptersByType.put(adapter.getType(), adapter);
        }

        String type = properties.getMemory().getType();
        activeAdapter = adaptersByType.get(type);
        if (activeAdapter == null) {
            activeAdapter = adaptersByType.get(TYPE_IN_MEMORY);
            log.warn("[Memory] Type '{}' not found, using: {}", type, TYPE_IN_MEMORY);
        } else {
            log.info("[Memory] Active memory type: {}", type);
        }
        if (activeAdapter == null) {
            throw new IllegalStateException("No conversation memory adapter available");
        }
        activeAdapter.initialize();
    }

    // ==================== ConversationMemoryPort delegation ====================

    @Override
    public String getType() {
        return activeAdapter.getType();
    }

    @Override
    public String createConversation(String title) {
        return activeAdapter.createConversation(title);
    }

    @Override
    public void addMessage(String conversationId, String role, String content) {
        activeAdapter.addMessage(conversationId, role, content);
    }

    @Override
    public Conversation getConversation(String conversationId) {
        return activeAdapter.getConversation(conversationId);
    }

    @Override
    public List<Conversation> listConversations(int limit) {
        return activeAdapter.listConversations(limit);
    }

    @Override
    public boolean exists(String conversationId) {
        return activeAdapter.exists(conversationId);
    }

    @Override
    public boolean deleteConversation(String conversationId) {
        return activeAdapter.deleteConversation(conversationId);
    }

    @Override
    public void renameConversation(String conversationId, String title) {
        activeAdapter.renameConversation(conversationId, title);
    }
}
