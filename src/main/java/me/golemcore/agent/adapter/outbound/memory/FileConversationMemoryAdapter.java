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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.ConversationNotFoundException;
import me.golemcore.agent.domain.exception.MemoryPersistenceException;
import me.golemcore.agent.domain.model.Conversation;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.service.ConversationKeys;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Flat-log transcript store: one JSON document per conversation under
 * {@code {workspace}/conversations/{id}.json}, fully rewritten (atomically) on
 * every change. All transcripts are loaded into a lock-guarded cache when the
 * adapter is selected.
 *
 * <p>
 * Memory type: {@code "file"}
 */
@Component
@Slf4j
public class FileConversationMemoryAdapter implements ConversationMemoryAdapter {

    private static final String FILE_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    private final Object lock = new Object();
    private final Map<String, Conversation> cache = new HashMap<>();

    public FileConversationMemoryAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            AgentProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getMemory().getDirectory();
    }

    @Override
    public String getType() {
        return "file";
    }

    @Override
    public void initialize() {
        synchronized (lock) {
            try {
                storagePort.ensureDirectory(directory).join();
                List<String> files = storagePort.listObjects(directory).join();
                for (String file : files) {
                    if (file.endsWith(FILE_SUFFIX)) {
                        loadFile(file);
                    }
                }
                log.info("[Memory] Loaded {} conversation(s) from {}", cache.size(), directory);
            } catch (CompletionException e) {
                throw new MemoryPersistenceException("Failed to load conversations from " + directory, e);
            }
        }
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
            write(conversation);
            cache.put(conversation.getId(), conversation);
        }
        log.debug("[Memory] Created conversation {}", conversation.getId());
        return conversation.getId();
    }

    @Override
    public void addMessage(String conversationId, String role, String content) {
        synchronized (lock) {
            Conversation conversation = requireConversation(conversationId);
            Instant previousUpdate = conversation.getUpdatedAt();
            conversation.addMessage(Message.of(role, content, clock.instant()));
            try {
                write(conversation);
            } catch (MemoryPersistenceException e) {
                // keep cache identical to disk
                conversation.getMessages().remove(conversation.getMessages().size() - 1);
                conversation.setUpdatedAt(previousUpdate);
                throw e;
            }
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
            return cache.values().stream()
                    .sorted(ConversationKeys.byRecentActivity())
                    .limit(limit > 0 ? limit : Long.MAX_VALUE)
                    .map(Conversation::copy)
                    .toList();
        }
    }

    @Override
    public boolean exists(String conversationId) {
        synchronized (lock) {
            return conversationId != null && cache.containsKey(conversationId);
        }
    }

    @Override
    public boolean deleteConversation(String conversationId) {
        synchronized (lock) {
            if (conversationId == null || !cache.containsKey(conversationId)) {
                return false;
            }
            try {
                storagePort.deleteObject(directory, conversationId + FILE_SUFFIX).join();
            } catch (CompletionException e) {
                throw new MemoryPersistenceException("Failed to delete conversation " + conversationId, e);
            }
            cache.remove(conversationId);
            log.debug("[Memory] Deleted conversation {}", conversationId);
            return true;
        }
    }

    @Override
    public void renameConversation(String conversationId, String title) {
        synchronized (lock) {
            Conversation conversation = requireConversation(conversationId);
            String previousTitle = conversation.getTitle();
            Instant previousUpdate = conversation.getUpdatedAt();
            conversation.setTitle(title);
            conversation.setUpdatedAt(clock.instant());
            try {
                write(conversation);
            } catch (MemoryPersistenceException e) {
                conversation.setTitle(previousTitle);
                conversation.setUpdatedAt(previousUpdate);
                throw e;
            }
        }
    }

    private Conversation requireConversation(String conversationId) {
        Conversation conversation = ConversationKeys.isValidKey(conversationId) ? cache.get(conversationId) : null;
        if (conversation == null) {
            throw new ConversationNotFoundException(conversationId);
        }
        return conversation;
    }

    private void loadFile(String file) {
        String json = storagePort.getText(directory, file).join();
        if (json == null || json.isBlank()) {
            return;
        }
        try {
            Conversation conversation = objectMapper.readValue(json, Conversation.class);
            if (ConversationKeys.isValidKey(conversation.getId())) {
                cache.put(conversation.getId(), conversation);
            } else {
                log.warn("[Memory] Skipping {}: invalid conversation id", file);
            }
        } catch (JsonProcessingException e) {
            log.warn("[Memory] Skipping unreadable transcript {}: {}", file, e.getOriginalMessage());
        }
    }

    private void write(Conversation conversation) {
        try {
            String json = objectMapper.writeValueAsString(conversation);
            storagePort.putTextAtomic(directory, conversation.getId() + FILE_SUFFIX, json).join();
        } catch (JsonProcessingException | CompletionException e) {
            throw new MemoryPersistenceException("Failed to save conversation " + conversation.getId(), e);
        }
    }
}
