package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.Conversation;

import java.util.List;

/**
 * Durable conversation transcripts.
 *
 * <p>
 * Implementations are selected once at startup by
 * {@code agent.memory.type}. Every method is safe to call concurrently. Read
 * and write failures surface as
 * {@link me.golemcore.agent.domain.exception.MemoryPersistenceException}.
 */
public interface ConversationMemoryPort {

    /**
     * Memory type identifier (e.g., "file", "in-memory").
     */
    String getType();

    /**
     * Creates an empty conversation and returns its id.
     */
    String createConversation(String title);

    /**
     * Appends one message to the conversation log.
     *
     * @throws me.golemcore.agent.domain.exception.ConversationNotFoundException
     *             if the conversation does not exist
     */
    void addMessage(String conversationId, String role, String content);

    /**
     * Returns a detached copy of the transcript.
     *
     * @throws me.golemcore.agent.domain.exception.ConversationNotFoundException
     *             if the conversation does not exist
     */
    Conversation getConversation(String conversationId);

    /**
     * Returns up to {@code limit} conversations, most recently updated first. A
     * non-positive limit returns all of them.
     */
    List<Conversation> listConversations(int limit);

    boolean exists(String conversationId);

    /**
     * @return true if a conversation was deleted
     */
    boolean deleteConversation(String conversationId);

    /**
     * @throws me.golemcore.agent.domain.exception.ConversationNotFoundException
     *             if the conversation does not exist
     */
    void renameConversation(String conversationId, String title);
}
