package me.golemcore.agent.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable conversation transcript owned by the memory collaborator. The message
 * log is append-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    private String id;
    private String title;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    public void addMessage(Message message) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
        this.updatedAt = message.getTimestamp();
    }

    @JsonIgnore
    public int getMessageCount() {
        return messages != null ? messages.size() : 0;
    }

    /**
     * Detached copy, so callers can never mutate the stored log.
     */
    public Conversation copy() {
        return Conversation.builder()
                .id(id)
                .title(title)
                .messages(messages != null ? new ArrayList<>(messages) : new ArrayList<>())
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
