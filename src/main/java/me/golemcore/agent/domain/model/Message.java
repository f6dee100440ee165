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
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A single transcript entry. Messages are immutable once appended to a
 * {@link Conversation}.
 */
@Value
@Builder
@Jacksonized
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";

    String role; // user, assistant, system
    String content;
    Instant timestamp;

    public static Message of(String role, String content, Instant timestamp) {
        return Message.builder()
                .role(role)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }
}
