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

import lombok.Builder;
import lombok.Value;

/**
 * Event delivered on the per-turn stream. Order per turn: META, THINKING
 * (analyzing), optional THINKING (tool_call, then tool_result or tool_error),
 * THINKING (generating), one or more CONTENT, DONE.
 */
@Value
@Builder
public class AgentStreamEvent {

    public enum Type {
        META, THINKING, CONTENT, DONE
    }

    Type type;
    ThinkingPhase phase;
    String message;
    String conversationId;
    String agentConversationId;

    public static AgentStreamEvent meta(String conversationId, String agentConversationId) {
        return AgentStreamEvent.builder()
                .type(Type.META)
                .conversationId(conversationId)
                .agentConversationId(agentConversationId)
                .build();
    }

    public static AgentStreamEvent thinking(ThinkingPhase phase, String message) {
        return AgentStreamEvent.builder()
                .type(Type.THINKING)
                .phase(phase)
                .message(message)
                .build();
    }

    public static AgentStreamEvent content(String delta) {
        return AgentStreamEvent.builder()
                .type(Type.CONTENT)
                .message(delta)
                .build();
    }

    public static AgentStreamEvent done() {
        return AgentStreamEvent.builder()
                .type(Type.DONE)
                .message("done")
                .build();
    }

    public boolean isContent() {
        return type == Type.CONTENT;
    }
}
