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

import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds the model prompt for a turn: the fixed system instruction (plus the
 * capability catalog) and the most recent {@code agent.prompt.history-limit}
 * messages, oldest first.
 */
@Component
public class PromptBuilder {

    private final AgentProperties.PromptProperties prompt;
    private final String legacyMarker;

    public PromptBuilder(AgentProperties properties) {
        this.prompt = properties.getPrompt();
        this.legacyMarker = properties.getToolCall().getLegacyMarker();
    }

    public LlmRequest build(List<Message> history, Map<String, String> capabilities) {
        return LlmRequest.builder()
                .systemPrompt(buildSystemPrompt(capabilities))
                .messages(window(history))
                .build();
    }

    List<Message> window(List<Message> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        int limit = prompt.getHistoryLimit();
        if (limit <= 0 || history.size() <= limit) {
            return List.copyOf(history);
        }
        return List.copyOf(history.subList(history.size() - limit, history.size()));
    }

    String buildSystemPrompt(Map<String, String> capabilities) {
        String base = prompt.getSystem() != null ? prompt.getSystem().trim() : "";
        if (!prompt.isIncludeCapabilityCatalog() || capabilities == null || capabilities.isEmpty()) {
            return base;
        }
        StringBuilder sb = new StringBuilder(base);
        if (!base.isEmpty()) {
            sb.append("\n\n");
        }
        sb.append("You can use the following tools:\n");
        capabilities.forEach((name, description) -> sb.append("- ").append(name).append(": ")
                .append(description).append('\n'));
        sb.append("\nTo use a tool, reply with nothing but a JSON object, for example:\n")
                .append("{\"tool\": \"<tool name>\", \"params\": {\"<name>\": \"<value>\"}}\n")
                .append("A fenced block opening with ```tool:<tool name> or a line starting with ")
                .append(legacyMarker)
                .append(" <tool name> <parameters> is also accepted. Use at most one tool per reply. ")
                .append("When no tool is needed, answer directly.");
        return sb.toString();
    }
}
