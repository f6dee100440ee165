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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.engine.AgentEngine;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConversationMemoryPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Binds caller-facing conversation handles to durable conversation ids.
 *
 * <p>
 * A binding is created on first contact and never rebound. Every read and
 * write of the table happens under one lock.
 */
@Service
@Slf4j
public class ConversationIdentityBinder {

    private final ConversationMemoryPort memory;
    private final AgentEngine engine;
    private final AgentProperties properties;

    private final Object lock = new Object();
    private final Map<String, String> bindings = new HashMap<>();

    public ConversationIdentityBinder(ConversationMemoryPort memory, AgentEngine engine,
            AgentProperties properties) {
        this.memory = memory;
        this.engine = engine;
        this.properties = properties;
    }

    /**
     * Resolves the handle to its internal conversation id, binding it first if
     * it has not been seen.
     *
     * <ul>
     * <li>blank handle: a new handle is minted and bound to the engine's active
     * conversation</li>
     * <li>unseen handle naming an existing conversation: bound to it</li>
     * <li>any other unseen handle: bound to a newly created conversation</li>
     * </ul>
     */
    public Binding resolve(String handle) {
        synchronized (lock) {
            if (handle == null || handle.isBlank()) {
                String minted = mintHandleLocked();
                String internalId = engine.getConversationId();
                bindings.put(minted, internalId);
                log.info("[Binder] Minted handle {} -> {}", minted, internalId);
                return new Binding(minted, internalId);
            }

            String key = handle.trim();
            String bound = bindings.get(key);
            if (bound != null) {
                return new Binding(key, bound);
            }

            String internalId;
            if (memory.exists(key)) {
                internalId = key;
            } else {
                internalId = memory.createConversation(properties.getMemory().getDefaultTitle());
            }
            bindings.put(key, internalId);
            log.info("[Binder] Bound handle {} -> {}", key, internalId);
            return new Binding(key, internalId);
        }
    }

    public Optional<String> lookup(String handle) {
        if (handle == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(bindings.get(handle.trim()));
        }
    }

    /**
     * Drops every handle bound to the given conversation. Returns the removed
     * handles.
     */
    public List<String> forgetConversation(String internalId) {
        List<String> removed = new ArrayList<>();
        synchronized (lock) {
            bindings.entrySet().removeIf(entry -> {
                if (entry.getValue().equals(internalId)) {
                    removed.add(entry.getKey());
                    return true;
                }
                return false;
            });
        }
        if (!removed.isEmpty()) {
            log.info("[Binder] Forgot {} handle(s) for {}", removed.size(), internalId);
        }
        return removed;
    }

    public int size() {
        synchronized (lock) {
            return bindings.size();
        }
    }

    private String mintHandleLocked() {
        String candidate = ConversationKeys.newHandle();
        while (bindings.containsKey(candidate)) {
            candidate = ConversationKeys.newHandle();
        }
        return candidate;
    }

    /**
     * Resolved pair of caller handle and internal conversation id.
     */
    public record Binding(String handle, String internalId) {
    }
}
