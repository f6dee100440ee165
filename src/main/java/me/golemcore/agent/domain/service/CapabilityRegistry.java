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
import me.golemcore.agent.domain.component.Capability;
import me.golemcore.agent.domain.exception.CapabilityAlreadyRegisteredException;
import me.golemcore.agent.domain.exception.CapabilityNotFoundException;
import me.golemcore.agent.domain.model.CapabilityResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe name to capability mapping.
 *
 * <p>
 * Registration is normally done once at startup, but late registrations are
 * visible to subsequent lookups immediately and never disturb invocations in
 * flight. Invocation forwards to the capability and returns its result
 * verbatim.
 */
@Component
@Slf4j
public class CapabilityRegistry {

    private final Map<String, Capability> capabilities = new ConcurrentHashMap<>();

    public CapabilityRegistry(List<Capability> beans) {
        for (Capability capability : beans) {
            if (!capability.isEnabled()) {
                log.debug("[Tools] Skipping disabled capability: {}", capability.getName());
                continue;
            }
            register(capability.getName(), capability);
        }
    }

    /**
     * Registers a capability under the given name.
     *
     * @throws CapabilityAlreadyRegisteredException
     *             if the name is taken
     */
    public void register(String name, Capability capability) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("capability name must not be blank");
        }
        if (capability == null) {
            throw new IllegalArgumentException("capability must not be null");
        }
        Capability existing = capabilities.putIfAbsent(name, capability);
        if (existing != null) {
            throw new CapabilityAlreadyRegisteredException(name);
        }
        log.info("[Tools] Registered capability: {}", name);
    }

    public Optional<Capability> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(capabilities.get(name));
    }

    public boolean isRegistered(String name) {
        return find(name).isPresent();
    }

    /**
     * Forwards to the named capability.
     *
     * @throws CapabilityNotFoundException
     *             if no capability is registered under {@code name}
     */
    public CompletableFuture<CapabilityResult> invoke(String name, Map<String, Object> parameters) {
        Capability capability = find(name).orElseThrow(() -> new CapabilityNotFoundException(name));
        Map<String, Object> args = parameters != null ? parameters : Collections.emptyMap();
        log.debug("[Tools] Invoking '{}' with {} parameter(s)", name, args.size());
        return capability.execute(args);
    }

    public List<String> getNames() {
        List<String> names = new ArrayList<>(capabilities.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Name to description, sorted by name.
     */
    public Map<String, String> describeAll() {
        Map<String, String> result = new LinkedHashMap<>();
        for (String name : getNames()) {
            Capability capability = capabilities.get(name);
            if (capability != null) {
                result.put(name, capability.getDescription());
            }
        }
        return result;
    }
}
