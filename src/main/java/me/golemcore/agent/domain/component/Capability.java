package me.golemcore.agent.domain.component;

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

import me.golemcore.agent.domain.model.CapabilityResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Named callable unit the model can invoke from its output. Spring beans
 * implementing this interface are registered with
 * {@link me.golemcore.agent.domain.service.CapabilityRegistry} at startup.
 */
public interface Capability {

    /**
     * Returns the unique name the model uses to address this capability.
     */
    String getName();

    /**
     * Returns a one-line description shown to the model in the capability
     * catalog.
     */
    String getDescription();

    /**
     * Executes the capability. Failures are reported either as a
     * {@link CapabilityResult#failure(String)} or by completing the future
     * exceptionally. The registry applies no timeout; capabilities own their
     * own.
     *
     * @param parameters
     *            string-keyed parameters, values are scalars or JSON structures
     * @return a future containing the execution result
     */
    CompletableFuture<CapabilityResult> execute(Map<String, Object> parameters);

    /**
     * Whether the capability should be registered. Disabled beans are skipped.
     */
    default boolean isEnabled() {
        return true;
    }
}
