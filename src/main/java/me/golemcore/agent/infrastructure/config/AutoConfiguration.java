package me.golemcore.agent.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.service.CapabilityRegistry;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;

/**
 * Shared infrastructure beans and the startup summary.
 *
 * <p>
 * The {@link ObjectMapper} writes ISO-8601 timestamps and tolerates unknown
 * fields; transcripts on disk and backend payloads both go through it.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AgentProperties properties;
    private final LlmPort llmPort;
    private final CapabilityRegistry capabilityRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logStartupSummary() {
        log.info("GolemCore Agent ready: provider={} model={} available={}",
                llmPort.getProviderId(), llmPort.getCurrentModel(), llmPort.isAvailable());
        log.info("Capabilities: {}", capabilityRegistry.getNames());
        log.info("Memory: {} (storage {}), history window {} messages",
                properties.getMemory().getType(), properties.getStorage().getLocal().getBasePath(),
                properties.getPrompt().getHistoryLimit());
        if (!llmPort.isAvailable()) {
            log.warn("[LLM] Backend '{}' is not usable; check agent.llm settings", llmPort.getProviderId());
        }
    }
}
