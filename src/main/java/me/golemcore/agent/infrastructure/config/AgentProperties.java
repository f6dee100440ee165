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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the agent, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model backend selection, timeouts and retries</li>
 * <li>{@link PromptProperties} - system instruction and history window</li>
 * <li>{@link ToolCallProperties} - tool-call extraction</li>
 * <li>{@link MemoryProperties} - transcript persistence</li>
 * <li>{@link StorageProperties} - local workspace directory</li>
 * <li>{@link StreamProperties} - streaming delivery</li>
 * <li>{@link CapabilitiesProperties} - built-in capabilities</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private PromptProperties prompt = new PromptProperties();
    private ToolCallProperties toolCall = new ToolCallProperties();
    private MemoryProperties memory = new MemoryProperties();
    private StorageProperties storage = new StorageProperties();
    private StreamProperties stream = new StreamProperties();
    private HttpProperties http = new HttpProperties();
    private CapabilitiesProperties capabilities = new CapabilitiesProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "ollama";
        private long timeoutMs = 180_000;
        private OllamaProperties ollama = new OllamaProperties();
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class OllamaProperties {
        private String baseUrl = "http://localhost:11434";
        private String model = "qwen2.5:7b";
        private int maxTokens = 2048;
        private double temperature = 0.7;
        private int connectRetries = 3;
        private long connectBackoffMs = 2_000;
        private int loadRetries = 3;
        private long loadRetryDelayMs = 5_000;
    }

    @Data
    public static class Langchain4jProperties {
        private String provider = "openai"; // openai (or any OpenAI-compatible API), anthropic
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private Double temperature = 0.7;
        private int maxRetries = 3;
        private long initialBackoffMs = 2_000;
    }

    // ==================== PROMPT ====================

    @Data
    public static class PromptProperties {
        private String system = "You are a helpful assistant. Answer concisely and accurately.";
        private int historyLimit = 10;
        private boolean includeCapabilityCatalog = true;
        private String fallbackMessage = "Sorry, I could not produce a valid response. Please try again.";
    }

    @Data
    public static class ToolCallProperties {
        private String legacyMarker = "使用工具:";
    }

    // ==================== MEMORY / STORAGE ====================

    @Data
    public static class MemoryProperties {
        private String type = "file"; // file, in-memory
        private String defaultTitle = "New conversation";
        private int listLimit = 50;
        private String directory = "conversations";
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore-agent/workspace";
    }

    // ==================== TRANSPORT ====================

    @Data
    public static class StreamProperties {
        private int channelCapacity = 100;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10_000;
        private long readTimeout = 180_000;
        private long writeTimeout = 60_000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300_000;
    }

    // ==================== CAPABILITIES ====================

    @Data
    public static class CapabilitiesProperties {
        private ToggleProperties calculator = new ToggleProperties();
        private KnowledgeBaseProperties knowledgeBase = new KnowledgeBaseProperties();
        private WebSearchProperties webSearch = new WebSearchProperties();
    }

    @Data
    public static class ToggleProperties {
        private boolean enabled = true;
    }

    @Data
    public static class KnowledgeBaseProperties {
        private boolean enabled = true;
        private String directory = "knowledge";
    }

    @Data
    public static class WebSearchProperties {
        private boolean enabled = true;
        private String engine = "auto"; // auto, duckduckgo, searchapi
        private String apiKey;
        private String duckDuckGoUrl = "https://api.duckduckgo.com";
        private String searchApiUrl = "https://api.searchapi.com";
        private int maxResults = 10;
    }
}
