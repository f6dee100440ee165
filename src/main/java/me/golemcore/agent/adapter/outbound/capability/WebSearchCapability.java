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

package me.golemcore.agent.adapter.outbound.capability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.Capability;
import me.golemcore.agent.domain.exception.CapabilityValidationException;
import me.golemcore.agent.domain.model.CapabilityResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Internet search.
 *
 * <p>
 * Uses SearchAPI when an API key is configured and the DuckDuckGo Instant
 * Answer API otherwise. Each hit is returned as {@code {title, link,
 * description}}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code agent.capabilities.web-search.enabled}
 * <li>{@code agent.capabilities.web-search.engine} - auto, duckduckgo or
 * searchapi
 * <li>{@code agent.capabilities.web-search.api-key} - SearchAPI key
 * <li>{@code agent.capabilities.web-search.max-results} - default 10
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSearchCapability implements Capability {

    public static final String NAME = "web_search";

    static final String ENGINE_DUCKDUCKGO = "duckduckgo";
    static final String ENGINE_SEARCHAPI = "searchapi";

    private static final String PARAM_QUERY = "query";
    private static final String SUMMARY_TITLE = "Summary";
    private static final String TITLE_SEPARATOR = " - ";

    private final FeignClientFactory feignClientFactory;
    private final AgentProperties properties;

    private boolean enabled;
    private String engine;
    private String apiKey;
    private int maxResults;
    private DuckDuckGoApi duckDuckGoApi;
    private SearchApi searchApi;

    @PostConstruct
    public void init() {
        AgentProperties.WebSearchProperties config = properties.getCapabilities().getWebSearch();
        this.enabled = config.isEnabled();
        this.apiKey = config.getApiKey();
        this.maxResults = Math.max(1, config.getMaxResults());
        this.engine = selectEngine(config.getEngine());

        if (!enabled) {
            return;
        }
        if (ENGINE_SEARCHAPI.equals(engine)) {
            this.searchApi = feignClientFactory.create(SearchApi.class, config.getSearchApiUrl());
        } else {
            this.duckDuckGoApi = feignClientFactory.create(DuckDuckGoApi.class, config.getDuckDuckGoUrl());
        }
        log.info("[Tools] Web search initialized (engine: {})", engine);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Search the internet for current or factual information. Params: query.";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    String getEngine() {
        return engine;
    }

    @Override
    public CompletableFuture<CapabilityResult> execute(Map<String, Object> parameters) {
        Object rawQuery = parameters.get(PARAM_QUERY);
        if (!(rawQuery instanceof String query) || query.isBlank()) {
            return CompletableFuture.failedFuture(new CapabilityValidationException("Missing parameter: query"));
        }
        String trimmed = query.trim();
        return CompletableFuture.supplyAsync(() -> search(trimmed));
    }

    private CapabilityResult search(String query) {
        try {
            List<Map<String, String>> hits = ENGINE_SEARCHAPI.equals(engine)
                    ? searchWithSearchApi(query)
                    : searchWithDuckDuckGo(query);
            if (hits.isEmpty()) {
                return CapabilityResult.success("No results found for: " + query);
            }
            log.debug("[Tools] Web search '{}' returned {} hit(s)", query, hits.size());
            return CapabilityResult.success(hits);
        } catch (RetryableException e) {
            log.warn("[Tools] Web search unreachable for query {}: {}", query, e.getMessage());
            return CapabilityResult.failure("Search request failed: " + e.getMessage());
        } catch (FeignException e) {
            log.warn("[Tools] Web search failed (status {}) for query: {}", e.status(), query);
            return CapabilityResult.failure("Search request failed with status " + e.status());
        }
    }

    private List<Map<String, String>> searchWithSearchApi(String query) {
        SearchApiResponse response = searchApi.search(query, apiKey);
        List<Map<String, String>> hits = new ArrayList<>();
        if (response != null && response.getResults() != null) {
            for (SearchApiResult result : response.getResults()) {
                addHit(hits, result.getTitle(), result.getLink(), result.getDescription());
            }
        }
        return hits;
    }

    private List<Map<String, String>> searchWithDuckDuckGo(String query) {
        DuckDuckGoResponse response = duckDuckGoApi.search(query);
        List<Map<String, String>> hits = new ArrayList<>();
        if (response == null) {
            return hits;
        }
        if (hasText(response.getAbstractText()) && hasText(response.getAbstractUrl())) {
            addHit(hits, SUMMARY_TITLE, response.getAbstractUrl(), response.getAbstractText());
        }
        addTopics(hits, response.getRelatedTopics());
        addTopics(hits, response.getResults());
        return hits;
    }

    private void addTopics(List<Map<String, String>> hits, List<DuckDuckGoTopic> topics) {
        if (topics == null) {
            return;
        }
        for (DuckDuckGoTopic topic : topics) {
            // category groups carry no text of their own
            if (hasText(topic.getText()) && hasText(topic.getFirstUrl())) {
                String title = topic.getText().split(TITLE_SEPARATOR, 2)[0];
                addHit(hits, title, topic.getFirstUrl(), topic.getText());
            }
        }
    }

    private void addHit(List<Map<String, String>> hits, String title, String link, String description) {
        if (hits.size() >= maxResults) {
            return;
        }
        Map<String, String> hit = new LinkedHashMap<>();
        hit.put("title", title != null ? title : "");
        hit.put("link", link != null ? link : "");
        hit.put("description", description != null ? description : "");
        hits.add(hit);
    }

    private String selectEngine(String configured) {
        boolean hasKey = hasText(apiKey);
        if (ENGINE_DUCKDUCKGO.equalsIgnoreCase(configured)) {
            return ENGINE_DUCKDUCKGO;
        }
        if (ENGINE_SEARCHAPI.equalsIgnoreCase(configured) && !hasKey) {
            log.warn("[Tools] SearchAPI selected but no API key configured, using DuckDuckGo");
            return ENGINE_DUCKDUCKGO;
        }
        return hasKey ? ENGINE_SEARCHAPI : ENGINE_DUCKDUCKGO;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    // Feign API interfaces
    interface DuckDuckGoApi {
        @RequestLine("GET /?q={query}&format=json&no_html=1&no_redirect=1")
        DuckDuckGoResponse search(@Param("query") String query);
    }

    interface SearchApi {
        @RequestLine("GET /v1/search?q={query}&api_key={apiKey}")
        SearchApiResponse search(@Param("query") String query, @Param("apiKey") String apiKey);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DuckDuckGoResponse {
        @JsonProperty("AbstractText")
        private String abstractText;
        @JsonProperty("AbstractURL")
        private String abstractUrl;
        @JsonProperty("RelatedTopics")
        private List<DuckDuckGoTopic> relatedTopics;
        @JsonProperty("Results")
        private List<DuckDuckGoTopic> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DuckDuckGoTopic {
        @JsonProperty("Text")
        private String text;
        @JsonProperty("FirstURL")
        private String firstUrl;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchApiResponse {
        private List<SearchApiResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchApiResult {
        private String title;
        private String link;
        private String description;
    }
}
