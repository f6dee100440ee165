package me.golemcore.agent.adapter.outbound.capability;

import me.golemcore.agent.domain.exception.CapabilityValidationException;
import me.golemcore.agent.domain.model.CapabilityResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.config.AutoConfiguration;
import me.golemcore.agent.infrastructure.http.FeignClientFactory;
import me.golemcore.agent.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebSearchCapabilityTest {

    private OkHttpMockEngine http;
    private AgentProperties properties;

    @BeforeEach
    void setUp() {
        http = new OkHttpMockEngine();
        properties = new AgentProperties();
        properties.getCapabilities().getWebSearch().setDuckDuckGoUrl("http://ddg.test");
        properties.getCapabilities().getWebSearch().setSearchApiUrl("http://searchapi.test");
    }

    // ==================== engine selection ====================

    @Test
    void shouldUseDuckDuckGoWithoutApiKey() {
        assertEquals(WebSearchCapability.ENGINE_DUCKDUCKGO, capability().getEngine());
    }

    @Test
    void shouldUseSearchApiWhenKeyConfigured() {
        properties.getCapabilities().getWebSearch().setApiKey("secret");

        assertEquals(WebSearchCapability.ENGINE_SEARCHAPI, capability().getEngine());
    }

    @Test
    void shouldFallBackToDuckDuckGoWhenSearchApiHasNoKey() {
        properties.getCapabilities().getWebSearch().setEngine("searchapi");

        assertEquals(WebSearchCapability.ENGINE_DUCKDUCKGO, capability().getEngine());
    }

    // ==================== DuckDuckGo ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldCollectAbstractAndTopicsFromDuckDuckGo() {
        http.enqueueJson(200, """
                {"AbstractText": "Java is a programming language.",
                 "AbstractURL": "https://en.wikipedia.org/wiki/Java",
                 "RelatedTopics": [
                   {"Text": "Java virtual machine - runs bytecode", "FirstURL": "https://duckduckgo.com/JVM"},
                   {"Name": "Islands", "Topics": []}
                 ],
                 "Results": [],
                 "Heading": "Java"}
                """);

        CapabilityResult result = capability().execute(Map.of("query", "java")).join();

        assertTrue(result.isSuccess());
        List<Map<String, String>> hits = (List<Map<String, String>>) result.getValue();
        assertEquals(2, hits.size());
        assertEquals(Map.of("title", "Summary",
                "link", "https://en.wikipedia.org/wiki/Java",
                "description", "Java is a programming language."), hits.get(0));
        assertEquals("Java virtual machine", hits.get(1).get("title"));

        OkHttpMockEngine.CapturedRequest request = http.takeRequest();
        assertEquals("GET", request.method());
        assertTrue(request.query().contains("q=java"), request.query());
        assertTrue(request.query().contains("format=json"), request.query());
        assertEquals("golemcore-agent", request.userAgent());
    }

    @Test
    void shouldReportNoResults() {
        http.enqueueJson(200, "{\"AbstractText\": \"\", \"RelatedTopics\": [], \"Results\": []}");

        CapabilityResult result = capability().execute(Map.of("query", "zxqv")).join();

        assertEquals("No results found for: zxqv", result.getValue());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCapNumberOfHits() {
        properties.getCapabilities().getWebSearch().setMaxResults(1);
        http.enqueueJson(200, """
                {"RelatedTopics": [
                   {"Text": "One", "FirstURL": "https://a.example"},
                   {"Text": "Two", "FirstURL": "https://b.example"}
                 ]}
                """);

        CapabilityResult result = capability().execute(Map.of("query", "numbers")).join();

        assertEquals(1, ((List<Map<String, String>>) result.getValue()).size());
    }

    // ==================== SearchAPI ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldMapSearchApiResults() {
        properties.getCapabilities().getWebSearch().setApiKey("secret");
        http.enqueueJson(200, """
                {"results": [{"title": "Spring Boot", "link": "https://spring.io", "description": "Framework"}]}
                """);

        CapabilityResult result = capability().execute(Map.of("query", "spring boot")).join();

        List<Map<String, String>> hits = (List<Map<String, String>>) result.getValue();
        assertEquals("https://spring.io", hits.get(0).get("link"));
        OkHttpMockEngine.CapturedRequest request = http.takeRequest();
        assertEquals("/v1/search", request.path());
        assertTrue(request.query().contains("api_key=secret"), request.query());
    }

    // ==================== failures ====================

    @Test
    void shouldTurnHttpErrorIntoFailedResult() {
        http.enqueueJson(500, "{\"error\": \"boom\"}");

        CapabilityResult result = capability().execute(Map.of("query", "java")).join();

        assertFalse(result.isSuccess());
        assertEquals("Search request failed with status 500", result.getError());
    }

    @Test
    void shouldReportConnectionFailureWithoutRetrying() {
        http.enqueueFailure(new IOException("connection refused"));

        CapabilityResult result = capability().execute(Map.of("query", "java")).join();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Search request failed: "), result.getError());
        assertEquals(1, http.getRequestCount());
    }

    @Test
    void shouldRejectMissingQuery() {
        CompletableFuture<CapabilityResult> future = capability().execute(Map.of("query", " "));

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(CapabilityValidationException.class, error.getCause());
        assertEquals(0, http.getRequestCount());
    }

    private WebSearchCapability capability() {
        FeignClientFactory factory = new FeignClientFactory(http.client(), AutoConfiguration.objectMapper(),
                properties);
        WebSearchCapability capability = new WebSearchCapability(factory, properties);
        capability.init();
        return capability;
    }
}
