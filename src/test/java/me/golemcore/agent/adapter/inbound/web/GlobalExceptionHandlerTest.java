package me.golemcore.agent.adapter.inbound.web;

import me.golemcore.agent.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.agent.domain.exception.CapabilityValidationException;
import me.golemcore.agent.domain.exception.ConversationNotFoundException;
import me.golemcore.agent.domain.exception.LlmBackendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldKeepResponseStatusFromException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "Route not found");

        assertResponse(handler.handleResponseStatus(ex), HttpStatus.NOT_FOUND, "Route not found");
    }

    @Test
    void shouldMapValidationFailuresToBadRequest() {
        assertResponse(handler.handleBadRequest(new IllegalArgumentException("message is required")),
                HttpStatus.BAD_REQUEST, "message is required");
        assertResponse(handler.handleBadRequest(new CapabilityValidationException("Missing parameter: a")),
                HttpStatus.BAD_REQUEST, "Missing parameter: a");
    }

    @Test
    void shouldMapUnknownConversationToNotFound() {
        ConversationNotFoundException ex = new ConversationNotFoundException("conv_x");

        assertResponse(handler.handleNotFound(ex), HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        assertResponse(handler.handleIllegalState(new IllegalStateException("busy")), HttpStatus.CONFLICT, "busy");
    }

    @Test
    void shouldMapBackendFailureToBadGateway() {
        assertResponse(handler.handleBackend(new LlmBackendException("Ollama unreachable")),
                HttpStatus.BAD_GATEWAY, "Ollama unreachable");
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        assertResponse(handler.handleGeneric(new RuntimeException("stack details")),
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static void assertResponse(Mono<ResponseEntity<ApiErrorResponse>> response, HttpStatus status,
            String message) {
        StepVerifier.create(response)
                .assertNext(entity -> {
                    assertEquals(status, entity.getStatusCode());
                    ApiErrorResponse body = entity.getBody();
                    assertNotNull(body);
                    assertEquals(status.value(), body.getStatus());
                    assertEquals(message, body.getMessage());
                })
                .verifyComplete();
    }
}
