package me.golemcore.agent.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.agent.domain.exception.CapabilityNotFoundException;
import me.golemcore.agent.domain.exception.CapabilityValidationException;
import me.golemcore.agent.domain.exception.ConversationNotFoundException;
import me.golemcore.agent.domain.exception.LlmBackendException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps domain failures to {@link ApiErrorResponse} bodies for the API
 * controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.agent.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler({ IllegalArgumentException.class, CapabilityValidationException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleBadRequest(RuntimeException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({ ConversationNotFoundException.class, CapabilityNotFoundException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(RuntimeException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(LlmBackendException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleBackend(LlmBackendException ex) {
        log.error("[API] Model backend failure: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
