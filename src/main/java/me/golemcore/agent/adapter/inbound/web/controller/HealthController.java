package me.golemcore.agent.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.agent.adapter.inbound.web.dto.HealthResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final Clock clock;

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        return Mono.just(ResponseEntity.ok(HealthResponse.builder()
                .status("healthy")
                .timestamp(Instant.now(clock).toString())
                .build()));
    }
}
