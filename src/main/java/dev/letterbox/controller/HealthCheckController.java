package dev.letterbox.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@Tag(name = "Health", description = "Liveness probe")
@Slf4j
public class HealthCheckController {

    @GetMapping("/health_check")
    @Operation(summary = "Health check", description = "Always 200 with an empty body")
    public Mono<ResponseEntity<Void>> healthCheck() {
        log.debug("Health check is working");
        return Mono.just(ResponseEntity.ok().<Void>build());
    }
}
