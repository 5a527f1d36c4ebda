package dev.letterbox.exception;

import dev.letterbox.config.RequestIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Maps failures to bare status codes. Response bodies are always empty so that
 * neither rejected input nor storage errors are echoed back to the client.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SubscriberValidationException.class)
    public Mono<ResponseEntity<Void>> handleSubscriberValidation(SubscriberValidationException ex, ServerWebExchange exchange) {
        log.warn("[{}] Invalid subscriber data on {}: {}", requestId(exchange), path(exchange), ex.getMessage());
        return status(HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<Void>> handleServerWebInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("[{}] Bad request input on {}: {}", requestId(exchange), path(exchange), ex.getReason());
        return status(HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SubscriptionStorageException.class)
    public Mono<ResponseEntity<Void>> handleSubscriptionStorage(SubscriptionStorageException ex, ServerWebExchange exchange) {
        // Details were logged where the failure happened, together with the request id.
        log.error("[{}] Storage failure on {}: {}", requestId(exchange), path(exchange), ex.getMessage());
        return status(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<Void>> handleResponseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        log.warn("[{}] Response status exception on {}: {} - {}", requestId(exchange), path(exchange), ex.getStatusCode(), ex.getReason());
        return Mono.just(ResponseEntity.status(ex.getStatusCode()).<Void>build());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Void>> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("[{}] Unexpected error on {}: ", requestId(exchange), path(exchange), ex);
        return status(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private Mono<ResponseEntity<Void>> status(HttpStatus status) {
        return Mono.just(ResponseEntity.status(status).<Void>build());
    }

    private String requestId(ServerWebExchange exchange) {
        String requestId = exchange.getRequest().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
        if (requestId == null) {
            requestId = exchange.getResponse().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
        }
        return requestId != null ? requestId : "-";
    }

    private String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }
}
