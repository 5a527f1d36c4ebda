package dev.letterbox.controller;

import dev.letterbox.dto.SubscriptionForm;
import dev.letterbox.service.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
@Tag(name = "Subscriptions", description = "Newsletter subscription endpoint")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @PostMapping("/subscriptions")
    @Operation(summary = "Subscribe to the newsletter",
            description = "Accepts a URL-encoded form with `name` and `email`. All responses have an empty body.")
    @ApiResponse(responseCode = "200", description = "Subscriber stored")
    @ApiResponse(responseCode = "400", description = "Missing or invalid name or email")
    @ApiResponse(responseCode = "500", description = "Subscriber could not be stored")
    public Mono<ResponseEntity<Void>> subscribe(ServerWebExchange exchange) {
        return exchange.getFormData()
                .map(SubscriptionForm::fromFormData)
                .flatMap(subscriptionService::subscribe)
                .thenReturn(ResponseEntity.ok().<Void>build());
    }
}
