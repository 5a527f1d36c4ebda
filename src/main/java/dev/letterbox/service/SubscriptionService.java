package dev.letterbox.service;

import dev.letterbox.config.RequestIdFilter;
import dev.letterbox.domain.NewSubscriber;
import dev.letterbox.dto.SubscriptionForm;
import dev.letterbox.entity.Subscription;
import dev.letterbox.exception.SubscriberValidationException;
import dev.letterbox.exception.SubscriptionStorageException;
import dev.letterbox.metrics.SubscriptionMetrics;
import dev.letterbox.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Turns a raw subscription form into a stored subscription.
 * <p>
 * Steps run in order and each one short-circuits the rest:
 * <ol>
 *   <li>validate the form into a {@link NewSubscriber}, or fail with {@link SubscriberValidationException}</li>
 *   <li>insert the subscription row, or fail with {@link SubscriptionStorageException}</li>
 *   <li>send the welcome email when dispatch is enabled; failures are logged and swallowed</li>
 * </ol>
 * Every log line carries the request id found in the Reactor context.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final EmailService emailService;
    private final SubscriptionMetrics subscriptionMetrics;
    private final Clock clock;

    public Mono<Subscription> subscribe(SubscriptionForm form) {
        return Mono.deferContextual(ctx -> {
            String requestId = ctx.getOrDefault(RequestIdFilter.REQUEST_ID_CONTEXT_KEY, UUID.randomUUID().toString());
            log.info("[{}] Adding '{}' '{}' as a new subscriber", requestId, form.getEmail(), form.getName());

            return Mono.fromCallable(() -> NewSubscriber.fromForm(form.getEmail(), form.getName()))
                    // Logged once, by the exception handler.
                    .doOnError(SubscriberValidationException.class, ex -> subscriptionMetrics.incrementRejected())
                    .flatMap(subscriber -> insertSubscriber(subscriber, requestId)
                            .flatMap(saved -> sendWelcomeEmail(subscriber, requestId).thenReturn(saved)));
        });
    }

    private Mono<Subscription> insertSubscriber(NewSubscriber subscriber, String requestId) {
        Subscription subscription = Subscription.of(subscriber, UUID.randomUUID(), OffsetDateTime.now(clock));

        return subscriptionRepository.save(subscription)
                .doOnSuccess(saved -> {
                    log.info("[{}] New subscriber details have been saved: id={}, '{}' '{}'",
                            requestId, saved.getId(), saved.getEmail(), saved.getName());
                    subscriptionMetrics.incrementAccepted();
                })
                .onErrorMap(ex -> {
                    log.error("[{}] Failed to save new subscriber '{}' '{}'",
                            requestId, subscription.getEmail(), subscription.getName(), ex);
                    subscriptionMetrics.incrementStorageFailure();
                    return new SubscriptionStorageException("Failed to save new subscriber", ex);
                });
    }

    private Mono<Void> sendWelcomeEmail(NewSubscriber subscriber, String requestId) {
        if (!emailService.isDispatchEnabled()) {
            log.debug("[{}] Email dispatch disabled, no welcome email sent", requestId);
            return Mono.empty();
        }

        return emailService.sendWelcome(subscriber)
                .doOnSuccess(v -> {
                    log.info("[{}] Welcome email sent to '{}'", requestId, subscriber.email().asString());
                    subscriptionMetrics.incrementDispatchSuccess();
                })
                // The subscription is already stored; a failed email must not change the response.
                .onErrorResume(ex -> {
                    log.warn("[{}] Failed to send welcome email to '{}': {}",
                            requestId, subscriber.email().asString(), ex.getMessage());
                    subscriptionMetrics.incrementDispatchFailure();
                    return Mono.empty();
                });
    }
}
