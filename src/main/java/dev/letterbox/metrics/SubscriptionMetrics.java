package dev.letterbox.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SubscriptionMetrics {

    public static final String SUBSCRIPTIONS = "letterbox.subscriptions";
    public static final String EMAIL_DISPATCH = "letterbox.email.dispatch";

    private final MeterRegistry meterRegistry;

    private Counter acceptedCounter;
    private Counter rejectedCounter;
    private Counter storageFailureCounter;
    private Counter dispatchSuccessCounter;
    private Counter dispatchFailureCounter;

    @PostConstruct
    public void init() {
        acceptedCounter = Counter.builder(SUBSCRIPTIONS)
                .description("Subscription requests by outcome")
                .tag("outcome", "accepted")
                .register(meterRegistry);
        rejectedCounter = Counter.builder(SUBSCRIPTIONS)
                .description("Subscription requests by outcome")
                .tag("outcome", "rejected")
                .register(meterRegistry);
        storageFailureCounter = Counter.builder(SUBSCRIPTIONS)
                .description("Subscription requests by outcome")
                .tag("outcome", "storage_failure")
                .register(meterRegistry);

        dispatchSuccessCounter = Counter.builder(EMAIL_DISPATCH)
                .description("Welcome email dispatch attempts by outcome")
                .tag("outcome", "success")
                .register(meterRegistry);
        dispatchFailureCounter = Counter.builder(EMAIL_DISPATCH)
                .description("Welcome email dispatch attempts by outcome")
                .tag("outcome", "failure")
                .register(meterRegistry);
    }

    public void incrementAccepted() {
        acceptedCounter.increment();
    }

    public void incrementRejected() {
        rejectedCounter.increment();
    }

    public void incrementStorageFailure() {
        storageFailureCounter.increment();
    }

    public void incrementDispatchSuccess() {
        dispatchSuccessCounter.increment();
    }

    public void incrementDispatchFailure() {
        dispatchFailureCounter.increment();
    }
}
