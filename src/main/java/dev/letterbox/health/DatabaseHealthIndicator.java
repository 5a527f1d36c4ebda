package dev.letterbox.health;

import io.r2dbc.spi.ConnectionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reactive health indicator for the subscriptions database.
 * Runs a trivial query through the shared connection pool.
 */
@Component("db")
@RequiredArgsConstructor
@Slf4j
public class DatabaseHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String VALIDATION_QUERY = "SELECT 1";

    private final DatabaseClient databaseClient;
    private final ConnectionFactory connectionFactory;

    @Override
    public Mono<Health> health() {
        return checkDatabaseConnection()
                .timeout(TIMEOUT)
                .onErrorResume(this::buildDownHealth);
    }

    private Mono<Health> checkDatabaseConnection() {
        return databaseClient.sql(VALIDATION_QUERY)
                .fetch()
                .one()
                .map(result -> Health.up()
                        .withDetail("database", databaseName())
                        .withDetail("validationQuery", VALIDATION_QUERY)
                        .build())
                .switchIfEmpty(Mono.fromSupplier(() -> Health.up()
                        .withDetail("database", databaseName())
                        .build()));
    }

    private String databaseName() {
        try {
            return connectionFactory.getMetadata().getName();
        } catch (RuntimeException e) {
            return "unknown";
        }
    }

    private Mono<Health> buildDownHealth(Throwable ex) {
        log.error("Database health check failed: {}", ex.getMessage());
        return Mono.just(Health.down()
                .withDetail("error", ex.getClass().getSimpleName())
                .withDetail("message", String.valueOf(ex.getMessage()))
                .build());
    }
}
