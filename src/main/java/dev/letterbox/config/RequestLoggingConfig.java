package dev.letterbox.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.server.WebFilter;

import java.time.Duration;
import java.time.Instant;

/**
 * One log line per request, tagged with the id assigned by {@link RequestIdFilter}.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class RequestLoggingConfig {

    @Bean
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> {
            Instant start = Instant.now();
            String method = exchange.getRequest().getMethod().name();
            String path = exchange.getRequest().getPath().value();

            String rawRequestId = exchange.getRequest().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
            final String requestId = (rawRequestId == null || rawRequestId.isBlank()) ? "-" : rawRequestId;

            return chain.filter(exchange)
                    .doOnSuccess(aVoid -> {
                        Duration duration = Duration.between(start, Instant.now());
                        HttpStatusCode status = exchange.getResponse().getStatusCode();
                        logRequest(requestId, method, path, status != null ? status.value() : 200, duration);
                    })
                    .doOnError(error -> {
                        Duration duration = Duration.between(start, Instant.now());
                        log.error("[{}] {} {} - ERROR {} in {}ms",
                                requestId, method, path, error.getMessage(), duration.toMillis());
                    });
        };
    }

    private void logRequest(String requestId, String method, String path, int status, Duration duration) {
        if (path.startsWith("/actuator") || path.contains("/swagger") || path.startsWith("/v3/api-docs")) {
            log.trace("[{}] {} {} - {} in {}ms", requestId, method, path, status, duration.toMillis());
        } else if (status >= 400) {
            log.warn("[{}] {} {} - {} in {}ms", requestId, method, path, status, duration.toMillis());
        } else {
            log.info("[{}] {} {} - {} in {}ms", requestId, method, path, status, duration.toMillis());
        }
    }
}
