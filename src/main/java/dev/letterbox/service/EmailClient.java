package dev.letterbox.service;

import dev.letterbox.config.RequestIdFilter;
import dev.letterbox.domain.SubscriberEmail;
import dev.letterbox.dto.SendEmailRequest;
import dev.letterbox.exception.EmailDispatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the transactional email provider.
 * <p>
 * Each call to {@link #send} is a single {@code POST {base-url}/email}, authenticated with the
 * {@value #AUTH_TOKEN_HEADER} header. There is no retry. The token is never logged.
 */
@Service
@Slf4j
public class EmailClient {

    public static final String AUTH_TOKEN_HEADER = "X-Provider-Auth-Token";
    static final String SEND_PATH = "/email";

    private final WebClient webClient;
    private final SubscriberEmail sender;
    private final Duration timeout;
    private final boolean enabled;

    public EmailClient(
            WebClient.Builder webClientBuilder,
            @Value("${app.email-client.base-url:http://localhost:8025}") String baseUrl,
            @Value("${app.email-client.sender-email:newsletter@letterbox.dev}") String senderEmail,
            @Value("${app.email-client.authorization-token:}") String authorizationToken,
            @Value("${app.email-client.timeout-millis:10000}") long timeoutMillis,
            @Value("${app.email-client.enabled:false}") boolean enabled) {
        // An invalid sender address aborts startup.
        this.sender = SubscriberEmail.parse(senderEmail);
        this.timeout = Duration.ofMillis(timeoutMillis);
        this.enabled = enabled;
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(AUTH_TOKEN_HEADER, authorizationToken)
                .build();

        if (enabled) {
            log.info("Email client enabled: baseUrl={}, sender={}, timeout={}ms", baseUrl, sender.asString(), timeoutMillis);
        } else {
            log.info("Email client is DISABLED");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Send one email to {@code recipient}.
     *
     * @return empty Mono on any 2xx answer; errors with {@link EmailDispatchException} on a
     *         non-2xx status, a transport failure or a timeout
     */
    public Mono<Void> send(SubscriberEmail recipient, String subject, String htmlBody, String textBody) {
        return Mono.deferContextual(ctx -> {
            String requestId = ctx.getOrDefault(RequestIdFilter.REQUEST_ID_CONTEXT_KEY, "-");
            if (!enabled) {
                log.debug("[{}] Email client disabled, skipping email to {}", requestId, recipient.asString());
                return Mono.<Void>empty();
            }

            SendEmailRequest body = new SendEmailRequest(
                    sender.asString(), recipient.asString(), subject, htmlBody, textBody);

            return webClient.post()
                    .uri(SEND_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .doOnSuccess(response -> log.debug("[{}] Email sent to {}", requestId, recipient.asString()))
                    .onErrorMap(ex -> !(ex instanceof EmailDispatchException), this::toDispatchException)
                    .then();
        });
    }

    private EmailDispatchException toDispatchException(Throwable ex) {
        if (ex instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return new EmailDispatchException("Email provider responded with status " + status, status, ex);
        }
        return new EmailDispatchException("Email provider request failed: " + ex.getMessage(), null, ex);
    }
}
