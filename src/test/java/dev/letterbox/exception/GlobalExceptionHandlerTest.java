package dev.letterbox.exception;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.letterbox.config.RequestIdFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.test.StepVerifier;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private static final String REQUEST_ID = "7d0c6f0e-3b1a-4b8e-9a51-2f4c1e0b9a77";

    private final Logger logger = (Logger) LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    private GlobalExceptionHandler handler;
    private ServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/subscriptions")
                .header(RequestIdFilter.REQUEST_ID_HEADER, REQUEST_ID)
                .build());
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    @DisplayName("should log a rejected subscription once at WARN with the request id")
    void shouldLogRejectionWithRequestId() {
        handler.handleSubscriberValidation(
                new SubscriberValidationException("x", "\"x\" is not a valid subscriber email."), exchange).block();

        assertThat(appender.list)
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage()).startsWith("[" + REQUEST_ID + "]");
                });
    }

    @Test
    @DisplayName("should log a storage failure with the request id")
    void shouldLogStorageFailureWithRequestId() {
        handler.handleSubscriptionStorage(
                new SubscriptionStorageException("Failed to save new subscriber", new SQLException("boom")), exchange).block();

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(message -> message.contains(REQUEST_ID));
    }

    @Nested
    @DisplayName("client errors")
    class ClientErrors {

        @Test
        @DisplayName("should map subscriber validation failure to 400 with empty body")
        void shouldHandleSubscriberValidation() {
            SubscriberValidationException ex =
                    new SubscriberValidationException("<script>", "\"<script>\" is not a valid subscriber name.");

            StepVerifier.create(handler.handleSubscriberValidation(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                        assertThat(response.getBody()).isNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should map unreadable input to 400")
        void shouldHandleServerWebInput() {
            StepVerifier.create(handler.handleServerWebInput(new ServerWebInputException("bad form"), exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should keep the status of a ResponseStatusException")
        void shouldHandleResponseStatus() {
            ResponseStatusException ex = new ResponseStatusException(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "nope");

            StepVerifier.create(handler.handleResponseStatus(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
                        assertThat(response.getBody()).isNull();
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("server errors")
    class ServerErrors {

        @Test
        @DisplayName("should map storage failure to 500 with empty body")
        void shouldHandleSubscriptionStorage() {
            SubscriptionStorageException ex =
                    new SubscriptionStorageException("Failed to save new subscriber", new SQLException("duplicate key"));

            StepVerifier.create(handler.handleSubscriptionStorage(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
                        assertThat(response.getBody()).isNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should map anything else to 500")
        void shouldHandleGenericException() {
            StepVerifier.create(handler.handleGenericException(new IllegalStateException("boom"), exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR))
                    .verifyComplete();
        }
    }
}
