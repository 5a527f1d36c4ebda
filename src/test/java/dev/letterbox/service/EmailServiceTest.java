package dev.letterbox.service;

import dev.letterbox.domain.NewSubscriber;
import dev.letterbox.domain.SubscriberEmail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.support.ResourceBundleMessageSource;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmailService")
class EmailServiceTest {

    @Mock
    private EmailClient emailClient;

    private EmailService emailService;

    @BeforeEach
    void setUp() {
        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");
        messageSource.setDefaultEncoding("UTF-8");
        emailService = new EmailService(emailClient, messageSource);
    }

    @Test
    @DisplayName("should compose the welcome email from messages with the trimmed name")
    void shouldComposeWelcomeEmail() {
        when(emailClient.send(any(), anyString(), anyString(), anyString())).thenReturn(Mono.empty());
        NewSubscriber subscriber = NewSubscriber.fromForm("ursula_le_guin@gmail.com", "  le guin ");
        ArgumentCaptor<String> subject = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> html = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);

        StepVerifier.create(emailService.sendWelcome(subscriber))
                .verifyComplete();

        verify(emailClient).send(eq(SubscriberEmail.parse("ursula_le_guin@gmail.com")),
                subject.capture(), html.capture(), text.capture());
        assertThat(subject.getValue()).isNotBlank();
        assertThat(html.getValue()).contains("Hi le guin,").contains("<p>");
        assertThat(text.getValue()).contains("le guin").doesNotContain("<p>");
    }

    @Test
    @DisplayName("should escape the name in the HTML body only")
    void shouldEscapeNameInHtml() {
        when(emailClient.send(any(), anyString(), anyString(), anyString())).thenReturn(Mono.empty());
        ArgumentCaptor<String> html = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);

        emailService.sendWelcome(NewSubscriber.fromForm("a@b.com", "Tom & Jerry's")).block();

        verify(emailClient).send(any(), anyString(), html.capture(), text.capture());
        assertThat(html.getValue()).contains("Hi Tom &amp; Jerry&#39;s,").doesNotContain("Tom & Jerry");
        assertThat(text.getValue()).contains("Tom & Jerry's");
    }

    @Test
    @DisplayName("should propagate client failures")
    void shouldPropagateFailure() {
        when(emailClient.send(any(), anyString(), anyString(), anyString()))
                .thenReturn(Mono.error(new IllegalStateException("provider down")));

        StepVerifier.create(emailService.sendWelcome(NewSubscriber.fromForm("a@b.com", "le guin")))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    @DisplayName("should report dispatch state of the client")
    void shouldReportDispatchEnabled() {
        when(emailClient.isEnabled()).thenReturn(true);

        assertThat(emailService.isDispatchEnabled()).isTrue();
    }
}
